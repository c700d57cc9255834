package com.mirlift.ir.ullbc;

import com.mirlift.types.IntegerTy;
import com.mirlift.types.ScalarValue;
import com.mirlift.types.Tagged;
import com.mirlift.types.id.BlockId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 多路跳转的目标：布尔二分支，或整数值分派（带 otherwise 目标）。
 */
public abstract class SwitchTargets implements Tagged {

    private SwitchTargets() {
    }

    public static SwitchTargets ifThenElse(BlockId thenBlock, BlockId elseBlock) {
        return new If(thenBlock, elseBlock);
    }

    public static SwitchTargets switchInt(IntegerTy intTy, Map<ScalarValue, BlockId> cases, BlockId otherwise) {
        return new SwitchInt(intTy, cases, otherwise);
    }

    /** 所有目标块，按出现顺序 */
    public abstract List<BlockId> getTargets();

    public static final class If extends SwitchTargets {
        private final BlockId thenBlock;
        private final BlockId elseBlock;

        private If(BlockId thenBlock, BlockId elseBlock) {
            this.thenBlock = Objects.requireNonNull(thenBlock);
            this.elseBlock = Objects.requireNonNull(elseBlock);
        }

        public BlockId getThenBlock() { return thenBlock; }
        public BlockId getElseBlock() { return elseBlock; }

        @Override
        public List<BlockId> getTargets() {
            List<BlockId> list = new ArrayList<>();
            list.add(thenBlock);
            list.add(elseBlock);
            return list;
        }

        @Override
        public String tag() { return "If"; }

        @Override
        public Object[] fields() { return new Object[]{thenBlock, elseBlock}; }
    }

    public static final class SwitchInt extends SwitchTargets {
        private final IntegerTy intTy;
        /** 保持插入顺序 */
        private final Map<ScalarValue, BlockId> cases;
        private final BlockId otherwise;

        private SwitchInt(IntegerTy intTy, Map<ScalarValue, BlockId> cases, BlockId otherwise) {
            this.intTy = Objects.requireNonNull(intTy);
            this.cases = Collections.unmodifiableMap(new LinkedHashMap<>(cases));
            this.otherwise = Objects.requireNonNull(otherwise);
        }

        public IntegerTy getIntTy() { return intTy; }
        public Map<ScalarValue, BlockId> getCases() { return cases; }
        public BlockId getOtherwise() { return otherwise; }

        @Override
        public List<BlockId> getTargets() {
            List<BlockId> list = new ArrayList<>(cases.values());
            list.add(otherwise);
            return list;
        }

        @Override
        public String tag() { return "SwitchInt"; }

        @Override
        public Object[] fields() {
            List<Object[]> pairs = new ArrayList<>();
            for (Map.Entry<ScalarValue, BlockId> e : cases.entrySet()) {
                pairs.add(new Object[]{e.getKey(), e.getValue()});
            }
            return new Object[]{intTy, pairs, otherwise};
        }
    }
}
