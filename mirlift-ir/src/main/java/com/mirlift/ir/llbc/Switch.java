package com.mirlift.ir.llbc;

import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.types.IntegerTy;
import com.mirlift.types.ScalarValue;
import com.mirlift.types.Tagged;
import com.mirlift.types.id.VariantId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 结构化分支：布尔条件、整数值分派、按枚举变体匹配。
 */
public abstract class Switch implements Tagged {

    private Switch() {
    }

    public static Switch ifThenElse(Operand cond, Statement thenBranch, Statement elseBranch) {
        return new If(cond, thenBranch, elseBranch);
    }

    public static Switch switchInt(Operand discr, IntegerTy intTy, List<SwitchCase<ScalarValue>> targets,
                                   Statement otherwise) {
        return new SwitchInt(discr, intTy, targets, otherwise);
    }

    public static Switch match(Place scrutinee, List<SwitchCase<VariantId>> targets, Statement otherwise) {
        return new Match(scrutinee, targets, otherwise);
    }

    /** 所有分支体（含 otherwise），按出现顺序 */
    public abstract List<Statement> branches();

    public static final class If extends Switch {
        private final Operand cond;
        private final Statement thenBranch;
        private final Statement elseBranch;

        private If(Operand cond, Statement thenBranch, Statement elseBranch) {
            this.cond = Objects.requireNonNull(cond);
            this.thenBranch = Objects.requireNonNull(thenBranch);
            this.elseBranch = Objects.requireNonNull(elseBranch);
        }

        public Operand getCond() { return cond; }
        public Statement getThenBranch() { return thenBranch; }
        public Statement getElseBranch() { return elseBranch; }

        public If withCond(Operand newCond) {
            return new If(newCond, thenBranch, elseBranch);
        }

        @Override
        public List<Statement> branches() {
            List<Statement> list = new ArrayList<>();
            list.add(thenBranch);
            list.add(elseBranch);
            return list;
        }

        @Override
        public String tag() { return "If"; }

        @Override
        public Object[] fields() { return new Object[]{cond, thenBranch, elseBranch}; }
    }

    /**
     * 按整数值分派。每个分支可对应多个值；otherwise 总是存在。
     */
    public static final class SwitchInt extends Switch {
        private final Operand discr;
        private final IntegerTy intTy;
        private final List<SwitchCase<ScalarValue>> targets;
        private final Statement otherwise;

        private SwitchInt(Operand discr, IntegerTy intTy, List<SwitchCase<ScalarValue>> targets,
                          Statement otherwise) {
            this.discr = Objects.requireNonNull(discr);
            this.intTy = Objects.requireNonNull(intTy);
            this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
            this.otherwise = Objects.requireNonNull(otherwise);
        }

        public Operand getDiscr() { return discr; }
        public IntegerTy getIntTy() { return intTy; }
        public List<SwitchCase<ScalarValue>> getTargets() { return targets; }
        public Statement getOtherwise() { return otherwise; }

        public SwitchInt withDiscr(Operand newDiscr) {
            return new SwitchInt(newDiscr, intTy, targets, otherwise);
        }

        @Override
        public List<Statement> branches() {
            List<Statement> list = new ArrayList<>();
            for (SwitchCase<ScalarValue> c : targets) {
                list.add(c.getBody());
            }
            list.add(otherwise);
            return list;
        }

        @Override
        public String tag() { return "SwitchInt"; }

        @Override
        public Object[] fields() { return new Object[]{discr, intTy, targets, otherwise}; }
    }

    /**
     * 按枚举变体匹配。覆盖全部变体时 otherwise 为 null。
     */
    public static final class Match extends Switch {
        private final Place scrutinee;
        private final List<SwitchCase<VariantId>> targets;
        private final Statement otherwise;  // nullable

        private Match(Place scrutinee, List<SwitchCase<VariantId>> targets, Statement otherwise) {
            this.scrutinee = Objects.requireNonNull(scrutinee);
            this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
            this.otherwise = otherwise;
        }

        public Place getScrutinee() { return scrutinee; }
        public List<SwitchCase<VariantId>> getTargets() { return targets; }
        public Statement getOtherwise() { return otherwise; }

        public Match withScrutinee(Place newScrutinee) {
            return new Match(newScrutinee, targets, otherwise);
        }

        @Override
        public List<Statement> branches() {
            List<Statement> list = new ArrayList<>();
            for (SwitchCase<VariantId> c : targets) {
                list.add(c.getBody());
            }
            if (otherwise != null) list.add(otherwise);
            return list;
        }

        @Override
        public String tag() { return "Match"; }

        @Override
        public Object[] fields() { return new Object[]{scrutinee, targets, otherwise}; }
    }
}
