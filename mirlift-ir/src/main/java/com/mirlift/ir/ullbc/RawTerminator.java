package com.mirlift.ir.ullbc;

import com.mirlift.ir.expr.Assert;
import com.mirlift.ir.expr.Call;
import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.types.Tagged;
import com.mirlift.types.id.BlockId;

import java.util.Objects;

/**
 * 基本块终止指令。
 */
public abstract class RawTerminator implements Tagged {

    public static final RawTerminator PANIC = new Simple("Panic");
    public static final RawTerminator RETURN = new Simple("Return");
    public static final RawTerminator UNREACHABLE = new Simple("Unreachable");

    private RawTerminator() {
    }

    public static RawTerminator gotoBlock(BlockId target) { return new Goto(target); }
    public static RawTerminator switchOn(Operand discr, SwitchTargets targets) { return new Switch(discr, targets); }
    public static RawTerminator drop(Place place, BlockId target) { return new Drop(place, target); }
    public static RawTerminator call(Call call, BlockId target) { return new CallTerm(call, target); }
    public static RawTerminator assertThen(Assert a, BlockId target) { return new AssertTerm(a, target); }

    /** 无字段的终止指令 */
    public static final class Simple extends RawTerminator {
        private final String name;

        private Simple(String name) { this.name = name; }

        @Override
        public String tag() { return name; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return name.toLowerCase(); }
    }

    public static final class Goto extends RawTerminator {
        private final BlockId target;

        private Goto(BlockId target) { this.target = Objects.requireNonNull(target); }

        public BlockId getTarget() { return target; }

        @Override
        public String tag() { return "Goto"; }

        @Override
        public Object[] fields() { return new Object[]{target}; }

        @Override
        public String toString() { return "goto bb" + target.getIndex(); }
    }

    public static final class Switch extends RawTerminator {
        private final Operand discr;
        private final SwitchTargets targets;

        private Switch(Operand discr, SwitchTargets targets) {
            this.discr = Objects.requireNonNull(discr);
            this.targets = Objects.requireNonNull(targets);
        }

        public Operand getDiscr() { return discr; }
        public SwitchTargets getTargets() { return targets; }

        @Override
        public String tag() { return "Switch"; }

        @Override
        public Object[] fields() { return new Object[]{discr, targets}; }

        @Override
        public String toString() { return "switch " + discr + " -> " + targets.getTargets(); }
    }

    public static final class Drop extends RawTerminator {
        private final Place place;
        private final BlockId target;

        private Drop(Place place, BlockId target) {
            this.place = Objects.requireNonNull(place);
            this.target = Objects.requireNonNull(target);
        }

        public Place getPlace() { return place; }
        public BlockId getTarget() { return target; }

        @Override
        public String tag() { return "Drop"; }

        @Override
        public Object[] fields() { return new Object[]{place, target}; }

        @Override
        public String toString() { return "drop " + place + "; goto bb" + target.getIndex(); }
    }

    public static final class CallTerm extends RawTerminator {
        private final Call call;
        private final BlockId target;

        private CallTerm(Call call, BlockId target) {
            this.call = Objects.requireNonNull(call);
            this.target = Objects.requireNonNull(target);
        }

        public Call getCall() { return call; }
        public BlockId getTarget() { return target; }

        @Override
        public String tag() { return "Call"; }

        @Override
        public Object[] fields() { return new Object[]{call, target}; }

        @Override
        public String toString() { return call + "; goto bb" + target.getIndex(); }
    }

    public static final class AssertTerm extends RawTerminator {
        private final Assert assertion;
        private final BlockId target;

        private AssertTerm(Assert assertion, BlockId target) {
            this.assertion = Objects.requireNonNull(assertion);
            this.target = Objects.requireNonNull(target);
        }

        public Assert getAssertion() { return assertion; }
        public BlockId getTarget() { return target; }

        @Override
        public String tag() { return "Assert"; }

        @Override
        public Object[] fields() { return new Object[]{assertion, target}; }

        @Override
        public String toString() { return assertion + "; goto bb" + target.getIndex(); }
    }
}
