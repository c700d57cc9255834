package com.mirlift.ir.llbc;

import com.mirlift.ir.expr.Assert;
import com.mirlift.ir.expr.Call;
import com.mirlift.ir.expr.Place;
import com.mirlift.ir.expr.Rvalue;
import com.mirlift.types.Tagged;
import com.mirlift.types.id.VariantId;

import java.util.Objects;

/**
 * 结构化语句内容。变体本身不可变；子语句是可变的 {@link Statement} 单元。
 */
public abstract class RawStatement implements Tagged {

    public static final RawStatement PANIC = new Simple("Panic");
    public static final RawStatement RETURN = new Simple("Return");
    public static final RawStatement NOP = new Simple("Nop");

    private RawStatement() {
    }

    public static RawStatement assign(Place dest, Rvalue value) { return new Assign(dest, value); }
    public static RawStatement fakeRead(Place place) { return new FakeRead(place); }

    public static RawStatement setDiscriminant(Place place, VariantId variant) {
        return new SetDiscriminant(place, variant);
    }

    public static RawStatement drop(Place place) { return new Drop(place); }
    public static RawStatement assertion(Assert a) { return new AssertStmt(a); }
    public static RawStatement call(Call call) { return new CallStmt(call); }
    public static RawStatement breakOut(int depth) { return new Break(depth); }
    public static RawStatement continueLoop(int depth) { return new Continue(depth); }

    /** 构造序列节点；需要保持右嵌套时使用 {@link Statement#sequence(Statement, Statement)} */
    public static RawStatement sequence(Statement first, Statement next) { return new Sequence(first, next); }

    public static RawStatement switchOn(Switch sw) { return new SwitchStmt(sw); }
    public static RawStatement loop(Statement body) { return new Loop(body); }

    public boolean isNop() {
        return this == NOP;
    }

    /** 无字段的语句 */
    public static final class Simple extends RawStatement {
        private final String name;

        private Simple(String name) { this.name = name; }

        @Override
        public String tag() { return name; }

        @Override
        public Object[] fields() { return new Object[0]; }
    }

    public static final class Assign extends RawStatement {
        private final Place dest;
        private final Rvalue value;

        private Assign(Place dest, Rvalue value) {
            this.dest = Objects.requireNonNull(dest);
            this.value = Objects.requireNonNull(value);
        }

        public Place getDest() { return dest; }
        public Rvalue getValue() { return value; }

        @Override
        public String tag() { return "Assign"; }

        @Override
        public Object[] fields() { return new Object[]{dest, value}; }
    }

    public static final class FakeRead extends RawStatement {
        private final Place place;

        private FakeRead(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public String tag() { return "FakeRead"; }

        @Override
        public Object[] fields() { return new Object[]{place}; }
    }

    public static final class SetDiscriminant extends RawStatement {
        private final Place place;
        private final VariantId variant;

        private SetDiscriminant(Place place, VariantId variant) {
            this.place = Objects.requireNonNull(place);
            this.variant = Objects.requireNonNull(variant);
        }

        public Place getPlace() { return place; }
        public VariantId getVariant() { return variant; }

        @Override
        public String tag() { return "SetDiscriminant"; }

        @Override
        public Object[] fields() { return new Object[]{place, variant}; }
    }

    public static final class Drop extends RawStatement {
        private final Place place;

        private Drop(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public String tag() { return "Drop"; }

        @Override
        public Object[] fields() { return new Object[]{place}; }
    }

    public static final class AssertStmt extends RawStatement {
        private final Assert assertion;

        private AssertStmt(Assert assertion) { this.assertion = Objects.requireNonNull(assertion); }

        public Assert getAssertion() { return assertion; }

        @Override
        public String tag() { return "Assert"; }

        @Override
        public Object[] fields() { return new Object[]{assertion}; }
    }

    public static final class CallStmt extends RawStatement {
        private final Call call;

        private CallStmt(Call call) { this.call = Objects.requireNonNull(call); }

        public Call getCall() { return call; }

        @Override
        public String tag() { return "Call"; }

        @Override
        public Object[] fields() { return new Object[]{call}; }
    }

    /** 跳出外层第 depth 个循环（0 为最内层） */
    public static final class Break extends RawStatement {
        private final int depth;

        private Break(int depth) { this.depth = depth; }

        public int getDepth() { return depth; }

        @Override
        public String tag() { return "Break"; }

        @Override
        public Object[] fields() { return new Object[]{depth}; }
    }

    public static final class Continue extends RawStatement {
        private final int depth;

        private Continue(int depth) { this.depth = depth; }

        public int getDepth() { return depth; }

        @Override
        public String tag() { return "Continue"; }

        @Override
        public Object[] fields() { return new Object[]{depth}; }
    }

    public static final class Sequence extends RawStatement {
        private final Statement first;
        private final Statement next;

        private Sequence(Statement first, Statement next) {
            this.first = Objects.requireNonNull(first);
            this.next = Objects.requireNonNull(next);
        }

        public Statement getFirst() { return first; }
        public Statement getNext() { return next; }

        @Override
        public String tag() { return "Sequence"; }

        @Override
        public Object[] fields() { return new Object[]{first, next}; }
    }

    public static final class SwitchStmt extends RawStatement {
        private final Switch sw;

        private SwitchStmt(Switch sw) { this.sw = Objects.requireNonNull(sw); }

        public Switch getSwitch() { return sw; }

        @Override
        public String tag() { return "Switch"; }

        @Override
        public Object[] fields() { return new Object[]{sw}; }
    }

    public static final class Loop extends RawStatement {
        private final Statement body;

        private Loop(Statement body) { this.body = Objects.requireNonNull(body); }

        public Statement getBody() { return body; }

        @Override
        public String tag() { return "Loop"; }

        @Override
        public Object[] fields() { return new Object[]{body}; }
    }
}
