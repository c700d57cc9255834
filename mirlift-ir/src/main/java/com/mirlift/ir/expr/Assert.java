package com.mirlift.ir.expr;

import java.util.Objects;

/**
 * 断言 cond == expected，否则 panic。
 */
public final class Assert {

    private final Operand cond;
    private final boolean expected;

    public Assert(Operand cond, boolean expected) {
        this.cond = Objects.requireNonNull(cond);
        this.expected = expected;
    }

    public Operand getCond() { return cond; }
    public boolean isExpected() { return expected; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assert)) return false;
        Assert that = (Assert) o;
        return expected == that.expected && cond.equals(that.cond);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cond, expected);
    }

    @Override
    public String toString() {
        return "assert(" + cond + " == " + expected + ")";
    }
}
