package com.mirlift.ir.expr;

import com.mirlift.types.IntegerTy;
import com.mirlift.types.Tagged;

import java.util.Objects;

/**
 * 一元运算：取反、取负，以及整数类型之间的转换。
 */
public abstract class UnOp implements Tagged {

    public static final UnOp NOT = new Simple("Not", "!");
    public static final UnOp NEG = new Simple("Neg", "-");

    private UnOp() {
    }

    public static UnOp cast(IntegerTy from, IntegerTy to) {
        return new Cast(from, to);
    }

    public static final class Simple extends UnOp {
        private final String name;
        private final String symbol;

        private Simple(String name, String symbol) {
            this.name = name;
            this.symbol = symbol;
        }

        @Override
        public String tag() { return name; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return symbol; }
    }

    public static final class Cast extends UnOp {
        private final IntegerTy from;
        private final IntegerTy to;

        private Cast(IntegerTy from, IntegerTy to) {
            this.from = Objects.requireNonNull(from);
            this.to = Objects.requireNonNull(to);
        }

        public IntegerTy getFrom() { return from; }
        public IntegerTy getTo() { return to; }

        @Override
        public String tag() { return "Cast"; }

        @Override
        public Object[] fields() { return new Object[]{from, to}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Cast)) return false;
            Cast that = (Cast) o;
            return from == that.from && to == that.to;
        }

        @Override
        public int hashCode() { return Objects.hash(from, to); }

        @Override
        public String toString() { return "cast<" + from + ", " + to + ">"; }
    }
}
