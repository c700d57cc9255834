package com.mirlift.types;

import java.util.Objects;

/**
 * 字面量类型：整数、bool、char。不支持浮点。
 */
public abstract class LiteralTy implements Tagged {

    public static final LiteralTy BOOL = new Bool();
    public static final LiteralTy CHAR = new Char();

    private LiteralTy() {
    }

    public static LiteralTy integer(IntegerTy ty) {
        return new Integer(ty);
    }

    public static final class Integer extends LiteralTy {
        private final IntegerTy integerTy;

        private Integer(IntegerTy integerTy) {
            this.integerTy = Objects.requireNonNull(integerTy);
        }

        public IntegerTy getIntegerTy() { return integerTy; }

        @Override
        public String tag() { return "Integer"; }

        @Override
        public Object[] fields() { return new Object[]{integerTy}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Integer && ((Integer) o).integerTy == integerTy;
        }

        @Override
        public int hashCode() { return integerTy.hashCode(); }

        @Override
        public String toString() { return integerTy.toString(); }
    }

    public static final class Bool extends LiteralTy {
        private Bool() {}

        @Override
        public String tag() { return "Bool"; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return "bool"; }
    }

    public static final class Char extends LiteralTy {
        private Char() {}

        @Override
        public String tag() { return "Char"; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return "char"; }
    }
}
