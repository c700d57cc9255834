package com.mirlift.types;

import java.util.Objects;

/**
 * 字面量值。
 */
public abstract class Literal implements Tagged {

    private Literal() {
    }

    public static Literal scalar(ScalarValue value) { return new Scalar(value); }
    public static Literal bool(boolean value) { return new Bool(value); }
    public static Literal character(String value) { return new Char(value); }

    public static final class Scalar extends Literal {
        private final ScalarValue value;

        private Scalar(ScalarValue value) {
            this.value = Objects.requireNonNull(value);
        }

        public ScalarValue getValue() { return value; }

        @Override
        public String tag() { return "Scalar"; }

        @Override
        public Object[] fields() { return new Object[]{value}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Scalar && ((Scalar) o).value.equals(value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return value.toString(); }
    }

    public static final class Bool extends Literal {
        private final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        public boolean getValue() { return value; }

        @Override
        public String tag() { return "Bool"; }

        @Override
        public Object[] fields() { return new Object[]{value}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bool && ((Bool) o).value == value;
        }

        @Override
        public int hashCode() { return Boolean.hashCode(value); }

        @Override
        public String toString() { return String.valueOf(value); }
    }

    /** 一个 Unicode 标量值，用字符串保存以容纳代理对 */
    public static final class Char extends Literal {
        private final String value;

        private Char(String value) {
            this.value = Objects.requireNonNull(value);
            if (value.codePointCount(0, value.length()) != 1) {
                throw new IllegalArgumentException("not a single char: " + value);
            }
        }

        public String getValue() { return value; }

        @Override
        public String tag() { return "Char"; }

        @Override
        public Object[] fields() { return new Object[]{value}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Char && ((Char) o).value.equals(value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return "'" + value + "'"; }
    }
}
