package com.mirlift.types;

import com.mirlift.types.id.ConstGenericVarId;
import com.mirlift.types.id.GlobalDeclId;

import java.util.Objects;

/**
 * 常量泛型实参：全局常量、常量泛型变量，或具体值。
 */
public abstract class ConstGeneric implements Tagged {

    private ConstGeneric() {
    }

    public static ConstGeneric global(GlobalDeclId id) { return new Global(id); }
    public static ConstGeneric var(ConstGenericVarId id) { return new Var(id); }
    public static ConstGeneric value(Literal literal) { return new Value(literal); }

    public static final class Global extends ConstGeneric {
        private final GlobalDeclId id;

        private Global(GlobalDeclId id) { this.id = Objects.requireNonNull(id); }

        public GlobalDeclId getId() { return id; }

        @Override
        public String tag() { return "Global"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Global && ((Global) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.toString(); }
    }

    public static final class Var extends ConstGeneric {
        private final ConstGenericVarId id;

        private Var(ConstGenericVarId id) { this.id = Objects.requireNonNull(id); }

        public ConstGenericVarId getId() { return id; }

        @Override
        public String tag() { return "Var"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var && ((Var) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.toString(); }
    }

    public static final class Value extends ConstGeneric {
        private final Literal literal;

        private Value(Literal literal) { this.literal = Objects.requireNonNull(literal); }

        public Literal getLiteral() { return literal; }

        @Override
        public String tag() { return "Value"; }

        @Override
        public Object[] fields() { return new Object[]{literal}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Value && ((Value) o).literal.equals(literal);
        }

        @Override
        public int hashCode() { return literal.hashCode(); }

        @Override
        public String toString() { return literal.toString(); }
    }
}
