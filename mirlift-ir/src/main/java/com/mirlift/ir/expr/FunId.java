package com.mirlift.ir.expr;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.FunDeclId;

import java.util.Objects;

/**
 * 被调用的函数：crate 中的函数声明或内建函数。
 */
public abstract class FunId implements Tagged {

    private FunId() {
    }

    public static FunId regular(FunDeclId id) { return new Regular(id); }
    public static FunId assumed(AssumedFunId id) { return new Assumed(id); }

    public static final class Regular extends FunId {
        private final FunDeclId id;

        private Regular(FunDeclId id) { this.id = Objects.requireNonNull(id); }

        public FunDeclId getId() { return id; }

        @Override
        public String tag() { return "Regular"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Regular && ((Regular) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.toString(); }
    }

    public static final class Assumed extends FunId {
        private final AssumedFunId id;

        private Assumed(AssumedFunId id) { this.id = Objects.requireNonNull(id); }

        public AssumedFunId getId() { return id; }

        @Override
        public String tag() { return "Assumed"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Assumed && ((Assumed) o).id == id;
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.tag(); }
    }
}
