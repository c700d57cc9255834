package com.mirlift.types;

import com.mirlift.types.id.TypeDeclId;

import java.util.Objects;

/**
 * ADT 标识：用户定义 ADT、元组，或内建类型。
 */
public abstract class TypeId implements Tagged {

    public static final TypeId TUPLE = new Tuple();

    private TypeId() {
    }

    public static TypeId adt(TypeDeclId id) { return new Adt(id); }
    public static TypeId assumed(AssumedTy ty) { return new Assumed(ty); }

    public static final class Adt extends TypeId {
        private final TypeDeclId id;

        private Adt(TypeDeclId id) { this.id = Objects.requireNonNull(id); }

        public TypeDeclId getId() { return id; }

        @Override
        public String tag() { return "Adt"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Adt && ((Adt) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.toString(); }
    }

    public static final class Tuple extends TypeId {
        private Tuple() {}

        @Override
        public String tag() { return "Tuple"; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return "Tuple"; }
    }

    public static final class Assumed extends TypeId {
        private final AssumedTy ty;

        private Assumed(AssumedTy ty) { this.ty = Objects.requireNonNull(ty); }

        public AssumedTy getTy() { return ty; }

        @Override
        public String tag() { return "Assumed"; }

        @Override
        public Object[] fields() { return new Object[]{ty}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Assumed && ((Assumed) o).ty == ty;
        }

        @Override
        public int hashCode() { return ty.hashCode(); }

        @Override
        public String toString() { return ty.toString(); }
    }
}
