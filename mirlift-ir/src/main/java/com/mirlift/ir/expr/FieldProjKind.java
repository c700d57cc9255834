package com.mirlift.ir.expr;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.id.VariantId;

import java.util.Objects;

/**
 * 字段投影的目标：ADT（枚举时带变体）或元组（带元数）。
 */
public abstract class FieldProjKind implements Tagged {

    private FieldProjKind() {
    }

    public static FieldProjKind adt(TypeDeclId typeId, VariantId variantId) {
        return new Adt(typeId, variantId);
    }

    public static FieldProjKind tuple(int arity) {
        return new Tuple(arity);
    }

    public static final class Adt extends FieldProjKind {
        private final TypeDeclId typeId;
        private final VariantId variantId;  // nullable: 结构体

        private Adt(TypeDeclId typeId, VariantId variantId) {
            this.typeId = Objects.requireNonNull(typeId);
            this.variantId = variantId;
        }

        public TypeDeclId getTypeId() { return typeId; }
        public VariantId getVariantId() { return variantId; }

        @Override
        public String tag() { return "Adt"; }

        @Override
        public Object[] fields() { return new Object[]{typeId, variantId}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Adt)) return false;
            Adt that = (Adt) o;
            return typeId.equals(that.typeId) && Objects.equals(variantId, that.variantId);
        }

        @Override
        public int hashCode() { return Objects.hash(typeId, variantId); }
    }

    public static final class Tuple extends FieldProjKind {
        private final int arity;

        private Tuple(int arity) { this.arity = arity; }

        public int getArity() { return arity; }

        @Override
        public String tag() { return "Tuple"; }

        @Override
        public Object[] fields() { return new Object[]{arity}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tuple && ((Tuple) o).arity == arity;
        }

        @Override
        public int hashCode() { return arity; }
    }
}
