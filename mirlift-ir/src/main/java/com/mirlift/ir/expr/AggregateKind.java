package com.mirlift.ir.expr;

import com.mirlift.types.ErasedRegion;
import com.mirlift.types.GenericArgs;
import com.mirlift.types.Tagged;
import com.mirlift.types.Ty;
import com.mirlift.types.TypeId;
import com.mirlift.types.id.VariantId;

import java.util.Objects;

/**
 * 聚合构造的目标：ADT（结构体、枚举变体、元组）或定长数组。
 */
public abstract class AggregateKind implements Tagged {

    private AggregateKind() {
    }

    public static AggregateKind adt(TypeId typeId, VariantId variantId, GenericArgs<ErasedRegion> generics) {
        return new Adt(typeId, variantId, generics);
    }

    public static AggregateKind array(Ty<ErasedRegion> elemTy, int length) {
        return new Array(elemTy, length);
    }

    public static final class Adt extends AggregateKind {
        private final TypeId typeId;
        private final VariantId variantId;  // nullable
        private final GenericArgs<ErasedRegion> generics;

        private Adt(TypeId typeId, VariantId variantId, GenericArgs<ErasedRegion> generics) {
            this.typeId = Objects.requireNonNull(typeId);
            this.variantId = variantId;
            this.generics = Objects.requireNonNull(generics);
        }

        public TypeId getTypeId() { return typeId; }
        public VariantId getVariantId() { return variantId; }
        public GenericArgs<ErasedRegion> getGenerics() { return generics; }

        public Adt withGenerics(GenericArgs<ErasedRegion> newGenerics) {
            return new Adt(typeId, variantId, newGenerics);
        }

        @Override
        public String tag() { return "Adt"; }

        @Override
        public Object[] fields() { return new Object[]{typeId, variantId, generics}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Adt)) return false;
            Adt that = (Adt) o;
            return typeId.equals(that.typeId) && Objects.equals(variantId, that.variantId)
                    && generics.equals(that.generics);
        }

        @Override
        public int hashCode() { return Objects.hash(typeId, variantId, generics); }
    }

    public static final class Array extends AggregateKind {
        private final Ty<ErasedRegion> elemTy;
        private final int length;

        private Array(Ty<ErasedRegion> elemTy, int length) {
            this.elemTy = Objects.requireNonNull(elemTy);
            this.length = length;
        }

        public Ty<ErasedRegion> getElemTy() { return elemTy; }
        public int getLength() { return length; }

        @Override
        public String tag() { return "Array"; }

        @Override
        public Object[] fields() { return new Object[]{elemTy, length}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Array)) return false;
            Array that = (Array) o;
            return length == that.length && elemTy.equals(that.elemTy);
        }

        @Override
        public int hashCode() { return Objects.hash(elemTy, length); }
    }
}
