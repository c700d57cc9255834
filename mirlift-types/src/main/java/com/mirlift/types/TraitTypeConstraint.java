package com.mirlift.types;

import java.util.Objects;

/**
 * 对 trait 关联类型的约束，例如 {@code T: Foo<S = String>} 中的 {@code S = String}。
 */
public final class TraitTypeConstraint<R> {

    private final TraitRef<R> traitRef;
    private final GenericArgs<R> generics;
    private final String typeName;
    private final Ty<R> ty;

    public TraitTypeConstraint(TraitRef<R> traitRef, GenericArgs<R> generics, String typeName, Ty<R> ty) {
        this.traitRef = Objects.requireNonNull(traitRef);
        this.generics = Objects.requireNonNull(generics);
        this.typeName = Objects.requireNonNull(typeName);
        this.ty = Objects.requireNonNull(ty);
    }

    public TraitRef<R> getTraitRef() { return traitRef; }
    public GenericArgs<R> getGenerics() { return generics; }
    public String getTypeName() { return typeName; }
    public Ty<R> getTy() { return ty; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraitTypeConstraint)) return false;
        TraitTypeConstraint<?> that = (TraitTypeConstraint<?>) o;
        return traitRef.equals(that.traitRef) && generics.equals(that.generics)
                && typeName.equals(that.typeName) && ty.equals(that.ty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traitRef, generics, typeName, ty);
    }

    @Override
    public String toString() {
        return traitRef + "::" + typeName + generics + " = " + ty;
    }
}
