package com.mirlift.types;

import java.util.Objects;

/**
 * 对一个 trait 实例的引用：见证路径 + 实参。traitDeclRef 冗余保存被实现的 trait。
 */
public final class TraitRef<R> {

    private final TraitInstanceId traitId;
    private final GenericArgs<R> generics;
    private final TraitDeclRef<R> traitDeclRef;

    public TraitRef(TraitInstanceId traitId, GenericArgs<R> generics, TraitDeclRef<R> traitDeclRef) {
        this.traitId = Objects.requireNonNull(traitId);
        this.generics = Objects.requireNonNull(generics);
        this.traitDeclRef = Objects.requireNonNull(traitDeclRef);
    }

    public TraitInstanceId getTraitId() { return traitId; }
    public GenericArgs<R> getGenerics() { return generics; }
    public TraitDeclRef<R> getTraitDeclRef() { return traitDeclRef; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraitRef)) return false;
        TraitRef<?> that = (TraitRef<?>) o;
        return traitId.equals(that.traitId) && generics.equals(that.generics)
                && traitDeclRef.equals(that.traitDeclRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traitId, generics, traitDeclRef);
    }

    @Override
    public String toString() {
        return traitId + generics.toString();
    }
}
