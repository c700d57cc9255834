package com.mirlift.types;

import com.mirlift.types.id.TraitDeclId;

import java.util.Objects;

/**
 * 对 trait 声明的引用。对 {@code impl Foo<bool> for String}，实参为 [String, bool]。
 */
public final class TraitDeclRef<R> {

    private final TraitDeclId traitId;
    private final GenericArgs<R> generics;

    public TraitDeclRef(TraitDeclId traitId, GenericArgs<R> generics) {
        this.traitId = Objects.requireNonNull(traitId);
        this.generics = Objects.requireNonNull(generics);
    }

    public TraitDeclId getTraitId() { return traitId; }
    public GenericArgs<R> getGenerics() { return generics; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraitDeclRef)) return false;
        TraitDeclRef<?> that = (TraitDeclRef<?>) o;
        return traitId.equals(that.traitId) && generics.equals(that.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traitId, generics);
    }

    @Override
    public String toString() {
        return traitId + generics.toString();
    }
}
