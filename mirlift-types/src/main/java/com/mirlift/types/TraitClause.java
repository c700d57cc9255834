package com.mirlift.types;

import com.mirlift.types.id.TraitClauseId;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.meta.Meta;

import java.util.Objects;

/**
 * 一条 trait 约束子句，例如 {@code where T: Foo<U>}。
 * clauseId 位置稳定，供 {@link TraitInstanceId.Clause} 引用；相等比较忽略 meta。
 */
public final class TraitClause {

    private final TraitClauseId clauseId;
    private final Meta meta;  // nullable
    private final TraitDeclId traitId;
    /** 其中的 traitRefs 应为空 */
    private final GenericArgs<Region> generics;

    public TraitClause(TraitClauseId clauseId, Meta meta, TraitDeclId traitId, GenericArgs<Region> generics) {
        this.clauseId = Objects.requireNonNull(clauseId);
        this.meta = meta;
        this.traitId = Objects.requireNonNull(traitId);
        this.generics = Objects.requireNonNull(generics);
    }

    public TraitClauseId getClauseId() { return clauseId; }
    public Meta getMeta() { return meta; }
    public TraitDeclId getTraitId() { return traitId; }
    public GenericArgs<Region> getGenerics() { return generics; }

    public TraitClause withGenerics(GenericArgs<Region> newGenerics) {
        return new TraitClause(clauseId, meta, traitId, newGenerics);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraitClause)) return false;
        TraitClause that = (TraitClause) o;
        return clauseId.equals(that.clauseId) && traitId.equals(that.traitId)
                && generics.equals(that.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauseId, traitId, generics);
    }

    @Override
    public String toString() {
        return clauseId + ": " + traitId + generics;
    }
}
