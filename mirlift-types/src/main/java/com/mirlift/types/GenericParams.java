package com.mirlift.types;

import com.mirlift.types.id.ConstGenericVarId;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.RegionId;
import com.mirlift.types.id.TraitClauseId;
import com.mirlift.types.id.TypeVarId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 声明处的泛型参数：区域、类型、常量泛型变量，以及需要由调用方提供见证的 trait 子句。
 * 其余不需要见证的约束放在 {@link Predicates} 中。
 */
public final class GenericParams {

    private final IdVector<RegionId, RegionVar> regions;
    private final IdVector<TypeVarId, TypeVar> types;
    private final IdVector<ConstGenericVarId, ConstGenericVar> constGenerics;
    private final IdVector<TraitClauseId, TraitClause> traitClauses;

    public GenericParams(IdVector<RegionId, RegionVar> regions, IdVector<TypeVarId, TypeVar> types,
                         IdVector<ConstGenericVarId, ConstGenericVar> constGenerics,
                         IdVector<TraitClauseId, TraitClause> traitClauses) {
        this.regions = Objects.requireNonNull(regions);
        this.types = Objects.requireNonNull(types);
        this.constGenerics = Objects.requireNonNull(constGenerics);
        this.traitClauses = Objects.requireNonNull(traitClauses);
    }

    public static GenericParams empty() {
        return new GenericParams(IdVector.<RegionId, RegionVar>empty(RegionId.FACTORY),
                IdVector.<TypeVarId, TypeVar>empty(TypeVarId.FACTORY),
                IdVector.<ConstGenericVarId, ConstGenericVar>empty(ConstGenericVarId.FACTORY),
                IdVector.<TraitClauseId, TraitClause>empty(TraitClauseId.FACTORY));
    }

    public IdVector<RegionId, RegionVar> getRegions() { return regions; }
    public IdVector<TypeVarId, TypeVar> getTypes() { return types; }
    public IdVector<ConstGenericVarId, ConstGenericVar> getConstGenerics() { return constGenerics; }
    public IdVector<TraitClauseId, TraitClause> getTraitClauses() { return traitClauses; }

    public boolean isEmpty() {
        return regions.isEmpty() && types.isEmpty() && constGenerics.isEmpty() && traitClauses.isEmpty();
    }

    /**
     * 恒等实参：每个参数映射到自身（区域为最外层 binder 中的绑定变量，trait 子句为 Clause(i)）。
     */
    public GenericArgs<Region> identityArgs() {
        List<Region> regionArgs = new ArrayList<>();
        for (RegionId id : regions.ids()) {
            regionArgs.add(Region.bvar(0, id.getIndex()));
        }
        List<Ty<Region>> typeArgs = new ArrayList<>();
        for (TypeVarId id : types.ids()) {
            typeArgs.add(Ty.<Region>typeVar(id));
        }
        List<ConstGeneric> constArgs = new ArrayList<>();
        for (ConstGenericVarId id : constGenerics.ids()) {
            constArgs.add(ConstGeneric.var(id));
        }
        List<TraitRef<Region>> traitArgs = new ArrayList<>();
        for (TraitClause clause : traitClauses) {
            TraitDeclRef<Region> declRef = new TraitDeclRef<>(clause.getTraitId(), clause.getGenerics());
            traitArgs.add(new TraitRef<>(TraitInstanceId.clause(clause.getClauseId()),
                    GenericArgs.<Region>empty(), declRef));
        }
        return new GenericArgs<>(regionArgs, typeArgs, constArgs, traitArgs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericParams)) return false;
        GenericParams that = (GenericParams) o;
        return regions.equals(that.regions) && types.equals(that.types)
                && constGenerics.equals(that.constGenerics) && traitClauses.equals(that.traitClauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, types, constGenerics, traitClauses);
    }
}
