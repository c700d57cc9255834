package com.mirlift.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 使用处的泛型实参：区域、类型、常量泛型，以及为 trait 子句提供的见证。
 * 与声明处的 {@link GenericParams} 逐项对应。
 */
public final class GenericArgs<R> {

    private final List<R> regions;
    private final List<Ty<R>> types;
    private final List<ConstGeneric> constGenerics;
    private final List<TraitRef<R>> traitRefs;

    public GenericArgs(List<R> regions, List<Ty<R>> types, List<ConstGeneric> constGenerics,
                       List<TraitRef<R>> traitRefs) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.constGenerics = Collections.unmodifiableList(new ArrayList<>(constGenerics));
        this.traitRefs = Collections.unmodifiableList(new ArrayList<>(traitRefs));
    }

    public static <R> GenericArgs<R> empty() {
        return new GenericArgs<>(Collections.<R>emptyList(), Collections.<Ty<R>>emptyList(),
                Collections.<ConstGeneric>emptyList(), Collections.<TraitRef<R>>emptyList());
    }

    public static <R> GenericArgs<R> ofTypes(List<Ty<R>> types) {
        return new GenericArgs<>(Collections.<R>emptyList(), types,
                Collections.<ConstGeneric>emptyList(), Collections.<TraitRef<R>>emptyList());
    }

    public List<R> getRegions() { return regions; }
    public List<Ty<R>> getTypes() { return types; }
    public List<ConstGeneric> getConstGenerics() { return constGenerics; }
    public List<TraitRef<R>> getTraitRefs() { return traitRefs; }

    public boolean isEmpty() {
        return regions.isEmpty() && types.isEmpty() && constGenerics.isEmpty() && traitRefs.isEmpty();
    }

    /**
     * 实参数量是否与声明的参数逐项一致。
     */
    public boolean matchesArity(GenericParams params) {
        return regions.size() == params.getRegions().size()
                && types.size() == params.getTypes().size()
                && constGenerics.size() == params.getConstGenerics().size()
                && traitRefs.size() == params.getTraitClauses().size();
    }

    /** 同样的区域/类型/常量，替换 trait 见证 */
    public GenericArgs<R> withTraitRefs(List<TraitRef<R>> newTraitRefs) {
        return new GenericArgs<>(regions, types, constGenerics, newTraitRefs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericArgs)) return false;
        GenericArgs<?> that = (GenericArgs<?>) o;
        return regions.equals(that.regions) && types.equals(that.types)
                && constGenerics.equals(that.constGenerics) && traitRefs.equals(that.traitRefs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, types, constGenerics, traitRefs);
    }

    @Override
    public String toString() {
        List<Object> all = new ArrayList<>();
        all.addAll(regions);
        all.addAll(types);
        all.addAll(constGenerics);
        if (all.isEmpty() && traitRefs.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("<");
        for (int i = 0; i < all.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(all.get(i));
        }
        if (!traitRefs.isEmpty()) {
            sb.append(all.isEmpty() ? "" : "; ").append("[");
            for (int i = 0; i < traitRefs.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(traitRefs.get(i).getTraitId());
            }
            sb.append("]");
        }
        return sb.append('>').toString();
    }
}
