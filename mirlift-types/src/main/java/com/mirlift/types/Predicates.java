package com.mirlift.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 作用于一个定义的、不需要见证的约束：区域间/类型对区域的 outlives 关系，以及关联类型约束。
 */
public final class Predicates {

    private final List<OutlivesPred<Region, Region>> regionsOutlive;
    private final List<OutlivesPred<Ty<Region>, Region>> typesOutlive;
    private final List<TraitTypeConstraint<Region>> traitTypeConstraints;

    public Predicates(List<OutlivesPred<Region, Region>> regionsOutlive,
                      List<OutlivesPred<Ty<Region>, Region>> typesOutlive,
                      List<TraitTypeConstraint<Region>> traitTypeConstraints) {
        this.regionsOutlive = Collections.unmodifiableList(new ArrayList<>(regionsOutlive));
        this.typesOutlive = Collections.unmodifiableList(new ArrayList<>(typesOutlive));
        this.traitTypeConstraints = Collections.unmodifiableList(new ArrayList<>(traitTypeConstraints));
    }

    public static Predicates empty() {
        return new Predicates(Collections.<OutlivesPred<Region, Region>>emptyList(),
                Collections.<OutlivesPred<Ty<Region>, Region>>emptyList(),
                Collections.<TraitTypeConstraint<Region>>emptyList());
    }

    public List<OutlivesPred<Region, Region>> getRegionsOutlive() { return regionsOutlive; }
    public List<OutlivesPred<Ty<Region>, Region>> getTypesOutlive() { return typesOutlive; }
    public List<TraitTypeConstraint<Region>> getTraitTypeConstraints() { return traitTypeConstraints; }

    public boolean isEmpty() {
        return regionsOutlive.isEmpty() && typesOutlive.isEmpty() && traitTypeConstraints.isEmpty();
    }

    public Predicates withTraitTypeConstraints(List<TraitTypeConstraint<Region>> constraints) {
        return new Predicates(regionsOutlive, typesOutlive, constraints);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Predicates)) return false;
        Predicates that = (Predicates) o;
        return regionsOutlive.equals(that.regionsOutlive) && typesOutlive.equals(that.typesOutlive)
                && traitTypeConstraints.equals(that.traitTypeConstraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regionsOutlive, typesOutlive, traitTypeConstraints);
    }
}
