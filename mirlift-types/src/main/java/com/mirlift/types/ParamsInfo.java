package com.mirlift.types;

import java.util.Objects;

/**
 * trait 方法签名中来自外层（trait 声明或 impl）的参数与约束个数。
 * <p>
 * trait 方法的泛型参数由外层参数与方法自身参数拼接而成，下游需要据此切分。
 */
public final class ParamsInfo {

    private final int numRegionParams;
    private final int numTypeParams;
    private final int numConstGenericParams;
    private final int numTraitClauses;
    private final int numRegionsOutlive;
    private final int numTypesOutlive;
    private final int numTraitTypeConstraints;

    public ParamsInfo(int numRegionParams, int numTypeParams, int numConstGenericParams, int numTraitClauses,
                      int numRegionsOutlive, int numTypesOutlive, int numTraitTypeConstraints) {
        this.numRegionParams = numRegionParams;
        this.numTypeParams = numTypeParams;
        this.numConstGenericParams = numConstGenericParams;
        this.numTraitClauses = numTraitClauses;
        this.numRegionsOutlive = numRegionsOutlive;
        this.numTypesOutlive = numTypesOutlive;
        this.numTraitTypeConstraints = numTraitTypeConstraints;
    }

    public static ParamsInfo of(GenericParams generics, Predicates preds) {
        return new ParamsInfo(
                generics.getRegions().size(),
                generics.getTypes().size(),
                generics.getConstGenerics().size(),
                generics.getTraitClauses().size(),
                preds.getRegionsOutlive().size(),
                preds.getTypesOutlive().size(),
                preds.getTraitTypeConstraints().size());
    }

    public int getNumRegionParams() { return numRegionParams; }
    public int getNumTypeParams() { return numTypeParams; }
    public int getNumConstGenericParams() { return numConstGenericParams; }
    public int getNumTraitClauses() { return numTraitClauses; }
    public int getNumRegionsOutlive() { return numRegionsOutlive; }
    public int getNumTypesOutlive() { return numTypesOutlive; }
    public int getNumTraitTypeConstraints() { return numTraitTypeConstraints; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamsInfo)) return false;
        ParamsInfo that = (ParamsInfo) o;
        return numRegionParams == that.numRegionParams && numTypeParams == that.numTypeParams
                && numConstGenericParams == that.numConstGenericParams
                && numTraitClauses == that.numTraitClauses
                && numRegionsOutlive == that.numRegionsOutlive
                && numTypesOutlive == that.numTypesOutlive
                && numTraitTypeConstraints == that.numTraitTypeConstraints;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numRegionParams, numTypeParams, numConstGenericParams, numTraitClauses,
                numRegionsOutlive, numTypesOutlive, numTraitTypeConstraints);
    }
}
