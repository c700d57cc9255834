package com.mirlift.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数签名。签名保留真实区域（函数体中的区域已擦除），下游据此为借用做抽象。
 */
public final class FunSig {

    private final boolean isUnsafe;
    private final GenericParams generics;
    private final Predicates preds;
    /** 仅 trait 方法有值 */
    private final ParamsInfo parentParamsInfo;
    private final List<Ty<Region>> inputs;
    private final Ty<Region> output;

    public FunSig(boolean isUnsafe, GenericParams generics, Predicates preds, ParamsInfo parentParamsInfo,
                  List<Ty<Region>> inputs, Ty<Region> output) {
        this.isUnsafe = isUnsafe;
        this.generics = Objects.requireNonNull(generics);
        this.preds = Objects.requireNonNull(preds);
        this.parentParamsInfo = parentParamsInfo;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.output = Objects.requireNonNull(output);
    }

    public boolean isUnsafe() { return isUnsafe; }
    public GenericParams getGenerics() { return generics; }
    public Predicates getPreds() { return preds; }
    public ParamsInfo getParentParamsInfo() { return parentParamsInfo; }
    public List<Ty<Region>> getInputs() { return inputs; }
    public Ty<Region> getOutput() { return output; }

    public FunSig withTypes(GenericParams newGenerics, Predicates newPreds,
                            List<Ty<Region>> newInputs, Ty<Region> newOutput) {
        return new FunSig(isUnsafe, newGenerics, newPreds, parentParamsInfo, newInputs, newOutput);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunSig)) return false;
        FunSig that = (FunSig) o;
        return isUnsafe == that.isUnsafe && generics.equals(that.generics) && preds.equals(that.preds)
                && Objects.equals(parentParamsInfo, that.parentParamsInfo)
                && inputs.equals(that.inputs) && output.equals(that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(isUnsafe, generics, preds, parentParamsInfo, inputs, output);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(isUnsafe ? "unsafe fn(" : "fn(");
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(inputs.get(i));
        }
        return sb.append(") -> ").append(output).toString();
    }
}
