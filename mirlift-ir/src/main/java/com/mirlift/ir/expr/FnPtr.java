package com.mirlift.ir.expr;

import com.mirlift.types.ErasedRegion;
import com.mirlift.types.GenericArgs;

import java.util.Objects;

/**
 * 函数指针：调用目标 + 实参。
 */
public final class FnPtr {

    private final FunIdOrTraitMethodRef func;
    private final GenericArgs<ErasedRegion> generics;

    public FnPtr(FunIdOrTraitMethodRef func, GenericArgs<ErasedRegion> generics) {
        this.func = Objects.requireNonNull(func);
        this.generics = Objects.requireNonNull(generics);
    }

    public FunIdOrTraitMethodRef getFunc() { return func; }
    public GenericArgs<ErasedRegion> getGenerics() { return generics; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FnPtr)) return false;
        FnPtr that = (FnPtr) o;
        return func.equals(that.func) && generics.equals(that.generics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(func, generics);
    }

    @Override
    public String toString() {
        return func.toString() + generics;
    }
}
