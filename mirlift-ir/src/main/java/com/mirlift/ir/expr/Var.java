package com.mirlift.ir.expr;

import com.mirlift.types.ErasedRegion;
import com.mirlift.types.Ty;
import com.mirlift.types.id.VarId;

import java.util.Objects;

/**
 * 函数体局部变量。0 号为返回值，其后依次为参数，再后为临时变量。
 */
public final class Var {

    private final VarId index;
    private final String name;  // nullable
    private final Ty<ErasedRegion> ty;

    public Var(VarId index, String name, Ty<ErasedRegion> ty) {
        this.index = Objects.requireNonNull(index);
        this.name = name;
        this.ty = Objects.requireNonNull(ty);
    }

    public VarId getIndex() { return index; }
    public String getName() { return name; }
    public Ty<ErasedRegion> getTy() { return ty; }

    public Var withTy(Ty<ErasedRegion> newTy) {
        return new Var(index, name, newTy);
    }

    @Override
    public String toString() {
        return (name != null ? name : "") + "@" + index.getIndex() + ": " + ty;
    }
}
