package com.mirlift.types;

import com.mirlift.types.id.ConstGenericVarId;

import java.util.Objects;

/**
 * 常量泛型变量声明，类型总是字面量类型。
 */
public final class ConstGenericVar {

    private final ConstGenericVarId index;
    private final String name;
    private final LiteralTy ty;

    public ConstGenericVar(ConstGenericVarId index, String name, LiteralTy ty) {
        this.index = Objects.requireNonNull(index);
        this.name = Objects.requireNonNull(name);
        this.ty = Objects.requireNonNull(ty);
    }

    public ConstGenericVarId getIndex() { return index; }
    public String getName() { return name; }
    public LiteralTy getTy() { return ty; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstGenericVar)) return false;
        ConstGenericVar that = (ConstGenericVar) o;
        return index.equals(that.index) && name.equals(that.name) && ty.equals(that.ty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name, ty);
    }

    @Override
    public String toString() {
        return "const " + name + ": " + ty;
    }
}
