package com.mirlift.types;

import com.mirlift.types.id.TypeVarId;

import java.util.Objects;

/**
 * 类型变量声明。
 */
public final class TypeVar {

    private final TypeVarId index;
    private final String name;

    public TypeVar(TypeVarId index, String name) {
        this.index = Objects.requireNonNull(index);
        this.name = Objects.requireNonNull(name);
    }

    public TypeVarId getIndex() { return index; }
    public String getName() { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeVar)) return false;
        TypeVar that = (TypeVar) o;
        return index.equals(that.index) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
