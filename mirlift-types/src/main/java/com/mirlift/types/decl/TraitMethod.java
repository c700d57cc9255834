package com.mirlift.types.decl;

import com.mirlift.types.id.FunDeclId;

import java.util.Objects;

/**
 * trait 声明或实现中的方法项：名字 + 对应函数声明。
 * trait 声明中未被覆盖的已提供方法可能没有函数 id。
 */
public final class TraitMethod {

    private final String name;
    private final FunDeclId funId;  // nullable

    public TraitMethod(String name, FunDeclId funId) {
        this.name = Objects.requireNonNull(name);
        this.funId = funId;
    }

    public String getName() { return name; }
    public FunDeclId getFunId() { return funId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraitMethod)) return false;
        TraitMethod that = (TraitMethod) o;
        return name.equals(that.name) && Objects.equals(funId, that.funId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, funId);
    }

    @Override
    public String toString() {
        return name + " -> " + funId;
    }
}
