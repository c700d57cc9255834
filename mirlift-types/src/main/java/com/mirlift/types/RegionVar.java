package com.mirlift.types;

import com.mirlift.types.id.RegionId;

import java.util.Objects;

/**
 * 区域变量声明。
 */
public final class RegionVar {

    private final RegionId index;
    private final String name;  // 匿名区域为 null

    public RegionVar(RegionId index, String name) {
        this.index = Objects.requireNonNull(index);
        this.name = name;
    }

    public RegionId getIndex() { return index; }
    public String getName() { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegionVar)) return false;
        RegionVar that = (RegionVar) o;
        return index.equals(that.index) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name);
    }

    @Override
    public String toString() {
        return name != null ? name : "'_" + index.getIndex();
    }
}
