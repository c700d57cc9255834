package com.mirlift.types.id;

/**
 * 强类型整数标识符基类。
 * 每种实体一个 final 子类，不同种类的 id 互不相等，也不能互相赋值。
 *
 * @param <I> 具体 id 类型
 */
public abstract class IndexId<I extends IndexId<I>> implements Comparable<I> {

    private final int index;

    protected IndexId(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("negative id: " + index);
        }
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    /** 用于 toString 的种类名 */
    protected abstract String kindName();

    @Override
    public int compareTo(I other) {
        return Integer.compare(index, other.getIndex());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return index == ((IndexId<?>) o).index;
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + index;
    }

    @Override
    public String toString() {
        return kindName() + "@" + index;
    }
}
