package com.mirlift.types;

import java.util.Objects;

/**
 * 生存期约束 {@code a: b}：左侧（区域或类型）比右侧区域活得更久。
 */
public final class OutlivesPred<T, U> {

    private final T left;
    private final U right;

    public OutlivesPred(T left, U right) {
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public T getLeft() { return left; }
    public U getRight() { return right; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutlivesPred)) return false;
        OutlivesPred<?, ?> that = (OutlivesPred<?, ?>) o;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return left + ": " + right;
    }
}
