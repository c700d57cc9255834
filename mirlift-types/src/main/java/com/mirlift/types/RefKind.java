package com.mirlift.types;

/**
 * 引用/裸指针的可变性。
 */
public enum RefKind implements Tagged {
    MUT("Mut"),
    SHARED("Shared");

    private final String serializedName;

    RefKind(String serializedName) {
        this.serializedName = serializedName;
    }

    @Override
    public String tag() { return serializedName; }

    @Override
    public Object[] fields() { return new Object[0]; }
}
