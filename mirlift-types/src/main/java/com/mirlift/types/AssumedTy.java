package com.mirlift.types;

/**
 * 内建（assumed）类型：原生数组/切片/字符串，以及按原生处理的标准库类型。
 * 目前全部对泛型参数协变。
 */
public enum AssumedTy implements Tagged {
    /** Box 被翻译为恒等 */
    BOX("Box"),
    PTR_UNIQUE("PtrUnique"),
    PTR_NON_NULL("PtrNonNull"),
    ARRAY("Array"),
    SLICE("Slice"),
    STR("Str");

    private final String serializedName;

    AssumedTy(String serializedName) {
        this.serializedName = serializedName;
    }

    @Override
    public String tag() { return serializedName; }

    @Override
    public Object[] fields() { return new Object[0]; }

    @Override
    public String toString() { return serializedName; }
}
