package com.mirlift.types;

/**
 * 已擦除的区域。函数体中的类型统一使用它，签名中从不出现。
 */
public enum ErasedRegion implements Tagged {
    ERASED;

    @Override
    public String tag() { return "Erased"; }

    @Override
    public Object[] fields() { return new Object[0]; }

    @Override
    public String toString() { return "'_"; }
}
