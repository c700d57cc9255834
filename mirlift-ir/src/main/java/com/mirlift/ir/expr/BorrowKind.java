package com.mirlift.ir.expr;

import com.mirlift.types.Tagged;

/**
 * 借用种类。
 */
public enum BorrowKind implements Tagged {
    SHARED("Shared"),
    MUT("Mut"),
    /** 两阶段借用：先以共享方式使用，激活后变为可变借用 */
    TWO_PHASE_MUT("TwoPhaseMut"),
    /** 只用于模式匹配守卫，不允许读取被借用值的内容 */
    SHALLOW("Shallow");

    private final String serializedName;

    BorrowKind(String serializedName) {
        this.serializedName = serializedName;
    }

    @Override
    public String tag() { return serializedName; }

    @Override
    public Object[] fields() { return new Object[0]; }
}
