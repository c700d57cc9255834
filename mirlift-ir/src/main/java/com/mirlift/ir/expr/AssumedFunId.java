package com.mirlift.ir.expr;

import com.mirlift.types.Tagged;

/**
 * 内建函数（Box 操作、数组/切片下标与转换）。
 */
public enum AssumedFunId implements Tagged {
    BOX_NEW("BoxNew"),
    BOX_FREE("BoxFree"),
    ARRAY_INDEX_SHARED("ArrayIndexShared"),
    ARRAY_INDEX_MUT("ArrayIndexMut"),
    ARRAY_TO_SLICE_SHARED("ArrayToSliceShared"),
    ARRAY_TO_SLICE_MUT("ArrayToSliceMut"),
    ARRAY_REPEAT("ArrayRepeat"),
    SLICE_INDEX_SHARED("SliceIndexShared"),
    SLICE_INDEX_MUT("SliceIndexMut");

    private final String serializedName;

    AssumedFunId(String serializedName) {
        this.serializedName = serializedName;
    }

    @Override
    public String tag() { return serializedName; }

    @Override
    public Object[] fields() { return new Object[0]; }
}
