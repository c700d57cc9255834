package com.mirlift.types;

import java.math.BigInteger;

/**
 * 整数类型。isize/usize 按 64 位处理。
 */
public enum IntegerTy implements Tagged {
    ISIZE("Isize", 64, true),
    I8("I8", 8, true),
    I16("I16", 16, true),
    I32("I32", 32, true),
    I64("I64", 64, true),
    I128("I128", 128, true),
    USIZE("Usize", 64, false),
    U8("U8", 8, false),
    U16("U16", 16, false),
    U32("U32", 32, false),
    U64("U64", 64, false),
    U128("U128", 128, false);

    private final String serializedName;
    private final int bits;
    private final boolean signed;

    IntegerTy(String serializedName, int bits, boolean signed) {
        this.serializedName = serializedName;
        this.bits = bits;
        this.signed = signed;
    }

    public int getBits() {
        return bits;
    }

    public boolean isSigned() {
        return signed;
    }

    /** 2^bits - 1 */
    public BigInteger mask() {
        return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    public BigInteger minValue() {
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    public BigInteger maxValue() {
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE) : mask();
    }

    @Override
    public String tag() {
        return serializedName;
    }

    @Override
    public Object[] fields() {
        return new Object[0];
    }

    @Override
    public String toString() {
        return serializedName.toLowerCase();
    }
}
