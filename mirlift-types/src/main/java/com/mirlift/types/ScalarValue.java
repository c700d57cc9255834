package com.mirlift.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 带类型的整数值。
 * 值可以按有符号数给出（如 i8 的 -1），也可以直接给出原始位模式（如 255），
 * {@link #toBits()} 对两者得到相同的无符号位模式。
 */
public final class ScalarValue implements Tagged {

    private final IntegerTy integerTy;
    private final BigInteger value;

    public ScalarValue(IntegerTy integerTy, BigInteger value) {
        this.integerTy = Objects.requireNonNull(integerTy);
        this.value = Objects.requireNonNull(value);
        if (value.compareTo(integerTy.minValue()) < 0 || value.compareTo(integerTy.mask()) > 0) {
            throw new IllegalArgumentException("value " + value + " does not fit in " + integerTy);
        }
    }

    public static ScalarValue of(IntegerTy integerTy, long value) {
        return new ScalarValue(integerTy, BigInteger.valueOf(value));
    }

    /**
     * 从原始位模式构造，按类型宽度截断。
     */
    public static ScalarValue fromBits(IntegerTy integerTy, BigInteger bits) {
        return new ScalarValue(integerTy, bits.and(integerTy.mask()));
    }

    public IntegerTy getIntegerTy() { return integerTy; }
    public BigInteger getValue() { return value; }

    /**
     * 按类型宽度重新解释为无符号位模式。
     */
    public BigInteger toBits() {
        return value.and(integerTy.mask());
    }

    /**
     * 按类型的符号性解释出的数值（位模式 255 的 i8 → -1）。
     */
    public BigInteger toSignedValue() {
        BigInteger bits = toBits();
        if (integerTy.isSigned() && bits.testBit(integerTy.getBits() - 1)) {
            return bits.subtract(BigInteger.ONE.shiftLeft(integerTy.getBits()));
        }
        return bits;
    }

    @Override
    public String tag() {
        return integerTy.tag();
    }

    @Override
    public Object[] fields() {
        return new Object[]{toSignedValue()};
    }

    /** 相等按位模式比较 */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarValue)) return false;
        ScalarValue that = (ScalarValue) o;
        return integerTy == that.integerTy && toBits().equals(that.toBits());
    }

    @Override
    public int hashCode() {
        return Objects.hash(integerTy, toBits());
    }

    @Override
    public String toString() {
        return toSignedValue() + ": " + integerTy;
    }
}
