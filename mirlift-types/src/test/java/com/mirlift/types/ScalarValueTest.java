package com.mirlift.types;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 整数值与位模式测试
 */
class ScalarValueTest {

    @Test
    @DisplayName("i8 的 -1 位模式为 255")
    void testNegativeI8Bits() {
        ScalarValue v = ScalarValue.of(IntegerTy.I8, -1);
        assertEquals(BigInteger.valueOf(255), v.toBits());
        assertEquals(BigInteger.valueOf(-1), v.toSignedValue());
    }

    @Test
    @DisplayName("按位模式给出的 255: i8 与 -1: i8 相等")
    void testBitsEquality() {
        ScalarValue fromSigned = ScalarValue.of(IntegerTy.I8, -1);
        ScalarValue fromBits = ScalarValue.fromBits(IntegerTy.I8, BigInteger.valueOf(255));
        assertEquals(fromSigned, fromBits);
        assertEquals(fromSigned.hashCode(), fromBits.hashCode());
    }

    @Test
    @DisplayName("u8 的 255 不是负数")
    void testUnsigned() {
        ScalarValue v = ScalarValue.of(IntegerTy.U8, 255);
        assertEquals(BigInteger.valueOf(255), v.toSignedValue());
        assertNotEquals(v, ScalarValue.of(IntegerTy.I8, -1));
    }

    @Test
    @DisplayName("isize 按 64 位处理")
    void testIsize() {
        ScalarValue v = ScalarValue.of(IntegerTy.ISIZE, -1);
        assertEquals(IntegerTy.U64.mask(), v.toBits());
        assertEquals(64, IntegerTy.USIZE.getBits());
    }

    @Test
    @DisplayName("i128 边界")
    void testI128() {
        BigInteger min = IntegerTy.I128.minValue();
        ScalarValue v = new ScalarValue(IntegerTy.I128, min);
        assertEquals(BigInteger.ONE.shiftLeft(127), v.toBits());
        assertEquals(min, v.toSignedValue());
    }

    @Test
    @DisplayName("fromBits 按宽度截断")
    void testTruncate() {
        ScalarValue v = ScalarValue.fromBits(IntegerTy.U8, BigInteger.valueOf(0x1FF));
        assertEquals(BigInteger.valueOf(0xFF), v.toBits());
    }

    @Test
    @DisplayName("超出范围的值被拒绝")
    void testOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> ScalarValue.of(IntegerTy.U8, 256));
        assertThrows(IllegalArgumentException.class, () -> ScalarValue.of(IntegerTy.U8, -1));
        assertThrows(IllegalArgumentException.class, () -> ScalarValue.of(IntegerTy.I8, -129));
    }

    @Test
    @DisplayName("序列化标签与有符号值")
    void testTagged() {
        ScalarValue v = ScalarValue.fromBits(IntegerTy.I16, BigInteger.valueOf(0xFFFE));
        assertEquals("I16", v.tag());
        assertArrayEquals(new Object[]{BigInteger.valueOf(-2)}, v.fields());
    }
}
