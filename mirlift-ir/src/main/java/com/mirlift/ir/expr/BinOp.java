package com.mirlift.ir.expr;

import com.mirlift.types.Tagged;

/**
 * 二元运算符。Checked* 返回 (结果, 是否溢出) 元组。
 */
public enum BinOp implements Tagged {
    BIT_XOR("BitXor", "^"),
    BIT_AND("BitAnd", "&"),
    BIT_OR("BitOr", "|"),
    EQ("Eq", "=="),
    LT("Lt", "<"),
    LE("Le", "<="),
    NE("Ne", "!="),
    GE("Ge", ">="),
    GT("Gt", ">"),
    DIV("Div", "/"),
    REM("Rem", "%"),
    ADD("Add", "+"),
    SUB("Sub", "-"),
    MUL("Mul", "*"),
    CHECKED_ADD("CheckedAdd", "+?"),
    CHECKED_SUB("CheckedSub", "-?"),
    CHECKED_MUL("CheckedMul", "*?"),
    SHL("Shl", "<<"),
    SHR("Shr", ">>");

    private final String serializedName;
    private final String symbol;

    BinOp(String serializedName, String symbol) {
        this.serializedName = serializedName;
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public String tag() { return serializedName; }

    @Override
    public Object[] fields() { return new Object[0]; }
}
