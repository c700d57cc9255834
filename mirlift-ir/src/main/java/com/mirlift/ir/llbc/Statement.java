package com.mirlift.ir.llbc;

import com.mirlift.types.meta.Meta;

import java.util.List;
import java.util.Objects;

/**
 * 结构化语句树中的一个可变单元：元信息 + 内容。
 * <p>
 * pass 通过替换单元内容原地改写语句树，父节点持有的引用保持不变。
 */
public final class Statement {

    private Meta meta;
    private RawStatement content;

    public Statement(Meta meta, RawStatement content) {
        this.meta = Objects.requireNonNull(meta);
        this.content = Objects.requireNonNull(content);
    }

    public static Statement nop(Meta meta) {
        return new Statement(meta, RawStatement.NOP);
    }

    /**
     * 把两条语句连接为序列。
     * 结果保持右嵌套：序列的第一个元素从不是序列；元信息取两者合并后的区间。
     */
    public static Statement sequence(Statement first, Statement next) {
        Meta meta = Meta.combine(first.meta, next.meta);
        if (first.content instanceof RawStatement.Sequence) {
            RawStatement.Sequence seq = (RawStatement.Sequence) first.content;
            return new Statement(meta, RawStatement.sequence(seq.getFirst(), sequence(seq.getNext(), next)));
        }
        return new Statement(meta, RawStatement.sequence(first, next));
    }

    /** 依次连接，至少一条 */
    public static Statement sequence(List<Statement> statements) {
        if (statements.isEmpty()) {
            throw new IllegalArgumentException("empty statement list");
        }
        Statement result = statements.get(statements.size() - 1);
        for (int i = statements.size() - 2; i >= 0; i--) {
            result = sequence(statements.get(i), result);
        }
        return result;
    }

    public Meta getMeta() { return meta; }
    public RawStatement getContent() { return content; }

    public void setMeta(Meta meta) {
        this.meta = Objects.requireNonNull(meta);
    }

    public void setContent(RawStatement content) {
        this.content = Objects.requireNonNull(content);
    }

    /** 用另一条语句的元信息与内容覆盖本单元 */
    public void replaceWith(Statement other) {
        this.meta = other.meta;
        this.content = other.content;
    }

    @Override
    public String toString() {
        return LlbcPrinter.print(this);
    }
}
