package com.mirlift.types.meta;

import java.util.Objects;

/**
 * 附着在声明与语句上的源码元信息。
 */
public final class Meta {

    private final Span span;
    /** 宏展开等生成代码的来源区间，可为 null */
    private final Span generatedFromSpan;

    public Meta(Span span, Span generatedFromSpan) {
        this.span = span;
        this.generatedFromSpan = generatedFromSpan;
    }

    public Meta(Span span) {
        this(span, null);
    }

    public Span getSpan() { return span; }
    public Span getGeneratedFromSpan() { return generatedFromSpan; }

    /**
     * 合并两条元信息（用于把两条语句融合为一条时保留完整区间）。
     */
    public static Meta combine(Meta a, Meta b) {
        Span generated;
        if (a.generatedFromSpan == null) {
            generated = b.generatedFromSpan;
        } else if (b.generatedFromSpan == null) {
            generated = a.generatedFromSpan;
        } else {
            generated = Span.combine(a.generatedFromSpan, b.generatedFromSpan);
        }
        return new Meta(Span.combine(a.span, b.span), generated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Meta)) return false;
        Meta that = (Meta) o;
        return span.equals(that.span) && Objects.equals(generatedFromSpan, that.generatedFromSpan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(span, generatedFromSpan);
    }

    @Override
    public String toString() {
        return span.toString();
    }
}
