package com.mirlift.ir.ullbc;

import com.mirlift.types.meta.Meta;

import java.util.Objects;

public final class Statement {

    private final Meta meta;
    private final RawStatement content;

    public Statement(Meta meta, RawStatement content) {
        this.meta = Objects.requireNonNull(meta);
        this.content = Objects.requireNonNull(content);
    }

    public Meta getMeta() { return meta; }
    public RawStatement getContent() { return content; }

    @Override
    public String toString() {
        return content.toString();
    }
}
