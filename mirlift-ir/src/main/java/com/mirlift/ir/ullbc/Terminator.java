package com.mirlift.ir.ullbc;

import com.mirlift.types.meta.Meta;

import java.util.Objects;

public final class Terminator {

    private final Meta meta;
    private final RawTerminator content;

    public Terminator(Meta meta, RawTerminator content) {
        this.meta = Objects.requireNonNull(meta);
        this.content = Objects.requireNonNull(content);
    }

    public Meta getMeta() { return meta; }
    public RawTerminator getContent() { return content; }

    @Override
    public String toString() {
        return content.toString();
    }
}
