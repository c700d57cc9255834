package com.mirlift.ir.translate;

import com.mirlift.types.meta.Meta;

/**
 * 严格模式下登记错误时抛出。
 */
public class TranslationException extends RuntimeException {
    private final Meta meta;

    public TranslationException(String message, Meta meta) {
        super(message);
        this.meta = meta;
    }

    public Meta getMeta() {
        return meta;
    }

    @Override
    public String getMessage() {
        if (meta == null) return super.getMessage();
        return super.getMessage() + " at " + meta;
    }
}
