package com.mirlift.ir.gast;

import com.mirlift.ir.expr.Var;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.VarId;
import com.mirlift.types.meta.Meta;

import java.util.Objects;

/**
 * 函数或全局量的函数体。T 为控制流表示：非结构化的基本块表，或结构化的语句树。
 * <p>
 * locals 中 0 号为返回值，1..argCount 为参数。
 */
public final class GExprBody<T> {

    private final Meta meta;
    private final int argCount;
    private final IdVector<VarId, Var> locals;
    private T body;

    public GExprBody(Meta meta, int argCount, IdVector<VarId, Var> locals, T body) {
        this.meta = Objects.requireNonNull(meta);
        this.argCount = argCount;
        this.locals = Objects.requireNonNull(locals);
        this.body = Objects.requireNonNull(body);
    }

    public Meta getMeta() { return meta; }
    public int getArgCount() { return argCount; }
    public IdVector<VarId, Var> getLocals() { return locals; }
    public T getBody() { return body; }

    public void setBody(T body) {
        this.body = Objects.requireNonNull(body);
    }
}
