package com.mirlift.ir.gast;

import com.mirlift.types.FunSig;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.meta.Meta;
import com.mirlift.types.names.Name;

import java.util.Objects;

/**
 * 函数声明。body 为 null 表示不透明或外部函数。
 *
 * @param <B> 函数体控制流表示
 */
public final class GFunDecl<B> {

    private final FunDeclId defId;
    private final Meta meta;
    private final boolean isLocal;
    private final Name name;
    private FunSig signature;
    private final FunKind kind;
    private final GExprBody<B> body;

    public GFunDecl(FunDeclId defId, Meta meta, boolean isLocal, Name name, FunSig signature, FunKind kind,
                    GExprBody<B> body) {
        this.defId = Objects.requireNonNull(defId);
        this.meta = Objects.requireNonNull(meta);
        this.isLocal = isLocal;
        this.name = Objects.requireNonNull(name);
        this.signature = Objects.requireNonNull(signature);
        this.kind = Objects.requireNonNull(kind);
        this.body = body;
    }

    public FunDeclId getDefId() { return defId; }
    public Meta getMeta() { return meta; }
    public boolean isLocal() { return isLocal; }
    public Name getName() { return name; }
    public FunSig getSignature() { return signature; }
    public FunKind getKind() { return kind; }
    public GExprBody<B> getBody() { return body; }

    public void setSignature(FunSig signature) {
        this.signature = Objects.requireNonNull(signature);
    }

    @Override
    public String toString() {
        return "fn " + name + " (" + defId + ")";
    }
}
