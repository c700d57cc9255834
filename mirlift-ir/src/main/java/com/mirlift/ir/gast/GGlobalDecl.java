package com.mirlift.ir.gast;

import com.mirlift.types.ErasedRegion;
import com.mirlift.types.Ty;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.meta.Meta;
import com.mirlift.types.names.Name;

import java.util.Objects;

/**
 * 全局常量/静态量声明。body 计算其初始值，外部全局量没有 body。
 */
public final class GGlobalDecl<B> {

    private final GlobalDeclId defId;
    private final Meta meta;
    private final boolean isLocal;
    private final Name name;
    private Ty<ErasedRegion> ty;
    private final GExprBody<B> body;

    public GGlobalDecl(GlobalDeclId defId, Meta meta, boolean isLocal, Name name, Ty<ErasedRegion> ty,
                       GExprBody<B> body) {
        this.defId = Objects.requireNonNull(defId);
        this.meta = Objects.requireNonNull(meta);
        this.isLocal = isLocal;
        this.name = Objects.requireNonNull(name);
        this.ty = Objects.requireNonNull(ty);
        this.body = body;
    }

    public GlobalDeclId getDefId() { return defId; }
    public Meta getMeta() { return meta; }
    public boolean isLocal() { return isLocal; }
    public Name getName() { return name; }
    public Ty<ErasedRegion> getTy() { return ty; }
    public GExprBody<B> getBody() { return body; }

    public void setTy(Ty<ErasedRegion> ty) {
        this.ty = Objects.requireNonNull(ty);
    }

    @Override
    public String toString() {
        return "global " + name + " (" + defId + ")";
    }
}
