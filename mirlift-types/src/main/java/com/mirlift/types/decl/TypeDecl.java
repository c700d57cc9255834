package com.mirlift.types.decl;

import com.mirlift.types.GenericParams;
import com.mirlift.types.Predicates;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.meta.Meta;
import com.mirlift.types.names.Name;

import java.util.Objects;

/**
 * 类型声明（结构体、枚举、不透明类型）。
 * kind / generics / preds 可被清理类 pass 原地替换。
 */
public final class TypeDecl {

    private final TypeDeclId defId;
    private final Meta meta;
    /** false 表示来自外部 crate */
    private final boolean isLocal;
    private final Name name;
    private GenericParams generics;
    private Predicates preds;
    private TypeDeclKind kind;

    public TypeDecl(TypeDeclId defId, Meta meta, boolean isLocal, Name name, GenericParams generics,
                    Predicates preds, TypeDeclKind kind) {
        this.defId = Objects.requireNonNull(defId);
        this.meta = Objects.requireNonNull(meta);
        this.isLocal = isLocal;
        this.name = Objects.requireNonNull(name);
        this.generics = Objects.requireNonNull(generics);
        this.preds = Objects.requireNonNull(preds);
        this.kind = Objects.requireNonNull(kind);
    }

    public TypeDeclId getDefId() { return defId; }
    public Meta getMeta() { return meta; }
    public boolean isLocal() { return isLocal; }
    public Name getName() { return name; }
    public GenericParams getGenerics() { return generics; }
    public Predicates getPreds() { return preds; }
    public TypeDeclKind getKind() { return kind; }

    public void setGenerics(GenericParams generics) { this.generics = Objects.requireNonNull(generics); }
    public void setPreds(Predicates preds) { this.preds = Objects.requireNonNull(preds); }
    public void setKind(TypeDeclKind kind) { this.kind = Objects.requireNonNull(kind); }

    public boolean isEnum() {
        return kind instanceof TypeDeclKind.Enum;
    }

    @Override
    public String toString() {
        return "type " + name + " (" + defId + ", " + kind.tag() + ")";
    }
}
