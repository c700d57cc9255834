package com.mirlift.types.decl;

import com.mirlift.types.Region;
import com.mirlift.types.Ty;
import com.mirlift.types.meta.Meta;

import java.util.Objects;

/**
 * 结构体或枚举变体的字段。元组式字段没有名字。
 */
public final class Field {

    private final Meta meta;
    private final String name;  // nullable
    private final Ty<Region> ty;

    public Field(Meta meta, String name, Ty<Region> ty) {
        this.meta = Objects.requireNonNull(meta);
        this.name = name;
        this.ty = Objects.requireNonNull(ty);
    }

    public Meta getMeta() { return meta; }
    public String getName() { return name; }
    public Ty<Region> getTy() { return ty; }

    public Field withTy(Ty<Region> newTy) {
        return new Field(meta, name, newTy);
    }

    @Override
    public String toString() {
        return (name != null ? name : "_") + ": " + ty;
    }
}
