package com.mirlift.ir.export;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.id.TraitImplId;
import com.mirlift.types.id.TypeDeclId;

import java.util.Objects;

/**
 * 按依赖排序后的一组声明。同种声明用各自的组，不同种类互相递归时用 Mixed。
 */
public final class DeclarationGroup implements Tagged {

    private final String kind;
    private final GDeclarationGroup<?> group;

    private DeclarationGroup(String kind, GDeclarationGroup<?> group) {
        this.kind = kind;
        this.group = Objects.requireNonNull(group);
    }

    public static DeclarationGroup type(GDeclarationGroup<TypeDeclId> group) {
        return new DeclarationGroup("Type", group);
    }

    public static DeclarationGroup fun(GDeclarationGroup<FunDeclId> group) {
        return new DeclarationGroup("Fun", group);
    }

    public static DeclarationGroup global(GDeclarationGroup<GlobalDeclId> group) {
        return new DeclarationGroup("Global", group);
    }

    public static DeclarationGroup traitDecl(GDeclarationGroup<TraitDeclId> group) {
        return new DeclarationGroup("TraitDecl", group);
    }

    public static DeclarationGroup traitImpl(GDeclarationGroup<TraitImplId> group) {
        return new DeclarationGroup("TraitImpl", group);
    }

    public static DeclarationGroup mixed(GDeclarationGroup<AnyTransId> group) {
        return new DeclarationGroup("Mixed", group);
    }

    public GDeclarationGroup<?> getGroup() {
        return group;
    }

    @Override
    public String tag() { return kind; }

    @Override
    public Object[] fields() { return new Object[]{group}; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeclarationGroup)) return false;
        DeclarationGroup that = (DeclarationGroup) o;
        return kind.equals(that.kind) && group.equals(that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, group);
    }

    @Override
    public String toString() {
        return kind + ":" + group.ids();
    }
}
