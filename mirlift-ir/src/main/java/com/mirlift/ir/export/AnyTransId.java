package com.mirlift.ir.export;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.IndexId;

import java.util.Objects;

/**
 * 任意种类的声明 id，用于混合声明组。
 */
public final class AnyTransId implements Tagged {

    public enum Kind {
        TYPE("Type"),
        FUN("Fun"),
        GLOBAL("Global"),
        TRAIT_DECL("TraitDecl"),
        TRAIT_IMPL("TraitImpl");

        private final String serializedName;

        Kind(String serializedName) {
            this.serializedName = serializedName;
        }
    }

    private final Kind kind;
    private final IndexId<?> id;

    public AnyTransId(Kind kind, IndexId<?> id) {
        this.kind = Objects.requireNonNull(kind);
        this.id = Objects.requireNonNull(id);
    }

    public Kind getKind() { return kind; }
    public IndexId<?> getId() { return id; }

    @Override
    public String tag() { return kind.serializedName; }

    @Override
    public Object[] fields() { return new Object[]{id}; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnyTransId)) return false;
        AnyTransId that = (AnyTransId) o;
        return kind == that.kind && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
