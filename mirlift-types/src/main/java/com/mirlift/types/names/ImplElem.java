package com.mirlift.types.names;

import com.mirlift.types.GenericParams;
import com.mirlift.types.Predicates;
import com.mirlift.types.id.Disambiguator;

import java.util.Objects;

/**
 * 名字路径中的 impl 块。同一类型可以有多个 impl 块，靠 disambiguator 区分。
 */
public final class ImplElem {

    private final Disambiguator disambiguator;
    private final GenericParams generics;
    private final Predicates preds;
    private final ImplElemKind kind;

    public ImplElem(Disambiguator disambiguator, GenericParams generics, Predicates preds, ImplElemKind kind) {
        this.disambiguator = Objects.requireNonNull(disambiguator);
        this.generics = Objects.requireNonNull(generics);
        this.preds = Objects.requireNonNull(preds);
        this.kind = Objects.requireNonNull(kind);
    }

    public Disambiguator getDisambiguator() { return disambiguator; }
    public GenericParams getGenerics() { return generics; }
    public Predicates getPreds() { return preds; }
    public ImplElemKind getKind() { return kind; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImplElem)) return false;
        ImplElem that = (ImplElem) o;
        return disambiguator.equals(that.disambiguator) && generics.equals(that.generics)
                && preds.equals(that.preds) && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(disambiguator, generics, preds, kind);
    }

    @Override
    public String toString() {
        return "{impl " + kind + "#" + disambiguator.getIndex() + "}";
    }
}
