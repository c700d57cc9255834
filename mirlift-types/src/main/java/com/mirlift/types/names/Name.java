package com.mirlift.types.names;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 条目的名字：路径段列表，第一段总是 crate 名。
 * <p>
 * 只在需要时（通常是 impl 块）插入 disambiguator，其余位置 disambiguator 为 0。
 * 条目本身由 id 唯一确定，名字仅用于展示与下游命名。
 */
public final class Name {

    private final List<PathElem> elems;

    public Name(List<PathElem> elems) {
        this.elems = Collections.unmodifiableList(new ArrayList<>(elems));
    }

    /** 由纯标识符构造，如 {@code Name.of("core", "option", "Option")} */
    public static Name of(String... idents) {
        List<PathElem> elems = new ArrayList<>();
        for (String ident : idents) {
            elems.add(PathElem.ident(ident));
        }
        return new Name(elems);
    }

    /** 解析 {@code a::b::c} 形式的纯标识符路径 */
    public static Name parse(String path) {
        return of(path.split("::"));
    }

    public List<PathElem> getElems() { return elems; }

    public int length() { return elems.size(); }

    /** 路径是否逐段等于给定的标识符（impl 段不匹配任何标识符） */
    public boolean equalsIdents(String... idents) {
        if (idents.length != elems.size()) return false;
        for (int i = 0; i < idents.length; i++) {
            PathElem e = elems.get(i);
            if (!(e instanceof PathElem.Ident) || !((PathElem.Ident) e).getName().equals(idents[i])) {
                return false;
            }
        }
        return true;
    }

    public Name append(PathElem elem) {
        List<PathElem> list = new ArrayList<>(elems);
        list.add(elem);
        return new Name(list);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Name && ((Name) o).elems.equals(elems);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elems);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elems.size(); i++) {
            if (i > 0) sb.append("::");
            sb.append(elems.get(i));
        }
        return sb.toString();
    }
}
