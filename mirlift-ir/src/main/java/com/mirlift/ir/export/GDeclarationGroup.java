package com.mirlift.ir.export;

import com.mirlift.types.Tagged;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一组声明：单个非递归声明，或一组互相递归的声明。
 *
 * @param <I> 声明 id 类型
 */
public abstract class GDeclarationGroup<I> implements Tagged {

    private GDeclarationGroup() {
    }

    public static <I> GDeclarationGroup<I> nonRec(I id) {
        return new NonRec<>(id);
    }

    public static <I> GDeclarationGroup<I> rec(List<I> ids) {
        return new Rec<>(ids);
    }

    /** 组内的全部 id */
    public abstract List<I> ids();

    public static final class NonRec<I> extends GDeclarationGroup<I> {
        private final I id;

        private NonRec(I id) { this.id = Objects.requireNonNull(id); }

        public I getId() { return id; }

        @Override
        public List<I> ids() { return Collections.singletonList(id); }

        @Override
        public String tag() { return "NonRec"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof NonRec && ((NonRec<?>) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }
    }

    public static final class Rec<I> extends GDeclarationGroup<I> {
        private final List<I> ids;

        private Rec(List<I> ids) { this.ids = Collections.unmodifiableList(new ArrayList<>(ids)); }

        @Override
        public List<I> ids() { return ids; }

        @Override
        public String tag() { return "Rec"; }

        @Override
        public Object[] fields() { return new Object[]{ids}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Rec && ((Rec<?>) o).ids.equals(ids);
        }

        @Override
        public int hashCode() { return ids.hashCode(); }
    }
}
