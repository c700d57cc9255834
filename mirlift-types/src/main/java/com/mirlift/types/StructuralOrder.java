package com.mirlift.types;

import com.mirlift.types.id.IndexId;

import java.util.Iterator;

/**
 * 类型项的结构化全序：先比较运行时类，再逐字段比较。
 * 与各类型的 equals 保持一致（equals 只看 {@link Tagged#fields()} 或对应 getter 暴露的字段）。
 */
final class StructuralOrder {

    private StructuralOrder() {}

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object a, Object b) {
        if (a == b) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        if (a instanceof Iterable && b instanceof Iterable) {
            return compareIterables((Iterable<?>) a, (Iterable<?>) b);
        }
        if (a.getClass() != b.getClass()) {
            return a.getClass().getName().compareTo(b.getClass().getName());
        }
        if (a instanceof IndexId) {
            return Integer.compare(((IndexId<?>) a).getIndex(), ((IndexId<?>) b).getIndex());
        }
        if (a instanceof Enum) {
            return Integer.compare(((Enum<?>) a).ordinal(), ((Enum<?>) b).ordinal());
        }
        if (a instanceof TraitInstanceId) {
            return ((TraitInstanceId) a).compareTo((TraitInstanceId) b);
        }
        if (a instanceof Tagged) {
            Tagged ta = (Tagged) a;
            Tagged tb = (Tagged) b;
            int c = ta.tag().compareTo(tb.tag());
            return c != 0 ? c : compareArrays(ta.fields(), tb.fields());
        }
        if (a instanceof GenericArgs) {
            GenericArgs<?> ga = (GenericArgs<?>) a;
            GenericArgs<?> gb = (GenericArgs<?>) b;
            int c = compareIterables(ga.getRegions(), gb.getRegions());
            if (c != 0) return c;
            c = compareIterables(ga.getTypes(), gb.getTypes());
            if (c != 0) return c;
            c = compareIterables(ga.getConstGenerics(), gb.getConstGenerics());
            return c != 0 ? c : compareIterables(ga.getTraitRefs(), gb.getTraitRefs());
        }
        if (a instanceof TraitRef) {
            TraitRef<?> ra = (TraitRef<?>) a;
            TraitRef<?> rb = (TraitRef<?>) b;
            return compareArrays(
                    new Object[]{ra.getTraitId(), ra.getGenerics(), ra.getTraitDeclRef()},
                    new Object[]{rb.getTraitId(), rb.getGenerics(), rb.getTraitDeclRef()});
        }
        if (a instanceof TraitDeclRef) {
            TraitDeclRef<?> ra = (TraitDeclRef<?>) a;
            TraitDeclRef<?> rb = (TraitDeclRef<?>) b;
            return compareArrays(new Object[]{ra.getTraitId(), ra.getGenerics()},
                    new Object[]{rb.getTraitId(), rb.getGenerics()});
        }
        if (a instanceof TypeVar) {
            TypeVar va = (TypeVar) a;
            TypeVar vb = (TypeVar) b;
            return compareArrays(new Object[]{va.getIndex(), va.getName()},
                    new Object[]{vb.getIndex(), vb.getName()});
        }
        if (a instanceof ConstGenericVar) {
            ConstGenericVar va = (ConstGenericVar) a;
            ConstGenericVar vb = (ConstGenericVar) b;
            return compareArrays(new Object[]{va.getIndex(), va.getName(), va.getTy()},
                    new Object[]{vb.getIndex(), vb.getName(), vb.getTy()});
        }
        if (a instanceof Comparable) {
            return ((Comparable) a).compareTo(b);
        }
        throw new IllegalArgumentException("no structural order for " + a.getClass().getName());
    }

    private static int compareArrays(Object[] a, Object[] b) {
        int n = Math.min(a.length, b.length);
        for (int i = 0; i < n; i++) {
            int c = compare(a[i], b[i]);
            if (c != 0) return c;
        }
        return Integer.compare(a.length, b.length);
    }

    private static int compareIterables(Iterable<?> a, Iterable<?> b) {
        Iterator<?> ia = a.iterator();
        Iterator<?> ib = b.iterator();
        while (ia.hasNext() && ib.hasNext()) {
            int c = compare(ia.next(), ib.next());
            if (c != 0) return c;
        }
        return Boolean.compare(ia.hasNext(), ib.hasNext());
    }
}
