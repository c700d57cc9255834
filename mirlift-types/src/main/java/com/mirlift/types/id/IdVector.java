package com.mirlift.types.id;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.AbstractMap.SimpleImmutableEntry;

/**
 * 以强类型 id 寻址的有序向量。
 * 只追加不删除：元素的 id 即其插入位置。
 */
public final class IdVector<I extends IndexId<I>, T> implements Iterable<T> {

    private final IdFactory<I> factory;
    private final List<T> elements;

    public IdVector(IdFactory<I> factory) {
        this.factory = factory;
        this.elements = new ArrayList<>();
    }

    public IdVector(IdFactory<I> factory, List<T> elements) {
        this.factory = factory;
        this.elements = new ArrayList<>(elements);
    }

    public static <I extends IndexId<I>, T> IdVector<I, T> empty(IdFactory<I> factory) {
        return new IdVector<>(factory);
    }

    @SafeVarargs
    public static <I extends IndexId<I>, T> IdVector<I, T> of(IdFactory<I> factory, T... elements) {
        IdVector<I, T> vector = new IdVector<>(factory);
        for (T element : elements) {
            vector.push(element);
        }
        return vector;
    }

    /**
     * 追加元素，返回其 id。
     */
    public I push(T element) {
        I id = factory.create(elements.size());
        elements.add(element);
        return id;
    }

    public T get(I id) {
        int index = id.getIndex();
        return index < elements.size() ? elements.get(index) : null;
    }

    public void set(I id, T element) {
        int index = id.getIndex();
        if (index >= elements.size()) {
            throw new IndexOutOfBoundsException(id + " out of " + elements.size());
        }
        elements.set(index, element);
    }

    public boolean contains(I id) {
        return id.getIndex() < elements.size();
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /** 下一个 push 将分配的 id */
    public I nextId() {
        return factory.create(elements.size());
    }

    public List<I> ids() {
        List<I> ids = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            ids.add(factory.create(i));
        }
        return ids;
    }

    /** (id, 元素) 对，按 id 顺序 */
    public List<Map.Entry<I, T>> entries() {
        List<Map.Entry<I, T>> entries = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            entries.add(new SimpleImmutableEntry<>(factory.create(i), elements.get(i)));
        }
        return entries;
    }

    public List<T> values() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<T> iterator() {
        return values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdVector)) return false;
        return elements.equals(((IdVector<?, ?>) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements);
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
