package com.mirlift.types.id;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 按 id 排序的声明表。
 * 与 {@link IdVector} 不同，允许缺口：翻译出错的声明可能不存在。
 */
public final class IdMap<I extends IndexId<I>, T> {

    private final TreeMap<I, T> entries = new TreeMap<>();

    public void put(I id, T value) {
        entries.put(id, value);
    }

    /** 不存在时返回 null */
    public T get(I id) {
        return entries.get(id);
    }

    public boolean containsKey(I id) {
        return entries.containsKey(id);
    }

    public T remove(I id) {
        return entries.remove(id);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<I> ids() {
        return new ArrayList<>(entries.keySet());
    }

    /** 按 id 顺序的值列表（快照） */
    public List<T> values() {
        return new ArrayList<>(entries.values());
    }

    public Map<I, T> asMap() {
        return Collections.unmodifiableMap(entries);
    }
}
