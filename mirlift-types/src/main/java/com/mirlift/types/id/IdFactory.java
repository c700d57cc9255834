package com.mirlift.types.id;

/**
 * 从整数下标构造 id。
 */
public interface IdFactory<I extends IndexId<I>> {

    I create(int index);
}
