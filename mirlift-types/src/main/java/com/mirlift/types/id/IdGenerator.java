package com.mirlift.types.id;

/**
 * 稠密 id 生成器：依次分配 0, 1, 2, ...，分配过的 id 不会再次使用。
 */
public final class IdGenerator<I extends IndexId<I>> {

    private final IdFactory<I> factory;
    private int next;

    public IdGenerator(IdFactory<I> factory) {
        this(factory, 0);
    }

    public IdGenerator(IdFactory<I> factory, int start) {
        this.factory = factory;
        this.next = start;
    }

    public I fresh() {
        return factory.create(next++);
    }

    /** 下一个将被分配的下标（即已分配数量） */
    public int peekIndex() {
        return next;
    }
}
