package com.mirlift.types.id;

/**
 * De Bruijn binder 深度：0 表示最内层 binder。
 */
public final class DeBruijnId extends IndexId<DeBruijnId> {

    public static final IdFactory<DeBruijnId> FACTORY = new IdFactory<DeBruijnId>() {
        @Override
        public DeBruijnId create(int index) {
            return new DeBruijnId(index);
        }
    };

    private DeBruijnId(int index) {
        super(index);
    }

    public static DeBruijnId of(int index) {
        return new DeBruijnId(index);
    }

    @Override
    protected String kindName() {
        return "DeBruijn";
    }
}
