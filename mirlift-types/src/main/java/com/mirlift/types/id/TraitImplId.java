package com.mirlift.types.id;

/**
 * trait 实现 id。
 */
public final class TraitImplId extends IndexId<TraitImplId> {

    public static final IdFactory<TraitImplId> FACTORY = new IdFactory<TraitImplId>() {
        @Override
        public TraitImplId create(int index) {
            return new TraitImplId(index);
        }
    };

    private TraitImplId(int index) {
        super(index);
    }

    public static TraitImplId of(int index) {
        return new TraitImplId(index);
    }

    @Override
    protected String kindName() {
        return "TraitImpl";
    }
}
