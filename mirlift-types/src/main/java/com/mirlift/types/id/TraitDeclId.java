package com.mirlift.types.id;

/**
 * trait 声明 id。
 */
public final class TraitDeclId extends IndexId<TraitDeclId> {

    public static final IdFactory<TraitDeclId> FACTORY = new IdFactory<TraitDeclId>() {
        @Override
        public TraitDeclId create(int index) {
            return new TraitDeclId(index);
        }
    };

    private TraitDeclId(int index) {
        super(index);
    }

    public static TraitDeclId of(int index) {
        return new TraitDeclId(index);
    }

    @Override
    protected String kindName() {
        return "TraitDecl";
    }
}
