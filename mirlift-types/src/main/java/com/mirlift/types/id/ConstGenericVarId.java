package com.mirlift.types.id;

/**
 * 常量泛型变量 id。
 */
public final class ConstGenericVarId extends IndexId<ConstGenericVarId> {

    public static final IdFactory<ConstGenericVarId> FACTORY = new IdFactory<ConstGenericVarId>() {
        @Override
        public ConstGenericVarId create(int index) {
            return new ConstGenericVarId(index);
        }
    };

    private ConstGenericVarId(int index) {
        super(index);
    }

    public static ConstGenericVarId of(int index) {
        return new ConstGenericVarId(index);
    }

    @Override
    protected String kindName() {
        return "ConstGeneric";
    }
}
