package com.mirlift.types.id;

/**
 * 函数声明 id。
 */
public final class FunDeclId extends IndexId<FunDeclId> {

    public static final IdFactory<FunDeclId> FACTORY = new IdFactory<FunDeclId>() {
        @Override
        public FunDeclId create(int index) {
            return new FunDeclId(index);
        }
    };

    private FunDeclId(int index) {
        super(index);
    }

    public static FunDeclId of(int index) {
        return new FunDeclId(index);
    }

    @Override
    protected String kindName() {
        return "Fun";
    }
}
