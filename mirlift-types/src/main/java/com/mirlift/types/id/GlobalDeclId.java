package com.mirlift.types.id;

/**
 * 全局常量/静态量声明 id。
 */
public final class GlobalDeclId extends IndexId<GlobalDeclId> {

    public static final IdFactory<GlobalDeclId> FACTORY = new IdFactory<GlobalDeclId>() {
        @Override
        public GlobalDeclId create(int index) {
            return new GlobalDeclId(index);
        }
    };

    private GlobalDeclId(int index) {
        super(index);
    }

    public static GlobalDeclId of(int index) {
        return new GlobalDeclId(index);
    }

    @Override
    protected String kindName() {
        return "Global";
    }
}
