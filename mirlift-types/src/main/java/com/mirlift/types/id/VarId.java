package com.mirlift.types.id;

/**
 * 函数体内局部变量 id。
 */
public final class VarId extends IndexId<VarId> {

    public static final IdFactory<VarId> FACTORY = new IdFactory<VarId>() {
        @Override
        public VarId create(int index) {
            return new VarId(index);
        }
    };

    private VarId(int index) {
        super(index);
    }

    public static VarId of(int index) {
        return new VarId(index);
    }

    @Override
    protected String kindName() {
        return "Var";
    }
}
