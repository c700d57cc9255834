package com.mirlift.types.id;

/**
 * 泛型类型变量 id。
 */
public final class TypeVarId extends IndexId<TypeVarId> {

    public static final IdFactory<TypeVarId> FACTORY = new IdFactory<TypeVarId>() {
        @Override
        public TypeVarId create(int index) {
            return new TypeVarId(index);
        }
    };

    private TypeVarId(int index) {
        super(index);
    }

    public static TypeVarId of(int index) {
        return new TypeVarId(index);
    }

    @Override
    protected String kindName() {
        return "TypeVar";
    }
}
