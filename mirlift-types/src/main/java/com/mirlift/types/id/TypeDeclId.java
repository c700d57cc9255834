package com.mirlift.types.id;

/**
 * 类型声明 id。
 */
public final class TypeDeclId extends IndexId<TypeDeclId> {

    public static final IdFactory<TypeDeclId> FACTORY = new IdFactory<TypeDeclId>() {
        @Override
        public TypeDeclId create(int index) {
            return new TypeDeclId(index);
        }
    };

    private TypeDeclId(int index) {
        super(index);
    }

    public static TypeDeclId of(int index) {
        return new TypeDeclId(index);
    }

    @Override
    protected String kindName() {
        return "TypeDecl";
    }
}
