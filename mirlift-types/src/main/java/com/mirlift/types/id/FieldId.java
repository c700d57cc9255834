package com.mirlift.types.id;

/**
 * 字段 id（在所属结构体/变体内编号）。
 */
public final class FieldId extends IndexId<FieldId> {

    public static final IdFactory<FieldId> FACTORY = new IdFactory<FieldId>() {
        @Override
        public FieldId create(int index) {
            return new FieldId(index);
        }
    };

    private FieldId(int index) {
        super(index);
    }

    public static FieldId of(int index) {
        return new FieldId(index);
    }

    @Override
    protected String kindName() {
        return "Field";
    }
}
