package com.mirlift.types.id;

/**
 * 枚举变体 id（在所属枚举内编号）。
 */
public final class VariantId extends IndexId<VariantId> {

    public static final IdFactory<VariantId> FACTORY = new IdFactory<VariantId>() {
        @Override
        public VariantId create(int index) {
            return new VariantId(index);
        }
    };

    private VariantId(int index) {
        super(index);
    }

    public static VariantId of(int index) {
        return new VariantId(index);
    }

    @Override
    protected String kindName() {
        return "Variant";
    }
}
