package com.mirlift.types.id;

/**
 * 区域（生命周期）变量 id，在所属 binder 内编号。
 */
public final class RegionId extends IndexId<RegionId> {

    public static final IdFactory<RegionId> FACTORY = new IdFactory<RegionId>() {
        @Override
        public RegionId create(int index) {
            return new RegionId(index);
        }
    };

    private RegionId(int index) {
        super(index);
    }

    public static RegionId of(int index) {
        return new RegionId(index);
    }

    @Override
    protected String kindName() {
        return "Region";
    }
}
