package com.mirlift.types.id;

/**
 * ULLBC 基本块 id。
 */
public final class BlockId extends IndexId<BlockId> {

    public static final IdFactory<BlockId> FACTORY = new IdFactory<BlockId>() {
        @Override
        public BlockId create(int index) {
            return new BlockId(index);
        }
    };

    private BlockId(int index) {
        super(index);
    }

    public static BlockId of(int index) {
        return new BlockId(index);
    }

    @Override
    protected String kindName() {
        return "Block";
    }
}
