package com.mirlift.types.id;

/**
 * trait 子句 id，位置稳定，供 Clause(id) 见证引用。
 */
public final class TraitClauseId extends IndexId<TraitClauseId> {

    public static final IdFactory<TraitClauseId> FACTORY = new IdFactory<TraitClauseId>() {
        @Override
        public TraitClauseId create(int index) {
            return new TraitClauseId(index);
        }
    };

    private TraitClauseId(int index) {
        super(index);
    }

    public static TraitClauseId of(int index) {
        return new TraitClauseId(index);
    }

    @Override
    protected String kindName() {
        return "Clause";
    }
}
