package com.mirlift.types.id;

/**
 * 名称路径消歧序号。
 */
public final class Disambiguator extends IndexId<Disambiguator> {

    public static final IdFactory<Disambiguator> FACTORY = new IdFactory<Disambiguator>() {
        @Override
        public Disambiguator create(int index) {
            return new Disambiguator(index);
        }
    };

    private Disambiguator(int index) {
        super(index);
    }

    public static Disambiguator of(int index) {
        return new Disambiguator(index);
    }

    @Override
    protected String kindName() {
        return "Disambiguator";
    }
}
