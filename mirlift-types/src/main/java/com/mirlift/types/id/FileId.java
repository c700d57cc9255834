package com.mirlift.types.id;

/**
 * 源文件 id。
 */
public final class FileId extends IndexId<FileId> {

    public static final IdFactory<FileId> FACTORY = new IdFactory<FileId>() {
        @Override
        public FileId create(int index) {
            return new FileId(index);
        }
    };

    private FileId(int index) {
        super(index);
    }

    public static FileId of(int index) {
        return new FileId(index);
    }

    @Override
    protected String kindName() {
        return "File";
    }
}
