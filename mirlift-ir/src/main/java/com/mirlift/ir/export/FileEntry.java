package com.mirlift.ir.export;

import com.mirlift.types.id.FileId;
import com.mirlift.types.meta.FileName;

import java.util.Objects;

/**
 * 文件表的一项，导出为 {@code [id, name]}。
 */
public final class FileEntry {

    private final FileId id;
    private final FileName name;

    public FileEntry(FileId id, FileName name) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
    }

    public FileId getId() { return id; }
    public FileName getName() { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileEntry)) return false;
        FileEntry that = (FileEntry) o;
        return id.equals(that.id) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }
}
