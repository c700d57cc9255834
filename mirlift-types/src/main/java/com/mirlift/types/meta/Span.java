package com.mirlift.types.meta;

import com.mirlift.types.id.FileId;

import java.util.Objects;

/**
 * 源码区间：文件 + [beg, end]。
 */
public final class Span {

    private final FileId fileId;
    private final Loc beg;
    private final Loc end;

    public Span(FileId fileId, Loc beg, Loc end) {
        this.fileId = fileId;
        this.beg = beg;
        this.end = end;
    }

    public FileId getFileId() { return fileId; }
    public Loc getBeg() { return beg; }
    public Loc getEnd() { return end; }

    /**
     * 合并两个区间。不同文件的区间无法合并，保留第一个。
     */
    public static Span combine(Span a, Span b) {
        if (!a.fileId.equals(b.fileId)) {
            return a;
        }
        Loc beg = a.beg.compareTo(b.beg) <= 0 ? a.beg : b.beg;
        Loc end = a.end.compareTo(b.end) >= 0 ? a.end : b.end;
        return new Span(a.fileId, beg, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span that = (Span) o;
        return fileId.equals(that.fileId) && beg.equals(that.beg) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileId, beg, end);
    }

    @Override
    public String toString() {
        return fileId + "[" + beg + "-" + end + "]";
    }
}
