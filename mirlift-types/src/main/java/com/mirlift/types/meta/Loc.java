package com.mirlift.types.meta;

/**
 * 源码位置（行从 1 开始，列从 0 开始）。
 */
public final class Loc implements Comparable<Loc> {

    private final int line;
    private final int col;

    public Loc(int line, int col) {
        this.line = line;
        this.col = col;
    }

    public int getLine() { return line; }
    public int getCol() { return col; }

    @Override
    public int compareTo(Loc o) {
        if (line != o.line) return Integer.compare(line, o.line);
        return Integer.compare(col, o.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Loc)) return false;
        Loc that = (Loc) o;
        return line == that.line && col == that.col;
    }

    @Override
    public int hashCode() {
        return 31 * line + col;
    }

    @Override
    public String toString() {
        return line + ":" + col;
    }
}
