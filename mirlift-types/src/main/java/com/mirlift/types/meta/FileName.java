package com.mirlift.types.meta;

import com.mirlift.types.Tagged;

import java.util.Objects;

/**
 * 文件名：虚拟路径（标准库等远程来源）、本地路径，或非真实文件（如宏生成）。
 */
public abstract class FileName implements Tagged {

    private final String value;

    private FileName(String value) {
        this.value = Objects.requireNonNull(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public Object[] fields() {
        return new Object[]{value};
    }

    public static FileName virtual(String path) { return new Virtual(path); }
    public static FileName local(String path) { return new Local(path); }
    public static FileName notReal(String label) { return new NotReal(label); }

    public static final class Virtual extends FileName {
        private Virtual(String path) { super(path); }

        @Override
        public String tag() { return "Virtual"; }
    }

    public static final class Local extends FileName {
        private Local(String path) { super(path); }

        @Override
        public String tag() { return "Local"; }
    }

    public static final class NotReal extends FileName {
        private NotReal(String label) { super(label); }

        @Override
        public String tag() { return "NotReal"; }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return value.equals(((FileName) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag(), value);
    }

    @Override
    public String toString() {
        return value;
    }
}
