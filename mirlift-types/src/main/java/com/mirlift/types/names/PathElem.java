package com.mirlift.types.names;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.Disambiguator;

import java.util.Objects;

/**
 * 名字路径的一段：标识符或 impl 块。
 */
public abstract class PathElem implements Tagged {

    private PathElem() {
    }

    public static PathElem ident(String name) {
        return new Ident(name, Disambiguator.of(0));
    }

    public static PathElem ident(String name, Disambiguator disambiguator) {
        return new Ident(name, disambiguator);
    }

    public static PathElem impl(ImplElem elem) {
        return new Impl(elem);
    }

    public static final class Ident extends PathElem {
        private final String name;
        private final Disambiguator disambiguator;

        private Ident(String name, Disambiguator disambiguator) {
            this.name = Objects.requireNonNull(name);
            this.disambiguator = Objects.requireNonNull(disambiguator);
        }

        public String getName() { return name; }
        public Disambiguator getDisambiguator() { return disambiguator; }

        @Override
        public String tag() { return "Ident"; }

        @Override
        public Object[] fields() { return new Object[]{name, disambiguator}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Ident)) return false;
            Ident that = (Ident) o;
            return name.equals(that.name) && disambiguator.equals(that.disambiguator);
        }

        @Override
        public int hashCode() { return Objects.hash(name, disambiguator); }

        @Override
        public String toString() {
            return disambiguator.getIndex() == 0 ? name : name + "#" + disambiguator.getIndex();
        }
    }

    public static final class Impl extends PathElem {
        private final ImplElem elem;

        private Impl(ImplElem elem) { this.elem = Objects.requireNonNull(elem); }

        public ImplElem getElem() { return elem; }

        @Override
        public String tag() { return "Impl"; }

        @Override
        public Object[] fields() { return new Object[]{elem}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Impl && ((Impl) o).elem.equals(elem);
        }

        @Override
        public int hashCode() { return elem.hashCode(); }

        @Override
        public String toString() { return elem.toString(); }
    }
}
