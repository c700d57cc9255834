package com.mirlift.types.decl;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.FieldId;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.VariantId;

import java.util.Objects;

/**
 * 类型声明的种类：结构体、枚举、不透明类型（外部或标记为不透明），或翻译出错的占位。
 */
public abstract class TypeDeclKind implements Tagged {

    public static final TypeDeclKind OPAQUE = new Opaque();

    private TypeDeclKind() {
    }

    public static TypeDeclKind struct(IdVector<FieldId, Field> fields) { return new Struct(fields); }
    public static TypeDeclKind enumeration(IdVector<VariantId, Variant> variants) { return new Enum(variants); }
    public static TypeDeclKind error(String message) { return new Error(message); }

    public static final class Struct extends TypeDeclKind {
        private final IdVector<FieldId, Field> fields;

        private Struct(IdVector<FieldId, Field> fields) { this.fields = Objects.requireNonNull(fields); }

        public IdVector<FieldId, Field> getFields() { return fields; }

        @Override
        public String tag() { return "Struct"; }

        @Override
        public Object[] fields() { return new Object[]{fields}; }
    }

    public static final class Enum extends TypeDeclKind {
        private final IdVector<VariantId, Variant> variants;

        private Enum(IdVector<VariantId, Variant> variants) { this.variants = Objects.requireNonNull(variants); }

        public IdVector<VariantId, Variant> getVariants() { return variants; }

        @Override
        public String tag() { return "Enum"; }

        @Override
        public Object[] fields() { return new Object[]{variants}; }
    }

    public static final class Opaque extends TypeDeclKind {
        private Opaque() {}

        @Override
        public String tag() { return "Opaque"; }

        @Override
        public Object[] fields() { return new Object[0]; }
    }

    public static final class Error extends TypeDeclKind {
        private final String message;

        private Error(String message) { this.message = Objects.requireNonNull(message); }

        public String getMessage() { return message; }

        @Override
        public String tag() { return "Error"; }

        @Override
        public Object[] fields() { return new Object[]{message}; }
    }
}
