package com.mirlift.ir.expr;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.FieldId;
import com.mirlift.types.id.VarId;

import java.util.Objects;

/**
 * 位置投影：解引用、Box 解引用、字段访问、下标访问。
 */
public abstract class ProjectionElem implements Tagged {

    public static final ProjectionElem DEREF = new Deref();
    public static final ProjectionElem DEREF_BOX = new DerefBox();

    private ProjectionElem() {
    }

    public static ProjectionElem field(FieldProjKind kind, FieldId fieldId) {
        return new Field(kind, fieldId);
    }

    public static ProjectionElem index(VarId var) {
        return new Index(var);
    }

    public static final class Deref extends ProjectionElem {
        private Deref() {}

        @Override
        public String tag() { return "Deref"; }

        @Override
        public Object[] fields() { return new Object[0]; }
    }

    public static final class DerefBox extends ProjectionElem {
        private DerefBox() {}

        @Override
        public String tag() { return "DerefBox"; }

        @Override
        public Object[] fields() { return new Object[0]; }
    }

    public static final class Field extends ProjectionElem {
        private final FieldProjKind kind;
        private final FieldId fieldId;

        private Field(FieldProjKind kind, FieldId fieldId) {
            this.kind = Objects.requireNonNull(kind);
            this.fieldId = Objects.requireNonNull(fieldId);
        }

        public FieldProjKind getKind() { return kind; }
        public FieldId getFieldId() { return fieldId; }

        @Override
        public String tag() { return "Field"; }

        @Override
        public Object[] fields() { return new Object[]{kind, fieldId}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Field)) return false;
            Field that = (Field) o;
            return kind.equals(that.kind) && fieldId.equals(that.fieldId);
        }

        @Override
        public int hashCode() { return Objects.hash(kind, fieldId); }
    }

    public static final class Index extends ProjectionElem {
        private final VarId var;

        private Index(VarId var) { this.var = Objects.requireNonNull(var); }

        public VarId getVar() { return var; }

        @Override
        public String tag() { return "Index"; }

        @Override
        public Object[] fields() { return new Object[]{var}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Index && ((Index) o).var.equals(var);
        }

        @Override
        public int hashCode() { return var.hashCode(); }
    }
}
