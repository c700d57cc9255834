package com.mirlift.types.decl;

import com.mirlift.types.ScalarValue;
import com.mirlift.types.id.FieldId;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.meta.Meta;

import java.util.Objects;

/**
 * 枚举变体。
 * <p>
 * discriminant 只在翻译期使用（把判别值读取改写为 match），不进入导出的快照。
 */
public final class Variant {

    private final Meta meta;
    private final String name;
    private final IdVector<FieldId, Field> fields;
    private final transient ScalarValue discriminant;

    public Variant(Meta meta, String name, IdVector<FieldId, Field> fields, ScalarValue discriminant) {
        this.meta = Objects.requireNonNull(meta);
        this.name = Objects.requireNonNull(name);
        this.fields = Objects.requireNonNull(fields);
        this.discriminant = Objects.requireNonNull(discriminant);
    }

    public Meta getMeta() { return meta; }
    public String getName() { return name; }
    public IdVector<FieldId, Field> getFields() { return fields; }
    public ScalarValue getDiscriminant() { return discriminant; }

    @Override
    public String toString() {
        return name + " = " + discriminant;
    }
}
