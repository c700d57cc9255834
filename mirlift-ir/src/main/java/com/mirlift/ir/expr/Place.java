package com.mirlift.ir.expr;

import com.mirlift.types.id.VarId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 内存位置：局部变量 + 投影路径。
 */
public final class Place {

    private final VarId varId;
    private final List<ProjectionElem> projection;

    public Place(VarId varId, List<ProjectionElem> projection) {
        this.varId = Objects.requireNonNull(varId);
        this.projection = Collections.unmodifiableList(new ArrayList<>(projection));
    }

    public static Place local(VarId varId) {
        return new Place(varId, Collections.<ProjectionElem>emptyList());
    }

    public VarId getVarId() { return varId; }
    public List<ProjectionElem> getProjection() { return projection; }

    /** 无投影，直接指向局部变量 */
    public boolean isLocal() {
        return projection.isEmpty();
    }

    public Place project(ProjectionElem elem) {
        List<ProjectionElem> list = new ArrayList<>(projection);
        list.add(elem);
        return new Place(varId, list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Place)) return false;
        Place that = (Place) o;
        return varId.equals(that.varId) && projection.equals(that.projection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(varId, projection);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("@").append(varId.getIndex());
        for (ProjectionElem elem : projection) {
            if (elem instanceof ProjectionElem.Deref || elem instanceof ProjectionElem.DerefBox) {
                sb.insert(0, "*(").append(")");
            } else if (elem instanceof ProjectionElem.Field) {
                sb.append('.').append(((ProjectionElem.Field) elem).getFieldId().getIndex());
            } else if (elem instanceof ProjectionElem.Index) {
                sb.append("[@").append(((ProjectionElem.Index) elem).getVar().getIndex()).append(']');
            }
        }
        return sb.toString();
    }
}
