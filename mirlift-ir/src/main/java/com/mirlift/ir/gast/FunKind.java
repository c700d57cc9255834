package com.mirlift.ir.gast;

import com.mirlift.types.Tagged;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.id.TraitImplId;

import java.util.Objects;

/**
 * 函数的来源：普通函数，或与 trait 相关的方法（实现、声明、默认提供）。
 */
public abstract class FunKind implements Tagged {

    public static final FunKind REGULAR = new Regular();

    private FunKind() {
    }

    public static FunKind traitMethodImpl(TraitImplId implId, TraitDeclId traitId, String methodName,
                                          boolean provided) {
        return new TraitMethodImpl(implId, traitId, methodName, provided);
    }

    public static FunKind traitMethodDecl(TraitDeclId traitId, String methodName) {
        return new TraitMethodDecl(traitId, methodName);
    }

    public static FunKind traitMethodProvided(TraitDeclId traitId, String methodName) {
        return new TraitMethodProvided(traitId, methodName);
    }

    public static final class Regular extends FunKind {
        private Regular() {}

        @Override
        public String tag() { return "Regular"; }

        @Override
        public Object[] fields() { return new Object[0]; }
    }

    /**
     * trait impl 中的方法。provided 为 true 表示 impl 覆盖了 trait 中带默认实现的方法。
     */
    public static final class TraitMethodImpl extends FunKind {
        private final TraitImplId implId;
        private final TraitDeclId traitId;
        private final String methodName;
        private final boolean provided;

        private TraitMethodImpl(TraitImplId implId, TraitDeclId traitId, String methodName, boolean provided) {
            this.implId = Objects.requireNonNull(implId);
            this.traitId = Objects.requireNonNull(traitId);
            this.methodName = Objects.requireNonNull(methodName);
            this.provided = provided;
        }

        public TraitImplId getImplId() { return implId; }
        public TraitDeclId getTraitId() { return traitId; }
        public String getMethodName() { return methodName; }
        public boolean isProvided() { return provided; }

        @Override
        public String tag() { return "TraitMethodImpl"; }

        @Override
        public Object[] fields() { return new Object[]{implId, traitId, methodName, provided}; }
    }

    /** trait 中声明但未提供实现的方法 */
    public static final class TraitMethodDecl extends FunKind {
        private final TraitDeclId traitId;
        private final String methodName;

        private TraitMethodDecl(TraitDeclId traitId, String methodName) {
            this.traitId = Objects.requireNonNull(traitId);
            this.methodName = Objects.requireNonNull(methodName);
        }

        public TraitDeclId getTraitId() { return traitId; }
        public String getMethodName() { return methodName; }

        @Override
        public String tag() { return "TraitMethodDecl"; }

        @Override
        public Object[] fields() { return new Object[]{traitId, methodName}; }
    }

    /** trait 中带默认实现的方法 */
    public static final class TraitMethodProvided extends FunKind {
        private final TraitDeclId traitId;
        private final String methodName;

        private TraitMethodProvided(TraitDeclId traitId, String methodName) {
            this.traitId = Objects.requireNonNull(traitId);
            this.methodName = Objects.requireNonNull(methodName);
        }

        public TraitDeclId getTraitId() { return traitId; }
        public String getMethodName() { return methodName; }

        @Override
        public String tag() { return "TraitMethodProvided"; }

        @Override
        public Object[] fields() { return new Object[]{traitId, methodName}; }
    }
}
