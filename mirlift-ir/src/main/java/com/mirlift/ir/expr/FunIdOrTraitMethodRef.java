package com.mirlift.ir.expr;

import com.mirlift.types.ErasedRegion;
import com.mirlift.types.Tagged;
import com.mirlift.types.TraitRef;
import com.mirlift.types.id.FunDeclId;

import java.util.Objects;

/**
 * 调用目标：直接的函数，或经由 trait 引用的方法（带方法所在的函数声明 id）。
 */
public abstract class FunIdOrTraitMethodRef implements Tagged {

    private FunIdOrTraitMethodRef() {
    }

    public static FunIdOrTraitMethodRef fun(FunId id) { return new Fun(id); }

    public static FunIdOrTraitMethodRef trait(TraitRef<ErasedRegion> traitRef, String methodName,
                                              FunDeclId methodId) {
        return new Trait(traitRef, methodName, methodId);
    }

    public static final class Fun extends FunIdOrTraitMethodRef {
        private final FunId id;

        private Fun(FunId id) { this.id = Objects.requireNonNull(id); }

        public FunId getId() { return id; }

        @Override
        public String tag() { return "Fun"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Fun && ((Fun) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.toString(); }
    }

    public static final class Trait extends FunIdOrTraitMethodRef {
        private final TraitRef<ErasedRegion> traitRef;
        private final String methodName;
        private final FunDeclId methodId;

        private Trait(TraitRef<ErasedRegion> traitRef, String methodName, FunDeclId methodId) {
            this.traitRef = Objects.requireNonNull(traitRef);
            this.methodName = Objects.requireNonNull(methodName);
            this.methodId = Objects.requireNonNull(methodId);
        }

        public TraitRef<ErasedRegion> getTraitRef() { return traitRef; }
        public String getMethodName() { return methodName; }
        public FunDeclId getMethodId() { return methodId; }

        public Trait withTraitRef(TraitRef<ErasedRegion> newRef) {
            return new Trait(newRef, methodName, methodId);
        }

        @Override
        public String tag() { return "Trait"; }

        @Override
        public Object[] fields() { return new Object[]{traitRef, methodName, methodId}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Trait)) return false;
            Trait that = (Trait) o;
            return traitRef.equals(that.traitRef) && methodName.equals(that.methodName)
                    && methodId.equals(that.methodId);
        }

        @Override
        public int hashCode() { return Objects.hash(traitRef, methodName, methodId); }

        @Override
        public String toString() { return traitRef + "::" + methodName; }
    }
}
