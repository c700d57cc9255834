package com.mirlift.types.names;

import com.mirlift.types.Region;
import com.mirlift.types.Tagged;
import com.mirlift.types.TraitDeclRef;
import com.mirlift.types.Ty;

import java.util.Objects;

/**
 * impl 块的两种形式：固有 impl（{@code impl<T> List<T>}）与 trait impl（{@code impl<T> PartialEq for List<T>}）。
 */
public abstract class ImplElemKind implements Tagged {

    private ImplElemKind() {
    }

    public static ImplElemKind ty(Ty<Region> ty) { return new TyKind(ty); }

    /** traitRef 的第一个类型实参为实现该 trait 的类型 */
    public static ImplElemKind trait(TraitDeclRef<Region> traitRef) { return new TraitKind(traitRef); }

    public static final class TyKind extends ImplElemKind {
        private final Ty<Region> ty;

        private TyKind(Ty<Region> ty) { this.ty = Objects.requireNonNull(ty); }

        public Ty<Region> getTy() { return ty; }

        @Override
        public String tag() { return "Ty"; }

        @Override
        public Object[] fields() { return new Object[]{ty}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof TyKind && ((TyKind) o).ty.equals(ty);
        }

        @Override
        public int hashCode() { return ty.hashCode(); }

        @Override
        public String toString() { return ty.toString(); }
    }

    public static final class TraitKind extends ImplElemKind {
        private final TraitDeclRef<Region> traitRef;

        private TraitKind(TraitDeclRef<Region> traitRef) { this.traitRef = Objects.requireNonNull(traitRef); }

        public TraitDeclRef<Region> getTraitRef() { return traitRef; }

        @Override
        public String tag() { return "Trait"; }

        @Override
        public Object[] fields() { return new Object[]{traitRef}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof TraitKind && ((TraitKind) o).traitRef.equals(traitRef);
        }

        @Override
        public int hashCode() { return traitRef.hashCode(); }

        @Override
        public String toString() { return traitRef.toString(); }
    }
}
