package com.mirlift.ir.expr;

import com.mirlift.types.ErasedRegion;
import com.mirlift.types.Literal;
import com.mirlift.types.Tagged;
import com.mirlift.types.Ty;

import java.util.Objects;

/**
 * 操作数：复制、移动或常量。
 */
public abstract class Operand implements Tagged {

    private Operand() {
    }

    public static Operand copy(Place place) { return new Copy(place); }
    public static Operand move(Place place) { return new Move(place); }
    public static Operand constant(Ty<ErasedRegion> ty, Literal value) { return new Const(ty, value); }

    public static final class Copy extends Operand {
        private final Place place;

        private Copy(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public String tag() { return "Copy"; }

        @Override
        public Object[] fields() { return new Object[]{place}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Copy && ((Copy) o).place.equals(place);
        }

        @Override
        public int hashCode() { return place.hashCode(); }

        @Override
        public String toString() { return "copy " + place; }
    }

    public static final class Move extends Operand {
        private final Place place;

        private Move(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public String tag() { return "Move"; }

        @Override
        public Object[] fields() { return new Object[]{place}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Move && ((Move) o).place.equals(place);
        }

        @Override
        public int hashCode() { return 31 + place.hashCode(); }

        @Override
        public String toString() { return "move " + place; }
    }

    public static final class Const extends Operand {
        private final Ty<ErasedRegion> ty;
        private final Literal value;

        private Const(Ty<ErasedRegion> ty, Literal value) {
            this.ty = Objects.requireNonNull(ty);
            this.value = Objects.requireNonNull(value);
        }

        public Ty<ErasedRegion> getTy() { return ty; }
        public Literal getValue() { return value; }

        @Override
        public String tag() { return "Const"; }

        @Override
        public Object[] fields() { return new Object[]{ty, value}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Const)) return false;
            Const that = (Const) o;
            return ty.equals(that.ty) && value.equals(that.value);
        }

        @Override
        public int hashCode() { return Objects.hash(ty, value); }

        @Override
        public String toString() { return "const " + value; }
    }
}
