package com.mirlift.ir.ullbc;

import com.mirlift.ir.expr.Place;
import com.mirlift.ir.expr.Rvalue;
import com.mirlift.types.Tagged;
import com.mirlift.types.id.VarId;
import com.mirlift.types.id.VariantId;

import java.util.Objects;

/**
 * 基本块内的非终止语句。
 */
public abstract class RawStatement implements Tagged {

    private RawStatement() {
    }

    public static RawStatement assign(Place dest, Rvalue value) { return new Assign(dest, value); }
    public static RawStatement fakeRead(Place place) { return new FakeRead(place); }

    public static RawStatement setDiscriminant(Place place, VariantId variant) {
        return new SetDiscriminant(place, variant);
    }

    public static RawStatement storageDead(VarId var) { return new StorageDead(var); }
    public static RawStatement deinit(Place place) { return new Deinit(place); }

    public static final class Assign extends RawStatement {
        private final Place dest;
        private final Rvalue value;

        private Assign(Place dest, Rvalue value) {
            this.dest = Objects.requireNonNull(dest);
            this.value = Objects.requireNonNull(value);
        }

        public Place getDest() { return dest; }
        public Rvalue getValue() { return value; }

        @Override
        public String tag() { return "Assign"; }

        @Override
        public Object[] fields() { return new Object[]{dest, value}; }

        @Override
        public String toString() { return dest + " := " + value; }
    }

    public static final class FakeRead extends RawStatement {
        private final Place place;

        private FakeRead(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public String tag() { return "FakeRead"; }

        @Override
        public Object[] fields() { return new Object[]{place}; }

        @Override
        public String toString() { return "@fake_read(" + place + ")"; }
    }

    public static final class SetDiscriminant extends RawStatement {
        private final Place place;
        private final VariantId variant;

        private SetDiscriminant(Place place, VariantId variant) {
            this.place = Objects.requireNonNull(place);
            this.variant = Objects.requireNonNull(variant);
        }

        public Place getPlace() { return place; }
        public VariantId getVariant() { return variant; }

        @Override
        public String tag() { return "SetDiscriminant"; }

        @Override
        public Object[] fields() { return new Object[]{place, variant}; }

        @Override
        public String toString() { return "@discriminant(" + place + ") := " + variant; }
    }

    public static final class StorageDead extends RawStatement {
        private final VarId var;

        private StorageDead(VarId var) { this.var = Objects.requireNonNull(var); }

        public VarId getVar() { return var; }

        @Override
        public String tag() { return "StorageDead"; }

        @Override
        public Object[] fields() { return new Object[]{var}; }

        @Override
        public String toString() { return "@storage_dead(@" + var.getIndex() + ")"; }
    }

    public static final class Deinit extends RawStatement {
        private final Place place;

        private Deinit(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public String tag() { return "Deinit"; }

        @Override
        public Object[] fields() { return new Object[]{place}; }

        @Override
        public String toString() { return "@deinit(" + place + ")"; }
    }
}
