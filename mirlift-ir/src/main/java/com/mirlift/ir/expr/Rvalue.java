package com.mirlift.ir.expr;

import com.mirlift.types.ConstGeneric;
import com.mirlift.types.ErasedRegion;
import com.mirlift.types.Tagged;
import com.mirlift.types.Ty;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.TypeDeclId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 赋值语句右侧的值。
 */
public abstract class Rvalue implements Tagged {

    private Rvalue() {
    }

    public static Rvalue use(Operand op) { return new Use(op); }
    public static Rvalue ref(Place place, BorrowKind kind) { return new Ref(place, kind); }
    public static Rvalue unaryOp(UnOp op, Operand operand) { return new UnaryOp(op, operand); }

    public static Rvalue binaryOp(BinOp op, Operand left, Operand right) {
        return new BinaryOp(op, left, right);
    }

    public static Rvalue discriminant(Place place, TypeDeclId adtId) { return new Discriminant(place, adtId); }

    public static Rvalue aggregate(AggregateKind kind, List<Operand> ops) { return new Aggregate(kind, ops); }

    public static Rvalue global(GlobalDeclId id) { return new Global(id); }

    public static Rvalue len(Place place, Ty<ErasedRegion> ty, ConstGeneric length) {
        return new Len(place, ty, length);
    }

    public static final class Use extends Rvalue {
        private final Operand operand;

        private Use(Operand operand) { this.operand = Objects.requireNonNull(operand); }

        public Operand getOperand() { return operand; }

        @Override
        public String tag() { return "Use"; }

        @Override
        public Object[] fields() { return new Object[]{operand}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Use && ((Use) o).operand.equals(operand);
        }

        @Override
        public int hashCode() { return operand.hashCode(); }

        @Override
        public String toString() { return operand.toString(); }
    }

    public static final class Ref extends Rvalue {
        private final Place place;
        private final BorrowKind kind;

        private Ref(Place place, BorrowKind kind) {
            this.place = Objects.requireNonNull(place);
            this.kind = Objects.requireNonNull(kind);
        }

        public Place getPlace() { return place; }
        public BorrowKind getKind() { return kind; }

        @Override
        public String tag() { return "Ref"; }

        @Override
        public Object[] fields() { return new Object[]{place, kind}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Ref)) return false;
            Ref that = (Ref) o;
            return place.equals(that.place) && kind == that.kind;
        }

        @Override
        public int hashCode() { return Objects.hash(place, kind); }

        @Override
        public String toString() {
            return (kind == BorrowKind.SHARED ? "&" : "&mut ") + place;
        }
    }

    public static final class UnaryOp extends Rvalue {
        private final UnOp op;
        private final Operand operand;

        private UnaryOp(UnOp op, Operand operand) {
            this.op = Objects.requireNonNull(op);
            this.operand = Objects.requireNonNull(operand);
        }

        public UnOp getOp() { return op; }
        public Operand getOperand() { return operand; }

        @Override
        public String tag() { return "UnaryOp"; }

        @Override
        public Object[] fields() { return new Object[]{op, operand}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof UnaryOp)) return false;
            UnaryOp that = (UnaryOp) o;
            return op.equals(that.op) && operand.equals(that.operand);
        }

        @Override
        public int hashCode() { return Objects.hash(op, operand); }

        @Override
        public String toString() { return op + "(" + operand + ")"; }
    }

    public static final class BinaryOp extends Rvalue {
        private final BinOp op;
        private final Operand left;
        private final Operand right;

        private BinaryOp(BinOp op, Operand left, Operand right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public BinOp getOp() { return op; }
        public Operand getLeft() { return left; }
        public Operand getRight() { return right; }

        @Override
        public String tag() { return "BinaryOp"; }

        @Override
        public Object[] fields() { return new Object[]{op, left, right}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BinaryOp)) return false;
            BinaryOp that = (BinaryOp) o;
            return op == that.op && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() { return Objects.hash(op, left, right); }

        @Override
        public String toString() { return left + " " + op.getSymbol() + " " + right; }
    }

    /**
     * 读取枚举值的判别值。只存在于规范化之前，规范化后被折叠进 match。
     */
    public static final class Discriminant extends Rvalue {
        private final Place place;
        private final TypeDeclId adtId;

        private Discriminant(Place place, TypeDeclId adtId) {
            this.place = Objects.requireNonNull(place);
            this.adtId = Objects.requireNonNull(adtId);
        }

        public Place getPlace() { return place; }
        public TypeDeclId getAdtId() { return adtId; }

        @Override
        public String tag() { return "Discriminant"; }

        @Override
        public Object[] fields() { return new Object[]{place, adtId}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Discriminant)) return false;
            Discriminant that = (Discriminant) o;
            return place.equals(that.place) && adtId.equals(that.adtId);
        }

        @Override
        public int hashCode() { return Objects.hash(place, adtId); }

        @Override
        public String toString() { return "discriminant(" + place + ")"; }
    }

    public static final class Aggregate extends Rvalue {
        private final AggregateKind kind;
        private final List<Operand> operands;

        private Aggregate(AggregateKind kind, List<Operand> operands) {
            this.kind = Objects.requireNonNull(kind);
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        public AggregateKind getKind() { return kind; }
        public List<Operand> getOperands() { return operands; }

        @Override
        public String tag() { return "Aggregate"; }

        @Override
        public Object[] fields() { return new Object[]{kind, operands}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Aggregate)) return false;
            Aggregate that = (Aggregate) o;
            return kind.equals(that.kind) && operands.equals(that.operands);
        }

        @Override
        public int hashCode() { return Objects.hash(kind, operands); }

        @Override
        public String toString() { return kind.tag() + operands; }
    }

    public static final class Global extends Rvalue {
        private final GlobalDeclId id;

        private Global(GlobalDeclId id) { this.id = Objects.requireNonNull(id); }

        public GlobalDeclId getId() { return id; }

        @Override
        public String tag() { return "Global"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Global && ((Global) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.toString(); }
    }

    /**
     * 数组或切片长度。length 仅对数组给出。
     */
    public static final class Len extends Rvalue {
        private final Place place;
        private final Ty<ErasedRegion> ty;
        private final ConstGeneric length;  // nullable

        private Len(Place place, Ty<ErasedRegion> ty, ConstGeneric length) {
            this.place = Objects.requireNonNull(place);
            this.ty = Objects.requireNonNull(ty);
            this.length = length;
        }

        public Place getPlace() { return place; }
        public Ty<ErasedRegion> getTy() { return ty; }
        public ConstGeneric getLength() { return length; }

        @Override
        public String tag() { return "Len"; }

        @Override
        public Object[] fields() { return new Object[]{place, ty, length}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Len)) return false;
            Len that = (Len) o;
            return place.equals(that.place) && ty.equals(that.ty) && Objects.equals(length, that.length);
        }

        @Override
        public int hashCode() { return Objects.hash(place, ty, length); }

        @Override
        public String toString() { return "len(" + place + ")"; }
    }
}
