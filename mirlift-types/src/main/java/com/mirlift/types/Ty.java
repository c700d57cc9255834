package com.mirlift.types;

import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.RegionId;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.id.TypeVarId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类型。
 * <p>
 * 以区域表示 R 参数化：签名中 R = {@link Region}（保留真实区域，供后续借用抽象使用），
 * 函数体中 R = {@link ErasedRegion}。两种形态树结构相同，前者到后者的转换见 {@link RegionEraser}。
 *
 * @param <R> 区域表示
 */
public abstract class Ty<R> implements Tagged {

    private Ty() {
    }

    public abstract <T> T accept(TyVisitor<R, T> visitor);

    // ===== 工厂方法 =====

    public static <R> Ty<R> adt(TypeId typeId, GenericArgs<R> generics) {
        return new Adt<>(typeId, generics);
    }

    public static <R> Ty<R> adt(TypeDeclId id, GenericArgs<R> generics) {
        return new Adt<>(TypeId.adt(id), generics);
    }

    public static <R> Ty<R> tuple(List<Ty<R>> elements) {
        return new Adt<>(TypeId.TUPLE, GenericArgs.<R>ofTypes(elements));
    }

    public static <R> Ty<R> unit() {
        return tuple(Collections.<Ty<R>>emptyList());
    }

    public static <R> Ty<R> assumed(AssumedTy assumed, GenericArgs<R> generics) {
        return new Adt<>(TypeId.assumed(assumed), generics);
    }

    public static <R> Ty<R> typeVar(TypeVarId id) {
        return new TypeVarRef<>(id);
    }

    public static <R> Ty<R> literal(LiteralTy ty) {
        return new Lit<>(ty);
    }

    public static <R> Ty<R> integer(IntegerTy ty) {
        return new Lit<>(LiteralTy.integer(ty));
    }

    public static <R> Ty<R> bool() {
        return new Lit<>(LiteralTy.BOOL);
    }

    public static <R> Ty<R> never() {
        return new Never<>();
    }

    public static <R> Ty<R> ref(R region, Ty<R> pointee, RefKind kind) {
        return new Ref<>(region, pointee, kind);
    }

    public static <R> Ty<R> rawPtr(Ty<R> pointee, RefKind kind) {
        return new RawPtr<>(pointee, kind);
    }

    public static <R> Ty<R> traitType(TraitRef<R> traitRef, GenericArgs<R> generics, String name) {
        return new TraitType<>(traitRef, generics, name);
    }

    public static <R> Ty<R> arrow(IdVector<RegionId, RegionVar> boundRegions, List<Ty<R>> inputs, Ty<R> output) {
        return new Arrow<>(boundRegions, inputs, output);
    }

    public static <R> Ty<R> arrow(List<Ty<R>> inputs, Ty<R> output) {
        return new Arrow<>(IdVector.<RegionId, RegionVar>empty(RegionId.FACTORY), inputs, output);
    }

    // ===== 便捷判断 =====

    public boolean isUnit() {
        if (!(this instanceof Adt)) return false;
        Adt<R> adt = (Adt<R>) this;
        return adt.typeId instanceof TypeId.Tuple && adt.generics.isEmpty();
    }

    public boolean isNever() {
        return this instanceof Never;
    }

    /** 若为用户定义 ADT，返回其声明 id，否则 null */
    public TypeDeclId asAdtDeclId() {
        if (this instanceof Adt && ((Adt<R>) this).typeId instanceof TypeId.Adt) {
            return ((TypeId.Adt) ((Adt<R>) this).typeId).getId();
        }
        return null;
    }

    // ===== 变体 =====

    /**
     * ADT：用户定义类型、元组（含 unit）或内建类型。
     */
    public static final class Adt<R> extends Ty<R> {
        private final TypeId typeId;
        private final GenericArgs<R> generics;

        private Adt(TypeId typeId, GenericArgs<R> generics) {
            this.typeId = Objects.requireNonNull(typeId);
            this.generics = Objects.requireNonNull(generics);
        }

        public TypeId getTypeId() { return typeId; }
        public GenericArgs<R> getGenerics() { return generics; }

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitAdt(this); }

        @Override
        public String tag() { return "Adt"; }

        @Override
        public Object[] fields() { return new Object[]{typeId, generics}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Adt)) return false;
            Adt<?> that = (Adt<?>) o;
            return typeId.equals(that.typeId) && generics.equals(that.generics);
        }

        @Override
        public int hashCode() { return Objects.hash(typeId, generics); }

        @Override
        public String toString() {
            if (typeId instanceof TypeId.Tuple) {
                StringBuilder sb = new StringBuilder("(");
                List<Ty<R>> types = generics.getTypes();
                for (int i = 0; i < types.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(types.get(i));
                }
                if (types.size() == 1) sb.append(',');
                return sb.append(')').toString();
            }
            return typeId + generics.toString();
        }
    }

    /** 类型变量引用 */
    public static final class TypeVarRef<R> extends Ty<R> {
        private final TypeVarId id;

        private TypeVarRef(TypeVarId id) {
            this.id = Objects.requireNonNull(id);
        }

        public TypeVarId getId() { return id; }

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitTypeVar(this); }

        @Override
        public String tag() { return "TypeVar"; }

        @Override
        public Object[] fields() { return new Object[]{id}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof TypeVarRef && ((TypeVarRef<?>) o).id.equals(id);
        }

        @Override
        public int hashCode() { return id.hashCode(); }

        @Override
        public String toString() { return id.toString(); }
    }

    public static final class Lit<R> extends Ty<R> {
        private final LiteralTy literalTy;

        private Lit(LiteralTy literalTy) {
            this.literalTy = Objects.requireNonNull(literalTy);
        }

        public LiteralTy getLiteralTy() { return literalTy; }

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitLiteral(this); }

        @Override
        public String tag() { return "Literal"; }

        @Override
        public Object[] fields() { return new Object[]{literalTy}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lit && ((Lit<?>) o).literalTy.equals(literalTy);
        }

        @Override
        public int hashCode() { return literalTy.hashCode(); }

        @Override
        public String toString() { return literalTy.toString(); }
    }

    /**
     * 不返回的计算的类型，可被强制转换为任何类型。
     */
    public static final class Never<R> extends Ty<R> {
        private Never() {}

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitNever(this); }

        @Override
        public String tag() { return "Never"; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public boolean equals(Object o) { return o instanceof Never; }

        @Override
        public int hashCode() { return 7; }

        @Override
        public String toString() { return "!"; }
    }

    /** 借用 */
    public static final class Ref<R> extends Ty<R> {
        private final R region;
        private final Ty<R> pointee;
        private final RefKind kind;

        private Ref(R region, Ty<R> pointee, RefKind kind) {
            this.region = Objects.requireNonNull(region);
            this.pointee = Objects.requireNonNull(pointee);
            this.kind = Objects.requireNonNull(kind);
        }

        public R getRegion() { return region; }
        public Ty<R> getPointee() { return pointee; }
        public RefKind getKind() { return kind; }

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitRef(this); }

        @Override
        public String tag() { return "Ref"; }

        @Override
        public Object[] fields() { return new Object[]{region, pointee, kind}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Ref)) return false;
            Ref<?> that = (Ref<?>) o;
            return region.equals(that.region) && pointee.equals(that.pointee) && kind == that.kind;
        }

        @Override
        public int hashCode() { return Objects.hash(region, pointee, kind); }

        @Override
        public String toString() {
            return "&" + region + (kind == RefKind.MUT ? " mut " : " ") + pointee;
        }
    }

    public static final class RawPtr<R> extends Ty<R> {
        private final Ty<R> pointee;
        private final RefKind kind;

        private RawPtr(Ty<R> pointee, RefKind kind) {
            this.pointee = Objects.requireNonNull(pointee);
            this.kind = Objects.requireNonNull(kind);
        }

        public Ty<R> getPointee() { return pointee; }
        public RefKind getKind() { return kind; }

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitRawPtr(this); }

        @Override
        public String tag() { return "RawPtr"; }

        @Override
        public Object[] fields() { return new Object[]{pointee, kind}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof RawPtr)) return false;
            RawPtr<?> that = (RawPtr<?>) o;
            return pointee.equals(that.pointee) && kind == that.kind;
        }

        @Override
        public int hashCode() { return Objects.hash(pointee, kind); }

        @Override
        public String toString() {
            return (kind == RefKind.MUT ? "*mut " : "*const ") + pointee;
        }
    }

    /**
     * trait 关联类型投影，如 {@code <T as Iterator>::Item}。
     */
    public static final class TraitType<R> extends Ty<R> {
        private final TraitRef<R> traitRef;
        private final GenericArgs<R> generics;
        private final String typeName;

        private TraitType(TraitRef<R> traitRef, GenericArgs<R> generics, String typeName) {
            this.traitRef = Objects.requireNonNull(traitRef);
            this.generics = Objects.requireNonNull(generics);
            this.typeName = Objects.requireNonNull(typeName);
        }

        public TraitRef<R> getTraitRef() { return traitRef; }
        public GenericArgs<R> getGenerics() { return generics; }
        public String getTypeName() { return typeName; }

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitTraitType(this); }

        @Override
        public String tag() { return "TraitType"; }

        @Override
        public Object[] fields() { return new Object[]{traitRef, generics, typeName}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TraitType)) return false;
            TraitType<?> that = (TraitType<?>) o;
            return traitRef.equals(that.traitRef) && generics.equals(that.generics)
                    && typeName.equals(that.typeName);
        }

        @Override
        public int hashCode() { return Objects.hash(traitRef, generics, typeName); }

        @Override
        public String toString() {
            return traitRef + "::" + typeName + generics;
        }
    }

    /**
     * 函数指针类型。自身是一个区域 binder：内部的 BVar(0, r) 指向 boundRegions 中的 r。
     */
    public static final class Arrow<R> extends Ty<R> {
        private final IdVector<RegionId, RegionVar> boundRegions;
        private final List<Ty<R>> inputs;
        private final Ty<R> output;

        private Arrow(IdVector<RegionId, RegionVar> boundRegions, List<Ty<R>> inputs, Ty<R> output) {
            this.boundRegions = Objects.requireNonNull(boundRegions);
            this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
            this.output = Objects.requireNonNull(output);
        }

        public IdVector<RegionId, RegionVar> getBoundRegions() { return boundRegions; }
        public List<Ty<R>> getInputs() { return inputs; }
        public Ty<R> getOutput() { return output; }

        @Override
        public <T> T accept(TyVisitor<R, T> visitor) { return visitor.visitArrow(this); }

        @Override
        public String tag() { return "Arrow"; }

        @Override
        public Object[] fields() { return new Object[]{boundRegions, inputs, output}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arrow)) return false;
            Arrow<?> that = (Arrow<?>) o;
            return boundRegions.equals(that.boundRegions) && inputs.equals(that.inputs)
                    && output.equals(that.output);
        }

        @Override
        public int hashCode() { return Objects.hash(boundRegions, inputs, output); }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            if (!boundRegions.isEmpty()) {
                sb.append("for<").append(boundRegions).append("> ");
            }
            sb.append("fn(");
            for (int i = 0; i < inputs.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(inputs.get(i));
            }
            return sb.append(") -> ").append(output).toString();
        }
    }
}
