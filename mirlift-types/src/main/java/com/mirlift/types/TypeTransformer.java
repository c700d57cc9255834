package com.mirlift.types;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型恒等变换基类（copy-on-change）。
 * 递归遍历类型、泛型实参、trait 引用与 trait 见证；子节点无变化时返回原对象，否则构造新对象。
 * 子类覆盖特定方法实现改写（例如替换 {@link TraitInstanceId.Unsolved}）。
 *
 * @param <R> 区域表示
 */
public class TypeTransformer<R> implements TyVisitor<R, Ty<R>> {

    public Ty<R> transformTy(Ty<R> ty) {
        return ty.accept(this);
    }

    public R transformRegion(R region) {
        return region;
    }

    public ConstGeneric transformConstGeneric(ConstGeneric cg) {
        return cg;
    }

    public GenericArgs<R> transformGenericArgs(GenericArgs<R> args) {
        List<R> regions = transformList(args.getRegions(), new Fn<R>() {
            @Override
            public R apply(R r) { return transformRegion(r); }
        });
        List<Ty<R>> types = transformTys(args.getTypes());
        List<ConstGeneric> cgs = transformList(args.getConstGenerics(), new Fn<ConstGeneric>() {
            @Override
            public ConstGeneric apply(ConstGeneric c) { return transformConstGeneric(c); }
        });
        List<TraitRef<R>> refs = transformList(args.getTraitRefs(), new Fn<TraitRef<R>>() {
            @Override
            public TraitRef<R> apply(TraitRef<R> t) { return transformTraitRef(t); }
        });
        if (regions == args.getRegions() && types == args.getTypes()
                && cgs == args.getConstGenerics() && refs == args.getTraitRefs()) {
            return args;
        }
        return new GenericArgs<>(regions, types, cgs, refs);
    }

    public TraitRef<R> transformTraitRef(TraitRef<R> ref) {
        TraitInstanceId id = transformTraitInstanceId(ref.getTraitId());
        GenericArgs<R> generics = transformGenericArgs(ref.getGenerics());
        TraitDeclRef<R> declRef = transformTraitDeclRef(ref.getTraitDeclRef());
        if (id == ref.getTraitId() && generics == ref.getGenerics() && declRef == ref.getTraitDeclRef()) {
            return ref;
        }
        return new TraitRef<>(id, generics, declRef);
    }

    public TraitDeclRef<R> transformTraitDeclRef(TraitDeclRef<R> ref) {
        GenericArgs<R> generics = transformGenericArgs(ref.getGenerics());
        if (generics == ref.getGenerics()) return ref;
        return new TraitDeclRef<>(ref.getTraitId(), generics);
    }

    /**
     * 默认只沿 ParentClause/ItemClause 的 base 路径下降。
     */
    public TraitInstanceId transformTraitInstanceId(TraitInstanceId id) {
        if (id instanceof TraitInstanceId.ParentClause) {
            TraitInstanceId.ParentClause pc = (TraitInstanceId.ParentClause) id;
            TraitInstanceId base = transformTraitInstanceId(pc.getBase());
            if (base == pc.getBase()) return id;
            return TraitInstanceId.parentClause(base, pc.getTraitId(), pc.getClauseId());
        }
        if (id instanceof TraitInstanceId.ItemClause) {
            TraitInstanceId.ItemClause ic = (TraitInstanceId.ItemClause) id;
            TraitInstanceId base = transformTraitInstanceId(ic.getBase());
            if (base == ic.getBase()) return id;
            return TraitInstanceId.itemClause(base, ic.getTraitId(), ic.getItemName(), ic.getClauseId());
        }
        return id;
    }

    public List<Ty<R>> transformTys(List<Ty<R>> tys) {
        return transformList(tys, new Fn<Ty<R>>() {
            @Override
            public Ty<R> apply(Ty<R> t) { return transformTy(t); }
        });
    }

    // ==================== TyVisitor ====================

    @Override
    public Ty<R> visitAdt(Ty.Adt<R> ty) {
        GenericArgs<R> generics = transformGenericArgs(ty.getGenerics());
        if (generics == ty.getGenerics()) return ty;
        return Ty.adt(ty.getTypeId(), generics);
    }

    @Override
    public Ty<R> visitTypeVar(Ty.TypeVarRef<R> ty) {
        return ty;
    }

    @Override
    public Ty<R> visitLiteral(Ty.Lit<R> ty) {
        return ty;
    }

    @Override
    public Ty<R> visitNever(Ty.Never<R> ty) {
        return ty;
    }

    @Override
    public Ty<R> visitRef(Ty.Ref<R> ty) {
        R region = transformRegion(ty.getRegion());
        Ty<R> pointee = transformTy(ty.getPointee());
        if (region == ty.getRegion() && pointee == ty.getPointee()) return ty;
        return Ty.ref(region, pointee, ty.getKind());
    }

    @Override
    public Ty<R> visitRawPtr(Ty.RawPtr<R> ty) {
        Ty<R> pointee = transformTy(ty.getPointee());
        if (pointee == ty.getPointee()) return ty;
        return Ty.rawPtr(pointee, ty.getKind());
    }

    @Override
    public Ty<R> visitTraitType(Ty.TraitType<R> ty) {
        TraitRef<R> ref = transformTraitRef(ty.getTraitRef());
        GenericArgs<R> generics = transformGenericArgs(ty.getGenerics());
        if (ref == ty.getTraitRef() && generics == ty.getGenerics()) return ty;
        return Ty.traitType(ref, generics, ty.getTypeName());
    }

    @Override
    public Ty<R> visitArrow(Ty.Arrow<R> ty) {
        List<Ty<R>> inputs = transformTys(ty.getInputs());
        Ty<R> output = transformTy(ty.getOutput());
        if (inputs == ty.getInputs() && output == ty.getOutput()) return ty;
        return Ty.arrow(ty.getBoundRegions(), inputs, output);
    }

    // ==================== 辅助 ====================

    protected interface Fn<T> {
        T apply(T t);
    }

    /** 元素全部未变时返回原列表 */
    protected static <T> List<T> transformList(List<T> list, Fn<T> fn) {
        List<T> result = null;
        for (int i = 0; i < list.size(); i++) {
            T before = list.get(i);
            T after = fn.apply(before);
            if (after != before && result == null) {
                result = new ArrayList<>(list.subList(0, i));
            }
            if (result != null) result.add(after);
        }
        return result == null ? list : result;
    }
}
