package com.mirlift.types;

import java.util.ArrayList;
import java.util.List;

/**
 * 区域擦除：把签名形态的类型投影为函数体形态。单向，不可逆。
 */
public final class RegionEraser implements TyVisitor<Region, Ty<ErasedRegion>> {

    private static final RegionEraser INSTANCE = new RegionEraser();

    private RegionEraser() {
    }

    public static Ty<ErasedRegion> erase(Ty<Region> ty) {
        return ty.accept(INSTANCE);
    }

    public static GenericArgs<ErasedRegion> eraseArgs(GenericArgs<Region> args) {
        List<ErasedRegion> regions = new ArrayList<>();
        for (int i = 0; i < args.getRegions().size(); i++) {
            regions.add(ErasedRegion.ERASED);
        }
        List<TraitRef<ErasedRegion>> refs = new ArrayList<>();
        for (TraitRef<Region> ref : args.getTraitRefs()) {
            refs.add(eraseTraitRef(ref));
        }
        return new GenericArgs<>(regions, eraseAll(args.getTypes()), args.getConstGenerics(), refs);
    }

    public static TraitRef<ErasedRegion> eraseTraitRef(TraitRef<Region> ref) {
        return new TraitRef<>(ref.getTraitId(), eraseArgs(ref.getGenerics()),
                eraseTraitDeclRef(ref.getTraitDeclRef()));
    }

    public static TraitDeclRef<ErasedRegion> eraseTraitDeclRef(TraitDeclRef<Region> ref) {
        return new TraitDeclRef<>(ref.getTraitId(), eraseArgs(ref.getGenerics()));
    }

    public static List<Ty<ErasedRegion>> eraseAll(List<Ty<Region>> tys) {
        List<Ty<ErasedRegion>> out = new ArrayList<>(tys.size());
        for (Ty<Region> ty : tys) {
            out.add(erase(ty));
        }
        return out;
    }

    @Override
    public Ty<ErasedRegion> visitAdt(Ty.Adt<Region> ty) {
        return Ty.adt(ty.getTypeId(), eraseArgs(ty.getGenerics()));
    }

    @Override
    public Ty<ErasedRegion> visitTypeVar(Ty.TypeVarRef<Region> ty) {
        return Ty.typeVar(ty.getId());
    }

    @Override
    public Ty<ErasedRegion> visitLiteral(Ty.Lit<Region> ty) {
        return Ty.literal(ty.getLiteralTy());
    }

    @Override
    public Ty<ErasedRegion> visitNever(Ty.Never<Region> ty) {
        return Ty.never();
    }

    @Override
    public Ty<ErasedRegion> visitRef(Ty.Ref<Region> ty) {
        return Ty.ref(ErasedRegion.ERASED, erase(ty.getPointee()), ty.getKind());
    }

    @Override
    public Ty<ErasedRegion> visitRawPtr(Ty.RawPtr<Region> ty) {
        return Ty.rawPtr(erase(ty.getPointee()), ty.getKind());
    }

    @Override
    public Ty<ErasedRegion> visitTraitType(Ty.TraitType<Region> ty) {
        return Ty.traitType(eraseTraitRef(ty.getTraitRef()), eraseArgs(ty.getGenerics()), ty.getTypeName());
    }

    @Override
    public Ty<ErasedRegion> visitArrow(Ty.Arrow<Region> ty) {
        return Ty.arrow(ty.getBoundRegions(), eraseAll(ty.getInputs()), erase(ty.getOutput()));
    }
}
