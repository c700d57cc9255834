package com.mirlift.ir.pass;

import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.MutAstVisitor;
import com.mirlift.ir.llbc.MutTypeVisitor;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.ErasedRegion;
import com.mirlift.types.FunSig;
import com.mirlift.types.GenericArgs;
import com.mirlift.types.GenericParams;
import com.mirlift.types.OutlivesPred;
import com.mirlift.types.Predicates;
import com.mirlift.types.Region;
import com.mirlift.types.TraitClause;
import com.mirlift.types.TraitDeclRef;
import com.mirlift.types.TraitInstanceId;
import com.mirlift.types.TraitRef;
import com.mirlift.types.TraitTypeConstraint;
import com.mirlift.types.Ty;
import com.mirlift.types.TypeTransformer;
import com.mirlift.types.decl.Field;
import com.mirlift.types.decl.TraitDecl;
import com.mirlift.types.decl.TraitImpl;
import com.mirlift.types.decl.TypeDecl;
import com.mirlift.types.decl.TypeDeclKind;
import com.mirlift.types.decl.Variant;
import com.mirlift.types.id.FieldId;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.TraitClauseId;
import com.mirlift.types.id.VariantId;
import com.mirlift.types.meta.Meta;

import java.util.ArrayList;
import java.util.List;

/**
 * 把残留的 {@link TraitInstanceId.Unsolved} 见证改写为 {@link TraitInstanceId.Unknown}，每处登记一个错误。
 * 覆盖类型声明、函数签名、trait 声明与实现、全局量类型以及函数体。
 */
public class RemoveUnsolvedTraitRefs implements LlbcPass {

    @Override
    public String getName() {
        return "RemoveUnsolvedTraitRefs";
    }

    @Override
    public void run(TransCtx ctx, IdMap<FunDeclId, GFunDecl<Statement>> funs,
                    IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals) {
        SignatureCleaner sigs = new SignatureCleaner(ctx);
        BodyCleaner bodies = new BodyCleaner(ctx);

        for (TypeDecl decl : ctx.getTypeDecls().values()) {
            sigs.meta = decl.getMeta();
            decl.setGenerics(sigs.transformGenericParams(decl.getGenerics()));
            decl.setPreds(sigs.transformPredicates(decl.getPreds()));
            decl.setKind(sigs.transformTypeDeclKind(decl.getKind()));
        }
        for (TraitDecl decl : ctx.getTraitDecls().values()) {
            sigs.meta = decl.getMeta();
            cleanTraitDecl(sigs, decl);
        }
        for (TraitImpl impl : ctx.getTraitImpls().values()) {
            sigs.meta = impl.getMeta();
            cleanTraitImpl(sigs, impl);
        }
        for (GFunDecl<Statement> fun : funs.values()) {
            sigs.meta = fun.getMeta();
            fun.setSignature(sigs.transformFunSig(fun.getSignature()));
        }
        for (GGlobalDecl<Statement> global : globals.values()) {
            bodies.meta = global.getMeta();
            global.setTy(bodies.transformTy(global.getTy()));
        }

        final MutAstVisitor visitor = new MutAstVisitor(bodies) {
            @Override
            public void visitStatement(Statement st) {
                bodies.meta = st.getMeta();
                defaultVisitStatement(st);
            }
        };
        ctx.iterBodies(funs, globals, (name, body) -> {
            bodies.meta = body.getMeta();
            visitor.visitBody(body);
        });
    }

    private static void cleanTraitDecl(SignatureCleaner sigs, TraitDecl decl) {
        decl.setGenerics(sigs.transformGenericParams(decl.getGenerics()));
        decl.setPreds(sigs.transformPredicates(decl.getPreds()));
        decl.setParentClauses(sigs.transformClauses(decl.getParentClauses()));

        List<TraitDecl.Const> consts = new ArrayList<>();
        for (TraitDecl.Const c : decl.getConsts()) {
            Ty<Region> ty = sigs.transformTy(c.getTy());
            consts.add(ty == c.getTy() ? c : c.withTy(ty));
        }
        decl.setConsts(consts);

        List<TraitDecl.AssocType> types = new ArrayList<>();
        for (TraitDecl.AssocType t : decl.getTypes()) {
            List<TraitClause> clauses = sigs.transformClauses(t.getClauses());
            Ty<Region> defaultTy = t.getDefaultTy() == null ? null : sigs.transformTy(t.getDefaultTy());
            types.add(clauses == t.getClauses() && defaultTy == t.getDefaultTy() ? t : t.with(clauses, defaultTy));
        }
        decl.setTypes(types);
    }

    private static void cleanTraitImpl(SignatureCleaner sigs, TraitImpl impl) {
        impl.setImplTrait(sigs.transformTraitDeclRef(impl.getImplTrait()));
        impl.setGenerics(sigs.transformGenericParams(impl.getGenerics()));
        impl.setPreds(sigs.transformPredicates(impl.getPreds()));
        impl.setParentTraitRefs(sigs.transformTraitRefs(impl.getParentTraitRefs()));

        List<TraitImpl.Const> consts = new ArrayList<>();
        for (TraitImpl.Const c : impl.getConsts()) {
            Ty<Region> ty = sigs.transformTy(c.getTy());
            consts.add(ty == c.getTy() ? c : c.withTy(ty));
        }
        impl.setConsts(consts);

        List<TraitImpl.AssocType> types = new ArrayList<>();
        for (TraitImpl.AssocType t : impl.getTypes()) {
            List<TraitRef<Region>> refs = sigs.transformTraitRefs(t.getTraitRefs());
            Ty<Region> ty = sigs.transformTy(t.getTy());
            types.add(refs == t.getTraitRefs() && ty == t.getTy() ? t : t.with(refs, ty));
        }
        impl.setTypes(types);
    }

    private static TraitInstanceId replaceUnsolved(TransCtx ctx, Meta meta, TraitInstanceId.Unsolved id) {
        String message = "Could not find a clause for parameter: " + id.getTraitId() + id.getGenerics();
        ctx.registerError(meta, message);
        return TraitInstanceId.unknown(message);
    }

    /** 签名一侧（带区域） */
    private static final class SignatureCleaner extends TypeTransformer<Region> {
        private final TransCtx ctx;
        private Meta meta;

        SignatureCleaner(TransCtx ctx) {
            this.ctx = ctx;
        }

        @Override
        public TraitInstanceId transformTraitInstanceId(TraitInstanceId id) {
            if (id instanceof TraitInstanceId.Unsolved) {
                return replaceUnsolved(ctx, meta, (TraitInstanceId.Unsolved) id);
            }
            return super.transformTraitInstanceId(id);
        }

        List<TraitRef<Region>> transformTraitRefs(List<TraitRef<Region>> refs) {
            return transformList(refs, this::transformTraitRef);
        }

        List<TraitClause> transformClauses(List<TraitClause> clauses) {
            return transformList(clauses, c -> {
                GenericArgs<Region> generics = transformGenericArgs(c.getGenerics());
                return generics == c.getGenerics() ? c : c.withGenerics(generics);
            });
        }

        GenericParams transformGenericParams(GenericParams params) {
            List<TraitClause> before = params.getTraitClauses().values();
            List<TraitClause> after = transformClauses(before);
            if (after == before) return params;
            return new GenericParams(params.getRegions(), params.getTypes(), params.getConstGenerics(),
                    new IdVector<>(TraitClauseId.FACTORY, after));
        }

        Predicates transformPredicates(Predicates preds) {
            List<OutlivesPred<Ty<Region>, Region>> typesOutlive = transformList(preds.getTypesOutlive(), p -> {
                Ty<Region> left = transformTy(p.getLeft());
                return left == p.getLeft() ? p : new OutlivesPred<>(left, p.getRight());
            });
            List<TraitTypeConstraint<Region>> constraints = transformList(preds.getTraitTypeConstraints(), c -> {
                TraitRef<Region> ref = transformTraitRef(c.getTraitRef());
                GenericArgs<Region> generics = transformGenericArgs(c.getGenerics());
                Ty<Region> ty = transformTy(c.getTy());
                if (ref == c.getTraitRef() && generics == c.getGenerics() && ty == c.getTy()) return c;
                return new TraitTypeConstraint<>(ref, generics, c.getTypeName(), ty);
            });
            if (typesOutlive == preds.getTypesOutlive() && constraints == preds.getTraitTypeConstraints()) {
                return preds;
            }
            return new Predicates(preds.getRegionsOutlive(), typesOutlive, constraints);
        }

        FunSig transformFunSig(FunSig sig) {
            GenericParams generics = transformGenericParams(sig.getGenerics());
            Predicates preds = transformPredicates(sig.getPreds());
            List<Ty<Region>> inputs = transformTys(sig.getInputs());
            Ty<Region> output = transformTy(sig.getOutput());
            if (generics == sig.getGenerics() && preds == sig.getPreds()
                    && inputs == sig.getInputs() && output == sig.getOutput()) {
                return sig;
            }
            return sig.withTypes(generics, preds, inputs, output);
        }

        TypeDeclKind transformTypeDeclKind(TypeDeclKind kind) {
            if (kind instanceof TypeDeclKind.Struct) {
                IdVector<FieldId, Field> fields = ((TypeDeclKind.Struct) kind).getFields();
                IdVector<FieldId, Field> newFields = transformFields(fields);
                return newFields == fields ? kind : TypeDeclKind.struct(newFields);
            }
            if (kind instanceof TypeDeclKind.Enum) {
                IdVector<VariantId, Variant> variants = ((TypeDeclKind.Enum) kind).getVariants();
                List<Variant> result = new ArrayList<>();
                boolean changed = false;
                for (Variant v : variants) {
                    IdVector<FieldId, Field> fields = transformFields(v.getFields());
                    if (fields != v.getFields()) {
                        changed = true;
                        result.add(new Variant(v.getMeta(), v.getName(), fields, v.getDiscriminant()));
                    } else {
                        result.add(v);
                    }
                }
                return changed ? TypeDeclKind.enumeration(new IdVector<>(VariantId.FACTORY, result)) : kind;
            }
            return kind;
        }

        private IdVector<FieldId, Field> transformFields(IdVector<FieldId, Field> fields) {
            List<Field> before = fields.values();
            List<Field> after = transformList(before, f -> {
                Ty<Region> ty = transformTy(f.getTy());
                return ty == f.getTy() ? f : f.withTy(ty);
            });
            return after == before ? fields : new IdVector<>(FieldId.FACTORY, after);
        }
    }

    /** 函数体一侧（区域已擦除） */
    private static final class BodyCleaner extends MutTypeVisitor {
        private final TransCtx ctx;
        private Meta meta;

        BodyCleaner(TransCtx ctx) {
            this.ctx = ctx;
        }

        @Override
        public TraitInstanceId transformTraitInstanceId(TraitInstanceId id) {
            if (id instanceof TraitInstanceId.Unsolved) {
                return replaceUnsolved(ctx, meta, (TraitInstanceId.Unsolved) id);
            }
            return super.transformTraitInstanceId(id);
        }
    }
}
