package com.mirlift.ir.pass;

import com.mirlift.ir.expr.Call;
import com.mirlift.ir.expr.FnPtr;
import com.mirlift.ir.expr.FunIdOrTraitMethodRef;
import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.ir.gast.FunKind;
import com.mirlift.ir.gast.GExprBody;
import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.RawStatement;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.ErasedRegion;
import com.mirlift.types.FunSig;
import com.mirlift.types.GenericArgs;
import com.mirlift.types.GenericParams;
import com.mirlift.types.Predicates;
import com.mirlift.types.Region;
import com.mirlift.types.TraitDeclRef;
import com.mirlift.types.TraitInstanceId;
import com.mirlift.types.TraitRef;
import com.mirlift.types.Ty;
import com.mirlift.types.decl.Field;
import com.mirlift.types.decl.TraitImpl;
import com.mirlift.types.decl.TraitMethod;
import com.mirlift.types.decl.TypeDecl;
import com.mirlift.types.decl.TypeDeclKind;
import com.mirlift.types.id.FieldId;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.TraitClauseId;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.id.TraitImplId;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.names.Name;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.mirlift.ir.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("RemoveUnsolvedTraitRefs 测试")
class RemoveUnsolvedTraitRefsTest {

    private static final TraitDeclId CLONE = TraitDeclId.of(0);
    private static final TypeDeclId WRAPPER = TypeDeclId.of(1);

    private TransCtx ctx;
    private IdMap<FunDeclId, GFunDecl<Statement>> funs;
    private IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals;

    @BeforeEach
    void setUp() {
        ctx = new TransCtx("test");
        funs = new IdMap<>();
        globals = new IdMap<>();
    }

    private static <R> TraitRef<R> refWith(TraitInstanceId witness) {
        return new TraitRef<>(witness, GenericArgs.<R>empty(), new TraitDeclRef<>(CLONE, GenericArgs.<R>empty()));
    }

    private static TraitInstanceId unsolved() {
        return TraitInstanceId.unsolved(CLONE, GenericArgs.<Region>empty());
    }

    /** Wrapper<..> 类型，其泛型实参携带一个 trait 引用 */
    private static Ty<Region> wrapperWith(TraitInstanceId witness) {
        return Ty.adt(WRAPPER, GenericArgs.<Region>empty()
                .withTraitRefs(Collections.singletonList(RemoveUnsolvedTraitRefsTest.<Region>refWith(witness))));
    }

    private static TraitInstanceId witnessOf(Ty<?> ty) {
        return ((Ty.Adt<?>) ty).getGenerics().getTraitRefs().get(0).getTraitId();
    }

    @Test
    @DisplayName("签名、类型声明、trait 实现与函数体中的未解析引用都变为 Unknown")
    void testAllLocationsCleaned() {
        IdVector<FieldId, Field> fields = IdVector.of(FieldId.FACTORY, new Field(meta(1), "inner", wrapperWith(unsolved())));
        TypeDecl decl = new TypeDecl(TypeDeclId.of(2), meta(1), true, Name.of("test", "Holder"),
                GenericParams.empty(), Predicates.empty(), TypeDeclKind.struct(fields));
        ctx.getTypeDecls().put(decl.getDefId(), decl);

        TraitImpl impl = new TraitImpl(TraitImplId.of(0), true, Name.of("test", "Impl"), meta(2),
                new TraitDeclRef<>(CLONE, GenericArgs.<Region>empty()), GenericParams.empty(), Predicates.empty(),
                Collections.singletonList(RemoveUnsolvedTraitRefsTest.<Region>refWith(unsolved())),
                Collections.<TraitImpl.Const>emptyList(), Collections.<TraitImpl.AssocType>emptyList(),
                Collections.<TraitMethod>emptyList(), Collections.<TraitMethod>emptyList());
        ctx.getTraitImpls().put(impl.getDefId(), impl);

        FunSig sig = new FunSig(false, GenericParams.empty(), Predicates.empty(), null,
                Collections.singletonList(wrapperWith(unsolved())), Ty.<Region>unit());
        Call call = new Call(new FnPtr(FunIdOrTraitMethodRef.trait(
                RemoveUnsolvedTraitRefsTest.<ErasedRegion>refWith(unsolved()), "clone", FunDeclId.of(9)),
                GenericArgs.<ErasedRegion>empty()), Collections.<Operand>emptyList(), Place.local(RET));
        GExprBody<Statement> body = body(WRAPPER, st(3, RawStatement.call(call)));
        funs.put(FunDeclId.of(0), new GFunDecl<>(FunDeclId.of(0), meta(3), true, Name.of("test", "f"), sig,
                FunKind.REGULAR, body));

        new RemoveUnsolvedTraitRefs().run(ctx, funs, globals);

        assertThat(ctx.getErrorCount()).isEqualTo(4);
        Field field = ((TypeDeclKind.Struct) decl.getKind()).getFields().get(FieldId.of(0));
        assertThat(witnessOf(field.getTy())).isInstanceOf(TraitInstanceId.Unknown.class);
        assertThat(impl.getParentTraitRefs().get(0).getTraitId()).isInstanceOf(TraitInstanceId.Unknown.class);
        assertThat(witnessOf(funs.get(FunDeclId.of(0)).getSignature().getInputs().get(0)))
                .isInstanceOf(TraitInstanceId.Unknown.class);

        Call cleaned = ((RawStatement.CallStmt) body.getBody().getContent()).getCall();
        TraitRef<ErasedRegion> ref = ((FunIdOrTraitMethodRef.Trait) cleaned.getFunc().getFunc()).getTraitRef();
        assertThat(ref.getTraitId()).isInstanceOf(TraitInstanceId.Unknown.class);
        assertThat(((TraitInstanceId.Unknown) ref.getTraitId()).getMessage())
                .startsWith("Could not find a clause for parameter: ");
    }

    @Test
    @DisplayName("已解析的见证保持原对象不变")
    void testSolvedWitnessUntouched() {
        FunSig sig = new FunSig(false, GenericParams.empty(), Predicates.empty(), null,
                Collections.singletonList(wrapperWith(TraitInstanceId.clause(TraitClauseId.of(0)))), Ty.<Region>unit());
        funs.put(FunDeclId.of(0), new GFunDecl<>(FunDeclId.of(0), meta(3), true, Name.of("test", "g"), sig,
                FunKind.REGULAR, body(WRAPPER, st(3, RawStatement.RETURN))));

        new RemoveUnsolvedTraitRefs().run(ctx, funs, globals);

        assertThat(funs.get(FunDeclId.of(0)).getSignature()).isSameAs(sig);
        assertThat(ctx.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("全局量的类型同样被清理")
    void testGlobalType() {
        Ty<ErasedRegion> ty = Ty.adt(WRAPPER, GenericArgs.<ErasedRegion>empty().withTraitRefs(
                Collections.singletonList(RemoveUnsolvedTraitRefsTest.<ErasedRegion>refWith(unsolved()))));
        GGlobalDecl<Statement> global = new GGlobalDecl<>(GlobalDeclId.of(0), meta(4), true, Name.of("test", "G"),
                ty, null);
        globals.put(GlobalDeclId.of(0), global);

        new RemoveUnsolvedTraitRefs().run(ctx, funs, globals);

        assertThat(witnessOf(global.getTy())).isInstanceOf(TraitInstanceId.Unknown.class);
        assertThat(ctx.getErrorCount()).isEqualTo(1);
    }
}
