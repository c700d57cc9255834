package com.mirlift.ir.translate;

import com.mirlift.ir.export.DeclarationGroup;
import com.mirlift.ir.export.GDeclarationGroup;
import com.mirlift.ir.gast.FunKind;
import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.RawStatement;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.types.id.FileId;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.meta.FileName;
import com.mirlift.types.names.Name;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.mirlift.ir.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("TransCtx 测试")
class TransCtxTest {

    @Nested
    @DisplayName("错误登记")
    class Errors {

        @Test
        @DisplayName("默认继续执行，只计数")
        void testContinueOnFailure() {
            TransCtx ctx = new TransCtx("demo");
            assertThat(ctx.hasErrors()).isFalse();

            ctx.registerError(meta(1), "first");
            ctx.registerError(null, "second");

            assertThat(ctx.getErrorCount()).isEqualTo(2);
            assertThat(ctx.hasErrors()).isTrue();
        }

        @Test
        @DisplayName("严格模式抛出带位置的异常")
        void testStrict() {
            TransCtx ctx = new TransCtx("demo", TranslateOptions.strict());

            assertThatThrownBy(() -> ctx.registerError(meta(3), "boom"))
                    .isInstanceOf(TranslationException.class)
                    .hasMessageStartingWith("boom at ")
                    .satisfies(e -> assertThat(((TranslationException) e).getMeta()).isEqualTo(meta(3)));
            assertThat(ctx.getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("选项的默认值")
        void testOptionDefaults() {
            assertThat(new TranslateOptions().isContinueOnFailure()).isTrue();
            assertThat(TranslateOptions.strict().isContinueOnFailure()).isFalse();
            assertThat(new TranslateOptions().setDumpLlbc(true).isDumpLlbc()).isTrue();
        }
    }

    @Nested
    @DisplayName("函数体遍历")
    class Bodies {

        @Test
        @DisplayName("先函数后全局量，各自按 id 顺序，跳过无函数体的声明")
        void testIterBodiesOrder() {
            TransCtx ctx = new TransCtx("demo");
            IdMap<FunDeclId, GFunDecl<Statement>> funs = new IdMap<>();
            IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals = new IdMap<>();
            TypeDeclId adt = TypeDeclId.of(0);
            globals.put(GlobalDeclId.of(0), global(0, "G0", body(adt, st(1, RawStatement.RETURN))));
            funs.put(FunDeclId.of(2), fun(2, "f2", body(adt, st(1, RawStatement.RETURN))));
            funs.put(FunDeclId.of(1), new GFunDecl<>(FunDeclId.of(1), meta(1), false, Name.of("test", "opaque"),
                    unitSig(), FunKind.REGULAR, null));
            funs.put(FunDeclId.of(0), fun(0, "f0", body(adt, st(1, RawStatement.RETURN))));

            List<String> visited = new ArrayList<>();
            ctx.iterBodies(funs, globals, (name, body) -> visited.add(name.toString()));

            assertThat(visited).containsExactly(
                    Name.of("test", "f0").toString(), Name.of("test", "f2").toString(),
                    Name.of("test", "G0").toString());
        }
    }

    @Nested
    @DisplayName("文件表与声明顺序")
    class Ordering {

        @Test
        @DisplayName("文件按 id 排序")
        void testFilesSorted() {
            TransCtx ctx = new TransCtx("demo");
            ctx.registerFile(FileId.of(2), FileName.local("b.rs"));
            ctx.registerFile(FileId.of(0), FileName.virtual("a.rs"));

            assertThat(ctx.getIdToFile().keySet()).containsExactly(FileId.of(0), FileId.of(2));
        }

        @Test
        @DisplayName("排序器的结果原样保存")
        void testComputeDeclarationOrder() {
            TransCtx ctx = new TransCtx("demo");
            assertThat(ctx.getOrderedDecls()).isNull();

            List<FunDeclId> funIds = new ArrayList<>();
            funIds.add(FunDeclId.of(0));
            funIds.add(FunDeclId.of(1));
            ctx.computeDeclarationOrder((c, funs, globals) -> {
                List<DeclarationGroup> groups = new ArrayList<>();
                groups.add(DeclarationGroup.fun(GDeclarationGroup.rec(funs)));
                return groups;
            }, funIds, new ArrayList<GlobalDeclId>());

            assertThat(ctx.getOrderedDecls()).containsExactly(
                    DeclarationGroup.fun(GDeclarationGroup.rec(funIds)));
            assertThat(new ArrayList<Object>(ctx.getOrderedDecls().get(0).getGroup().ids())).containsExactly(
                    FunDeclId.of(0), FunDeclId.of(1));
        }
    }
}
