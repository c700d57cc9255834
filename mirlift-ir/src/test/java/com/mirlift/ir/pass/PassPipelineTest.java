package com.mirlift.ir.pass;

import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.RawStatement;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.ir.translate.TranslateOptions;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.TypeDeclId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.mirlift.ir.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("PassPipeline 测试")
class PassPipelineTest {

    @Test
    @DisplayName("默认管线的顺序")
    void testDefaultOrder() {
        List<String> names = new ArrayList<>();
        for (LlbcPass pass : PassPipeline.createDefault().getPasses()) {
            names.add(pass.getName());
        }
        assertThat(names).containsExactly(
                "RemoveReadDiscriminant", "DiscriminantReadChecker", "RemoveUnsolvedTraitRefs");
    }

    @Test
    @DisplayName("按加入顺序执行，每个 pass 看到同一组声明")
    void testExecuteInOrder() {
        TransCtx ctx = new TransCtx("test", new TranslateOptions().setDumpLlbc(false));
        IdMap<FunDeclId, GFunDecl<Statement>> funs = new IdMap<>();
        IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals = new IdMap<>();
        funs.put(FunDeclId.of(0), fun(0, "f", body(TypeDeclId.of(0), st(1, RawStatement.RETURN))));
        List<String> seen = new ArrayList<>();

        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(recording("first", seen));
        pipeline.addPass(recording("second", seen));
        pipeline.execute(ctx, funs, globals);

        assertThat(seen).containsExactly("first:1", "second:1");
    }

    @Test
    @DisplayName("返回的 pass 列表不可修改")
    void testPassesUnmodifiable() {
        PassPipeline pipeline = PassPipeline.createDefault();
        assertThatThrownBy(() -> pipeline.getPasses().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static LlbcPass recording(String name, List<String> seen) {
        return new LlbcPass() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public void run(TransCtx ctx, IdMap<FunDeclId, GFunDecl<Statement>> funs,
                            IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals) {
                seen.add(name + ":" + funs.size());
            }
        };
    }
}
