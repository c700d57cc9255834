package com.mirlift.ir.pass;

import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.LlbcPrinter;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 结构化函数体的 pass 管线，按加入顺序执行。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<LlbcPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线：判别值读取折叠为 match，随后检查无残留，最后清理未解析的 trait 引用。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new RemoveReadDiscriminant());
        pipeline.addPass(new DiscriminantReadChecker());
        pipeline.addPass(new RemoveUnsolvedTraitRefs());
        return pipeline;
    }

    public void addPass(LlbcPass pass) {
        passes.add(pass);
    }

    public List<LlbcPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public void execute(TransCtx ctx, IdMap<FunDeclId, GFunDecl<Statement>> funs,
                        IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals) {
        for (LlbcPass pass : passes) {
            LOG.fine("Running pass " + pass.getName() + " on crate " + ctx.getCrateName());
            pass.run(ctx, funs, globals);
        }

        // LLBC dump（设置 MIRLIFT_DUMP_LLBC=1 环境变量启用）
        if (ctx.getOptions().isDumpLlbc()) {
            System.err.println("===== LLBC DUMP =====");
            dumpLlbc(funs, globals);
            System.err.println("===== END LLBC DUMP =====");
        }
    }

    /**
     * 打印所有函数体（用于调试）。
     */
    private void dumpLlbc(IdMap<FunDeclId, GFunDecl<Statement>> funs,
                          IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals) {
        for (GFunDecl<Statement> fun : funs.values()) {
            System.err.println("fn " + fun.getName() + " " + fun.getSignature());
            if (fun.getBody() != null) {
                System.err.println("    " + LlbcPrinter.print(fun.getBody()).replace("\n", "\n    "));
            }
        }
        for (GGlobalDecl<Statement> global : globals.values()) {
            System.err.println("global " + global.getName() + ": " + global.getTy());
            if (global.getBody() != null) {
                System.err.println("    " + LlbcPrinter.print(global.getBody()).replace("\n", "\n    "));
            }
        }
    }
}
