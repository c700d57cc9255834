package com.mirlift.ir.pass;

import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;

/**
 * 结构化函数体上的变换 pass。
 */
public interface LlbcPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 原地改写函数与全局量；可恢复的问题通过 {@link TransCtx#registerError} 报告。
     */
    void run(TransCtx ctx, IdMap<FunDeclId, GFunDecl<Statement>> funs,
             IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals);
}
