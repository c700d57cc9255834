package com.mirlift.ir.export;

import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;

import java.util.List;

/**
 * 计算声明的依赖顺序与递归分组。结果原样存入 {@link TransCtx} 并随 crate 导出。
 */
public interface DeclarationReorderer {

    List<DeclarationGroup> reorder(TransCtx ctx, List<FunDeclId> funs, List<GlobalDeclId> globals);
}
