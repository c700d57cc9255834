package com.mirlift.ir.export;

import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.ir.ullbc.BlockData;
import com.mirlift.types.id.BlockId;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.IdVector;

import java.nio.file.Path;

/**
 * 两种可导出的 crate：函数体为基本块表（ULLBC）或结构化语句树（LLBC）。
 */
public abstract class CrateData {

    private CrateData() {
    }

    public static CrateData ullbc(TransCtx ctx,
                                  IdMap<FunDeclId, GFunDecl<IdVector<BlockId, BlockData>>> funs,
                                  IdMap<GlobalDeclId, GGlobalDecl<IdVector<BlockId, BlockData>>> globals) {
        return new Ullbc(GCrateData.assemble(ctx, funs, globals));
    }

    public static CrateData llbc(TransCtx ctx,
                                 IdMap<FunDeclId, GFunDecl<Statement>> funs,
                                 IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals) {
        return new Llbc(GCrateData.assemble(ctx, funs, globals));
    }

    public abstract GCrateData<?, ?> getData();

    public ExportResult serializeToFile(Path target) {
        return getData().serializeToFile(target);
    }

    public String toJson() {
        return getData().toJson();
    }

    public static final class Ullbc extends CrateData {
        private final GCrateData<GFunDecl<IdVector<BlockId, BlockData>>,
                GGlobalDecl<IdVector<BlockId, BlockData>>> data;

        private Ullbc(GCrateData<GFunDecl<IdVector<BlockId, BlockData>>,
                GGlobalDecl<IdVector<BlockId, BlockData>>> data) {
            this.data = data;
        }

        @Override
        public GCrateData<GFunDecl<IdVector<BlockId, BlockData>>,
                GGlobalDecl<IdVector<BlockId, BlockData>>> getData() {
            return data;
        }
    }

    public static final class Llbc extends CrateData {
        private final GCrateData<GFunDecl<Statement>, GGlobalDecl<Statement>> data;

        private Llbc(GCrateData<GFunDecl<Statement>, GGlobalDecl<Statement>> data) {
            this.data = data;
        }

        @Override
        public GCrateData<GFunDecl<Statement>, GGlobalDecl<Statement>> getData() {
            return data;
        }
    }
}
