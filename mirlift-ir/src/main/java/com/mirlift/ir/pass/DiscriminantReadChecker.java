package com.mirlift.ir.pass;

import com.mirlift.ir.expr.Rvalue;
import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.MutAstVisitor;
import com.mirlift.ir.llbc.RawStatement;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;

/**
 * 确认 {@link RemoveReadDiscriminant} 之后不再残留判别值读取。残留属于内部错误，直接抛出。
 */
public class DiscriminantReadChecker implements LlbcPass {

    @Override
    public String getName() {
        return "DiscriminantReadChecker";
    }

    @Override
    public void run(TransCtx ctx, IdMap<FunDeclId, GFunDecl<Statement>> funs,
                    IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals) {
        ctx.iterBodies(funs, globals, (name, body) -> new MutAstVisitor() {
            @Override
            public void visitStatement(Statement st) {
                RawStatement content = st.getContent();
                if (content instanceof RawStatement.Assign
                        && ((RawStatement.Assign) content).getValue() instanceof Rvalue.Discriminant) {
                    RawStatement.Assign assign = (RawStatement.Assign) content;
                    throw new IllegalStateException("Unexpected discriminant read in " + name
                            + " at " + st.getMeta() + ": " + assign.getDest() + " := " + assign.getValue());
                }
                defaultVisitStatement(st);
            }
        }.visitStatement(body.getBody()));
    }
}
