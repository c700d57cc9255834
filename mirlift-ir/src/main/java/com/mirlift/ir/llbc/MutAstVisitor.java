package com.mirlift.ir.llbc;

import com.mirlift.ir.expr.Assert;
import com.mirlift.ir.expr.Call;
import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.ir.expr.Rvalue;
import com.mirlift.ir.expr.Var;
import com.mirlift.ir.gast.GExprBody;
import com.mirlift.types.id.VarId;

import java.util.Map;

/**
 * 结构化语句树的可变遍历基类。
 * <p>
 * 子类覆盖 {@link #visitStatement(Statement)} 改写语句，处理完当前节点后调用
 * {@link #defaultVisitStatement(Statement)} 继续向子语句下降。
 * 表达式中的类型交给 {@link MutTypeVisitor} 改写，内容有变化时原地替换语句单元的内容。
 */
public abstract class MutAstVisitor {

    protected final MutTypeVisitor types;

    protected MutAstVisitor() {
        this(new MutTypeVisitor());
    }

    protected MutAstVisitor(MutTypeVisitor types) {
        this.types = types;
    }

    /**
     * 改写局部变量类型，再遍历语句树。
     */
    public void visitBody(GExprBody<Statement> body) {
        for (Map.Entry<VarId, Var> entry : body.getLocals().entries()) {
            Var var = types.transformVar(entry.getValue());
            if (var != entry.getValue()) {
                body.getLocals().set(entry.getKey(), var);
            }
        }
        visitStatement(body.getBody());
    }

    public void visitStatement(Statement st) {
        defaultVisitStatement(st);
    }

    protected final void defaultVisitStatement(Statement st) {
        RawStatement content = st.getContent();
        if (content instanceof RawStatement.Assign) {
            RawStatement.Assign assign = (RawStatement.Assign) content;
            Place dest = types.transformPlace(assign.getDest());
            Rvalue value = types.transformRvalue(assign.getValue());
            if (dest != assign.getDest() || value != assign.getValue()) {
                st.setContent(RawStatement.assign(dest, value));
            }
        } else if (content instanceof RawStatement.FakeRead) {
            Place place = ((RawStatement.FakeRead) content).getPlace();
            Place newPlace = types.transformPlace(place);
            if (newPlace != place) st.setContent(RawStatement.fakeRead(newPlace));
        } else if (content instanceof RawStatement.SetDiscriminant) {
            RawStatement.SetDiscriminant sd = (RawStatement.SetDiscriminant) content;
            Place newPlace = types.transformPlace(sd.getPlace());
            if (newPlace != sd.getPlace()) st.setContent(RawStatement.setDiscriminant(newPlace, sd.getVariant()));
        } else if (content instanceof RawStatement.Drop) {
            Place place = ((RawStatement.Drop) content).getPlace();
            Place newPlace = types.transformPlace(place);
            if (newPlace != place) st.setContent(RawStatement.drop(newPlace));
        } else if (content instanceof RawStatement.AssertStmt) {
            Assert a = ((RawStatement.AssertStmt) content).getAssertion();
            Assert newAssert = types.transformAssert(a);
            if (newAssert != a) st.setContent(RawStatement.assertion(newAssert));
        } else if (content instanceof RawStatement.CallStmt) {
            Call call = ((RawStatement.CallStmt) content).getCall();
            Call newCall = types.transformCall(call);
            if (newCall != call) st.setContent(RawStatement.call(newCall));
        } else if (content instanceof RawStatement.Sequence) {
            RawStatement.Sequence seq = (RawStatement.Sequence) content;
            visitStatement(seq.getFirst());
            visitStatement(seq.getNext());
        } else if (content instanceof RawStatement.SwitchStmt) {
            Switch sw = ((RawStatement.SwitchStmt) content).getSwitch();
            Switch newSw = transformSwitchHead(sw);
            if (newSw != sw) st.setContent(RawStatement.switchOn(newSw));
            for (Statement branch : newSw.branches()) {
                visitStatement(branch);
            }
        } else if (content instanceof RawStatement.Loop) {
            visitStatement(((RawStatement.Loop) content).getBody());
        }
        // Panic, Return, Break, Continue, Nop: 无子节点
    }

    /** 改写分支头部的操作数或位置；分支体单元保持不变 */
    private Switch transformSwitchHead(Switch sw) {
        if (sw instanceof Switch.If) {
            Switch.If s = (Switch.If) sw;
            Operand cond = types.transformOperand(s.getCond());
            return cond == s.getCond() ? sw : s.withCond(cond);
        }
        if (sw instanceof Switch.SwitchInt) {
            Switch.SwitchInt s = (Switch.SwitchInt) sw;
            Operand discr = types.transformOperand(s.getDiscr());
            return discr == s.getDiscr() ? sw : s.withDiscr(discr);
        }
        Switch.Match s = (Switch.Match) sw;
        Place scrutinee = types.transformPlace(s.getScrutinee());
        return scrutinee == s.getScrutinee() ? sw : s.withScrutinee(scrutinee);
    }
}
