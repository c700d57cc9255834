package com.mirlift.ir.llbc;

import com.mirlift.ir.expr.Var;
import com.mirlift.ir.gast.GExprBody;
import com.mirlift.types.ScalarValue;
import com.mirlift.types.id.VariantId;

import java.util.List;

/**
 * 结构化语句树的文本形式，用于调试输出与测试断言。
 */
public final class LlbcPrinter {

    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();

    private LlbcPrinter() {
    }

    public static String print(Statement st) {
        LlbcPrinter printer = new LlbcPrinter();
        printer.statement(st, "");
        return printer.sb.toString();
    }

    public static String print(GExprBody<Statement> body) {
        LlbcPrinter printer = new LlbcPrinter();
        for (Var local : body.getLocals()) {
            printer.sb.append("let ").append(local).append(";\n");
        }
        printer.sb.append('\n');
        printer.statement(body.getBody(), "");
        return printer.sb.toString();
    }

    private void statement(Statement st, String indent) {
        RawStatement content = st.getContent();
        if (content instanceof RawStatement.Sequence) {
            RawStatement.Sequence seq = (RawStatement.Sequence) content;
            statement(seq.getFirst(), indent);
            sb.append('\n');
            statement(seq.getNext(), indent);
            return;
        }
        sb.append(indent);
        if (content instanceof RawStatement.Assign) {
            RawStatement.Assign a = (RawStatement.Assign) content;
            sb.append(a.getDest()).append(" := ").append(a.getValue());
        } else if (content instanceof RawStatement.FakeRead) {
            sb.append("@fake_read(").append(((RawStatement.FakeRead) content).getPlace()).append(')');
        } else if (content instanceof RawStatement.SetDiscriminant) {
            RawStatement.SetDiscriminant sd = (RawStatement.SetDiscriminant) content;
            sb.append("@discriminant(").append(sd.getPlace()).append(") := ").append(sd.getVariant().getIndex());
        } else if (content instanceof RawStatement.Drop) {
            sb.append("drop ").append(((RawStatement.Drop) content).getPlace());
        } else if (content instanceof RawStatement.AssertStmt) {
            sb.append(((RawStatement.AssertStmt) content).getAssertion());
        } else if (content instanceof RawStatement.CallStmt) {
            sb.append(((RawStatement.CallStmt) content).getCall());
        } else if (content instanceof RawStatement.Break) {
            sb.append("break ").append(((RawStatement.Break) content).getDepth());
        } else if (content instanceof RawStatement.Continue) {
            sb.append("continue ").append(((RawStatement.Continue) content).getDepth());
        } else if (content instanceof RawStatement.Loop) {
            sb.append("loop {\n");
            statement(((RawStatement.Loop) content).getBody(), indent + INDENT);
            sb.append('\n').append(indent).append('}');
        } else if (content instanceof RawStatement.SwitchStmt) {
            switchStatement(((RawStatement.SwitchStmt) content).getSwitch(), indent);
        } else {
            sb.append(content.tag().toLowerCase());
        }
    }

    private void switchStatement(Switch sw, String indent) {
        String inner = indent + INDENT;
        if (sw instanceof Switch.If) {
            Switch.If s = (Switch.If) sw;
            sb.append("if ").append(s.getCond()).append(" {\n");
            statement(s.getThenBranch(), inner);
            sb.append('\n').append(indent).append("} else {\n");
            statement(s.getElseBranch(), inner);
            sb.append('\n').append(indent).append('}');
        } else if (sw instanceof Switch.SwitchInt) {
            Switch.SwitchInt s = (Switch.SwitchInt) sw;
            sb.append("switch ").append(s.getDiscr()).append(" {\n");
            for (SwitchCase<ScalarValue> c : s.getTargets()) {
                sb.append(inner).append(joinScalars(c.getValues())).append(" => {\n");
                statement(c.getBody(), inner + INDENT);
                sb.append('\n').append(inner).append("}\n");
            }
            otherwise(s.getOtherwise(), inner);
            sb.append(indent).append('}');
        } else {
            Switch.Match s = (Switch.Match) sw;
            sb.append("match ").append(s.getScrutinee()).append(" {\n");
            for (SwitchCase<VariantId> c : s.getTargets()) {
                sb.append(inner).append(joinVariants(c.getValues())).append(" => {\n");
                statement(c.getBody(), inner + INDENT);
                sb.append('\n').append(inner).append("}\n");
            }
            if (s.getOtherwise() != null) {
                otherwise(s.getOtherwise(), inner);
            }
            sb.append(indent).append('}');
        }
    }

    private void otherwise(Statement st, String indent) {
        sb.append(indent).append("_ => {\n");
        statement(st, indent + INDENT);
        sb.append('\n').append(indent).append("}\n");
    }

    private static String joinScalars(List<ScalarValue> values) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) out.append(" | ");
            out.append(values.get(i));
        }
        return out.toString();
    }

    private static String joinVariants(List<VariantId> values) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) out.append(" | ");
            out.append("Variant@").append(values.get(i).getIndex());
        }
        return out.toString();
    }
}
