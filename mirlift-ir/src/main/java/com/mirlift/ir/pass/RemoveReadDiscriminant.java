package com.mirlift.ir.pass;

import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.ir.expr.Rvalue;
import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.LlbcPrinter;
import com.mirlift.ir.llbc.MutAstVisitor;
import com.mirlift.ir.llbc.RawStatement;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.llbc.Switch;
import com.mirlift.ir.llbc.SwitchCase;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.ScalarValue;
import com.mirlift.types.decl.TypeDecl;
import com.mirlift.types.decl.TypeDeclKind;
import com.mirlift.types.decl.Variant;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.id.VariantId;
import com.mirlift.types.meta.Meta;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把"读取判别值 + 按整数分派"折叠为按变体匹配。
 * <p>
 * 形如
 * <pre>
 *   tmp := discriminant(p);
 *   switch move tmp { 0 => A, 1 => B, _ => C }
 * </pre>
 * 的语句序列改写为 {@code match p { Variant@0 => A, Variant@1 => B }}：
 * 整数值经变体的判别值换算为变体 id；所有变体都被覆盖时去掉 otherwise 分支。
 * <p>
 * 形状不符、类型不是枚举或判别值无对应变体时登记错误；前两种情况整条语句被置为 nop。
 */
public class RemoveReadDiscriminant implements LlbcPass {

    private static final Logger LOG = Logger.getLogger(RemoveReadDiscriminant.class.getName());

    @Override
    public String getName() {
        return "RemoveReadDiscriminant";
    }

    @Override
    public void run(TransCtx ctx, IdMap<FunDeclId, GFunDecl<Statement>> funs,
                    IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals) {
        ctx.iterBodies(funs, globals, (name, body) -> {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("# About to remove discriminant reads in decl: " + name + ":\n"
                        + LlbcPrinter.print(body));
            }
            new Visitor(ctx).visitStatement(body.getBody());
        });
    }

    private static final class Visitor extends MutAstVisitor {
        private final TransCtx ctx;

        Visitor(TransCtx ctx) {
            this.ctx = ctx;
        }

        @Override
        public void visitStatement(Statement st) {
            updateStatement(st);
            // 改写后的分支与后续语句、或未改写语句的子语句，都需要再访问一遍
            defaultVisitStatement(st);
        }

        private void updateStatement(Statement st) {
            RawStatement content = st.getContent();
            if (isDiscriminantRead(content)) {
                // 没有后继语句
                ctx.registerError(st.getMeta(), "A discriminant read must be followed by a `SwitchInt`");
                st.setContent(RawStatement.NOP);
                return;
            }
            if (!(content instanceof RawStatement.Sequence)) return;
            RawStatement.Sequence seq = (RawStatement.Sequence) content;
            Statement first = seq.getFirst();
            if (!isDiscriminantRead(first.getContent())) return;

            RawStatement.Assign assign = (RawStatement.Assign) first.getContent();
            Rvalue.Discriminant read = (Rvalue.Discriminant) assign.getValue();
            Place dest = assign.getDest();
            Meta meta1 = first.getMeta();

            // 判别值读取后必须紧跟一个 SwitchInt（可能位于序列的首位）
            Statement st2 = seq.getNext();
            Meta meta2;
            Switch.SwitchInt switchInt;
            Statement st3 = null;
            if (st2.getContent() instanceof RawStatement.Sequence
                    && asSwitchInt(((RawStatement.Sequence) st2.getContent()).getFirst().getContent()) != null) {
                RawStatement.Sequence seq2 = (RawStatement.Sequence) st2.getContent();
                meta2 = seq2.getFirst().getMeta();
                switchInt = asSwitchInt(seq2.getFirst().getContent());
                st3 = seq2.getNext();
            } else if (asSwitchInt(st2.getContent()) != null) {
                meta2 = st2.getMeta();
                switchInt = asSwitchInt(st2.getContent());
            } else {
                ctx.registerError(st.getMeta(), "A discriminant read must be followed by a `SwitchInt`");
                st.setContent(RawStatement.NOP);
                return;
            }

            if (!dest.isLocal() || !readsTemporary(switchInt.getDiscr(), dest)) {
                ctx.registerError(st.getMeta(), "The `SwitchInt` after a discriminant read must move "
                        + "the temporary it was assigned to");
                st.setContent(RawStatement.NOP);
                return;
            }

            List<Variant> variants = lookupVariants(st.getMeta(), read.getAdtId());
            if (variants == null) {
                st.setContent(RawStatement.NOP);
                return;
            }

            // 判别值（位模式）→ 变体 id；判别值可以是任意有符号整数类型
            Map<BigInteger, VariantId> discrToId = new HashMap<>();
            for (int i = 0; i < variants.size(); i++) {
                ScalarValue discr = variants.get(i).getDiscriminant();
                discrToId.put(discr.toBits(), VariantId.of(i));
            }
            Set<BigInteger> covered = new HashSet<>();
            List<SwitchCase<VariantId>> targets = new ArrayList<>();
            for (SwitchCase<ScalarValue> c : switchInt.getTargets()) {
                List<VariantId> ids = new ArrayList<>();
                for (ScalarValue value : c.getValues()) {
                    BigInteger bits = value.toBits();
                    VariantId id = discrToId.get(bits);
                    if (id == null) {
                        ctx.registerError(st.getMeta(), "Found incorrect discriminant " + bits
                                + " for enum " + read.getAdtId());
                        continue;
                    }
                    // 只有能对应到变体的值才算覆盖：未知值计入会让 otherwise 被误删
                    covered.add(bits);
                    ids.add(id);
                }
                targets.add(new SwitchCase<>(ids, c.getBody()));
            }
            boolean coversAll = covered.size() == discrToId.size();
            Statement otherwise = coversAll ? null : switchInt.getOtherwise();

            RawStatement match = RawStatement.switchOn(Switch.match(read.getPlace(), targets, otherwise));
            if (st3 != null) {
                Statement head = new Statement(Meta.combine(meta1, meta2), match);
                st.setContent(Statement.sequence(head, st3).getContent());
            } else {
                st.setContent(match);
            }
        }

        /** 找不到声明或不是枚举时登记错误并返回 null */
        private List<Variant> lookupVariants(Meta meta, TypeDeclId adtId) {
            TypeDecl decl = ctx.getTypeDecls().get(adtId);
            if (decl == null) {
                ctx.registerError(meta, "Missing declaration for the type of a discriminant read: " + adtId);
                return null;
            }
            TypeDeclKind kind = decl.getKind();
            if (kind instanceof TypeDeclKind.Enum) {
                return ((TypeDeclKind.Enum) kind).getVariants().values();
            }
            if (kind instanceof TypeDeclKind.Error) {
                ctx.registerError(meta, "Discriminant read on a type that failed to translate: " + decl.getName());
            } else {
                ctx.registerError(meta, "Discriminant read on a non-enum type: " + decl.getName());
            }
            return null;
        }

        private static boolean isDiscriminantRead(RawStatement content) {
            return content instanceof RawStatement.Assign
                    && ((RawStatement.Assign) content).getValue() instanceof Rvalue.Discriminant;
        }

        private static Switch.SwitchInt asSwitchInt(RawStatement content) {
            if (!(content instanceof RawStatement.SwitchStmt)) return null;
            Switch sw = ((RawStatement.SwitchStmt) content).getSwitch();
            return sw instanceof Switch.SwitchInt ? (Switch.SwitchInt) sw : null;
        }

        private static boolean readsTemporary(Operand discr, Place dest) {
            if (!(discr instanceof Operand.Move)) return false;
            Place read = ((Operand.Move) discr).getPlace();
            return read.isLocal() && read.getVarId().equals(dest.getVarId());
        }
    }
}
