package com.mirlift.ir.pass;

import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.ir.expr.Rvalue;
import com.mirlift.ir.gast.GExprBody;
import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.LlbcPrinter;
import com.mirlift.ir.llbc.MutAstVisitor;
import com.mirlift.ir.llbc.RawStatement;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.llbc.Switch;
import com.mirlift.ir.llbc.SwitchCase;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.ir.translate.TranslateOptions;
import com.mirlift.ir.translate.TranslationException;
import com.mirlift.types.IntegerTy;
import com.mirlift.types.ScalarValue;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.id.VariantId;
import com.mirlift.types.meta.Meta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.mirlift.ir.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("RemoveReadDiscriminant 测试")
class RemoveReadDiscriminantTest {

    private static final TypeDeclId ENUM3 = TypeDeclId.of(0);
    private static final TypeDeclId STRUCT = TypeDeclId.of(1);
    private static final TypeDeclId ENUM_I8 = TypeDeclId.of(2);
    private static final TypeDeclId MISSING = TypeDeclId.of(42);

    private TransCtx ctx;
    private IdMap<FunDeclId, GFunDecl<Statement>> funs;
    private IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals;

    @BeforeEach
    void setUp() {
        ctx = new TransCtx("test");
        registerDecls(ctx);
        funs = new IdMap<>();
        globals = new IdMap<>();
    }

    private static void registerDecls(TransCtx ctx) {
        ctx.getTypeDecls().put(ENUM3, enumDecl(ENUM3, "E3", IntegerTy.ISIZE, 0, 1, 2));
        ctx.getTypeDecls().put(STRUCT, structDecl(STRUCT, "S"));
        ctx.getTypeDecls().put(ENUM_I8, enumDecl(ENUM_I8, "Sign", IntegerTy.I8, -1, 0, 1));
    }

    private GExprBody<Statement> addFun(Statement statement) {
        GExprBody<Statement> body = body(ENUM3, statement);
        FunDeclId id = FunDeclId.of(funs.size());
        funs.put(id, fun(id.getIndex(), "f" + id.getIndex(), body));
        return body;
    }

    private void runPass() {
        new RemoveReadDiscriminant().run(ctx, funs, globals);
    }

    private static Switch.Match asMatch(Statement st) {
        assertThat(st.getContent()).isInstanceOf(RawStatement.SwitchStmt.class);
        Switch sw = ((RawStatement.SwitchStmt) st.getContent()).getSwitch();
        assertThat(sw).isInstanceOf(Switch.Match.class);
        return (Switch.Match) sw;
    }

    private static List<List<VariantId>> caseValues(Switch.Match match) {
        List<List<VariantId>> values = new ArrayList<>();
        for (SwitchCase<VariantId> c : match.getTargets()) {
            values.add(c.getValues());
        }
        return values;
    }

    private static int countDiscriminantReads(Statement root) {
        final int[] count = {0};
        new MutAstVisitor() {
            @Override
            public void visitStatement(Statement st) {
                if (st.getContent() instanceof RawStatement.Assign
                        && ((RawStatement.Assign) st.getContent()).getValue() instanceof Rvalue.Discriminant) {
                    count[0]++;
                }
                defaultVisitStatement(st);
            }
        }.visitStatement(root);
        return count[0];
    }

    // ============ 覆盖判定 ============

    @Nested
    @DisplayName("otherwise 分支")
    class Coverage {

        @Test
        @DisplayName("覆盖全部变体时去掉 otherwise")
        void testFullCoverageDropsOtherwise() {
            Statement a = marker(10, 0);
            Statement b = marker(11, 1);
            Statement c = marker(12, 2);
            GExprBody<Statement> body = addFun(readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, a), intCase(IntegerTy.ISIZE, 1, b),
                            intCase(IntegerTy.ISIZE, 2, c)),
                    marker(13, 99)));

            runPass();

            Switch.Match match = asMatch(body.getBody());
            assertThat(match.getOtherwise()).isNull();
            assertThat(caseValues(match)).containsExactly(
                    list(VariantId.of(0)), list(VariantId.of(1)), list(VariantId.of(2)));
            assertThat(match.getTargets().get(0).getBody()).isSameAs(a);
            assertThat(match.getTargets().get(2).getBody()).isSameAs(c);
            assertThat(ctx.getErrorCount()).isZero();
        }

        @Test
        @DisplayName("部分覆盖时保留原 otherwise 分支")
        void testPartialCoverageKeepsOtherwise() {
            Statement otherwise = marker(13, 99);
            GExprBody<Statement> body = addFun(readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0)), intCase(IntegerTy.ISIZE, 1, marker(11, 1))),
                    otherwise));

            runPass();

            Switch.Match match = asMatch(body.getBody());
            assertThat(match.getOtherwise()).isSameAs(otherwise);
            assertThat(match.getTargets()).hasSize(2);
            assertThat(match.getScrutinee().getVarId()).isEqualTo(SCRUTINEE);
        }

        @Test
        @DisplayName("一个分支对应多个值")
        void testMultiValueCase() {
            List<ScalarValue> values = list(ScalarValue.of(IntegerTy.ISIZE, 0), ScalarValue.of(IntegerTy.ISIZE, 2));
            GExprBody<Statement> body = addFun(readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(new SwitchCase<>(values, marker(10, 0)), intCase(IntegerTy.ISIZE, 1, marker(11, 1))),
                    marker(13, 99)));

            runPass();

            Switch.Match match = asMatch(body.getBody());
            assertThat(caseValues(match)).containsExactly(
                    list(VariantId.of(0), VariantId.of(2)), list(VariantId.of(1)));
            assertThat(match.getOtherwise()).isNull();
        }

        @Test
        @DisplayName("有符号判别值按位模式匹配：i8 的 -1 对应 255")
        void testSignedDiscriminantBitPattern() {
            List<ScalarValue> minusOne = Collections.singletonList(
                    ScalarValue.fromBits(IntegerTy.I8, BigInteger.valueOf(255)));
            GExprBody<Statement> body = addFun(readThenSwitch(1, ENUM_I8, IntegerTy.I8,
                    list(new SwitchCase<>(minusOne, marker(10, 0)),
                            intCase(IntegerTy.I8, 0, marker(11, 1)),
                            intCase(IntegerTy.I8, 1, marker(12, 2))),
                    marker(13, 99)));

            runPass();

            Switch.Match match = asMatch(body.getBody());
            assertThat(caseValues(match)).containsExactly(
                    list(VariantId.of(0)), list(VariantId.of(1)), list(VariantId.of(2)));
            assertThat(match.getOtherwise()).isNull();
            assertThat(ctx.getErrorCount()).isZero();
        }

        @Test
        @DisplayName("无对应变体的值被丢弃并登记错误，不计入覆盖")
        void testUnknownDiscriminantValue() {
            Statement otherwise = marker(13, 99);
            GExprBody<Statement> body = addFun(readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0)), intCase(IntegerTy.ISIZE, 1, marker(11, 1)),
                            intCase(IntegerTy.ISIZE, 7, marker(12, 7))),
                    otherwise));

            runPass();

            Switch.Match match = asMatch(body.getBody());
            assertThat(caseValues(match)).containsExactly(
                    list(VariantId.of(0)), list(VariantId.of(1)), Collections.<VariantId>emptyList());
            assertThat(match.getOtherwise()).isSameAs(otherwise);
            assertThat(ctx.getErrorCount()).isEqualTo(1);
        }
    }

    // ============ 序列 ============

    @Nested
    @DisplayName("后续语句")
    class Sequencing {

        @Test
        @DisplayName("switch 之后的语句接在 match 之后，match 的区间合并两条语句")
        void testTrailingStatementReattached() {
            Statement read = discriminantRead(1, ENUM3);
            Statement sw = switchOnTmp(2, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0))), marker(13, 99));
            Statement rest = st(5, RawStatement.RETURN);
            GExprBody<Statement> body = addFun(Statement.sequence(read, Statement.sequence(sw, rest)));

            runPass();

            Statement root = body.getBody();
            assertThat(root.getContent()).isInstanceOf(RawStatement.Sequence.class);
            RawStatement.Sequence seq = (RawStatement.Sequence) root.getContent();
            Switch.Match match = asMatch(seq.getFirst());
            assertThat(match.getOtherwise()).isNotNull();
            assertThat(seq.getFirst().getMeta()).isEqualTo(Meta.combine(meta(1), meta(2)));
            assertThat(seq.getNext()).isSameAs(rest);
        }

        @Test
        @DisplayName("序列中间的读取同样被改写")
        void testReadInsideLongerSequence() {
            Statement prefix = marker(1, 5);
            Statement read = discriminantRead(2, ENUM3);
            Statement sw = switchOnTmp(3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0)), intCase(IntegerTy.ISIZE, 1, marker(11, 1)),
                            intCase(IntegerTy.ISIZE, 2, marker(12, 2))),
                    marker(13, 99));
            Statement rest = st(5, RawStatement.RETURN);
            GExprBody<Statement> body = addFun(Statement.sequence(list(prefix, read, sw, rest)));

            runPass();

            RawStatement.Sequence outer = (RawStatement.Sequence) body.getBody().getContent();
            assertThat(outer.getFirst()).isSameAs(prefix);
            RawStatement.Sequence inner = (RawStatement.Sequence) outer.getNext().getContent();
            assertThat(asMatch(inner.getFirst()).getOtherwise()).isNull();
            assertThat(inner.getNext()).isSameAs(rest);
            assertThat(countDiscriminantReads(body.getBody())).isZero();
        }
    }

    // ============ 局部错误 ============

    @Nested
    @DisplayName("局部错误")
    class LocalErrors {

        @Test
        @DisplayName("后继不是 SwitchInt：整条语句置为 nop，其余读取照常改写")
        void testWrongSuccessorIsolated() {
            GExprBody<Statement> bad = addFun(Statement.sequence(discriminantRead(1, ENUM3),
                    Statement.sequence(st(2, RawStatement.breakOut(0)), st(3, RawStatement.RETURN))));
            GExprBody<Statement> good = addFun(readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0))), marker(13, 99)));

            runPass();

            assertThat(bad.getBody().getContent().isNop()).isTrue();
            asMatch(good.getBody());
            assertThat(ctx.getErrorCount()).isEqualTo(1);
            assertThat(ctx.hasErrors()).isTrue();
        }

        @Test
        @DisplayName("SwitchInt 位于两层序列之内视为形状错误")
        void testDeeperNestingIsError() {
            Statement sw = switchOnTmp(3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0))), marker(13, 99));
            Statement nested = st(2, RawStatement.sequence(st(2, RawStatement.sequence(marker(2, 1), sw)),
                    st(4, RawStatement.RETURN)));
            GExprBody<Statement> body = addFun(st(1, RawStatement.sequence(discriminantRead(1, ENUM3), nested)));

            runPass();

            assertThat(body.getBody().getContent().isNop()).isTrue();
            assertThat(ctx.getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("没有后继的读取")
        void testReadWithoutSuccessor() {
            GExprBody<Statement> body = addFun(discriminantRead(1, ENUM3));

            runPass();

            assertThat(body.getBody().getContent().isNop()).isTrue();
            assertThat(ctx.getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("switch 读取的不是判别值临时变量")
        void testSwitchOnOtherVariable() {
            Statement sw = st(2, RawStatement.switchOn(Switch.switchInt(
                    Operand.copy(Place.local(OTHER)), IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0))), marker(13, 99))));
            GExprBody<Statement> body = addFun(Statement.sequence(discriminantRead(1, ENUM3), sw));

            runPass();

            assertThat(body.getBody().getContent().isNop()).isTrue();
            assertThat(ctx.getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("被检查的类型不是枚举或不存在")
        void testNonEnumAndMissingType() {
            GExprBody<Statement> onStruct = addFun(readThenSwitch(1, STRUCT, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0))), marker(13, 99)));
            GExprBody<Statement> onMissing = addFun(readThenSwitch(1, MISSING, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0))), marker(13, 99)));

            runPass();

            assertThat(onStruct.getBody().getContent().isNop()).isTrue();
            assertThat(onMissing.getBody().getContent().isNop()).isTrue();
            assertThat(ctx.getErrorCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("严格模式下第一个错误即抛出")
        void testStrictModeThrows() {
            TransCtx strict = new TransCtx("strict", TranslateOptions.strict());
            registerDecls(strict);
            addFun(discriminantRead(1, ENUM3));

            assertThatThrownBy(() -> new RemoveReadDiscriminant().run(strict, funs, globals))
                    .isInstanceOf(TranslationException.class)
                    .hasMessageContaining("SwitchInt");
            assertThat(strict.getErrorCount()).isEqualTo(1);
        }
    }

    // ============ 遍历 ============

    @Nested
    @DisplayName("遍历与幂等")
    class Traversal {

        @Test
        @DisplayName("分支与循环内的嵌套读取都被改写")
        void testNestedOccurrences() {
            Statement inner = readThenSwitch(20, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(21, 0)), intCase(IntegerTy.ISIZE, 1, marker(22, 1)),
                            intCase(IntegerTy.ISIZE, 2, marker(23, 2))),
                    marker(24, 99));
            Statement inLoop = st(30, RawStatement.loop(readThenSwitch(31, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 1, st(32, RawStatement.breakOut(0)))),
                    st(33, RawStatement.continueLoop(0)))));
            GExprBody<Statement> body = addFun(readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, inner), intCase(IntegerTy.ISIZE, 1, inLoop)),
                    marker(13, 99)));

            runPass();

            Switch.Match outer = asMatch(body.getBody());
            asMatch(outer.getTargets().get(0).getBody());
            Statement loopBody = ((RawStatement.Loop) outer.getTargets().get(1).getBody().getContent()).getBody();
            assertThat(asMatch(loopBody).getOtherwise()).isNotNull();
            assertThat(countDiscriminantReads(body.getBody())).isZero();
        }

        @Test
        @DisplayName("全局量的函数体同样处理")
        void testGlobalBodies() {
            GExprBody<Statement> body = body(ENUM3, readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0))), marker(13, 99)));
            globals.put(GlobalDeclId.of(0), global(0, "G", body));

            runPass();

            asMatch(body.getBody());
        }

        @Test
        @DisplayName("运行两次与运行一次结果相同")
        void testIdempotent() {
            GExprBody<Statement> body = addFun(Statement.sequence(readThenSwitch(1, ENUM3, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(10, 0)), intCase(IntegerTy.ISIZE, 2, marker(11, 2))),
                    marker(13, 99)), st(20, RawStatement.RETURN)));

            runPass();
            String once = LlbcPrinter.print(body.getBody());
            int errors = ctx.getErrorCount();
            runPass();

            assertThat(LlbcPrinter.print(body.getBody())).isEqualTo(once);
            assertThat(ctx.getErrorCount()).isEqualTo(errors);
        }

        @Test
        @DisplayName("端到端：两变体枚举的读取与分派变为无 otherwise 的 match")
        void testEndToEndScenario() {
            TypeDeclId enumId = TypeDeclId.of(7);
            ctx.getTypeDecls().put(enumId, enumDecl(enumId, "AB", IntegerTy.ISIZE, 0, 1));
            Statement l1 = marker(10, 1);
            Statement l2 = marker(11, 2);
            Statement l3 = marker(12, 3);
            GExprBody<Statement> body = addFun(readThenSwitch(1, enumId, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, l1), intCase(IntegerTy.ISIZE, 1, l2)), l3));

            PassPipeline.createDefault().execute(ctx, funs, globals);

            Switch.Match match = asMatch(body.getBody());
            assertThat(caseValues(match)).containsExactly(list(VariantId.of(0)), list(VariantId.of(1)));
            assertThat(match.getTargets().get(0).getBody()).isSameAs(l1);
            assertThat(match.getTargets().get(1).getBody()).isSameAs(l2);
            assertThat(match.getOtherwise()).isNull();
            assertThat(countDiscriminantReads(body.getBody())).isZero();
            assertThat(LlbcPrinter.print(body.getBody())).startsWith("match @1 {").doesNotContain("_ =>");
            assertThat(ctx.hasErrors()).isFalse();
        }
    }
}
