package com.mirlift.ir.llbc;

import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.ir.expr.Rvalue;
import com.mirlift.ir.expr.Var;
import com.mirlift.ir.gast.GExprBody;
import com.mirlift.types.ErasedRegion;
import com.mirlift.types.IntegerTy;
import com.mirlift.types.Ty;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.id.VariantId;
import com.mirlift.types.meta.Loc;
import com.mirlift.types.meta.Meta;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.mirlift.ir.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("结构化语句测试")
class StatementTest {

    private static final TypeDeclId ENUM = TypeDeclId.of(0);

    // ============ 序列构造 ============

    @Nested
    @DisplayName("序列")
    class Sequences {

        @Test
        @DisplayName("左侧为序列时重新右嵌套")
        void testRightNesting() {
            Statement a = marker(1, 1);
            Statement b = marker(2, 2);
            Statement c = marker(3, 3);

            Statement seq = Statement.sequence(Statement.sequence(a, b), c);

            RawStatement.Sequence outer = (RawStatement.Sequence) seq.getContent();
            assertThat(outer.getFirst()).isSameAs(a);
            RawStatement.Sequence inner = (RawStatement.Sequence) outer.getNext().getContent();
            assertThat(inner.getFirst()).isSameAs(b);
            assertThat(inner.getNext()).isSameAs(c);
        }

        @Test
        @DisplayName("序列的区间覆盖所有语句")
        void testMetaCombined() {
            Statement seq = Statement.sequence(list(marker(1, 1), marker(2, 2), marker(5, 3)));

            Meta meta = seq.getMeta();
            assertThat(meta.getSpan().getBeg()).isEqualTo(new Loc(1, 0));
            assertThat(meta.getSpan().getEnd()).isEqualTo(new Loc(5, 20));
            assertThat(meta).isEqualTo(Meta.combine(meta(1), meta(5)));
        }

        @Test
        @DisplayName("空列表不能连接")
        void testEmptyList() {
            assertThatThrownBy(() -> Statement.sequence(Collections.<Statement>emptyList()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("nop 语句")
        void testNop() {
            assertThat(Statement.nop(meta(1)).getContent().isNop()).isTrue();
            assertThat(marker(1, 0).getContent().isNop()).isFalse();
        }
    }

    // ============ 打印 ============

    @Nested
    @DisplayName("文本形式")
    class Printing {

        @Test
        @DisplayName("match 与循环按层缩进")
        void testPrintMatch() {
            Statement match = st(1, RawStatement.switchOn(Switch.match(Place.local(SCRUTINEE),
                    list(new SwitchCase<>(list(VariantId.of(0), VariantId.of(2)), st(2, RawStatement.RETURN)),
                            new SwitchCase<>(list(VariantId.of(1)),
                                    st(3, RawStatement.loop(st(4, RawStatement.breakOut(0)))))),
                    null)));

            assertThat(LlbcPrinter.print(match)).isEqualTo(
                    "match @1 {\n"
                            + "    Variant@0 | Variant@2 => {\n"
                            + "        return\n"
                            + "    }\n"
                            + "    Variant@1 => {\n"
                            + "        loop {\n"
                            + "            break 0\n"
                            + "        }\n"
                            + "    }\n"
                            + "}");
        }

        @Test
        @DisplayName("switch 带 otherwise 分支")
        void testPrintSwitchInt() {
            String text = LlbcPrinter.print(readThenSwitch(1, ENUM, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, st(3, RawStatement.PANIC))), st(4, RawStatement.NOP)));

            assertThat(text).startsWith("@2 := discriminant(@1)\nswitch move @2 {\n");
            assertThat(text).contains("        panic\n").contains("    _ => {\n        nop\n    }\n");
        }

        @Test
        @DisplayName("函数体先列出局部变量")
        void testPrintBody() {
            String text = LlbcPrinter.print(body(ENUM, st(1, RawStatement.RETURN)));

            assertThat(text).startsWith("let @0: ").contains("let x@1: ").endsWith("\n\nreturn");
        }
    }

    // ============ 可变遍历 ============

    /** 把 i32 改写为 i64 */
    private static final class WidenI32 extends MutTypeVisitor {
        @Override
        public Ty<ErasedRegion> transformTy(Ty<ErasedRegion> ty) {
            if (ty.equals(Ty.<ErasedRegion>integer(IntegerTy.I32))) {
                return Ty.integer(IntegerTy.I64);
            }
            return super.transformTy(ty);
        }
    }

    @Nested
    @DisplayName("可变遍历")
    class Visiting {

        @Test
        @DisplayName("改写常量与局部变量的类型，未变化的语句保持原内容对象")
        void testRewriteTypes() {
            Statement changed = marker(2, 7);
            Statement untouched = st(3, RawStatement.drop(Place.local(TMP)));
            RawStatement untouchedContent = untouched.getContent();
            GExprBody<Statement> body = body(ENUM, st(1, RawStatement.loop(Statement.sequence(changed, untouched))));

            new MutAstVisitor(new WidenI32()) {
            }.visitBody(body);

            Var other = body.getLocals().get(OTHER);
            assertThat(other.getTy()).isEqualTo(Ty.<ErasedRegion>integer(IntegerTy.I64));
            assertThat(body.getLocals().get(TMP).getTy()).isEqualTo(Ty.<ErasedRegion>integer(IntegerTy.ISIZE));

            RawStatement.Assign assign = (RawStatement.Assign) changed.getContent();
            Operand.Const constant = (Operand.Const) ((Rvalue.Use) assign.getValue()).getOperand();
            assertThat(constant.getTy()).isEqualTo(Ty.<ErasedRegion>integer(IntegerTy.I64));
            assertThat(untouched.getContent()).isSameAs(untouchedContent);
        }

        @Test
        @DisplayName("默认遍历不改变任何内容")
        void testIdentityVisitor() {
            Statement st = readThenSwitch(1, ENUM, IntegerTy.ISIZE,
                    list(intCase(IntegerTy.ISIZE, 0, marker(3, 0))), marker(4, 1));
            RawStatement.Sequence seq = (RawStatement.Sequence) st.getContent();
            RawStatement readContent = seq.getFirst().getContent();
            RawStatement switchContent = seq.getNext().getContent();

            new MutAstVisitor() {
            }.visitStatement(st);

            assertThat(seq.getFirst().getContent()).isSameAs(readContent);
            assertThat(seq.getNext().getContent()).isSameAs(switchContent);
        }
    }
}
