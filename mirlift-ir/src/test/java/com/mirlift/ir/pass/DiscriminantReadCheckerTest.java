package com.mirlift.ir.pass;

import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.ir.llbc.Statement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.IntegerTy;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.TypeDeclId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.mirlift.ir.IrFixtures.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("DiscriminantReadChecker 测试")
class DiscriminantReadCheckerTest {

    private static final TypeDeclId ENUM = TypeDeclId.of(0);

    private TransCtx ctx;
    private IdMap<FunDeclId, GFunDecl<Statement>> funs;
    private IdMap<GlobalDeclId, GGlobalDecl<Statement>> globals;

    @BeforeEach
    void setUp() {
        ctx = new TransCtx("test");
        ctx.getTypeDecls().put(ENUM, enumDecl(ENUM, "E", IntegerTy.ISIZE, 0, 1));
        funs = new IdMap<>();
        globals = new IdMap<>();
    }

    @Test
    @DisplayName("折叠之后检查通过")
    void testPassesAfterNormalization() {
        funs.put(FunDeclId.of(0), fun(0, "f", body(ENUM, readThenSwitch(1, ENUM, IntegerTy.ISIZE,
                list(intCase(IntegerTy.ISIZE, 0, marker(10, 0)), intCase(IntegerTy.ISIZE, 1, marker(11, 1))),
                marker(12, 2)))));

        new RemoveReadDiscriminant().run(ctx, funs, globals);

        assertThatCode(() -> new DiscriminantReadChecker().run(ctx, funs, globals)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("残留的判别值读取直接抛出内部错误")
    void testLeftoverReadThrows() {
        globals.put(GlobalDeclId.of(0), global(0, "G", body(ENUM,
                Statement.sequence(marker(1, 0), discriminantRead(2, ENUM)))));

        assertThatThrownBy(() -> new DiscriminantReadChecker().run(ctx, funs, globals))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unexpected discriminant read")
                .hasMessageContaining("@2 := ");
        assertThat(ctx.getErrorCount()).isZero();
    }
}
