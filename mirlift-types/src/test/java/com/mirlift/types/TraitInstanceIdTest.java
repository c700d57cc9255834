package com.mirlift.types;

import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.TraitClauseId;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.id.TraitImplId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TraitInstanceId 测试")
class TraitInstanceIdTest {

    @Test
    @DisplayName("按变体顺序排序，局部子句在 Self 之前")
    void testVariantOrder() {
        TraitInstanceId self = TraitInstanceId.SELF;
        TraitInstanceId clause = TraitInstanceId.clause(TraitClauseId.of(3));
        TraitInstanceId impl = TraitInstanceId.traitImpl(TraitImplId.of(9));
        TraitInstanceId unknown = TraitInstanceId.unknown("oops");
        TraitInstanceId unsolved = TraitInstanceId.unsolved(TraitDeclId.of(0), GenericArgs.<Region>empty());

        List<TraitInstanceId> ids = new ArrayList<>(Arrays.asList(unknown, self, unsolved, clause, impl));
        Collections.sort(ids);

        assertThat(ids).containsExactly(impl, clause, self, unsolved, unknown);
    }

    @Test
    @DisplayName("同变体内按字段排序")
    void testSameVariantOrder() {
        TraitInstanceId c0 = TraitInstanceId.clause(TraitClauseId.of(0));
        TraitInstanceId c1 = TraitInstanceId.clause(TraitClauseId.of(1));
        assertThat(c0).isLessThan(c1);

        TraitInstanceId p0 = TraitInstanceId.parentClause(c0, TraitDeclId.of(2), TraitClauseId.of(1));
        TraitInstanceId p1 = TraitInstanceId.parentClause(c1, TraitDeclId.of(0), TraitClauseId.of(0));
        assertThat(p0).isLessThan(p1);
        assertThat(p0.compareTo(TraitInstanceId.parentClause(c0, TraitDeclId.of(2), TraitClauseId.of(1))))
                .isZero();
    }

    @Test
    @DisplayName("文本相同但结构不同的见证不会被有序集合合并")
    void testSameTextDifferentStructure() {
        TraitInstanceId plain = unsolvedWithRef(GenericArgs.<Region>empty());
        TraitInstanceId withBool = unsolvedWithRef(
                GenericArgs.ofTypes(Collections.singletonList(Ty.<Region>bool())));

        assertThat(plain.toString()).isEqualTo(withBool.toString());
        assertThat(plain).isNotEqualTo(withBool);
        assertThat(plain.compareTo(withBool)).isNegative();
        assertThat(withBool.compareTo(plain)).isPositive();
        assertThat(plain.compareTo(unsolvedWithRef(GenericArgs.<Region>empty()))).isZero();
        assertThat(new TreeSet<>(Arrays.asList(plain, withBool))).hasSize(2);
    }

    /** 带一个 trait 引用的 Unsolved；toString 不打印引用自身的泛型实参 */
    private static TraitInstanceId unsolvedWithRef(GenericArgs<Region> refGenerics) {
        TraitDeclRef<Region> declRef = new TraitDeclRef<>(TraitDeclId.of(1), refGenerics);
        TraitRef<Region> ref = new TraitRef<>(TraitInstanceId.clause(TraitClauseId.of(0)), refGenerics, declRef);
        GenericArgs<Region> generics = new GenericArgs<>(Collections.<Region>emptyList(),
                Collections.<Ty<Region>>emptyList(), Collections.<ConstGeneric>emptyList(),
                Collections.singletonList(ref));
        return TraitInstanceId.unsolved(TraitDeclId.of(0), generics);
    }

    @Test
    @DisplayName("嵌套路径相等性")
    void testNestedEquality() {
        TraitInstanceId base = TraitInstanceId.clause(TraitClauseId.of(0));
        TraitInstanceId a = TraitInstanceId.itemClause(base, TraitDeclId.of(1), "W", TraitClauseId.of(1));
        TraitInstanceId b = TraitInstanceId.itemClause(base, TraitDeclId.of(1), "W", TraitClauseId.of(1));
        TraitInstanceId c = TraitInstanceId.itemClause(base, TraitDeclId.of(1), "V", TraitClauseId.of(1));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
        assertThat(a.fields()).hasSize(4);
    }

    @Test
    @DisplayName("访问者分派到对应变体")
    void testVisitor() {
        TraitInstanceId closure = TraitInstanceId.closure(FunDeclId.of(4), GenericArgs.<ErasedRegion>empty());
        String name = closure.accept(new NameVisitor());
        assertThat(name).isEqualTo("closure");
        assertThat(TraitInstanceId.SELF.accept(new NameVisitor())).isEqualTo("self");
    }

    private static final class NameVisitor implements TraitInstanceIdVisitor<String> {
        @Override public String visitTraitImpl(TraitInstanceId.TraitImpl id) { return "impl"; }
        @Override public String visitBuiltinOrAuto(TraitInstanceId.BuiltinOrAuto id) { return "builtin"; }
        @Override public String visitClause(TraitInstanceId.Clause id) { return "clause"; }
        @Override public String visitParentClause(TraitInstanceId.ParentClause id) { return "parent"; }
        @Override public String visitItemClause(TraitInstanceId.ItemClause id) { return "item"; }
        @Override public String visitFnPointer(TraitInstanceId.FnPointer id) { return "fn"; }
        @Override public String visitClosure(TraitInstanceId.Closure id) { return "closure"; }
        @Override public String visitSelf(TraitInstanceId.SelfId id) { return "self"; }
        @Override public String visitUnsolved(TraitInstanceId.Unsolved id) { return "unsolved"; }
        @Override public String visitUnknown(TraitInstanceId.Unknown id) { return "unknown"; }
    }
}
