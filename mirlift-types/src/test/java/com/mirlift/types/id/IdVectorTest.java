package com.mirlift.types.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("id 层测试")
class IdVectorTest {

    @Nested
    @DisplayName("IndexId")
    class IndexIdTests {

        @Test
        @DisplayName("不同种类的同号 id 不相等")
        void testKindsNeverEqual() {
            assertThat((Object) TypeDeclId.of(3)).isNotEqualTo(FunDeclId.of(3));
            assertThat(TypeDeclId.of(3)).isEqualTo(TypeDeclId.of(3));
        }

        @Test
        @DisplayName("同种类按下标排序")
        void testOrdering() {
            assertThat(VariantId.of(1)).isLessThan(VariantId.of(2));
            assertThat(VariantId.of(5).compareTo(VariantId.of(5))).isZero();
        }

        @Test
        @DisplayName("toString 形如 Kind@n")
        void testToString() {
            assertThat(BlockId.of(4).toString()).isEqualTo("Block@4");
            assertThat(TypeDeclId.of(7).toString()).isEqualTo("TypeDecl@7");
        }

        @Test
        @DisplayName("负数下标被拒绝")
        void testNegative() {
            assertThatThrownBy(() -> VarId.of(-1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("IdGenerator")
    class GeneratorTests {

        @Test
        @DisplayName("依次分配稠密 id")
        void testDense() {
            IdGenerator<VarId> gen = new IdGenerator<>(VarId.FACTORY);
            assertThat(gen.fresh()).isEqualTo(VarId.of(0));
            assertThat(gen.fresh()).isEqualTo(VarId.of(1));
            assertThat(gen.fresh()).isEqualTo(VarId.of(2));
            assertThat(gen.peekIndex()).isEqualTo(3);
        }

        @Test
        @DisplayName("可从指定下标开始")
        void testStart() {
            IdGenerator<BlockId> gen = new IdGenerator<>(BlockId.FACTORY, 10);
            assertThat(gen.fresh().getIndex()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("IdVector")
    class VectorTests {

        @Test
        @DisplayName("push 返回插入位置的 id")
        void testPush() {
            IdVector<FieldId, String> vec = IdVector.empty(FieldId.FACTORY);
            FieldId a = vec.push("a");
            FieldId b = vec.push("b");
            assertThat(a).isEqualTo(FieldId.of(0));
            assertThat(b).isEqualTo(FieldId.of(1));
            assertThat(vec.get(b)).isEqualTo("b");
            assertThat(vec.nextId()).isEqualTo(FieldId.of(2));
        }

        @Test
        @DisplayName("越界 get 返回 null，越界 set 抛异常")
        void testOutOfRange() {
            IdVector<FieldId, String> vec = IdVector.of(FieldId.FACTORY, "x");
            assertThat(vec.get(FieldId.of(5))).isNull();
            assertThat(vec.contains(FieldId.of(0))).isTrue();
            assertThat(vec.contains(FieldId.of(1))).isFalse();
            assertThatThrownBy(() -> vec.set(FieldId.of(1), "y"))
                    .isInstanceOf(IndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("ids 与 entries 按 id 顺序")
        void testIteration() {
            IdVector<VariantId, String> vec = IdVector.of(VariantId.FACTORY, "A", "B", "C");
            assertThat(vec.ids()).containsExactly(VariantId.of(0), VariantId.of(1), VariantId.of(2));
            assertThat(vec.entries().get(2).getKey()).isEqualTo(VariantId.of(2));
            assertThat(vec.entries().get(2).getValue()).isEqualTo("C");
            assertThat(vec).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("values 不可修改")
        void testValuesUnmodifiable() {
            IdVector<VariantId, String> vec = IdVector.of(VariantId.FACTORY, "A");
            assertThatThrownBy(() -> vec.values().add("B"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("相等按元素比较")
        void testEquality() {
            IdVector<VariantId, String> a = new IdVector<>(VariantId.FACTORY, Arrays.asList("A", "B"));
            IdVector<VariantId, String> b = IdVector.of(VariantId.FACTORY, "A", "B");
            assertThat(a).isEqualTo(b);
            assertThat(a.hashCode()).isEqualTo(b.hashCode());
        }
    }

    @Nested
    @DisplayName("IdMap")
    class MapTests {

        @Test
        @DisplayName("按 id 顺序迭代，允许缺口")
        void testSortedWithGaps() {
            IdMap<FunDeclId, String> map = new IdMap<>();
            map.put(FunDeclId.of(5), "five");
            map.put(FunDeclId.of(0), "zero");
            map.put(FunDeclId.of(2), "two");

            assertThat(map.ids()).containsExactly(FunDeclId.of(0), FunDeclId.of(2), FunDeclId.of(5));
            assertThat(map.values()).containsExactly("zero", "two", "five");
            assertThat(map.get(FunDeclId.of(1))).isNull();
            assertThat(map.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("remove 之后不再包含")
        void testRemove() {
            IdMap<FunDeclId, String> map = new IdMap<>();
            map.put(FunDeclId.of(1), "one");
            assertThat(map.remove(FunDeclId.of(1))).isEqualTo("one");
            assertThat(map.containsKey(FunDeclId.of(1))).isFalse();
            assertThat(map.isEmpty()).isTrue();
        }
    }
}
