package com.mirlift.types.meta;

import com.mirlift.types.id.FileId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetaTest {

    private static Span span(int file, int l0, int c0, int l1, int c1) {
        return new Span(FileId.of(file), new Loc(l0, c0), new Loc(l1, c1));
    }

    @Test
    @DisplayName("同文件区间合并为最小覆盖区间")
    void testCombineSameFile() {
        Meta a = new Meta(span(0, 3, 4, 3, 20));
        Meta b = new Meta(span(0, 2, 0, 3, 10));
        Meta c = Meta.combine(a, b);
        assertEquals(span(0, 2, 0, 3, 20), c.getSpan());
        assertNull(c.getGeneratedFromSpan());
    }

    @Test
    @DisplayName("不同文件保留第一个区间")
    void testCombineDifferentFiles() {
        Meta a = new Meta(span(0, 1, 0, 1, 5));
        Meta b = new Meta(span(1, 9, 0, 9, 5));
        assertEquals(a.getSpan(), Meta.combine(a, b).getSpan());
    }

    @Test
    @DisplayName("生成来源区间只有一侧时取该侧")
    void testCombineGenerated() {
        Span gen = span(0, 10, 0, 10, 8);
        Meta a = new Meta(span(0, 1, 0, 1, 5), null);
        Meta b = new Meta(span(0, 2, 0, 2, 5), gen);
        assertEquals(gen, Meta.combine(a, b).getGeneratedFromSpan());
    }
}
