package com.mirlift.types.names;

import com.mirlift.types.GenericArgs;
import com.mirlift.types.GenericParams;
import com.mirlift.types.Predicates;
import com.mirlift.types.Region;
import com.mirlift.types.Ty;
import com.mirlift.types.id.Disambiguator;
import com.mirlift.types.id.TypeDeclId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Name 测试")
class NameTest {

    @Test
    @DisplayName("按 :: 连接路径段")
    void testToString() {
        assertThat(Name.of("core", "option", "Option").toString()).isEqualTo("core::option::Option");
        assertThat(Name.parse("a::b")).isEqualTo(Name.of("a", "b"));
    }

    @Test
    @DisplayName("impl 段带 disambiguator")
    void testImplElem() {
        ImplElem impl = new ImplElem(Disambiguator.of(1), GenericParams.empty(), Predicates.empty(),
                ImplElemKind.ty(Ty.<Region>adt(TypeDeclId.of(0), GenericArgs.<Region>empty())));
        Name name = Name.of("crate", "List").append(PathElem.impl(impl)).append(PathElem.ident("new"));

        assertThat(name.length()).isEqualTo(4);
        assertThat(name.toString()).startsWith("crate::List::{impl ").endsWith("#1}::new");
        assertThat(name.equalsIdents("crate", "List", "impl", "new")).isFalse();
    }

    @Test
    @DisplayName("标识符路径匹配")
    void testEqualsIdents() {
        Name name = Name.of("crate", "E");
        assertThat(name.equalsIdents("crate", "E")).isTrue();
        assertThat(name.equalsIdents("crate")).isFalse();
        assertThat(PathElem.ident("f", Disambiguator.of(2)).toString()).isEqualTo("f#2");
    }
}
