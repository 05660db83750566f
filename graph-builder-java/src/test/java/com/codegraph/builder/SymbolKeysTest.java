package com.codegraph.builder;

import com.codegraph.builder.java_analysis.SymbolKeys;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolKeysTest {

    @Test
    void typeKey() {
        assertEquals("java::com.shop.UserService", SymbolKeys.forType("com.shop.UserService"));
    }

    @Test
    void methodKeyWithoutParameters() {
        assertEquals("java::com.shop.User::getId()", SymbolKeys.forMethod("com.shop.User", "getId", List.of()));
    }

    @Test
    void parameterTypesAreErasedAndUnqualified() {
        String key = SymbolKeys.forMethod("com.shop.Repo", "saveAll",
            List.of("java.util.Map<String, java.util.List<Integer>>", "com.shop.User", "int"));
        assertEquals("java::com.shop.Repo::saveAll(Map, User, int)", key);
    }

    @Test
    void varargsBecomeArrays() {
        assertEquals("java::a.B::log(String, Object[])",
            SymbolKeys.forMethod("a.B", "log", List.of("String", "Object...")));
    }

    @Test
    void nestedTypesKeepTheirOuterName() {
        assertEquals("java::a.B::take(Outer.Inner)",
            SymbolKeys.forMethod("a.B", "take", List.of("com.x.Outer.Inner")));
    }

    @Test
    void constructorKey() {
        assertEquals("java::com.shop.User::<init>(String, int, boolean)",
            SymbolKeys.forMethod("com.shop.User", SymbolKeys.CONSTRUCTOR, List.of("String", "int", "boolean")));
    }
}
