package io.github.cyfko.docfilter.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MethodSignatures Tests")
class MethodSignaturesTest {

    @Test
    @DisplayName("Should recognize predicate methods by name and arity")
    void predicateMethods() throws NoSuchMethodException {
        Method containsKey = Map.class.getMethod("containsKey", Object.class);

        assertTrue(MethodSignatures.isPredicateMethod(containsKey, "containsKey", 1));
        assertFalse(MethodSignatures.isPredicateMethod(containsKey, "containsKey", 2));
        assertFalse(MethodSignatures.isPredicateMethod(containsKey, "containsValue", 1));
        assertFalse(MethodSignatures.isPredicateMethod(null, "containsKey", 1));
    }

    @Test
    @DisplayName("Should reject static methods")
    void rejectsStatic() throws NoSuchMethodException {
        Method isNull = Objects.class.getMethod("isNull", Object.class);

        assertFalse(MethodSignatures.isPredicateMethod(isNull, "isNull", 1));
    }

    @Test
    @DisplayName("Should recognize indexers")
    void indexers() throws NoSuchMethodException {
        assertTrue(MethodSignatures.isIndexerMethod(List.class.getMethod("get", int.class)));
        assertTrue(MethodSignatures.isIndexerMethod(Map.class.getMethod("get", Object.class)));
        assertFalse(MethodSignatures.isIndexerMethod(List.class.getMethod("size")));
    }

    @Test
    @DisplayName("Should check parameter types")
    void acceptsParameter() throws NoSuchMethodException {
        Method startsWith = String.class.getMethod("startsWith", String.class);

        assertTrue(MethodSignatures.acceptsParameter(startsWith, 0, String.class));
        assertFalse(MethodSignatures.acceptsParameter(startsWith, 0, Object.class));
        assertFalse(MethodSignatures.acceptsParameter(startsWith, 1, String.class));
    }
}
