package io.github.cyfko.docfilter.core.utils;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

/**
 * Structural predicates over reflected method signatures.
 * <p>
 * Translators claim method calls by shape (name, arity, staticness, visibility, return type)
 * rather than by declaring class, so that any mapping implementation exposing
 * {@code boolean containsKey(Object)} is recognized, not only {@link java.util.Map}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MethodSignatures {

    private MethodSignatures() {
        // Prevent instantiation
    }

    /**
     * Checks for a public, non-static method with the given name, return type and arity.
     *
     * @param method     the method to test
     * @param name       the expected name
     * @param returnType the expected return type ({@code boolean.class} for predicates)
     * @param arity      the expected number of parameters
     * @return {@code true} if the method has this shape
     */
    public static boolean isInstanceMethod(Method method, String name, Class<?> returnType, int arity) {
        return method != null
                && !Modifier.isStatic(method.getModifiers())
                && Modifier.isPublic(method.getModifiers())
                && method.getReturnType() == returnType
                && method.getName().equals(name)
                && method.getParameterCount() == arity;
    }

    /**
     * Checks for a public, non-static, boolean-returning method with the given name and arity.
     *
     * @param method the method to test
     * @param name   the expected name
     * @param arity  the expected number of parameters
     * @return {@code true} if the method is such a predicate
     */
    public static boolean isPredicateMethod(Method method, String name, int arity) {
        return isInstanceMethod(method, name, boolean.class, arity);
    }

    /**
     * Checks for the Java-native indexer shape: public, non-static {@code get} with one parameter,
     * as in {@code List.get(int)} and {@code Map.get(Object)}.
     *
     * @param method the method to test
     * @return {@code true} if the method reads an element by index or key
     */
    public static boolean isIndexerMethod(Method method) {
        return method != null
                && !Modifier.isStatic(method.getModifiers())
                && Modifier.isPublic(method.getModifiers())
                && method.getReturnType() != void.class
                && method.getName().equals("get")
                && method.getParameterCount() == 1;
    }

    /**
     * Checks whether a parameter type of the method is assignable from the given type.
     *
     * @param method   the method
     * @param index    the parameter position
     * @param expected the type that must be accepted
     * @return {@code true} if the parameter accepts {@code expected}
     */
    public static boolean acceptsParameter(Method method, int index, Class<?> expected) {
        return index < method.getParameterCount() && method.getParameterTypes()[index].isAssignableFrom(expected);
    }
}
