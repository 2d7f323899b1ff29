package io.github.cyfko.docfilter.core.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Expressions Tests")
class ExpressionsTest {

    private static final ParameterExpression X = Expressions.parameter("x", Object.class);

    // ==================== Method resolution ====================

    @Nested
    @DisplayName("Method resolution")
    class MethodResolution {

        @Test
        @DisplayName("Should resolve an interface method on the static receiver type")
        void resolvesInterfaceMethod() throws NoSuchMethodException {
            Expression tags = Expressions.member(X, "tags", Map.class);

            MethodCallExpression call = Expressions.call(tags, "containsKey", Expressions.constant("red"));

            assertEquals(Map.class.getMethod("containsKey", Object.class), call.method());
            assertEquals(boolean.class, call.type());
        }

        @Test
        @DisplayName("Should pick the overload matching the arity")
        void resolvesByArity() {
            Expression name = Expressions.member(X, "name", String.class);

            MethodCallExpression call = Expressions.call(name, "startsWith", Expressions.constant("a"));

            assertEquals(1, call.method().getParameterCount());
        }

        @Test
        @DisplayName("Should resolve Object methods on interfaces")
        void resolvesObjectMethodsOnInterfaces() {
            Expression labels = Expressions.member(X, "labels", List.class);

            MethodCallExpression call = Expressions.call(labels, "equals", Expressions.constant(List.of()));

            assertEquals("equals", call.method().getName());
        }

        @Test
        @DisplayName("Should accept a lambda for an interface-typed parameter")
        void acceptsLambdaArgument() {
            ParameterExpression s = Expressions.parameter("s", String.class);
            Expression labels = Expressions.member(X, "labels", List.class);
            Expression stream = Expressions.call(labels, "stream");

            MethodCallExpression call = Expressions.call(stream, "anyMatch",
                    Expressions.lambda(Expressions.constant(true), s));

            assertEquals("anyMatch", call.method().getName());
        }

        @Test
        @DisplayName("Should resolve static methods without a receiver")
        void resolvesStaticMethod() {
            MethodCallExpression call = Expressions.callStatic(Math.class, "abs", Expressions.constant(1));

            assertNull(call.target());
            assertEquals(int.class, call.method().getParameterTypes()[0]);
        }

        @Test
        @DisplayName("Should fail when no method accepts the arguments")
        void failsWithoutCandidate() {
            Expression tags = Expressions.member(X, "tags", Map.class);

            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> Expressions.call(tags, "containsKey"));
            assertTrue(exception.getMessage().contains("containsKey"));
        }
    }

    // ==================== Validation ====================

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should reject a call with the wrong number of arguments")
        void rejectsWrongArity() throws NoSuchMethodException {
            Method contains = Collection.class.getMethod("contains", Object.class);
            Expression labels = Expressions.member(X, "labels", List.class);

            assertThrows(IllegalArgumentException.class, () -> Expressions.call(labels, contains));
        }

        @Test
        @DisplayName("Should reject an instance call without a receiver")
        void rejectsMissingTarget() throws NoSuchMethodException {
            Method contains = Collection.class.getMethod("contains", Object.class);

            assertThrows(IllegalArgumentException.class,
                    () -> Expressions.call(null, contains, Expressions.constant("a")));
        }

        @Test
        @DisplayName("Should reject a constant not assignable to its declared type")
        void rejectsMistypedConstant() {
            assertThrows(IllegalArgumentException.class, () -> Expressions.constant("a", Integer.class));
        }

        @Test
        @DisplayName("Should reject logical operators over non-boolean operands")
        void rejectsNonBooleanLogicalOperands() {
            assertThrows(IllegalArgumentException.class,
                    () -> Expressions.and(Expressions.constant(1), Expressions.constant(true)));
        }

        @Test
        @DisplayName("Should box primitive types only")
        void boxes() {
            assertEquals(Integer.class, Expressions.box(int.class));
            assertEquals(String.class, Expressions.box(String.class));
        }
    }
}
