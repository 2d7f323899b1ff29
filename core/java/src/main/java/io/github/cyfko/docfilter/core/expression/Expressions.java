package io.github.cyfko.docfilter.core.expression;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static factory methods for building predicate expression trees.
 * <p>
 * The factory mirrors what an embedded query DSL captures from source code, so that a predicate
 * such as {@code x -> x.tags.containsKey("red") && x.age > 18} is written as:
 * </p>
 * <pre>{@code
 * ParameterExpression x = Expressions.parameter("x", Person.class);
 * Expression tags = Expressions.member(x, "tags", Map.class);
 * Expression age = Expressions.member(x, "age", int.class);
 *
 * LambdaExpression predicate = Expressions.lambda(
 *     Expressions.and(
 *         Expressions.call(tags, "containsKey", Expressions.constant("red")),
 *         Expressions.greaterThan(age, Expressions.constant(18))),
 *     x);
 * }</pre>
 *
 * <p>Method calls are resolved reflectively against the static type of the receiver (or the
 * given declaring type for static calls). Resolution picks the most specific public method whose
 * name, arity and parameter types accept the arguments; a lambda argument is accepted by any
 * interface-typed parameter.</p>
 *
 * @since 1.0.0
 */
public final class Expressions {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class
    );

    private Expressions() {
        // Prevent instantiation
    }

    public static ParameterExpression parameter(String name, Class<?> type) {
        return new ParameterExpression(name, type);
    }

    /**
     * Creates a constant whose type is the runtime class of the value ({@link Object} for {@code null}).
     *
     * @param value the constant value
     * @return the constant expression
     */
    public static ConstantExpression constant(Object value) {
        return new ConstantExpression(value, value == null ? Object.class : value.getClass());
    }

    public static ConstantExpression constant(Object value, Class<?> type) {
        return new ConstantExpression(value, type);
    }

    public static MemberExpression member(Expression target, String memberName, Class<?> type) {
        return new MemberExpression(target, memberName, type);
    }

    public static IndexExpression index(Expression target, Expression index, Class<?> elementType) {
        return new IndexExpression(target, index, elementType);
    }

    /**
     * Creates an instance method call, resolving the method on the static type of the target.
     *
     * @param target     the receiver
     * @param methodName the method name
     * @param arguments  the arguments
     * @return the method call expression
     * @throws IllegalArgumentException if no unique public method accepts the arguments
     */
    public static MethodCallExpression call(Expression target, String methodName, Expression... arguments) {
        Objects.requireNonNull(target, "Target cannot be null");
        Method method = findMethod(target.type(), methodName, false, arguments);
        return new MethodCallExpression(target, method, Arrays.asList(arguments));
    }

    public static MethodCallExpression call(Expression target, Method method, Expression... arguments) {
        return new MethodCallExpression(target, method, Arrays.asList(arguments));
    }

    /**
     * Creates a static method call.
     *
     * @param declaringType the class declaring the method
     * @param methodName    the method name
     * @param arguments     the arguments
     * @return the method call expression
     * @throws IllegalArgumentException if no unique public static method accepts the arguments
     */
    public static MethodCallExpression callStatic(Class<?> declaringType, String methodName, Expression... arguments) {
        Method method = findMethod(declaringType, methodName, true, arguments);
        return new MethodCallExpression(null, method, Arrays.asList(arguments));
    }

    public static LambdaExpression lambda(Expression body, ParameterExpression... parameters) {
        return new LambdaExpression(Arrays.asList(parameters), body);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(UnaryExpression.Operator.NOT, operand);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.AND, left, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.OR, left, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.EQUAL, left, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.NOT_EQUAL, left, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.LESS_THAN, left, right);
    }

    public static BinaryExpression lessThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.LESS_THAN_OR_EQUAL, left, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.GREATER_THAN, left, right);
    }

    public static BinaryExpression greaterThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(BinaryExpression.Operator.GREATER_THAN_OR_EQUAL, left, right);
    }

    /**
     * Returns the wrapper class of a primitive type, or the type itself.
     *
     * @param type any type
     * @return the boxed equivalent of {@code type}
     */
    public static Class<?> box(Class<?> type) {
        return type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    private static Method findMethod(Class<?> declaringType, String name, boolean wantStatic, Expression[] arguments) {
        Objects.requireNonNull(declaringType, "Declaring type cannot be null");
        Objects.requireNonNull(name, "Method name cannot be null");

        List<Method> candidates = new ArrayList<>();
        collectApplicable(declaringType.getMethods(), name, wantStatic, arguments, candidates);
        if (declaringType.isInterface()) {
            collectApplicable(Object.class.getMethods(), name, wantStatic, arguments, candidates);
        }

        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No public " + (wantStatic ? "static " : "") + "method "
                    + declaringType.getName() + "." + name + " accepts " + arguments.length + " argument(s)");
        }

        for (Method candidate : candidates) {
            boolean mostSpecific = candidates.stream()
                    .allMatch(other -> other == candidate || isAtLeastAsSpecific(candidate, other));
            if (mostSpecific) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Ambiguous method " + declaringType.getName() + "." + name
                + ": " + candidates.size() + " candidates");
    }

    private static void collectApplicable(Method[] methods, String name, boolean wantStatic,
                                          Expression[] arguments, List<Method> sink) {
        for (Method method : methods) {
            if (!method.getName().equals(name)
                    || Modifier.isStatic(method.getModifiers()) != wantStatic
                    || method.getParameterCount() != arguments.length
                    || method.isBridge()) {
                continue;
            }
            if (accepts(method.getParameterTypes(), arguments)
                    && sink.stream().noneMatch(m -> Arrays.equals(m.getParameterTypes(), method.getParameterTypes()))) {
                sink.add(method);
            }
        }
    }

    private static boolean accepts(Class<?>[] parameterTypes, Expression[] arguments) {
        for (int i = 0; i < parameterTypes.length; i++) {
            Expression argument = Objects.requireNonNull(arguments[i], "Argument cannot be null");
            if (argument instanceof LambdaExpression) {
                if (!parameterTypes[i].isInterface()) return false;
                continue;
            }
            if (!box(parameterTypes[i]).isAssignableFrom(box(argument.type()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAtLeastAsSpecific(Method candidate, Method other) {
        Class<?>[] mine = candidate.getParameterTypes();
        Class<?>[] theirs = other.getParameterTypes();
        for (int i = 0; i < mine.length; i++) {
            if (!box(theirs[i]).isAssignableFrom(box(mine[i]))) {
                return false;
            }
        }
        return true;
    }
}
