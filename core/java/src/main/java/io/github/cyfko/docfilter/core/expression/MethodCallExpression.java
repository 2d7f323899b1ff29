package io.github.cyfko.docfilter.core.expression;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Objects;

/**
 * Invocation of a method, either on a target ({@code target.method(args)}) or statically
 * ({@code Type.method(args)}, in which case {@link #target()} is {@code null}).
 * <p>
 * The reflected {@link Method} is kept so that translators can match calls structurally: by name,
 * arity, staticness, visibility and return type, independently of the concrete receiver class.
 * </p>
 *
 * @param target    the receiver, or {@code null} for a static method
 * @param method    the invoked method
 * @param arguments the argument expressions, in declaration order
 * @since 1.0.0
 */
public record MethodCallExpression(Expression target, Method method, List<Expression> arguments)
        implements Expression {

    public MethodCallExpression {
        Objects.requireNonNull(method, "Method cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        arguments = List.copyOf(arguments);

        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (isStatic && target != null) {
            throw new IllegalArgumentException("Static method " + method.getName() + " cannot have a target");
        }
        if (!isStatic && target == null) {
            throw new IllegalArgumentException("Instance method " + method.getName() + " requires a target");
        }
        if (arguments.size() != method.getParameterCount()) {
            throw new IllegalArgumentException("Method " + method.getName() + " expects "
                    + method.getParameterCount() + " argument(s), got " + arguments.size());
        }
    }

    @Override
    public Class<?> type() {
        return method.getReturnType();
    }

    /**
     * Returns the argument at the given position.
     *
     * @param index zero-based argument index
     * @return the argument expression
     */
    public Expression argument(int index) {
        return arguments.get(index);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
