package io.github.cyfko.docfilter.core.expression;

import java.util.Objects;

/**
 * Reference to a lambda parameter, such as {@code x} in {@code x -> x.age > 18}.
 * <p>
 * Parameters are compared by identity of their name and type; two lambdas declaring a parameter
 * with the same name and type therefore refer to the same symbol once bound in a translation
 * scope.
 * </p>
 *
 * @param name the parameter name used in diagnostics
 * @param type the declared type of the parameter
 * @since 1.0.0
 */
public record ParameterExpression(String name, Class<?> type) implements Expression {

    public ParameterExpression {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(type, "Parameter type cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be blank");
        }
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
