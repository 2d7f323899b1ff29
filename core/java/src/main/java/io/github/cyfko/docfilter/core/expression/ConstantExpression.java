package io.github.cyfko.docfilter.core.expression;

import java.util.Objects;

/**
 * Compile-time constant appearing in a predicate.
 * <p>
 * Only constants can be evaluated while translating: keys, comparison operands and membership
 * sets must be {@code ConstantExpression}s for the corresponding filters to be emitted. The value
 * may be {@code null}, in which case {@link #type()} still carries the declared type.
 * </p>
 *
 * @param value the constant value, possibly {@code null}
 * @param type  the static type of the constant
 * @since 1.0.0
 */
public record ConstantExpression(Object value, Class<?> type) implements Expression {

    public ConstantExpression {
        Objects.requireNonNull(type, "Constant type cannot be null");
        if (value != null && !Expressions.box(type).isInstance(value)) {
            throw new IllegalArgumentException(
                    "Constant value of type " + value.getClass().getName() + " is not assignable to " + type.getName());
        }
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
