package io.github.cyfko.docfilter.core.expression;

import java.util.Objects;

/**
 * Unary operator applied to a single operand.
 *
 * @param operator the operator
 * @param operand  the operand expression
 * @since 1.0.0
 */
public record UnaryExpression(Operator operator, Expression operand) implements Expression {

    /** Supported unary operators. */
    public enum Operator {
        /** Logical negation: {@code !operand}. */
        NOT
    }

    public UnaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (operator == Operator.NOT && !operand.isBoolean()) {
            throw new IllegalArgumentException("NOT requires a boolean operand, got " + operand.type().getName());
        }
    }

    @Override
    public Class<?> type() {
        return boolean.class;
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
