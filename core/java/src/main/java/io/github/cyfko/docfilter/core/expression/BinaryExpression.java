package io.github.cyfko.docfilter.core.expression;

import java.util.Objects;

/**
 * Binary operator applied to two operands: logical combinators ({@code &&}, {@code ||}) and
 * comparisons ({@code ==}, {@code !=}, {@code <}, {@code <=}, {@code >}, {@code >=}).
 * <p>
 * Every binary expression is boolean-valued. Logical combinators additionally require both
 * operands to be boolean.
 * </p>
 *
 * @param operator the operator
 * @param left     the left operand, evaluated first
 * @param right    the right operand
 * @since 1.0.0
 */
public record BinaryExpression(Operator operator, Expression left, Expression right) implements Expression {

    /**
     * Binary operators, with their Java source symbol.
     */
    public enum Operator {
        AND("&&"),
        OR("||"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * @return {@code true} for {@link #AND} and {@link #OR}
         */
        public boolean isLogical() {
            return this == AND || this == OR;
        }

        /**
         * Returns the operator to use when both operands are swapped, so that
         * {@code c OP x} can be rewritten as {@code x mirrored(OP) c}.
         *
         * @return the mirrored operator
         */
        public Operator mirrored() {
            return switch (this) {
                case LESS_THAN -> GREATER_THAN;
                case LESS_THAN_OR_EQUAL -> GREATER_THAN_OR_EQUAL;
                case GREATER_THAN -> LESS_THAN;
                case GREATER_THAN_OR_EQUAL -> LESS_THAN_OR_EQUAL;
                default -> this;
            };
        }
    }

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        if (operator.isLogical() && (!left.isBoolean() || !right.isBoolean())) {
            throw new IllegalArgumentException(operator + " requires boolean operands");
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
