package io.github.cyfko.docfilter.core.exception;

import io.github.cyfko.docfilter.core.expression.Expression;

/**
 * Thrown when a key argument that must be known at translation time is not a constant, or does
 * not serialize to a string through the mapping's key serializer.
 *
 * @since 1.0.0
 */
public class InvalidKeyArgumentException extends ExpressionNotSupportedException {

    private final transient Expression keyExpression;

    public InvalidKeyArgumentException(Expression expression, Expression keyExpression) {
        super(expression, "key must be a constant represented as a string");
        this.keyExpression = keyExpression;
    }

    public InvalidKeyArgumentException(Expression expression, Expression keyExpression, Throwable cause) {
        super(expression, "key must be a constant represented as a string", cause);
        this.keyExpression = keyExpression;
    }

    /**
     * @return the rejected key argument
     */
    public Expression getKeyExpression() {
        return keyExpression;
    }
}
