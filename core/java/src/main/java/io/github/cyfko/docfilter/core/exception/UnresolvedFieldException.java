package io.github.cyfko.docfilter.core.exception;

import io.github.cyfko.docfilter.core.expression.Expression;

/**
 * Thrown when an expression used as a field does not denote a deterministic path from the
 * document root: a computed value, an unmapped member, a non-constant index, or a type with no
 * serializer.
 *
 * @since 1.0.0
 */
public class UnresolvedFieldException extends ExpressionNotSupportedException {

    public UnresolvedFieldException(Expression expression, String reason) {
        super(expression, reason);
    }
}
