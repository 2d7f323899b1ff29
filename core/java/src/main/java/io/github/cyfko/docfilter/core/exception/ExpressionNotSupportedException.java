package io.github.cyfko.docfilter.core.exception;

import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.expression.ExpressionPrinter;

/**
 * Exception thrown when a predicate expression cannot be translated into a filter.
 * <p>
 * Translation is all-or-nothing: as soon as any node of a predicate cannot be expressed
 * faithfully in the filter grammar, the whole translation fails with this exception (or one of
 * its subclasses). No partial filter is returned and no approximate filter is substituted, since
 * a wrong filter would silently change query semantics.
 * </p>
 *
 * <p><strong>Failure categories:</strong></p>
 * <ul>
 *   <li>this class itself: no translator claims the expression shape</li>
 *   <li>{@link UnresolvedFieldException}: an operand is not a deterministic field path</li>
 *   <li>{@link UnsupportedRepresentationException}: the field's on-wire representation cannot
 *       express the predicate</li>
 *   <li>{@link InvalidKeyArgumentException}: a key argument is not a constant serializing to a string</li>
 *   <li>{@link SerializerCapabilityException}: the field's serializer lacks a required capability</li>
 * </ul>
 *
 * <p><strong>Message format:</strong></p>
 * <pre>{@code
 * Expression not supported: x.tags.containsKey(k) because key must be a constant represented as a string.
 * }</pre>
 *
 * <p>Callers are expected to surface this exception to the application developer as a
 * query-construction error, before any interaction with the database.</p>
 *
 * @since 1.0.0
 */
public class ExpressionNotSupportedException extends RuntimeException {

    private final transient Expression expression;
    private final String reason;

    /**
     * Creates an exception for an expression no translator supports.
     *
     * @param expression the offending expression
     */
    public ExpressionNotSupportedException(Expression expression) {
        this(expression, null);
    }

    /**
     * Creates an exception for an expression that cannot be translated for a known reason.
     *
     * @param expression the offending expression
     * @param reason     human readable reason, or {@code null}
     */
    public ExpressionNotSupportedException(Expression expression, String reason) {
        super(formatMessage(expression, reason));
        this.expression = expression;
        this.reason = reason;
    }

    /**
     * Creates an exception caused by a lower-level failure, e.g. a serializer rejecting a value.
     *
     * @param expression the offending expression
     * @param reason     human readable reason
     * @param cause      the underlying failure
     */
    public ExpressionNotSupportedException(Expression expression, String reason, Throwable cause) {
        super(formatMessage(expression, reason), cause);
        this.expression = expression;
        this.reason = reason;
    }

    /**
     * @return the offending source expression
     */
    public Expression getExpression() {
        return expression;
    }

    /**
     * @return the reason the expression is not supported, or {@code null} if none was given
     */
    public String getReason() {
        return reason;
    }

    private static String formatMessage(Expression expression, String reason) {
        String message = "Expression not supported: " + ExpressionPrinter.print(expression);
        return reason == null ? message + "." : message + " because " + reason + ".";
    }
}
