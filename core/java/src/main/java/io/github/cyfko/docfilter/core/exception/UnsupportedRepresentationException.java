package io.github.cyfko.docfilter.core.exception;

import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;

/**
 * Thrown when an expression is structurally recognized but the on-wire representation of the
 * field it targets cannot express the requested predicate.
 *
 * <pre>{@code
 * // Tags stored as ARRAY_OF_DOCUMENTS
 * x -> x.tags.containsKey("red")
 * // → containsKey is not supported when DictionaryRepresentation is ARRAY_OF_DOCUMENTS (array of documents)
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnsupportedRepresentationException extends ExpressionNotSupportedException {

    private final DictionaryRepresentation representation;

    public UnsupportedRepresentationException(Expression expression, String operation,
                                              DictionaryRepresentation representation) {
        super(expression, operation + " is not supported when DictionaryRepresentation is "
                + representation + " (" + representation.getDescription() + ")");
        this.representation = representation;
    }

    /**
     * @return the representation that prevented the translation
     */
    public DictionaryRepresentation getRepresentation() {
        return representation;
    }
}
