package io.github.cyfko.docfilter.core.expression;

import java.util.List;
import java.util.Objects;

/**
 * Predicate lambda: {@code (p1, ..., pn) -> body}.
 * <p>
 * A root filter predicate is a single-parameter lambda over the document type. Nested lambdas
 * appear as arguments of element predicates such as {@code items.stream().anyMatch(i -> ...)}.
 * </p>
 *
 * @param parameters the declared parameters
 * @param body       the lambda body
 * @since 1.0.0
 */
public record LambdaExpression(List<ParameterExpression> parameters, Expression body) implements Expression {

    public LambdaExpression {
        Objects.requireNonNull(parameters, "Parameters cannot be null");
        Objects.requireNonNull(body, "Body cannot be null");
        parameters = List.copyOf(parameters);
    }

    /**
     * Returns the single parameter of a one-argument lambda.
     *
     * @return the parameter
     * @throws IllegalStateException if the lambda does not declare exactly one parameter
     */
    public ParameterExpression parameter() {
        if (parameters.size() != 1) {
            throw new IllegalStateException("Lambda declares " + parameters.size() + " parameters, expected 1");
        }
        return parameters.get(0);
    }

    /**
     * Lambdas have no runtime value type of their own in a predicate tree; the body type is reported.
     */
    @Override
    public Class<?> type() {
        return body.type();
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
