package io.github.cyfko.docfilter.core.expression;

import java.util.Objects;

/**
 * Indexer or keyed access: {@code target[index]}.
 * <p>
 * Used both for positional access into arrays and lists and for keyed access into mappings.
 * The Java-native forms {@code list.get(i)} and {@code map.get(k)} are expressed as
 * {@link MethodCallExpression}s and are treated the same way by field resolution.
 * </p>
 *
 * @param target the indexed expression
 * @param index  the index or key expression
 * @param type   the static type of the element read
 * @since 1.0.0
 */
public record IndexExpression(Expression target, Expression index, Class<?> type) implements Expression {

    public IndexExpression {
        Objects.requireNonNull(target, "Indexed target cannot be null");
        Objects.requireNonNull(index, "Index cannot be null");
        Objects.requireNonNull(type, "Element type cannot be null");
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
