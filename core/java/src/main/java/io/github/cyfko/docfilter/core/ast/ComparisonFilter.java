package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;
import org.bson.BsonValue;

import java.util.Objects;

/**
 * Comparison of a field with a serialized constant: {@code { field: { $op: value } }}.
 *
 * @param operator the comparison operator
 * @param field    the compared field
 * @param value    the serialized operand
 * @since 1.0.0
 */
public record ComparisonFilter(ComparisonOperator operator, FieldPath field, BsonValue value) implements FilterNode {

    public ComparisonFilter {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(value, "Value cannot be null, use BsonNull instead");
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
