package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;
import org.bson.BsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Negated set membership: {@code { field: { $nin: [values] } }}.
 *
 * @param field  the tested field
 * @param values the serialized excluded values, in source order
 * @since 1.0.0
 */
public record NotInFilter(FieldPath field, List<BsonValue> values) implements FilterNode {

    public NotInFilter {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        values = List.copyOf(values);
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitNotIn(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
