package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;
import org.bson.BsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Set membership: {@code { field: { $in: [values] } }}. An empty set matches no document.
 *
 * @param field  the tested field
 * @param values the serialized candidate values, in source order
 * @since 1.0.0
 */
public record InFilter(FieldPath field, List<BsonValue> values) implements FilterNode {

    public InFilter {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(values, "Values cannot be null");
        values = List.copyOf(values);
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitIn(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
