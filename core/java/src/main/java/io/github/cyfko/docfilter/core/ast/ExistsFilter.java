package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

import java.util.Objects;

/**
 * Field existence test: {@code { field: { $exists: exists } }}.
 *
 * @param field  the tested field
 * @param exists whether the field must be present
 * @since 1.0.0
 */
public record ExistsFilter(FieldPath field, boolean exists) implements FilterNode {

    public ExistsFilter {
        Objects.requireNonNull(field, "Field cannot be null");
        if (field.isEmpty()) {
            throw new IllegalArgumentException("Existence cannot be tested on an empty path");
        }
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitExists(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
