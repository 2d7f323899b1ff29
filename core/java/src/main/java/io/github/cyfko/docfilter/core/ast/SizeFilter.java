package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

import java.util.Objects;

/**
 * Array length test: {@code { field: { $size: size } }}.
 *
 * @param field the array field
 * @param size  the exact expected number of elements
 * @since 1.0.0
 */
public record SizeFilter(FieldPath field, int size) implements FilterNode {

    public SizeFilter {
        Objects.requireNonNull(field, "Field cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Size must not be negative, got: " + size);
        }
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitSize(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
