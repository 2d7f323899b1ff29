package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

import java.util.Objects;

/**
 * Logical negation of a filter.
 *
 * @param filter the negated filter
 * @since 1.0.0
 */
public record NotFilter(FilterNode filter) implements FilterNode {

    public NotFilter {
        Objects.requireNonNull(filter, "Negated filter cannot be null");
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
