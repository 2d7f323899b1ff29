package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

import java.util.List;
import java.util.Objects;

/**
 * Logical AND of child filters: {@code { $and: [filters] }}.
 * <p>
 * Children keep the left-to-right order of the source expression.
 * </p>
 *
 * @param filters the child filters, at least one
 * @since 1.0.0
 */
public record AndFilter(List<FilterNode> filters) implements FilterNode {

    public AndFilter {
        Objects.requireNonNull(filters, "Filters cannot be null");
        filters = List.copyOf(filters);
        if (filters.isEmpty()) {
            throw new IllegalArgumentException("AND requires at least one filter");
        }
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
