package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

import java.util.Objects;

/**
 * Element-wise array match: {@code { field: { $elemMatch: filter } }}.
 * <p>
 * Fields referenced by {@link #filter()} are relative to the array element; the
 * {@linkplain FieldPath#empty() empty path} denotes the element itself when the array holds
 * scalars.
 * </p>
 *
 * @param field  the array field
 * @param filter the predicate applied to each element
 * @since 1.0.0
 */
public record ElemMatchFilter(FieldPath field, FilterNode filter) implements FilterNode {

    public ElemMatchFilter {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(filter, "Element filter cannot be null");
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitElemMatch(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
