package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

/**
 * Filter matching every document: {@code {}}.
 *
 * @since 1.0.0
 */
public record MatchAllFilter() implements FilterNode {

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitMatchAll(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
