package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

/**
 * Filter matching no document.
 *
 * @since 1.0.0
 */
public record MatchNoneFilter() implements FilterNode {

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitMatchNone(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
