package io.github.cyfko.docfilter.core.ast;

import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;

import java.util.Objects;

/**
 * Regular expression match: {@code { field: /pattern/options }}.
 *
 * @param field   the matched field
 * @param pattern the regular expression, in PCRE syntax
 * @param options the regex options ({@code "i"}, {@code "s"}, ...), empty when none
 * @since 1.0.0
 */
public record RegexFilter(FieldPath field, String pattern, String options) implements FilterNode {

    public RegexFilter {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        options = options == null ? "" : options;
    }

    @Override
    public <T> T accept(FilterNodeVisitor<T> visitor) {
        return visitor.visitRegex(this);
    }

    @Override
    public String toString() {
        return BsonFilterRenderer.toJson(this);
    }
}
