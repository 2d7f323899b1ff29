package io.github.cyfko.docfilter.core.config;

/**
 * Configuration of expression-to-filter translation.
 * <p>
 * Instances are immutable. A builder keeps construction fluent and forward compatible; unset
 * knobs take the defaults documented below.
 * </p>
 *
 * <ul>
 *   <li><strong>maxExpressionDepth</strong>: maximum nesting depth of a predicate expression
 *       (default: 256). Deeper predicates fail to translate instead of exhausting the stack.</li>
 *   <li><strong>flattenLogicalCombinators</strong>: merge directly nested AND (resp. OR) filters
 *       into their parent, keeping left-to-right order (default: {@code false}).</li>
 * </ul>
 *
 * <pre>{@code
 * TranslatorConfig config = TranslatorConfig.builder()
 *     .maxExpressionDepth(64)
 *     .flattenLogicalCombinators(true)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TranslatorConfig {

    /** Default maximum nesting depth. */
    public static final int DEFAULT_MAX_EXPRESSION_DEPTH = 256;

    private static final TranslatorConfig DEFAULTS = builder().build();

    private final int maxExpressionDepth;
    private final boolean flattenLogicalCombinators;

    private TranslatorConfig(Builder builder) {
        this.maxExpressionDepth = builder.maxExpressionDepth;
        this.flattenLogicalCombinators = builder.flattenLogicalCombinators;
    }

    public static TranslatorConfig defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public int getMaxExpressionDepth() { return maxExpressionDepth; }
    public boolean isFlattenLogicalCombinators() { return flattenLogicalCombinators; }

    @Override
    public String toString() {
        return "TranslatorConfig[maxExpressionDepth=" + maxExpressionDepth
                + ", flattenLogicalCombinators=" + flattenLogicalCombinators + "]";
    }

    /**
     * Builder for {@link TranslatorConfig}.
     */
    public static final class Builder {
        private int maxExpressionDepth = DEFAULT_MAX_EXPRESSION_DEPTH;
        private boolean flattenLogicalCombinators = false;

        private Builder() {}

        public Builder maxExpressionDepth(int maxExpressionDepth) {
            if (maxExpressionDepth <= 0) {
                throw new IllegalArgumentException("maxExpressionDepth must be positive, got: " + maxExpressionDepth);
            }
            this.maxExpressionDepth = maxExpressionDepth;
            return this;
        }

        public Builder flattenLogicalCombinators(boolean flatten) {
            this.flattenLogicalCombinators = flatten;
            return this;
        }

        public TranslatorConfig build() { return new TranslatorConfig(this); }
    }
}
