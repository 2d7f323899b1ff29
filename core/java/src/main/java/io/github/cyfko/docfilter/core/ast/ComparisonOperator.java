package io.github.cyfko.docfilter.core.ast;

/**
 * Comparison operators of the query-filter grammar.
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {

    /** Equality: {@code $eq} */
    EQ("$eq"),

    /** Inequality: {@code $ne} */
    NE("$ne"),

    /** Greater than: {@code $gt} */
    GT("$gt"),

    /** Greater than or equal: {@code $gte} */
    GTE("$gte"),

    /** Less than: {@code $lt} */
    LT("$lt"),

    /** Less than or equal: {@code $lte} */
    LTE("$lte");

    private final String operatorName;

    ComparisonOperator(String operatorName) {
        this.operatorName = operatorName;
    }

    /**
     * Returns the operator name as written in a query document.
     *
     * @return the operator name, e.g. {@code "$gte"}
     */
    public String getOperatorName() {
        return operatorName;
    }
}
