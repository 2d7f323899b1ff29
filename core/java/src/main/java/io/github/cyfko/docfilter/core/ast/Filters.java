package io.github.cyfko.docfilter.core.ast;

import org.bson.BsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Static factory methods for {@link FilterNode}s.
 *
 * <pre>{@code
 * FilterNode filter = Filters.and(
 *     Filters.exists(FieldPath.of("Tags", "red")),
 *     Filters.compare(ComparisonOperator.GT, FieldPath.of("Age"), new BsonInt32(18)));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Filters {

    private static final MatchAllFilter MATCH_ALL = new MatchAllFilter();
    private static final MatchNoneFilter MATCH_NONE = new MatchNoneFilter();

    private Filters() {
        // Prevent instantiation
    }

    public static ExistsFilter exists(FieldPath field) {
        return new ExistsFilter(field, true);
    }

    public static ExistsFilter notExists(FieldPath field) {
        return new ExistsFilter(field, false);
    }

    public static ComparisonFilter eq(FieldPath field, BsonValue value) {
        return new ComparisonFilter(ComparisonOperator.EQ, field, value);
    }

    public static ComparisonFilter compare(ComparisonOperator operator, FieldPath field, BsonValue value) {
        return new ComparisonFilter(operator, field, value);
    }

    public static InFilter in(FieldPath field, List<BsonValue> values) {
        return new InFilter(field, values);
    }

    public static NotInFilter notIn(FieldPath field, List<BsonValue> values) {
        return new NotInFilter(field, values);
    }

    public static RegexFilter regex(FieldPath field, String pattern, String options) {
        return new RegexFilter(field, pattern, options);
    }

    public static SizeFilter size(FieldPath field, int size) {
        return new SizeFilter(field, size);
    }

    public static ElemMatchFilter elemMatch(FieldPath field, FilterNode filter) {
        return new ElemMatchFilter(field, filter);
    }

    public static AndFilter and(FilterNode... filters) {
        return new AndFilter(List.of(filters));
    }

    public static AndFilter and(List<FilterNode> filters) {
        return new AndFilter(filters);
    }

    public static OrFilter or(FilterNode... filters) {
        return new OrFilter(List.of(filters));
    }

    public static OrFilter or(List<FilterNode> filters) {
        return new OrFilter(filters);
    }

    public static NotFilter not(FilterNode filter) {
        return new NotFilter(filter);
    }

    public static MatchAllFilter matchAll() {
        return MATCH_ALL;
    }

    public static MatchNoneFilter matchNone() {
        return MATCH_NONE;
    }

    /**
     * Builds an AND whose directly nested ANDs are merged into it, keeping left-to-right order.
     *
     * @param left  the left operand
     * @param right the right operand
     * @return the flattened conjunction
     */
    public static AndFilter flatAnd(FilterNode left, FilterNode right) {
        List<FilterNode> children = new ArrayList<>();
        addFlattened(children, left, AndFilter.class);
        addFlattened(children, right, AndFilter.class);
        return new AndFilter(children);
    }

    /**
     * Builds an OR whose directly nested ORs are merged into it, keeping left-to-right order.
     *
     * @param left  the left operand
     * @param right the right operand
     * @return the flattened disjunction
     */
    public static OrFilter flatOr(FilterNode left, FilterNode right) {
        List<FilterNode> children = new ArrayList<>();
        addFlattened(children, left, OrFilter.class);
        addFlattened(children, right, OrFilter.class);
        return new OrFilter(children);
    }

    private static void addFlattened(List<FilterNode> sink, FilterNode node, Class<? extends FilterNode> kind) {
        if (kind.isInstance(node) && node instanceof AndFilter and) {
            sink.addAll(and.filters());
        } else if (kind.isInstance(node) && node instanceof OrFilter or) {
            sink.addAll(or.filters());
        } else {
            sink.add(node);
        }
    }
}
