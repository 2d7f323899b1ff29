package io.github.cyfko.docfilter.core.ast;

/**
 * Node of the intermediate filter AST.
 * <p>
 * A filter AST mirrors the structure of a query-filter document independently of its final
 * encoding. Nodes are immutable and every field they reference is a resolved {@link FieldPath}.
 * Node shapes are restricted to those the target grammar accepts: for example a key-existence
 * test is only ever built against a sub-field of a mapping stored as a document.
 * </p>
 *
 * <h2>Node kinds</h2>
 * <ul>
 *   <li>Field predicates: {@link ExistsFilter}, {@link ComparisonFilter}, {@link InFilter},
 *       {@link NotInFilter}, {@link RegexFilter}, {@link SizeFilter}, {@link ElemMatchFilter}</li>
 *   <li>Combinators: {@link AndFilter}, {@link OrFilter}, {@link NotFilter}</li>
 *   <li>Constants: {@link MatchAllFilter}, {@link MatchNoneFilter}</li>
 * </ul>
 *
 * @see Filters
 * @see FilterNodeVisitor
 * @since 1.0.0
 */
public sealed interface FilterNode
        permits ExistsFilter, ComparisonFilter, InFilter, NotInFilter, RegexFilter, SizeFilter,
        ElemMatchFilter, AndFilter, OrFilter, NotFilter, MatchAllFilter, MatchNoneFilter {

    /**
     * Accept method for the visitor pattern.
     *
     * @param visitor the visitor
     * @param <T>     the visitor result type
     * @return the visitor result
     */
    <T> T accept(FilterNodeVisitor<T> visitor);
}
