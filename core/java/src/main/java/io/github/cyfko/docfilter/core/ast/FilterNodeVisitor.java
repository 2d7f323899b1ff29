package io.github.cyfko.docfilter.core.ast;

/**
 * Visitor over {@link FilterNode}s.
 *
 * @param <T> the result type
 * @since 1.0.0
 */
public interface FilterNodeVisitor<T> {

    T visitExists(ExistsFilter filter);

    T visitComparison(ComparisonFilter filter);

    T visitIn(InFilter filter);

    T visitNotIn(NotInFilter filter);

    T visitRegex(RegexFilter filter);

    T visitSize(SizeFilter filter);

    T visitElemMatch(ElemMatchFilter filter);

    T visitAnd(AndFilter filter);

    T visitOr(OrFilter filter);

    T visitNot(NotFilter filter);

    T visitMatchAll(MatchAllFilter filter);

    T visitMatchNone(MatchNoneFilter filter);
}
