package io.github.cyfko.docfilter.core.expression;

/**
 * Immutable node of a typed predicate expression tree.
 * <p>
 * An expression tree describes a boolean predicate over a root object type, in the same way an
 * embedded query DSL describes {@code x -> x.getTags().containsKey("red")}. Trees are built once
 * (usually through the {@link Expressions} factory methods), owned by the caller and never
 * modified by the translation engine.
 * </p>
 *
 * <h2>Node kinds</h2>
 * <ul>
 *   <li>{@link ParameterExpression}: reference to a lambda parameter</li>
 *   <li>{@link ConstantExpression}: compile-time constant value</li>
 *   <li>{@link MemberExpression}: member access ({@code x.name})</li>
 *   <li>{@link IndexExpression}: indexer or keyed access ({@code x.items[0]})</li>
 *   <li>{@link MethodCallExpression}: method invocation</li>
 *   <li>{@link UnaryExpression}: logical negation</li>
 *   <li>{@link BinaryExpression}: logical combinators and comparisons</li>
 *   <li>{@link LambdaExpression}: predicate with bound parameters</li>
 * </ul>
 *
 * <p>The hierarchy is closed: adding a node kind means adding a permitted record, which keeps
 * every dispatch over the tree exhaustive.</p>
 *
 * @see Expressions
 * @see ExpressionPrinter
 * @since 1.0.0
 */
public sealed interface Expression
        permits ParameterExpression, ConstantExpression, MemberExpression, IndexExpression,
        MethodCallExpression, UnaryExpression, BinaryExpression, LambdaExpression {

    /**
     * Returns the static type of the value this expression evaluates to.
     *
     * @return the Java type of the expression, never {@code null}
     */
    Class<?> type();

    /**
     * Indicates whether this expression evaluates to a boolean.
     *
     * @return {@code true} for {@code boolean} and {@link Boolean} typed expressions
     */
    default boolean isBoolean() {
        return type() == boolean.class || type() == Boolean.class;
    }
}
