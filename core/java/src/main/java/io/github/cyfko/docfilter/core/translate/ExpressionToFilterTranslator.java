package io.github.cyfko.docfilter.core.translate;

import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.exception.SerializerCapabilityException;
import io.github.cyfko.docfilter.core.expression.BinaryExpression;
import io.github.cyfko.docfilter.core.expression.ConstantExpression;
import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.expression.IndexExpression;
import io.github.cyfko.docfilter.core.expression.LambdaExpression;
import io.github.cyfko.docfilter.core.expression.MemberExpression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.expression.UnaryExpression;
import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;
import io.github.cyfko.docfilter.core.serialization.ArraySerializer;
import io.github.cyfko.docfilter.core.serialization.SerializationHelper;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.spi.MethodCallTranslatorRegistry;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.translate.operator.ComparisonExpressionToFilterTranslator;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Central dispatcher translating boolean expressions into {@link FilterNode}s.
 * <p>
 * Dispatch is by expression shape:
 * </p>
 * <ul>
 *   <li>{@code a && b}, {@code a || b}: both operands translated left to right, then combined</li>
 *   <li>{@code !a}: negation of the translated operand</li>
 *   <li>comparisons: delegated to {@link ComparisonExpressionToFilterTranslator}</li>
 *   <li>method calls: delegated to the translator the {@link MethodCallTranslatorRegistry} selects</li>
 *   <li>a boolean field used as a predicate: equality with {@code true}</li>
 *   <li>a boolean constant: match everything or nothing</li>
 * </ul>
 * <p>
 * Anything else raises {@link ExpressionNotSupportedException}. The dispatcher is stateless and
 * thread-safe; all per-translation state lives in the {@link TranslationContext}.
 * </p>
 *
 * @since 1.0.0
 */
public class ExpressionToFilterTranslator {

    private static final Logger log = Logger.getLogger(ExpressionToFilterTranslator.class.getName());

    private final MethodCallTranslatorRegistry translatorRegistry;

    public ExpressionToFilterTranslator(MethodCallTranslatorRegistry translatorRegistry) {
        this.translatorRegistry = Objects.requireNonNull(translatorRegistry, "translatorRegistry");
    }

    public MethodCallTranslatorRegistry getTranslatorRegistry() {
        return translatorRegistry;
    }

    /**
     * Translates a root predicate, binding its parameter to the document.
     *
     * @param context   the translation context
     * @param predicate a one-parameter boolean lambda
     * @param document  the document field: empty path plus the document serializer
     * @return the filter
     * @throws ExpressionNotSupportedException if any part of the predicate cannot be translated
     */
    public FilterNode translateLambda(TranslationContext context, LambdaExpression predicate, TranslatedField document) {
        requirePredicateLambda(predicate);
        log.fine(() -> "Translating predicate " + predicate);
        TranslationContext scoped = context.withSymbol(
                new Symbol(predicate.parameter(), document, Symbol.Kind.DOCUMENT));
        FilterNode filter = translate(scoped, predicate.body());
        log.fine(() -> "Translated predicate " + predicate + " to " + filter);
        return filter;
    }

    /**
     * Translates a predicate over the elements of an array field.
     * <p>
     * The returned filter is relative to the element and is meant to be wrapped in an
     * {@code $elemMatch} on {@code arrayField}. Inside the element predicate only the element
     * parameter is in scope. When the element is referenced as a whole (scalar elements), the
     * filter is restricted to operators that apply to the element itself, combined with
     * {@code &&} or {@code !}.
     * </p>
     *
     * @param context    the translation context
     * @param arrayField the array field, whose serializer must be an {@link ArraySerializer}
     * @param predicate  a one-parameter boolean lambda over the element
     * @return the element filter
     * @throws ExpressionNotSupportedException if the predicate cannot be expressed on an element
     */
    public FilterNode translateElementPredicate(TranslationContext context, TranslatedField arrayField,
                                                LambdaExpression predicate) {
        requirePredicateLambda(predicate);
        if (!(arrayField.serializer() instanceof ArraySerializer<?> arraySerializer)) {
            throw new SerializerCapabilityException(predicate, arrayField.serializer().getClass(), ArraySerializer.class);
        }
        TranslatedField element = new TranslatedField(FieldPath.empty(), arraySerializer.itemSerializer());
        TranslationContext elementContext = context.withIsolatedSymbol(
                new Symbol(predicate.parameter(), element, Symbol.Kind.ELEMENT));
        FilterNode elementFilter = translate(elementContext, predicate.body());

        if (BsonFilterRenderer.referencesCurrentElement(elementFilter)
                && !BsonFilterRenderer.isElementOperatorFilter(elementFilter)) {
            throw new ExpressionNotSupportedException(predicate,
                    "a predicate on the element itself can only combine element comparisons with && and !");
        }
        return elementFilter;
    }

    /**
     * Translates a boolean expression.
     *
     * @param context    the translation context
     * @param expression the expression
     * @return the filter
     * @throws ExpressionNotSupportedException if the expression cannot be translated
     */
    public FilterNode translate(TranslationContext context, Expression expression) {
        Objects.requireNonNull(expression, "expression");
        TranslationContext nested = context.nested();
        int maxDepth = nested.getConfig().getMaxExpressionDepth();
        if (nested.getDepth() > maxDepth) {
            throw new ExpressionNotSupportedException(expression,
                    "expression nesting exceeds the configured maximum depth of " + maxDepth);
        }

        if (expression instanceof BinaryExpression binary) {
            return binary.operator().isLogical()
                    ? translateLogical(nested, binary)
                    : ComparisonExpressionToFilterTranslator.INSTANCE.translate(this, nested, binary);
        }
        if (expression instanceof UnaryExpression unary) {
            return Filters.not(translate(nested, unary.operand()));
        }
        if (expression instanceof MethodCallExpression call) {
            return translateMethodCall(nested, call);
        }
        if (expression instanceof ConstantExpression constant) {
            return translateConstant(constant);
        }
        if (expression instanceof MemberExpression
                || expression instanceof IndexExpression
                || expression instanceof ParameterExpression) {
            return translateBooleanField(nested, expression);
        }
        throw new ExpressionNotSupportedException(expression);
    }

    private FilterNode translateLogical(TranslationContext context, BinaryExpression binary) {
        FilterNode left = translate(context, binary.left());
        FilterNode right = translate(context, binary.right());
        boolean flatten = context.getConfig().isFlattenLogicalCombinators();
        if (binary.operator() == BinaryExpression.Operator.AND) {
            return flatten ? Filters.flatAnd(left, right) : Filters.and(left, right);
        }
        return flatten ? Filters.flatOr(left, right) : Filters.or(left, right);
    }

    private FilterNode translateMethodCall(TranslationContext context, MethodCallExpression call) {
        Optional<MethodCallToFilterTranslator> translator = translatorRegistry.find(call.method());
        if (translator.isPresent()) {
            log.finer(() -> "Method " + call.method() + " claimed by " + translator.get().getClass().getSimpleName());
            return translator.get().translate(this, context, call);
        }
        if (call.isBoolean() && FilterFieldResolver.isField(context, call)) {
            return translateBooleanField(context, call);
        }
        throw new ExpressionNotSupportedException(call,
                "no translator supports method " + call.method().getDeclaringClass().getSimpleName()
                        + "." + call.method().getName());
    }

    private FilterNode translateConstant(ConstantExpression constant) {
        if (constant.value() instanceof Boolean value) {
            return value ? Filters.matchAll() : Filters.matchNone();
        }
        throw new ExpressionNotSupportedException(constant, "a non-boolean constant is not a predicate");
    }

    private FilterNode translateBooleanField(TranslationContext context, Expression expression) {
        if (!expression.isBoolean()) {
            throw new ExpressionNotSupportedException(expression, "a non-boolean value is not a predicate");
        }
        TranslatedField field = FilterFieldResolver.resolve(context, expression);
        try {
            return Filters.eq(field.path(), SerializationHelper.serializeValue(field.serializer(), Boolean.TRUE));
        } catch (IllegalArgumentException e) {
            throw new ExpressionNotSupportedException(expression, e.getMessage(), e);
        }
    }

    private static void requirePredicateLambda(LambdaExpression predicate) {
        Objects.requireNonNull(predicate, "predicate");
        if (predicate.parameters().size() != 1) {
            throw new ExpressionNotSupportedException(predicate, "a predicate must declare exactly one parameter");
        }
        if (!predicate.body().isBoolean()) {
            throw new ExpressionNotSupportedException(predicate, "the lambda body is not boolean");
        }
    }
}
