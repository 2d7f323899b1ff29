package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.ast.MatchAllFilter;
import io.github.cyfko.docfilter.core.ast.MatchNoneFilter;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.expression.LambdaExpression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;

import java.lang.reflect.Method;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Translates element predicates over an array field written with streams.
 *
 * <pre>{@code
 * x.items.stream().anyMatch(i -> i.qty > 5)   // { "Items": { "$elemMatch": { "Qty": { "$gt": 5 } } } }
 * x.items.stream().noneMatch(i -> i.qty > 5)  // { "Items": { "$not": { "$elemMatch": ... } } }
 * x.items.stream().allMatch(i -> i.qty > 5)   // no element fails: noneMatch(i -> !(i.qty > 5))
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AnyMatchMethodToFilterTranslator implements MethodCallToFilterTranslator {

    public static final AnyMatchMethodToFilterTranslator INSTANCE = new AnyMatchMethodToFilterTranslator();

    private AnyMatchMethodToFilterTranslator() {
    }

    @Override
    public Set<String> supportedMethodNames() {
        return Set.of("anyMatch", "noneMatch", "allMatch");
    }

    @Override
    public boolean canTranslate(Method method) {
        return Stream.class.isAssignableFrom(method.getDeclaringClass())
                && MethodSignatures.isPredicateMethod(method, method.getName(), 1)
                && supportedMethodNames().contains(method.getName());
    }

    @Override
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                MethodCallExpression call) {
        if (!isStreamCall(call.target())) {
            throw new ExpressionNotSupportedException(call, "the stream must come directly from an array field");
        }
        if (!(call.argument(0) instanceof LambdaExpression predicate)) {
            throw new ExpressionNotSupportedException(call, "the element predicate must be a lambda");
        }
        TranslatedField arrayField = FilterFieldResolver.resolve(context, ((MethodCallExpression) call.target()).target());
        FilterNode elementFilter = dispatcher.translateElementPredicate(context, arrayField, predicate);
        FieldPath path = arrayField.path();

        return switch (call.method().getName()) {
            case "anyMatch" -> anyMatch(path, elementFilter);
            case "noneMatch" -> Filters.not(anyMatch(path, elementFilter));
            case "allMatch" -> allMatch(path, elementFilter);
            default -> throw new ExpressionNotSupportedException(call);
        };
    }

    private static FilterNode anyMatch(FieldPath path, FilterNode elementFilter) {
        if (elementFilter instanceof MatchAllFilter) {
            // Some element matches iff there is a first element.
            return Filters.exists(path.subField("0"));
        }
        if (elementFilter instanceof MatchNoneFilter) {
            return Filters.matchNone();
        }
        return Filters.elemMatch(path, elementFilter);
    }

    private static FilterNode allMatch(FieldPath path, FilterNode elementFilter) {
        if (elementFilter instanceof MatchAllFilter) {
            return Filters.matchAll();
        }
        if (elementFilter instanceof MatchNoneFilter) {
            return Filters.notExists(path.subField("0"));
        }
        return Filters.not(Filters.elemMatch(path, Filters.not(elementFilter)));
    }

    private static boolean isStreamCall(Expression expression) {
        return expression instanceof MethodCallExpression stream
                && stream.target() != null
                && stream.method().getName().equals("stream")
                && stream.method().getParameterCount() == 0
                && Stream.class.isAssignableFrom(stream.method().getReturnType());
    }
}
