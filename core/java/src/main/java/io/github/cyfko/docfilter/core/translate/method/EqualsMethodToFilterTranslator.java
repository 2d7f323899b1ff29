package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.expression.BinaryExpression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.operator.ComparisonExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;

import java.lang.reflect.Method;
import java.util.Set;

/**
 * Translates {@code a.equals(b)} as the equality comparison {@code a == b}.
 *
 * @since 1.0.0
 */
public final class EqualsMethodToFilterTranslator implements MethodCallToFilterTranslator {

    public static final EqualsMethodToFilterTranslator INSTANCE = new EqualsMethodToFilterTranslator();

    private EqualsMethodToFilterTranslator() {
    }

    @Override
    public Set<String> supportedMethodNames() {
        return Set.of("equals");
    }

    @Override
    public boolean canTranslate(Method method) {
        return MethodSignatures.isPredicateMethod(method, "equals", 1)
                && method.getParameterTypes()[0] == Object.class;
    }

    @Override
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                MethodCallExpression call) {
        return ComparisonExpressionToFilterTranslator.INSTANCE.translateComparison(call, context,
                BinaryExpression.Operator.EQUAL, call.target(), call.argument(0));
    }
}
