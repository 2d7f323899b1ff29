package io.github.cyfko.docfilter.core.spi;

import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;

import java.lang.reflect.Method;
import java.util.Set;

/**
 * Contract for translating one shape of method call into a filter.
 * <p>
 * Implementations declare the method names they handle and a structural guard over the reflected
 * method signature. The dispatcher only invokes {@link #translate} on calls whose method passes
 * {@link #canTranslate(Method)}; deeper checks (field capabilities, constant arguments,
 * representations) happen inside {@code translate} and fail with an
 * {@link ExpressionNotSupportedException} subclass.
 * </p>
 * <p>
 * <strong>Statelessness:</strong> implementations must hold no mutable state; a single instance
 * is shared by all translations, possibly concurrently.
 * </p>
 *
 * <h3>Example Implementation:</h3>
 * <pre>{@code
 * public class StartsWithTranslator implements MethodCallToFilterTranslator {
 *     @Override
 *     public Set<String> supportedMethodNames() {
 *         return Set.of("startsWith");
 *     }
 *
 *     @Override
 *     public boolean canTranslate(Method method) {
 *         return method.getDeclaringClass() == String.class
 *             && MethodSignatures.isPredicateMethod(method, "startsWith", 1);
 *     }
 *
 *     @Override
 *     public FilterNode translate(ExpressionToFilterTranslator dispatcher,
 *                                 TranslationContext context, MethodCallExpression call) {
 *         TranslatedField field = FilterFieldResolver.resolve(context, call.target());
 *         String prefix = (String) ((ConstantExpression) call.argument(0)).value();
 *         return Filters.regex(field.path(), "^" + RegexUtils.escape(prefix), "");
 *     }
 * }
 * }</pre>
 *
 * @see MethodCallTranslatorRegistry
 * @since 1.0.0
 */
public interface MethodCallToFilterTranslator {

    /**
     * Returns the method names this translator may claim.
     *
     * @return a non-empty set of method names
     */
    Set<String> supportedMethodNames();

    /**
     * Structural guard: decides from the signature alone whether a call is of the shape this
     * translator handles.
     *
     * @param method the invoked method
     * @return {@code true} if the call shape is claimed
     */
    boolean canTranslate(Method method);

    /**
     * Translates a claimed call.
     *
     * @param dispatcher the dispatcher, for translating nested predicates
     * @param context    the translation context
     * @param call       the method call, whose method passed {@link #canTranslate(Method)}
     * @return the filter
     * @throws ExpressionNotSupportedException if the call cannot be translated faithfully
     */
    FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context, MethodCallExpression call);
}
