package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.expression.ConstantExpression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;
import io.github.cyfko.docfilter.core.utils.RegexUtils;

import java.lang.reflect.Method;
import java.util.Set;

/**
 * Translates string predicates with a constant argument into {@code $regex} filters.
 *
 * <pre>{@code
 * x.name.startsWith("Jo")          // { "Name": { "$regex": "^Jo" } }
 * x.name.endsWith(".txt")          // { "Name": { "$regex": "\\.txt\\z" } }
 * x.name.contains("an")            // { "Name": { "$regex": "an" } }
 * x.name.equalsIgnoreCase("joe")   // { "Name": { "$regex": "^joe\\z", "$options": "i" } }
 * x.name.matches("[A-Z]+")         // { "Name": { "$regex": "^(?:[A-Z]+)\\z" } }
 * }</pre>
 *
 * <p>Literal arguments are escaped; the {@code matches} pattern is anchored at both ends since
 * {@link String#matches(String)} matches the whole string.</p>
 *
 * @since 1.0.0
 */
public final class StringMethodToFilterTranslator implements MethodCallToFilterTranslator {

    public static final StringMethodToFilterTranslator INSTANCE = new StringMethodToFilterTranslator();

    private static final Set<String> METHOD_NAMES = Set.of("startsWith", "endsWith", "contains", "equalsIgnoreCase", "matches");

    private StringMethodToFilterTranslator() {
    }

    @Override
    public Set<String> supportedMethodNames() {
        return METHOD_NAMES;
    }

    @Override
    public boolean canTranslate(Method method) {
        return method.getDeclaringClass() == String.class
                && METHOD_NAMES.contains(method.getName())
                && MethodSignatures.isPredicateMethod(method, method.getName(), 1);
    }

    @Override
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                MethodCallExpression call) {
        TranslatedField field = FilterFieldResolver.resolve(context, call.target());
        if (field.serializer().valueType() != String.class) {
            throw new ExpressionNotSupportedException(call, "field " + field.path() + " is not stored as a string");
        }
        if (!(call.argument(0) instanceof ConstantExpression constant) || constant.value() == null) {
            throw new ExpressionNotSupportedException(call, "argument must be a non-null constant");
        }

        String text = constant.value().toString();
        String literal = RegexUtils.escape(text);
        // \z rather than $: $ also matches before a trailing newline
        return switch (call.method().getName()) {
            case "startsWith" -> Filters.regex(field.path(), "^" + literal, "");
            case "endsWith" -> Filters.regex(field.path(), literal + "\\z", "");
            case "contains" -> Filters.regex(field.path(), literal, "");
            case "equalsIgnoreCase" -> Filters.regex(field.path(), "^" + literal + "\\z", "i");
            case "matches" -> Filters.regex(field.path(), "^(?:" + text + ")\\z", "");
            default -> throw new ExpressionNotSupportedException(call);
        };
    }
}
