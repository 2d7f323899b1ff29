package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.serialization.ArraySerializer;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.serialization.DictionarySerializer;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;
import org.bson.BsonDocument;
import org.bson.BsonString;

import java.lang.reflect.Method;
import java.util.Set;

/**
 * Translates {@code isEmpty()} on strings, arrays and mappings.
 * <ul>
 *   <li>string: {@code { field: "" }}</li>
 *   <li>array, or mapping stored as an array: {@code { field: { $size: 0 } }}</li>
 *   <li>mapping stored as a document: {@code { field: {} }}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class IsEmptyMethodToFilterTranslator implements MethodCallToFilterTranslator {

    public static final IsEmptyMethodToFilterTranslator INSTANCE = new IsEmptyMethodToFilterTranslator();

    private IsEmptyMethodToFilterTranslator() {
    }

    @Override
    public Set<String> supportedMethodNames() {
        return Set.of("isEmpty");
    }

    @Override
    public boolean canTranslate(Method method) {
        return MethodSignatures.isPredicateMethod(method, "isEmpty", 0);
    }

    @Override
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                MethodCallExpression call) {
        TranslatedField field = FilterFieldResolver.resolve(context, call.target());
        if (field.serializer() instanceof ArraySerializer<?>) {
            return Filters.size(field.path(), 0);
        }
        if (field.serializer() instanceof DictionarySerializer<?> dictionarySerializer) {
            return dictionarySerializer.representation() == DictionaryRepresentation.DOCUMENT
                    ? Filters.eq(field.path(), new BsonDocument())
                    : Filters.size(field.path(), 0);
        }
        if (field.serializer().valueType() == String.class) {
            return Filters.eq(field.path(), new BsonString(""));
        }
        throw new ExpressionNotSupportedException(call,
                "field " + field.path() + " is neither a string, an array nor a mapping");
    }
}
