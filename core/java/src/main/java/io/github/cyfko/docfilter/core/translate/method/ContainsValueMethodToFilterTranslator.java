package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.exception.SerializerCapabilityException;
import io.github.cyfko.docfilter.core.exception.UnsupportedRepresentationException;
import io.github.cyfko.docfilter.core.expression.ConstantExpression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.serialization.DictionarySerializer;
import io.github.cyfko.docfilter.core.serialization.SerializationHelper;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;
import org.bson.BsonValue;

import java.lang.reflect.Method;
import java.util.Set;

/**
 * Translates {@code mapping.containsValue(value)}.
 * <p>
 * Values are addressable only when the mapping is stored as an array of entries:
 * </p>
 * <ul>
 *   <li>{@link DictionaryRepresentation#ARRAY_OF_DOCUMENTS}: {@code { field: { $elemMatch: { v: value } } }}</li>
 *   <li>{@link DictionaryRepresentation#ARRAY_OF_ARRAYS}: {@code { field: { $elemMatch: { "1": value } } }}</li>
 * </ul>
 * <p>
 * A mapping stored as a document has unknown keys, so its values cannot be matched.
 * </p>
 *
 * @since 1.0.0
 */
public final class ContainsValueMethodToFilterTranslator implements MethodCallToFilterTranslator {

    public static final ContainsValueMethodToFilterTranslator INSTANCE = new ContainsValueMethodToFilterTranslator();

    private ContainsValueMethodToFilterTranslator() {
    }

    @Override
    public Set<String> supportedMethodNames() {
        return Set.of("containsValue");
    }

    @Override
    public boolean canTranslate(Method method) {
        return MethodSignatures.isPredicateMethod(method, "containsValue", 1);
    }

    @Override
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                MethodCallExpression call) {
        TranslatedField field = FilterFieldResolver.resolve(context, call.target());
        if (!(field.serializer() instanceof DictionarySerializer<?> dictionarySerializer)) {
            throw new SerializerCapabilityException(call, field.serializer().getClass(), DictionarySerializer.class);
        }

        String valueElement = switch (dictionarySerializer.representation()) {
            case ARRAY_OF_DOCUMENTS -> DictionaryRepresentation.VALUE_ELEMENT;
            case ARRAY_OF_ARRAYS -> "1";
            case DOCUMENT -> throw new UnsupportedRepresentationException(call, "containsValue",
                    dictionarySerializer.representation());
        };

        if (!(call.argument(0) instanceof ConstantExpression constant)) {
            throw new ExpressionNotSupportedException(call, "value must be a constant");
        }
        BsonValue value;
        try {
            value = SerializationHelper.serializeValue(dictionarySerializer.valueSerializer(), constant.value());
        } catch (IllegalArgumentException e) {
            throw new ExpressionNotSupportedException(call, e.getMessage(), e);
        }
        return Filters.elemMatch(field.path(), Filters.eq(FieldPath.of(valueElement), value));
    }
}
