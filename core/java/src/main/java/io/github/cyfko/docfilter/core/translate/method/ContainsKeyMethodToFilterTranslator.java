package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.exception.InvalidKeyArgumentException;
import io.github.cyfko.docfilter.core.exception.SerializerCapabilityException;
import io.github.cyfko.docfilter.core.exception.UnsupportedRepresentationException;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.serialization.DictionarySerializer;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;

import java.lang.reflect.Method;
import java.util.Set;

/**
 * Translates {@code mapping.containsKey(key)} into a key existence test.
 * <p>
 * The emitted filter depends on how the mapping is stored:
 * </p>
 * <table>
 *   <caption>containsKey by representation</caption>
 *   <tr><th>Representation</th><th>Filter</th></tr>
 *   <tr><td>{@link DictionaryRepresentation#DOCUMENT}</td>
 *       <td>{@code { "field.key": { $exists: true } }}</td></tr>
 *   <tr><td>{@link DictionaryRepresentation#ARRAY_OF_ARRAYS}</td><td>not supported</td></tr>
 *   <tr><td>{@link DictionaryRepresentation#ARRAY_OF_DOCUMENTS}</td><td>not supported</td></tr>
 * </table>
 * <p>
 * Any public, non-static {@code boolean containsKey(x)} is claimed, whatever its declaring type.
 * The key must be a constant that the mapping's key serializer turns into a string.
 * </p>
 * <p>
 * The serialized key is appended to the field path verbatim. A key containing {@code .} is
 * therefore read by the server as a nested path ({@code containsKey("a.b")} tests
 * {@code Tags.a.b}), and a key starting with {@code $} is read as an operator. Mappings whose keys
 * may contain these characters should not be stored as {@link DictionaryRepresentation#DOCUMENT}.
 * </p>
 *
 * <pre>{@code
 * // Tags is a Map<String, String> stored as a document
 * x -> x.tags.containsKey("red")      // { "Tags.red": { "$exists": true } }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ContainsKeyMethodToFilterTranslator implements MethodCallToFilterTranslator {

    public static final ContainsKeyMethodToFilterTranslator INSTANCE = new ContainsKeyMethodToFilterTranslator();

    private ContainsKeyMethodToFilterTranslator() {
    }

    @Override
    public Set<String> supportedMethodNames() {
        return Set.of("containsKey");
    }

    @Override
    public boolean canTranslate(Method method) {
        return MethodSignatures.isPredicateMethod(method, "containsKey", 1);
    }

    /**
     * {@inheritDoc}
     *
     * @throws SerializerCapabilityException      if the receiver's serializer is not a {@link DictionarySerializer}
     * @throws UnsupportedRepresentationException if the mapping is not stored as a document
     * @throws InvalidKeyArgumentException        if the key is not a constant serialized as a string
     */
    @Override
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                MethodCallExpression call) {
        TranslatedField field = FilterFieldResolver.resolve(context, call.target());
        if (!(field.serializer() instanceof DictionarySerializer<?> dictionarySerializer)) {
            throw new SerializerCapabilityException(call, field.serializer().getClass(), DictionarySerializer.class);
        }

        DictionaryRepresentation representation = dictionarySerializer.representation();
        if (representation != DictionaryRepresentation.DOCUMENT) {
            throw new UnsupportedRepresentationException(call, "containsKey", representation);
        }
        String key = FilterFieldResolver.serializeKeyAsString(call, call.argument(0), dictionarySerializer);
        return Filters.exists(field.path().subField(key));
    }
}
