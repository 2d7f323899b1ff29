package io.github.cyfko.docfilter.core;

import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.config.TranslatorConfig;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.expression.LambdaExpression;
import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;
import io.github.cyfko.docfilter.core.serialization.SerializerRegistry;
import io.github.cyfko.docfilter.core.serialization.ValueSerializer;
import io.github.cyfko.docfilter.core.spi.MethodCallTranslatorRegistry;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import org.bson.BsonDocument;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point translating predicate lambdas over a document model into query filters.
 * <p>
 * A translator binds together the model's {@link SerializerRegistry}, a {@link TranslatorConfig}
 * and the {@link MethodCallTranslatorRegistry} of supported method calls. It holds no mutable
 * state and can be shared by any number of threads.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ClassMap<Person> personMap = ClassMap.builder(Person.class)
 *     .map("tags", "Tags", new MapSerializer<>(DictionaryRepresentation.DOCUMENT,
 *             StringSerializer.INSTANCE, StringSerializer.INSTANCE))
 *     .build();
 * SerializerRegistry registry = SerializerRegistry.builder()
 *     .register(Person.class, new ClassMapSerializer<>(personMap))
 *     .build();
 *
 * PredicateTranslator translator = PredicateTranslator.create(registry);
 *
 * ParameterExpression x = Expressions.parameter("x", Person.class);
 * LambdaExpression predicate = Expressions.lambda(
 *     Expressions.call(Expressions.member(x, "tags", Map.class), "containsKey", Expressions.constant("red")),
 *     x);
 *
 * BsonDocument query = translator.translateToDocument(predicate);
 * // { "Tags.red": { "$exists": true } }
 * }</pre>
 *
 * <p>Translation is all-or-nothing: any unsupported part of a predicate raises an
 * {@link ExpressionNotSupportedException} and no filter is produced.</p>
 *
 * @since 1.0.0
 */
public final class PredicateTranslator {

    private static final Logger log = Logger.getLogger(PredicateTranslator.class.getName());

    private final SerializerRegistry serializerRegistry;
    private final TranslatorConfig config;
    private final ExpressionToFilterTranslator dispatcher;

    private PredicateTranslator(SerializerRegistry serializerRegistry, TranslatorConfig config,
                                MethodCallTranslatorRegistry translatorRegistry) {
        this.serializerRegistry = Objects.requireNonNull(serializerRegistry, "serializerRegistry");
        this.config = Objects.requireNonNull(config, "config");
        this.dispatcher = new ExpressionToFilterTranslator(Objects.requireNonNull(translatorRegistry, "translatorRegistry"));
    }

    /**
     * Creates a translator with default configuration and the built-in method translators.
     *
     * @param serializerRegistry the serializers of the model
     * @return the translator
     */
    public static PredicateTranslator create(SerializerRegistry serializerRegistry) {
        return create(serializerRegistry, TranslatorConfig.defaults());
    }

    public static PredicateTranslator create(SerializerRegistry serializerRegistry, TranslatorConfig config) {
        return create(serializerRegistry, config, MethodCallTranslatorRegistry.defaults());
    }

    /**
     * Creates a fully configured translator.
     *
     * @param serializerRegistry the serializers of the model
     * @param config             the translation configuration
     * @param translatorRegistry the method call translators
     * @return the translator
     */
    public static PredicateTranslator create(SerializerRegistry serializerRegistry, TranslatorConfig config,
                                             MethodCallTranslatorRegistry translatorRegistry) {
        return new PredicateTranslator(serializerRegistry, config, translatorRegistry);
    }

    /**
     * Translates a root predicate into a filter.
     *
     * @param predicate a one-parameter boolean lambda over a registered document type
     * @return the filter
     * @throws ExpressionNotSupportedException if the predicate, or any part of it, cannot be translated
     */
    public FilterNode translate(LambdaExpression predicate) {
        Objects.requireNonNull(predicate, "predicate");
        if (predicate.parameters().size() != 1) {
            throw new ExpressionNotSupportedException(predicate, "a predicate must declare exactly one parameter");
        }
        ParameterExpression parameter = predicate.parameter();
        ValueSerializer<?> documentSerializer = serializerRegistry.lookup(parameter.type()).orElseThrow(() ->
                new ExpressionNotSupportedException(predicate,
                        "no serializer is registered for " + parameter.type().getName()));

        TranslationContext context = TranslationContext.create(serializerRegistry, config);
        try {
            return dispatcher.translateLambda(context, predicate, new TranslatedField(FieldPath.empty(), documentSerializer));
        } catch (ExpressionNotSupportedException e) {
            log.fine(() -> "Predicate " + predicate + " rejected: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Translates a root predicate and renders it as a query document.
     *
     * @param predicate a one-parameter boolean lambda over a registered document type
     * @return the query document
     * @throws ExpressionNotSupportedException if the predicate cannot be translated
     */
    public BsonDocument translateToDocument(LambdaExpression predicate) {
        return BsonFilterRenderer.render(translate(predicate));
    }

    public SerializerRegistry getSerializerRegistry() {
        return serializerRegistry;
    }

    public TranslatorConfig getConfig() {
        return config;
    }

    public MethodCallTranslatorRegistry getTranslatorRegistry() {
        return dispatcher.getTranslatorRegistry();
    }
}
