package io.github.cyfko.docfilter.core.translate;

import io.github.cyfko.docfilter.core.config.TranslatorConfig;
import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.serialization.SerializerRegistry;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable state threaded through the translation of one root predicate.
 * <p>
 * A context is never modified: entering a nested lambda or a deeper expression yields a new
 * context that shares everything else with its parent. Parameter bindings are kept in a
 * persistent linked list, innermost scope first, so that extending a context is cheap and the
 * parent remains valid.
 * </p>
 *
 * <pre>{@code
 * TranslationContext root = TranslationContext.create(registry, TranslatorConfig.defaults())
 *     .withSymbol(new Symbol(x, rootField, Symbol.Kind.DOCUMENT));
 * TranslationContext inner = root.withSymbol(new Symbol(item, itemField, Symbol.Kind.ELEMENT));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TranslationContext {

    private final SerializerRegistry serializerRegistry;
    private final TranslatorConfig config;
    private final Scope scope;
    private final int depth;

    private TranslationContext(SerializerRegistry serializerRegistry, TranslatorConfig config, Scope scope, int depth) {
        this.serializerRegistry = serializerRegistry;
        this.config = config;
        this.scope = scope;
        this.depth = depth;
    }

    /**
     * Creates an empty context.
     *
     * @param serializerRegistry the serializers of the model
     * @param config             the translation configuration
     * @return a context with no bound parameter
     */
    public static TranslationContext create(SerializerRegistry serializerRegistry, TranslatorConfig config) {
        return new TranslationContext(
                Objects.requireNonNull(serializerRegistry, "serializerRegistry"),
                Objects.requireNonNull(config, "config"),
                null,
                0);
    }

    public SerializerRegistry getSerializerRegistry() {
        return serializerRegistry;
    }

    public TranslatorConfig getConfig() {
        return config;
    }

    /**
     * @return the nesting depth of the expression being translated
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Returns a context where {@code symbol} shadows any existing binding of the same parameter.
     *
     * @param symbol the new binding
     * @return the extended context
     */
    public TranslationContext withSymbol(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        return new TranslationContext(serializerRegistry, config, new Scope(symbol, scope), depth);
    }

    /**
     * Returns a context where {@code symbol} is the only binding in scope.
     * <p>
     * Used for element predicates: fields inside an {@code $elemMatch} are relative to the array
     * element, so outer parameters must not resolve there.
     * </p>
     *
     * @param symbol the sole binding
     * @return the isolated context
     */
    public TranslationContext withIsolatedSymbol(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        return new TranslationContext(serializerRegistry, config, new Scope(symbol, null), depth);
    }

    /**
     * Returns a context one nesting level deeper.
     *
     * @return the nested context
     */
    public TranslationContext nested() {
        return new TranslationContext(serializerRegistry, config, scope, depth + 1);
    }

    /**
     * Finds the innermost binding of a parameter.
     *
     * @param parameter the parameter
     * @return the binding, or empty if the parameter is not in scope
     */
    public Optional<Symbol> lookup(ParameterExpression parameter) {
        for (Scope s = scope; s != null; s = s.parent) {
            if (s.symbol.parameter().equals(parameter)) {
                return Optional.of(s.symbol);
            }
        }
        return Optional.empty();
    }

    private record Scope(Symbol symbol, Scope parent) {
    }
}
