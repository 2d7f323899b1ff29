package io.github.cyfko.docfilter.core.spi;

import io.github.cyfko.docfilter.core.translate.method.AnyMatchMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.ContainsKeyMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.ContainsMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.ContainsValueMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.EqualsMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.IsEmptyMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.StringMethodToFilterTranslator;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of {@link MethodCallToFilterTranslator}s, keyed by method name.
 * <p>
 * For a given call, the registry looks up the translators registered under the method name and
 * returns the first, in registration order, whose structural guard accepts the method. Guards of
 * translators sharing a name are expected to be disjoint (e.g. {@code String.contains} versus
 * {@code Collection.contains}), so at most one translator claims any call shape.
 * </p>
 *
 * <p><strong>Immutability:</strong> registries are built once and never change, so they can be
 * shared between threads without synchronization.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * // Built-in translators only
 * MethodCallTranslatorRegistry registry = MethodCallTranslatorRegistry.defaults();
 *
 * // Built-ins plus a custom translator
 * MethodCallTranslatorRegistry extended = MethodCallTranslatorRegistry.builder()
 *     .registerDefaults()
 *     .register(new StartsWithIgnoreCaseTranslator())
 *     .build();
 *
 * Optional<MethodCallToFilterTranslator> translator = extended.find(call.method());
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MethodCallTranslatorRegistry {

    private static final MethodCallTranslatorRegistry DEFAULTS = builder().registerDefaults().build();

    private final Map<String, List<MethodCallToFilterTranslator>> translators;

    private MethodCallTranslatorRegistry(Map<String, List<MethodCallToFilterTranslator>> translators) {
        Map<String, List<MethodCallToFilterTranslator>> copy = new HashMap<>();
        translators.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        this.translators = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the registry of built-in translators.
     *
     * @return the shared default registry
     */
    public static MethodCallTranslatorRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the translator claiming a method.
     *
     * @param method the invoked method
     * @return the claiming translator, or empty if none structurally matches
     */
    public Optional<MethodCallToFilterTranslator> find(Method method) {
        Objects.requireNonNull(method, "method");
        return translators.getOrDefault(method.getName(), List.of()).stream()
                .filter(translator -> translator.canTranslate(method))
                .findFirst();
    }

    /**
     * Returns the translators registered under a method name, in registration order.
     *
     * @param methodName the method name
     * @return the translators, possibly empty
     */
    public List<MethodCallToFilterTranslator> getTranslators(String methodName) {
        return translators.getOrDefault(methodName, List.of());
    }

    /**
     * Returns a snapshot of all method names with at least one translator, useful for
     * diagnostics.
     *
     * @return the registered method names
     */
    public Set<String> getAllRegisteredMethodNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(translators.keySet()));
    }

    /**
     * Builder for {@link MethodCallTranslatorRegistry}.
     */
    public static final class Builder {
        private final Map<String, List<MethodCallToFilterTranslator>> translators = new HashMap<>();
        private final List<MethodCallToFilterTranslator> registered = new ArrayList<>();

        private Builder() {
        }

        /**
         * Registers a translator under each of its method names.
         *
         * @param translator the translator
         * @return this builder
         * @throws IllegalArgumentException if the same instance is already registered, or it declares no method name
         */
        public Builder register(MethodCallToFilterTranslator translator) {
            Objects.requireNonNull(translator, "translator");
            if (registered.stream().anyMatch(t -> t == translator)) {
                throw new IllegalArgumentException("Translator [" + translator.getClass().getName() + "] is already registered.");
            }
            Set<String> names = Objects.requireNonNull(translator.supportedMethodNames(), "supportedMethodNames");
            if (names.isEmpty()) {
                throw new IllegalArgumentException("Translator [" + translator.getClass().getName() + "] declares no method name.");
            }
            registered.add(translator);
            for (String name : names) {
                translators.computeIfAbsent(name, n -> new ArrayList<>()).add(translator);
            }
            return this;
        }

        /**
         * Registers the built-in translators.
         *
         * @return this builder
         */
        public Builder registerDefaults() {
            return register(ContainsKeyMethodToFilterTranslator.INSTANCE)
                    .register(ContainsValueMethodToFilterTranslator.INSTANCE)
                    .register(StringMethodToFilterTranslator.INSTANCE)
                    .register(ContainsMethodToFilterTranslator.INSTANCE)
                    .register(EqualsMethodToFilterTranslator.INSTANCE)
                    .register(IsEmptyMethodToFilterTranslator.INSTANCE)
                    .register(AnyMatchMethodToFilterTranslator.INSTANCE);
        }

        public MethodCallTranslatorRegistry build() {
            return new MethodCallTranslatorRegistry(translators);
        }
    }
}
