package io.github.cyfko.docfilter.core.serialization;

import io.github.cyfko.docfilter.core.expression.Expressions;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Explicit, statically typed registry of serializers, passed by reference to the translation
 * engine.
 * <p>
 * The registry supplies the serializer of the root document type of a predicate. It is immutable
 * once built and can be shared between threads.
 * </p>
 *
 * <pre>{@code
 * SerializerRegistry registry = SerializerRegistry.builder()
 *     .register(Person.class, new ClassMapSerializer<>(personMap))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SerializerRegistry {

    private final Map<Class<?>, ValueSerializer<?>> serializers;

    private SerializerRegistry(Map<Class<?>, ValueSerializer<?>> serializers) {
        this.serializers = Collections.unmodifiableMap(new HashMap<>(serializers));
    }

    /**
     * Creates a builder pre-populated with the scalar serializers.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up the serializer registered for a type. Primitive types resolve to their wrapper's
     * serializer.
     *
     * @param type the Java type
     * @return the serializer, or empty if none is registered
     */
    public Optional<ValueSerializer<?>> lookup(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return Optional.ofNullable(serializers.get(Expressions.box(type)));
    }

    /**
     * Returns the serializer registered for a type.
     *
     * @param type the Java type
     * @return the serializer
     * @throws IllegalArgumentException if no serializer is registered for {@code type}
     */
    public ValueSerializer<?> serializerFor(Class<?> type) {
        return lookup(type).orElseThrow(() ->
                new IllegalArgumentException("No serializer registered for " + type.getName()));
    }

    /**
     * Builder for {@link SerializerRegistry}.
     */
    public static final class Builder {
        private final Map<Class<?>, ValueSerializer<?>> serializers = new HashMap<>();

        private Builder() {
            serializers.put(String.class, StringSerializer.INSTANCE);
            serializers.put(Integer.class, Int32Serializer.INSTANCE);
            serializers.put(Long.class, Int64Serializer.INSTANCE);
            serializers.put(Double.class, DoubleSerializer.INSTANCE);
            serializers.put(Boolean.class, BooleanSerializer.INSTANCE);
            serializers.put(Instant.class, InstantSerializer.INSTANCE);
        }

        /**
         * Registers (or replaces) the serializer of a type.
         *
         * @param type       the Java type
         * @param serializer its serializer
         * @param <T>        the type
         * @return this builder
         */
        public <T> Builder register(Class<T> type, ValueSerializer<? extends T> serializer) {
            serializers.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(serializer, "serializer"));
            return this;
        }

        public SerializerRegistry build() {
            return new SerializerRegistry(serializers);
        }
    }
}
