package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonValue;

/**
 * Serializer of a value type into its document representation.
 * <p>
 * The translation engine only uses serializers to encode constants the way the corresponding
 * field is stored, and to discover capabilities through the sub-interfaces
 * {@link DocumentSerializer}, {@link ArraySerializer} and {@link DictionarySerializer}. Concrete
 * serializer classes are never inspected beyond these interfaces.
 * </p>
 * <p>
 * Implementations must be immutable and therefore safe to share between concurrent translations.
 * </p>
 *
 * @param <T> the serialized Java type
 * @since 1.0.0
 */
public interface ValueSerializer<T> {

    /**
     * Returns the Java type handled by this serializer.
     *
     * @return the value type, never a primitive
     */
    Class<T> valueType();

    /**
     * Serializes a non-null value.
     *
     * @param value the value to serialize
     * @return the serialized form
     */
    BsonValue serialize(T value);
}
