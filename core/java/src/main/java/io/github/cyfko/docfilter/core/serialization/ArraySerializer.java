package io.github.cyfko.docfilter.core.serialization;

/**
 * Capability of serializers that store a value as an array.
 *
 * @param <T> the serialized Java type
 * @since 1.0.0
 */
public interface ArraySerializer<T> extends ValueSerializer<T> {

    /**
     * @return the serializer of the array items
     */
    ValueSerializer<?> itemSerializer();
}
