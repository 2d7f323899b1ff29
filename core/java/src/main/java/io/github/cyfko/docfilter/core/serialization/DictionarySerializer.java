package io.github.cyfko.docfilter.core.serialization;

/**
 * Capability of serializers that store a key/value mapping.
 * <p>
 * The {@linkplain #representation() representation} is fixed when the serializer is configured
 * and decides which filters can be expressed against the mapping: key-existence tests, for
 * instance, only map to a sub-field existence check under {@link DictionaryRepresentation#DOCUMENT}.
 * </p>
 *
 * @param <T> the serialized Java type
 * @since 1.0.0
 */
public interface DictionarySerializer<T> extends ValueSerializer<T> {

    /**
     * @return the on-wire representation of the mapping
     */
    DictionaryRepresentation representation();

    /**
     * @return the serializer of the mapping keys
     */
    ValueSerializer<?> keySerializer();

    /**
     * @return the serializer of the mapping values
     */
    ValueSerializer<?> valueSerializer();
}
