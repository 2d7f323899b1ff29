package io.github.cyfko.docfilter.core.serialization;

import java.util.Objects;

/**
 * Serialization information of an object member: the element name it is stored under and the
 * serializer of its value.
 *
 * @param elementName the element name in the serialized document
 * @param serializer  the serializer of the member value
 * @since 1.0.0
 */
public record MemberSerializationInfo(String elementName, ValueSerializer<?> serializer) {

    public MemberSerializationInfo {
        Objects.requireNonNull(elementName, "Element name cannot be null");
        Objects.requireNonNull(serializer, "Serializer cannot be null");
        if (elementName.isBlank()) {
            throw new IllegalArgumentException("Element name cannot be blank");
        }
    }
}
