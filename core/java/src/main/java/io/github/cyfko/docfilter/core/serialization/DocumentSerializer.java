package io.github.cyfko.docfilter.core.serialization;

import java.util.Optional;

/**
 * Capability of serializers that store a value as a document with named members.
 *
 * @param <T> the serialized Java type
 * @since 1.0.0
 */
public interface DocumentSerializer<T> extends ValueSerializer<T> {

    /**
     * Looks up how a member is serialized.
     *
     * @param memberName the member name as declared on the object model
     * @return the serialization info, or empty if the member is not mapped
     */
    Optional<MemberSerializationInfo> memberSerializationInfo(String memberName);
}
