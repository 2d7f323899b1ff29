package io.github.cyfko.docfilter.core.translate.field;

import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.serialization.ValueSerializer;

import java.util.Objects;

/**
 * A resolved field: its path in the serialized document plus the serializer governing the
 * values stored there.
 *
 * @param path       the resolved path
 * @param serializer the serializer of the field value
 * @since 1.0.0
 */
public record TranslatedField(FieldPath path, ValueSerializer<?> serializer) {

    public TranslatedField {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(serializer, "serializer");
    }

    /**
     * Returns a field one level deeper.
     *
     * @param elementName   the sub-field name
     * @param subSerializer the serializer of the sub-field value
     * @return the sub-field
     */
    public TranslatedField subField(String elementName, ValueSerializer<?> subSerializer) {
        return new TranslatedField(path.subField(elementName), subSerializer);
    }

    /**
     * Two translated fields are path-equal when their paths are equal, regardless of serializers.
     *
     * @param other another field
     * @return {@code true} if both fields denote the same path
     */
    public boolean isPathEqual(TranslatedField other) {
        return other != null && path.equals(other.path);
    }
}
