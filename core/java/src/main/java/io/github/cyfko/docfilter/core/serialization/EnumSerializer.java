package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;

import java.util.Objects;

/**
 * Serializes enum constants either by name or by ordinal.
 *
 * <pre>{@code
 * new EnumSerializer<>(Status.class, EnumSerializer.Representation.STRING);  // "ACTIVE"
 * new EnumSerializer<>(Status.class, EnumSerializer.Representation.ORDINAL); // 0
 * }</pre>
 *
 * @param <E> the enum type
 * @since 1.0.0
 */
public final class EnumSerializer<E extends Enum<E>> implements ValueSerializer<E> {

    /** Storage form of enum constants. */
    public enum Representation {
        STRING,
        ORDINAL
    }

    private final Class<E> enumType;
    private final Representation representation;

    public EnumSerializer(Class<E> enumType, Representation representation) {
        this.enumType = Objects.requireNonNull(enumType, "enumType");
        this.representation = Objects.requireNonNull(representation, "representation");
    }

    public Representation getRepresentation() {
        return representation;
    }

    @Override
    public Class<E> valueType() {
        return enumType;
    }

    @Override
    public BsonValue serialize(E value) {
        return representation == Representation.STRING
                ? new BsonString(value.name())
                : new BsonInt32(value.ordinal());
    }

    @Override
    public String toString() {
        return "EnumSerializer<" + enumType.getSimpleName() + ", " + representation + ">";
    }
}
