package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonInt32;
import org.bson.BsonValue;

/**
 * Serializes integers as 32-bit BSON integers.
 *
 * @since 1.0.0
 */
public final class Int32Serializer implements ValueSerializer<Integer> {

    public static final Int32Serializer INSTANCE = new Int32Serializer();

    private Int32Serializer() {
    }

    @Override
    public Class<Integer> valueType() {
        return Integer.class;
    }

    @Override
    public BsonValue serialize(Integer value) {
        return new BsonInt32(value);
    }

    @Override
    public String toString() {
        return "Int32Serializer";
    }
}
