package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonInt64;
import org.bson.BsonValue;

/**
 * Serializes longs as 64-bit BSON integers.
 *
 * @since 1.0.0
 */
public final class Int64Serializer implements ValueSerializer<Long> {

    public static final Int64Serializer INSTANCE = new Int64Serializer();

    private Int64Serializer() {
    }

    @Override
    public Class<Long> valueType() {
        return Long.class;
    }

    @Override
    public BsonValue serialize(Long value) {
        return new BsonInt64(value);
    }

    @Override
    public String toString() {
        return "Int64Serializer";
    }
}
