package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonDouble;
import org.bson.BsonValue;

/**
 * Serializes doubles as BSON doubles.
 *
 * @since 1.0.0
 */
public final class DoubleSerializer implements ValueSerializer<Double> {

    public static final DoubleSerializer INSTANCE = new DoubleSerializer();

    private DoubleSerializer() {
    }

    @Override
    public Class<Double> valueType() {
        return Double.class;
    }

    @Override
    public BsonValue serialize(Double value) {
        return new BsonDouble(value);
    }

    @Override
    public String toString() {
        return "DoubleSerializer";
    }
}
