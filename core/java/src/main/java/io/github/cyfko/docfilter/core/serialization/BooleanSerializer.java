package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonBoolean;
import org.bson.BsonValue;

/**
 * Serializes booleans as BSON booleans.
 *
 * @since 1.0.0
 */
public final class BooleanSerializer implements ValueSerializer<Boolean> {

    public static final BooleanSerializer INSTANCE = new BooleanSerializer();

    private BooleanSerializer() {
    }

    @Override
    public Class<Boolean> valueType() {
        return Boolean.class;
    }

    @Override
    public BsonValue serialize(Boolean value) {
        return new BsonBoolean(value);
    }

    @Override
    public String toString() {
        return "BooleanSerializer";
    }
}
