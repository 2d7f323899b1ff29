package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * Serializes strings as BSON strings.
 *
 * @since 1.0.0
 */
public final class StringSerializer implements ValueSerializer<String> {

    public static final StringSerializer INSTANCE = new StringSerializer();

    private StringSerializer() {
    }

    @Override
    public Class<String> valueType() {
        return String.class;
    }

    @Override
    public BsonValue serialize(String value) {
        return new BsonString(value);
    }

    @Override
    public String toString() {
        return "StringSerializer";
    }
}
