package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonDateTime;
import org.bson.BsonValue;

import java.time.Instant;

/**
 * Serializes instants as BSON date-times, truncated to milliseconds.
 *
 * @since 1.0.0
 */
public final class InstantSerializer implements ValueSerializer<Instant> {

    public static final InstantSerializer INSTANCE = new InstantSerializer();

    private InstantSerializer() {
    }

    @Override
    public Class<Instant> valueType() {
        return Instant.class;
    }

    @Override
    public BsonValue serialize(Instant value) {
        return new BsonDateTime(value.toEpochMilli());
    }

    @Override
    public String toString() {
        return "InstantSerializer";
    }
}
