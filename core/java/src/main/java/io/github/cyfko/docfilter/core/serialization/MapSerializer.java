package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.Map;
import java.util.Objects;

/**
 * Serializes maps according to a configured {@link DictionaryRepresentation}.
 * <p>
 * The representation is chosen once, when the model is configured, and cannot change afterwards:
 * </p>
 * <pre>{@code
 * MapSerializer<String, Integer> tags = new MapSerializer<>(
 *     DictionaryRepresentation.DOCUMENT, StringSerializer.INSTANCE, Int32Serializer.INSTANCE);
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 * @since 1.0.0
 */
public final class MapSerializer<K, V> implements DictionarySerializer<Map<K, V>> {

    private final DictionaryRepresentation representation;
    private final ValueSerializer<K> keySerializer;
    private final ValueSerializer<V> valueSerializer;

    public MapSerializer(DictionaryRepresentation representation,
                         ValueSerializer<K> keySerializer,
                         ValueSerializer<V> valueSerializer) {
        this.representation = Objects.requireNonNull(representation, "representation");
        this.keySerializer = Objects.requireNonNull(keySerializer, "keySerializer");
        this.valueSerializer = Objects.requireNonNull(valueSerializer, "valueSerializer");
    }

    /**
     * Returns a serializer identical to this one except for its representation.
     *
     * @param newRepresentation the representation of the new serializer
     * @return a new serializer
     */
    public MapSerializer<K, V> withRepresentation(DictionaryRepresentation newRepresentation) {
        return new MapSerializer<>(newRepresentation, keySerializer, valueSerializer);
    }

    @Override
    public DictionaryRepresentation representation() {
        return representation;
    }

    @Override
    public ValueSerializer<K> keySerializer() {
        return keySerializer;
    }

    @Override
    public ValueSerializer<V> valueSerializer() {
        return valueSerializer;
    }

    @Override
    public Class<Map<K, V>> valueType() {
        return SerializationHelper.parameterizedClass(Map.class);
    }

    @Override
    public BsonValue serialize(Map<K, V> value) {
        return switch (representation) {
            case DOCUMENT -> serializeAsDocument(value);
            case ARRAY_OF_ARRAYS -> serializeAsArrayOfArrays(value);
            case ARRAY_OF_DOCUMENTS -> serializeAsArrayOfDocuments(value);
        };
    }

    private BsonDocument serializeAsDocument(Map<K, V> value) {
        BsonDocument document = new BsonDocument();
        for (Map.Entry<K, V> entry : value.entrySet()) {
            BsonValue key = SerializationHelper.serializeValue(keySerializer, entry.getKey());
            if (!key.isString()) {
                throw new IllegalArgumentException("When using DictionaryRepresentation.DOCUMENT key values must serialize as strings, got "
                        + key.getBsonType());
            }
            document.put(key.asString().getValue(), SerializationHelper.serializeValue(valueSerializer, entry.getValue()));
        }
        return document;
    }

    private BsonArray serializeAsArrayOfArrays(Map<K, V> value) {
        BsonArray array = new BsonArray();
        for (Map.Entry<K, V> entry : value.entrySet()) {
            BsonArray pair = new BsonArray();
            pair.add(SerializationHelper.serializeValue(keySerializer, entry.getKey()));
            pair.add(SerializationHelper.serializeValue(valueSerializer, entry.getValue()));
            array.add(pair);
        }
        return array;
    }

    private BsonArray serializeAsArrayOfDocuments(Map<K, V> value) {
        BsonArray array = new BsonArray();
        for (Map.Entry<K, V> entry : value.entrySet()) {
            array.add(new BsonDocument()
                    .append(DictionaryRepresentation.KEY_ELEMENT, SerializationHelper.serializeValue(keySerializer, entry.getKey()))
                    .append(DictionaryRepresentation.VALUE_ELEMENT, SerializationHelper.serializeValue(valueSerializer, entry.getValue())));
        }
        return array;
    }

    @Override
    public String toString() {
        return "MapSerializer<" + representation + ", " + keySerializer + ", " + valueSerializer + ">";
    }
}
