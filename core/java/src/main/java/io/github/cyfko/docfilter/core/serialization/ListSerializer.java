package io.github.cyfko.docfilter.core.serialization;

import org.bson.BsonArray;
import org.bson.BsonValue;

import java.util.List;
import java.util.Objects;

/**
 * Serializes lists as BSON arrays, delegating each item to an item serializer.
 *
 * @param <E> the item type
 * @since 1.0.0
 */
public final class ListSerializer<E> implements ArraySerializer<List<E>> {

    private final ValueSerializer<E> itemSerializer;

    public ListSerializer(ValueSerializer<E> itemSerializer) {
        this.itemSerializer = Objects.requireNonNull(itemSerializer, "itemSerializer");
    }

    @Override
    public Class<List<E>> valueType() {
        return SerializationHelper.parameterizedClass(List.class);
    }

    @Override
    public ValueSerializer<E> itemSerializer() {
        return itemSerializer;
    }

    @Override
    public BsonValue serialize(List<E> value) {
        BsonArray array = new BsonArray();
        for (E item : value) {
            array.add(SerializationHelper.serializeValue(itemSerializer, item));
        }
        return array;
    }

    @Override
    public String toString() {
        return "ListSerializer<" + itemSerializer + ">";
    }
}
