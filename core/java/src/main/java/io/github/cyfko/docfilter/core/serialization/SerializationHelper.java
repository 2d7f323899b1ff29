package io.github.cyfko.docfilter.core.serialization;

import io.github.cyfko.docfilter.core.expression.Expressions;
import org.bson.BsonNull;
import org.bson.BsonValue;

import java.util.Objects;

/**
 * Helpers for serializing values through type-erased serializers.
 *
 * @since 1.0.0
 */
public final class SerializationHelper {

    private SerializationHelper() {
        // Prevent instantiation
    }

    /**
     * Serializes a value with a serializer whose type parameter is not statically known.
     * <p>
     * {@code null} serializes to {@link BsonNull#VALUE}.
     * </p>
     *
     * @param serializer the serializer
     * @param value      the value, possibly {@code null}
     * @return the serialized value
     * @throws IllegalArgumentException if the value is not an instance of the serializer's value type
     */
    @SuppressWarnings("unchecked") // checked by valueType.isInstance below
    public static BsonValue serializeValue(ValueSerializer<?> serializer, Object value) {
        Objects.requireNonNull(serializer, "serializer");
        if (value == null) {
            return BsonNull.VALUE;
        }
        Class<?> valueType = Expressions.box(serializer.valueType());
        value = widen(value, valueType);
        if (!valueType.isInstance(value)) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                    + " cannot be serialized by " + serializer + " (expects " + valueType.getName() + ")");
        }
        return ((ValueSerializer<Object>) serializer).serialize(value);
    }

    /**
     * Types a raw class literal as one of its parameterizations, e.g. {@code List.class} as
     * {@code Class<List<E>>}. Class literals cannot carry type arguments, so generic serializers
     * report their value type through this single unchecked cast.
     *
     * @param rawType the raw class
     * @param <T>     the parameterized type
     * @return {@code rawType}
     */
    @SuppressWarnings("unchecked")
    static <T> Class<T> parameterizedClass(Class<?> rawType) {
        return (Class<T>) rawType;
    }

    /**
     * Applies the lossless widening conversions Java applies to numeric primitives, so that an
     * {@code int} constant can be compared with a {@code long} or {@code double} field.
     */
    private static Object widen(Object value, Class<?> targetType) {
        if (!(value instanceof Number number) || targetType.isInstance(value)) {
            return value;
        }
        boolean integral = value instanceof Byte || value instanceof Short || value instanceof Integer;
        if (targetType == Integer.class && integral) {
            return number.intValue();
        }
        if (targetType == Long.class && (integral || value instanceof Long)) {
            return number.longValue();
        }
        if (targetType == Double.class && (integral || value instanceof Float)) {
            return number.doubleValue();
        }
        return value;
    }
}
