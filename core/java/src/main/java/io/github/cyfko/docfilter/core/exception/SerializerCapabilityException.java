package io.github.cyfko.docfilter.core.exception;

import io.github.cyfko.docfilter.core.expression.Expression;

/**
 * Thrown when the serializer of a resolved field lacks a capability the translator requires,
 * e.g. a {@code containsKey} call on a field whose serializer is not a dictionary serializer.
 * The message names the concrete serializer class.
 *
 * @since 1.0.0
 */
public class SerializerCapabilityException extends ExpressionNotSupportedException {

    private final Class<?> serializerType;
    private final Class<?> requiredCapability;

    public SerializerCapabilityException(Expression expression, Class<?> serializerType, Class<?> requiredCapability) {
        super(expression, "class " + serializerType.getName() + " does not implement the "
                + requiredCapability.getSimpleName() + " interface");
        this.serializerType = serializerType;
        this.requiredCapability = requiredCapability;
    }

    /**
     * @return the concrete class of the field's serializer
     */
    public Class<?> getSerializerType() {
        return serializerType;
    }

    /**
     * @return the capability interface that was required
     */
    public Class<?> getRequiredCapability() {
        return requiredCapability;
    }
}
