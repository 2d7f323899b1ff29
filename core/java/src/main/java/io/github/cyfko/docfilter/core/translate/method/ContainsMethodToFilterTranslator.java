package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.exception.SerializerCapabilityException;
import io.github.cyfko.docfilter.core.expression.ConstantExpression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.serialization.ArraySerializer;
import io.github.cyfko.docfilter.core.serialization.SerializationHelper;
import io.github.cyfko.docfilter.core.serialization.ValueSerializer;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;
import org.bson.BsonValue;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Translates {@code Collection.contains(x)} in its two useful forms.
 * <ul>
 *   <li>array field, constant item: {@code x.tags.contains("red")} becomes
 *       {@code { "Tags": "red" }}, which matches arrays holding the item</li>
 *   <li>constant collection, field item: {@code List.of("a", "b").contains(x.code)} becomes
 *       {@code { "Code": { "$in": ["a", "b"] } }}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ContainsMethodToFilterTranslator implements MethodCallToFilterTranslator {

    public static final ContainsMethodToFilterTranslator INSTANCE = new ContainsMethodToFilterTranslator();

    private ContainsMethodToFilterTranslator() {
    }

    @Override
    public Set<String> supportedMethodNames() {
        return Set.of("contains");
    }

    @Override
    public boolean canTranslate(Method method) {
        return Collection.class.isAssignableFrom(method.getDeclaringClass())
                && MethodSignatures.isPredicateMethod(method, "contains", 1);
    }

    @Override
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                MethodCallExpression call) {
        if (call.target() instanceof ConstantExpression constant) {
            return translateMembership(context, call, constant);
        }

        TranslatedField field = FilterFieldResolver.resolve(context, call.target());
        if (!(field.serializer() instanceof ArraySerializer<?> arraySerializer)) {
            throw new SerializerCapabilityException(call, field.serializer().getClass(), ArraySerializer.class);
        }
        if (!(call.argument(0) instanceof ConstantExpression item)) {
            throw new ExpressionNotSupportedException(call, "item must be a constant");
        }
        return Filters.eq(field.path(), serialize(call, arraySerializer.itemSerializer(), item.value()));
    }

    private FilterNode translateMembership(TranslationContext context, MethodCallExpression call,
                                           ConstantExpression collection) {
        if (!(collection.value() instanceof Collection<?> candidates)) {
            throw new ExpressionNotSupportedException(call, "receiver must be a non-null constant collection");
        }
        TranslatedField field = FilterFieldResolver.resolve(context, call.argument(0));
        List<BsonValue> values = new ArrayList<>(candidates.size());
        for (Object candidate : candidates) {
            values.add(serialize(call, field.serializer(), candidate));
        }
        return Filters.in(field.path(), values);
    }

    private static BsonValue serialize(MethodCallExpression call, ValueSerializer<?> serializer, Object value) {
        try {
            return SerializationHelper.serializeValue(serializer, value);
        } catch (IllegalArgumentException e) {
            throw new ExpressionNotSupportedException(call, e.getMessage(), e);
        }
    }
}
