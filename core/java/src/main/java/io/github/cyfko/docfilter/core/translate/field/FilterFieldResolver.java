package io.github.cyfko.docfilter.core.translate.field;

import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.exception.InvalidKeyArgumentException;
import io.github.cyfko.docfilter.core.exception.UnresolvedFieldException;
import io.github.cyfko.docfilter.core.exception.UnsupportedRepresentationException;
import io.github.cyfko.docfilter.core.expression.ConstantExpression;
import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.expression.IndexExpression;
import io.github.cyfko.docfilter.core.expression.MemberExpression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.serialization.ArraySerializer;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.serialization.DictionarySerializer;
import io.github.cyfko.docfilter.core.serialization.DocumentSerializer;
import io.github.cyfko.docfilter.core.serialization.MemberSerializationInfo;
import io.github.cyfko.docfilter.core.serialization.SerializationHelper;
import io.github.cyfko.docfilter.core.translate.Symbol;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;
import org.bson.BsonValue;

import java.util.logging.Logger;

/**
 * Resolves member and indexer access chains into {@link TranslatedField}s.
 * <p>
 * Resolution is compositional: {@code x.a.b[k]} resolves {@code x} through the context, then
 * extends the path with the element name of member {@code a}, then of member {@code b}, then with
 * the serialized form of {@code k}. Each step asks the serializer of the previous step for the
 * capability it needs, so the resulting path always matches the serialized document layout.
 * </p>
 *
 * <h2>Supported steps</h2>
 * <ul>
 *   <li>a lambda parameter bound to an array element ({@code $elemMatch} scope)</li>
 *   <li>member access on a {@link DocumentSerializer}</li>
 *   <li>constant integer index on an {@link ArraySerializer}: {@code items[0]}, {@code items.get(0)}</li>
 *   <li>constant key on a {@link DictionarySerializer} stored as
 *       {@link DictionaryRepresentation#DOCUMENT}: {@code attrs["k"]}, {@code attrs.get("k")}</li>
 * </ul>
 *
 * <p>Anything else fails with {@link UnresolvedFieldException}. Resolution has no side effects.</p>
 *
 * @since 1.0.0
 */
public final class FilterFieldResolver {

    private static final Logger log = Logger.getLogger(FilterFieldResolver.class.getName());

    private FilterFieldResolver() {
        // Prevent instantiation
    }

    /**
     * Resolves an expression denoting a field.
     *
     * @param context    the translation context holding parameter bindings
     * @param expression the member/indexer access chain
     * @return the resolved field
     * @throws UnresolvedFieldException        if the expression is not a deterministic field path
     * @throws ExpressionNotSupportedException if a keyed step cannot be expressed for the field's representation
     */
    public static TranslatedField resolve(TranslationContext context, Expression expression) {
        TranslatedField field = resolve(context, expression, false);
        log.finer(() -> "Resolved " + expression + " to field " + field.path());
        return field;
    }

    /**
     * Tells whether an expression can be resolved as a field, without raising.
     *
     * @param context    the translation context
     * @param expression any expression
     * @return {@code true} if {@link #resolve(TranslationContext, Expression)} would succeed
     */
    public static boolean isField(TranslationContext context, Expression expression) {
        try {
            resolve(context, expression, false);
            return true;
        } catch (ExpressionNotSupportedException e) {
            log.finest(() -> expression + " is not a field: " + e.getReason());
            return false;
        }
    }

    private static TranslatedField resolve(TranslationContext context, Expression expression, boolean allowDocument) {
        if (expression instanceof ParameterExpression parameter) {
            return resolveParameter(context, parameter, allowDocument);
        }
        if (expression instanceof MemberExpression member) {
            return resolveMember(context, member);
        }
        if (expression instanceof IndexExpression index) {
            return resolveIndex(context, expression, index.target(), index.index());
        }
        if (expression instanceof MethodCallExpression call && MethodSignatures.isIndexerMethod(call.method())) {
            return resolveIndex(context, expression, call.target(), call.argument(0));
        }
        throw new UnresolvedFieldException(expression, "it does not denote a field of the document");
    }

    private static TranslatedField resolveParameter(TranslationContext context, ParameterExpression parameter,
                                                    boolean allowDocument) {
        Symbol symbol = context.lookup(parameter).orElseThrow(() ->
                new UnresolvedFieldException(parameter, "parameter " + parameter.name() + " is not in scope"));
        if (symbol.kind() == Symbol.Kind.DOCUMENT && !allowDocument) {
            throw new UnresolvedFieldException(parameter, "the document itself is not a field");
        }
        return symbol.field();
    }

    private static TranslatedField resolveMember(TranslationContext context, MemberExpression member) {
        TranslatedField container = resolve(context, member.target(), true);
        if (!(container.serializer() instanceof DocumentSerializer<?> documentSerializer)) {
            throw new UnresolvedFieldException(member, "serializer " + container.serializer()
                    + " of " + member.target() + " does not map members");
        }
        MemberSerializationInfo info = documentSerializer.memberSerializationInfo(member.memberName())
                .orElseThrow(() -> new UnresolvedFieldException(member, "member " + member.memberName()
                        + " is not mapped by " + documentSerializer));
        return container.subField(info.elementName(), info.serializer());
    }

    private static TranslatedField resolveIndex(TranslationContext context, Expression expression,
                                                Expression target, Expression index) {
        TranslatedField container = resolve(context, target, false);
        if (!(index instanceof ConstantExpression constant)) {
            throw new UnresolvedFieldException(expression, "index " + index + " must be a constant");
        }

        if (container.serializer() instanceof ArraySerializer<?> arraySerializer) {
            if (!(constant.value() instanceof Integer position) || position < 0) {
                throw new UnresolvedFieldException(expression, "array index must be a non-negative int constant");
            }
            return container.subField(String.valueOf(position), arraySerializer.itemSerializer());
        }

        if (container.serializer() instanceof DictionarySerializer<?> dictionarySerializer) {
            DictionaryRepresentation representation = dictionarySerializer.representation();
            if (representation != DictionaryRepresentation.DOCUMENT) {
                throw new UnsupportedRepresentationException(expression, "keyed access", representation);
            }
            String key = serializeKeyAsString(expression, constant, dictionarySerializer);
            return container.subField(key, dictionarySerializer.valueSerializer());
        }

        throw new UnresolvedFieldException(expression, "serializer " + container.serializer()
                + " of " + target + " is neither an array nor a dictionary serializer");
    }

    /**
     * Serializes a constant key through the key serializer of a dictionary and requires the
     * result to be a string.
     *
     * @param expression           the expression being translated, for diagnostics
     * @param key                  the key argument
     * @param dictionarySerializer the dictionary serializer
     * @return the serialized key
     * @throws InvalidKeyArgumentException if the key is not a constant or does not serialize to a string
     */
    public static String serializeKeyAsString(Expression expression, Expression key,
                                              DictionarySerializer<?> dictionarySerializer) {
        if (key instanceof ConstantExpression constant && constant.value() != null) {
            BsonValue serializedKey;
            try {
                serializedKey = SerializationHelper.serializeValue(dictionarySerializer.keySerializer(), constant.value());
            } catch (IllegalArgumentException e) {
                throw new InvalidKeyArgumentException(expression, key, e);
            }
            if (serializedKey.isString()) {
                return serializedKey.asString().getValue();
            }
        }
        throw new InvalidKeyArgumentException(expression, key);
    }
}
