package io.github.cyfko.docfilter.core.translate.operator;

import io.github.cyfko.docfilter.core.ast.ComparisonOperator;
import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.exception.UnsupportedRepresentationException;
import io.github.cyfko.docfilter.core.expression.BinaryExpression;
import io.github.cyfko.docfilter.core.expression.BinaryExpression.Operator;
import io.github.cyfko.docfilter.core.expression.ConstantExpression;
import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.serialization.ArraySerializer;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.serialization.DictionarySerializer;
import io.github.cyfko.docfilter.core.serialization.SerializationHelper;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.FilterFieldResolver;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import io.github.cyfko.docfilter.core.utils.MethodSignatures;
import org.bson.BsonValue;

import java.util.logging.Logger;

/**
 * Translates comparison expressions ({@code ==, !=, <, <=, >, >=}).
 *
 * <p>Three shapes are recognized, tried in this order:</p>
 * <ol>
 *   <li><strong>compareTo</strong>: {@code a.compareTo(b) OP 0} is translated as {@code a OP b}.</li>
 *   <li><strong>array size</strong>: {@code items.size() OP n} with a constant {@code n} becomes
 *       a {@code $size} test for equality, or an existence test on element {@code n} or
 *       {@code n - 1} for ordering operators.</li>
 *   <li><strong>field against constant</strong>: the constant is serialized with the field's
 *       serializer. A constant on the left is moved to the right and the operator mirrored.</li>
 * </ol>
 *
 * <pre>{@code
 * x.age > 18                 // { "Age": { "$gt": 18 } }
 * 18 < x.age                 // same
 * x.name.compareTo("m") >= 0 // { "Name": { "$gte": "m" } }
 * x.items.size() > 2         // { "Items.2": { "$exists": true } }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ComparisonExpressionToFilterTranslator {

    public static final ComparisonExpressionToFilterTranslator INSTANCE = new ComparisonExpressionToFilterTranslator();

    private static final Logger log = Logger.getLogger(ComparisonExpressionToFilterTranslator.class.getName());

    private ComparisonExpressionToFilterTranslator() {
    }

    /**
     * Translates a comparison.
     *
     * @param dispatcher the dispatcher
     * @param context    the translation context
     * @param expression a non-logical binary expression
     * @return the filter
     * @throws ExpressionNotSupportedException if the comparison cannot be translated
     */
    public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                BinaryExpression expression) {
        Operator operator = expression.operator();
        if (operator.isLogical()) {
            throw new IllegalArgumentException("Not a comparison: " + expression);
        }
        Expression left = expression.left();
        Expression right = expression.right();

        if (isCompareToCall(right) && !isCompareToCall(left)) {
            operator = operator.mirrored();
            Expression swap = left;
            left = right;
            right = swap;
        }
        if (isCompareToCall(left)) {
            return translateCompareTo(expression, context, operator, (MethodCallExpression) left, right);
        }

        if (isSizeCall(right) && left instanceof ConstantExpression) {
            operator = operator.mirrored();
            Expression swap = left;
            left = right;
            right = swap;
        }
        if (isSizeCall(left) && right instanceof ConstantExpression constant) {
            return translateSize(expression, context, operator, (MethodCallExpression) left, constant);
        }

        return translateComparison(expression, context, operator, left, right);
    }

    /**
     * Translates {@code left OP right} where one operand is a field and the other a constant.
     *
     * @param source   the expression reported in errors
     * @param context  the translation context
     * @param operator the comparison operator
     * @param left     the left operand
     * @param right    the right operand
     * @return the filter
     * @throws ExpressionNotSupportedException if neither or both operands are fields, or the
     *                                         constant cannot be serialized as the field is
     */
    public FilterNode translateComparison(Expression source, TranslationContext context, Operator operator,
                                          Expression left, Expression right) {
        if (left instanceof ConstantExpression && right instanceof ConstantExpression) {
            throw new ExpressionNotSupportedException(source, "both operands are constants");
        }
        if (left instanceof ConstantExpression) {
            operator = operator.mirrored();
            Expression swap = left;
            left = right;
            right = swap;
        }
        if (!(right instanceof ConstantExpression constant)) {
            throw new ExpressionNotSupportedException(source, "one operand must be a constant");
        }

        TranslatedField field = FilterFieldResolver.resolve(context, left);
        if (constant.value() == null && operator != Operator.EQUAL && operator != Operator.NOT_EQUAL) {
            throw new ExpressionNotSupportedException(source, "null can only be compared for equality");
        }

        BsonValue value;
        try {
            value = SerializationHelper.serializeValue(field.serializer(), constant.value());
        } catch (IllegalArgumentException e) {
            throw new ExpressionNotSupportedException(source, e.getMessage(), e);
        }
        ComparisonOperator comparison = toComparisonOperator(operator);
        log.finest(() -> "Comparison " + source + " on field " + field.path() + " with " + comparison);
        return Filters.compare(comparison, field.path(), value);
    }

    private FilterNode translateCompareTo(Expression source, TranslationContext context, Operator operator,
                                          MethodCallExpression compareTo, Expression zero) {
        if (!(zero instanceof ConstantExpression constant) || !Integer.valueOf(0).equals(constant.value())) {
            throw new ExpressionNotSupportedException(source, "the result of compareTo can only be compared with 0");
        }
        return translateComparison(source, context, operator, compareTo.target(), compareTo.argument(0));
    }

    private FilterNode translateSize(Expression source, TranslationContext context, Operator operator,
                                     MethodCallExpression sizeCall, ConstantExpression constant) {
        if (!(constant.value() instanceof Integer size)) {
            throw new ExpressionNotSupportedException(source, "size must be compared with an int constant");
        }
        TranslatedField field = FilterFieldResolver.resolve(context, sizeCall.target());
        requireArrayLayout(source, field);
        FieldPath path = field.path();

        return switch (operator) {
            case EQUAL -> size < 0 ? Filters.matchNone() : Filters.size(path, size);
            case NOT_EQUAL -> size < 0 ? Filters.matchAll() : Filters.not(Filters.size(path, size));
            case GREATER_THAN -> size < 0 ? anyArray(path) : Filters.exists(path.subField(String.valueOf(size)));
            case GREATER_THAN_OR_EQUAL -> size <= 0
                    ? anyArray(path)
                    : Filters.exists(path.subField(String.valueOf(size - 1)));
            case LESS_THAN -> size <= 0
                    ? Filters.matchNone()
                    : Filters.notExists(path.subField(String.valueOf(size - 1)));
            case LESS_THAN_OR_EQUAL -> size < 0
                    ? Filters.matchNone()
                    : Filters.notExists(path.subField(String.valueOf(size)));
            default -> throw new IllegalStateException("Unexpected operator: " + operator);
        };
    }

    /**
     * Matches every document where the array is present. The current element of an enclosing
     * {@code $elemMatch} is always present, so an empty path matches everything.
     */
    private static FilterNode anyArray(FieldPath path) {
        return path.isEmpty() ? Filters.matchAll() : Filters.exists(path);
    }

    private static void requireArrayLayout(Expression source, TranslatedField field) {
        if (field.serializer() instanceof ArraySerializer<?>) {
            return;
        }
        if (field.serializer() instanceof DictionarySerializer<?> dictionarySerializer) {
            DictionaryRepresentation representation = dictionarySerializer.representation();
            if (representation == DictionaryRepresentation.DOCUMENT) {
                throw new UnsupportedRepresentationException(source, "size", representation);
            }
            return;
        }
        throw new ExpressionNotSupportedException(source, "field " + field.path() + " is not stored as an array");
    }

    private static boolean isCompareToCall(Expression expression) {
        return expression instanceof MethodCallExpression call
                && MethodSignatures.isInstanceMethod(call.method(), "compareTo", int.class, 1);
    }

    private static boolean isSizeCall(Expression expression) {
        return expression instanceof MethodCallExpression call
                && MethodSignatures.isInstanceMethod(call.method(), "size", int.class, 0);
    }

    private static ComparisonOperator toComparisonOperator(Operator operator) {
        return switch (operator) {
            case EQUAL -> ComparisonOperator.EQ;
            case NOT_EQUAL -> ComparisonOperator.NE;
            case LESS_THAN -> ComparisonOperator.LT;
            case LESS_THAN_OR_EQUAL -> ComparisonOperator.LTE;
            case GREATER_THAN -> ComparisonOperator.GT;
            case GREATER_THAN_OR_EQUAL -> ComparisonOperator.GTE;
            default -> throw new IllegalArgumentException("Not a comparison operator: " + operator);
        };
    }
}
