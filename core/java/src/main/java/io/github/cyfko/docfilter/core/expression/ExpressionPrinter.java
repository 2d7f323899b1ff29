package io.github.cyfko.docfilter.core.expression;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Renders expression trees as Java-like source text for diagnostics.
 * <p>
 * The output is meant for error messages and logs, e.g.
 * {@code x -> x.tags.containsKey("red") && x.age > 18}. It is not a parser input format.
 * </p>
 *
 * @since 1.0.0
 */
public final class ExpressionPrinter {

    private ExpressionPrinter() {
        // Prevent instantiation
    }

    /**
     * Prints the given expression.
     *
     * @param expression the expression to print, may be {@code null}
     * @return the source-like representation
     */
    public static String print(Expression expression) {
        if (expression == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder();
        append(sb, expression);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Expression expression) {
        if (expression instanceof ParameterExpression parameter) {
            sb.append(parameter.name());
        } else if (expression instanceof ConstantExpression constant) {
            sb.append(formatValue(constant.value()));
        } else if (expression instanceof MemberExpression member) {
            append(sb, member.target());
            sb.append('.').append(member.memberName());
        } else if (expression instanceof IndexExpression index) {
            append(sb, index.target());
            sb.append('[');
            append(sb, index.index());
            sb.append(']');
        } else if (expression instanceof MethodCallExpression call) {
            if (call.target() == null) {
                sb.append(call.method().getDeclaringClass().getSimpleName());
            } else {
                append(sb, call.target());
            }
            sb.append('.').append(call.method().getName()).append('(');
            for (int i = 0; i < call.arguments().size(); i++) {
                if (i > 0) sb.append(", ");
                append(sb, call.argument(i));
            }
            sb.append(')');
        } else if (expression instanceof UnaryExpression unary) {
            sb.append('!');
            appendOperand(sb, unary.operand(), Integer.MAX_VALUE);
        } else if (expression instanceof BinaryExpression binary) {
            int precedence = precedence(binary.operator());
            appendOperand(sb, binary.left(), precedence);
            sb.append(' ').append(binary.operator().getSymbol()).append(' ');
            appendOperand(sb, binary.right(), precedence + 1);
        } else if (expression instanceof LambdaExpression lambda) {
            if (lambda.parameters().size() == 1) {
                sb.append(lambda.parameters().get(0).name());
            } else {
                sb.append(lambda.parameters().stream()
                        .map(ParameterExpression::name)
                        .collect(Collectors.joining(", ", "(", ")")));
            }
            sb.append(" -> ");
            append(sb, lambda.body());
        }
    }

    private static void appendOperand(StringBuilder sb, Expression operand, int parentPrecedence) {
        boolean parenthesize = (operand instanceof BinaryExpression binary
                && precedence(binary.operator()) < parentPrecedence)
                || operand instanceof LambdaExpression;
        if (parenthesize) sb.append('(');
        append(sb, operand);
        if (parenthesize) sb.append(')');
    }

    private static int precedence(BinaryExpression.Operator operator) {
        return switch (operator) {
            case OR -> 1;
            case AND -> 2;
            case EQUAL, NOT_EQUAL -> 3;
            default -> 4;
        };
    }

    private static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return '"' + escape(text.toString()) + '"';
        }
        if (value instanceof Character c) {
            return "'" + escape(String.valueOf(c)) + "'";
        }
        if (value instanceof Long) {
            return value + "L";
        }
        if (value instanceof Enum<?> e) {
            return e.getDeclaringClass().getSimpleName() + "." + e.name();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(ExpressionPrinter::formatValue).collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
