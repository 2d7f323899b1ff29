package io.github.cyfko.docfilter.core.expression;

import java.util.Objects;

/**
 * Access to a named member of an object: {@code target.memberName}.
 *
 * @param target     the expression whose member is read
 * @param memberName the member name as declared on the object model
 * @param type       the static type of the member
 * @since 1.0.0
 */
public record MemberExpression(Expression target, String memberName, Class<?> type) implements Expression {

    public MemberExpression {
        Objects.requireNonNull(target, "Member target cannot be null");
        Objects.requireNonNull(memberName, "Member name cannot be null");
        Objects.requireNonNull(type, "Member type cannot be null");
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
