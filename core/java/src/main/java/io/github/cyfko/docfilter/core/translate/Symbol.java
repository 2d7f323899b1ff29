package io.github.cyfko.docfilter.core.translate;

import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;

import java.util.Objects;

/**
 * Binding of a lambda parameter to the field it stands for.
 *
 * @param parameter the bound parameter
 * @param field     the field the parameter denotes
 * @param kind      whether the parameter denotes the root document or an array element
 * @since 1.0.0
 */
public record Symbol(ParameterExpression parameter, TranslatedField field, Kind kind) {

    /** What a bound parameter stands for. */
    public enum Kind {
        /** The root document of the predicate. Only its members are fields. */
        DOCUMENT,
        /** The current element of an array matched by {@code $elemMatch}. */
        ELEMENT
    }

    public Symbol {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
    }
}
