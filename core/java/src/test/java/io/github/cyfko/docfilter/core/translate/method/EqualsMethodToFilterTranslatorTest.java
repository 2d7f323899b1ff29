package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.PredicateTranslator;
import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.expression.Expressions;
import io.github.cyfko.docfilter.core.fixtures.TestModel;
import org.bson.BsonString;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.github.cyfko.docfilter.core.fixtures.TestModel.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EqualsMethodToFilterTranslator Tests")
class EqualsMethodToFilterTranslatorTest {

    private final PredicateTranslator translator = PredicateTranslator.create(TestModel.registry());

    @Test
    @DisplayName("Should translate field.equals(constant) as equality")
    void shouldTranslateFieldEqualsConstant() {
        assertEquals(Filters.eq(FieldPath.of("Name"), new BsonString("Joe")),
                translator.translate(predicate(Expressions.call(name(), "equals", Expressions.constant("Joe")))));
    }

    @Test
    @DisplayName("Should translate constant.equals(field) as equality")
    void shouldTranslateConstantEqualsField() {
        assertEquals(Filters.eq(FieldPath.of("Status"), new BsonString("ACTIVE")),
                translator.translate(predicate(Expressions.call(
                        Expressions.constant(Status.ACTIVE), "equals", status()))));
    }

    @Test
    @DisplayName("Should only claim equals(Object)")
    void shouldOnlyClaimEqualsObject() throws NoSuchMethodException {
        assertTrue(EqualsMethodToFilterTranslator.INSTANCE.canTranslate(String.class.getMethod("equals", Object.class)));
        assertFalse(EqualsMethodToFilterTranslator.INSTANCE.canTranslate(String.class.getMethod("equalsIgnoreCase", String.class)));
    }
}
