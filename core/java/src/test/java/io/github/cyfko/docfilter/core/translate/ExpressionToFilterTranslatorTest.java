package io.github.cyfko.docfilter.core.translate;

import io.github.cyfko.docfilter.core.ast.ComparisonOperator;
import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.config.TranslatorConfig;
import io.github.cyfko.docfilter.core.exception.ExpressionNotSupportedException;
import io.github.cyfko.docfilter.core.exception.UnresolvedFieldException;
import io.github.cyfko.docfilter.core.expression.Expression;
import io.github.cyfko.docfilter.core.expression.Expressions;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.fixtures.TestModel;
import io.github.cyfko.docfilter.core.serialization.ClassMapSerializer;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.spi.MethodCallToFilterTranslator;
import io.github.cyfko.docfilter.core.spi.MethodCallTranslatorRegistry;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import org.bson.BsonBoolean;
import org.bson.BsonInt32;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static io.github.cyfko.docfilter.core.fixtures.TestModel.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

@DisplayName("ExpressionToFilterTranslator Tests")
class ExpressionToFilterTranslatorTest {

    private static final TranslatedField DOCUMENT = new TranslatedField(FieldPath.empty(),
            new ClassMapSerializer<>(TestModel.personMap(DictionaryRepresentation.DOCUMENT)));

    private final ExpressionToFilterTranslator dispatcher =
            new ExpressionToFilterTranslator(MethodCallTranslatorRegistry.defaults());

    private FilterNode translate(Expression body) {
        return translate(TranslatorConfig.defaults(), body);
    }

    private FilterNode translate(TranslatorConfig config, Expression body) {
        TranslationContext context = TranslationContext.create(TestModel.registry(), config);
        return dispatcher.translateLambda(context, predicate(body), DOCUMENT);
    }

    private static Expression ageAbove(int bound) {
        return Expressions.greaterThan(age(), Expressions.constant(bound));
    }

    // ============================================================================
    // Logical composition
    // ============================================================================

    @Nested
    @DisplayName("Logical composition")
    class LogicalComposition {

        @Test
        @DisplayName("Should combine && into an ordered AND")
        void shouldTranslateAnd() {
            FilterNode filter = translate(Expressions.and(ageAbove(1), ageAbove(2)));

            assertEquals(Filters.and(
                    Filters.compare(ComparisonOperator.GT, FieldPath.of("Age"), new BsonInt32(1)),
                    Filters.compare(ComparisonOperator.GT, FieldPath.of("Age"), new BsonInt32(2))), filter);
        }

        @Test
        @DisplayName("Should keep nested ANDs unless flattening is configured")
        void shouldKeepNestingByDefault() {
            Expression nested = Expressions.and(Expressions.and(ageAbove(1), ageAbove(2)), ageAbove(3));

            FilterNode kept = translate(nested);
            FilterNode flattened = translate(TranslatorConfig.builder().flattenLogicalCombinators(true).build(), nested);

            assertEquals(Filters.and(Filters.and(translate(ageAbove(1)), translate(ageAbove(2))), translate(ageAbove(3))), kept);
            assertEquals(Filters.and(translate(ageAbove(1)), translate(ageAbove(2)), translate(ageAbove(3))), flattened);
        }

        @Test
        @DisplayName("Should flatten ORs without merging a nested AND")
        void shouldFlattenOrOnly() {
            TranslatorConfig flatten = TranslatorConfig.builder().flattenLogicalCombinators(true).build();
            Expression expression = Expressions.or(Expressions.or(ageAbove(1), Expressions.and(ageAbove(2), ageAbove(3))), ageAbove(4));

            FilterNode filter = translate(flatten, expression);

            assertEquals(Filters.or(translate(ageAbove(1)),
                    Filters.and(translate(ageAbove(2)), translate(ageAbove(3))),
                    translate(ageAbove(4))), filter);
        }

        @Test
        @DisplayName("Should negate with NOT")
        void shouldTranslateNot() {
            assertEquals(Filters.not(translate(ageAbove(1))), translate(Expressions.not(ageAbove(1))));
        }
    }

    // ============================================================================
    // Boolean leaves
    // ============================================================================

    @Nested
    @DisplayName("Boolean leaves")
    class BooleanLeaves {

        @Test
        @DisplayName("Should compare a boolean member with true")
        void shouldTranslateBooleanMember() {
            assertEquals(Filters.eq(FieldPath.of("Active"), BsonBoolean.TRUE), translate(active()));
        }

        @Test
        @DisplayName("Should compare a boolean array element accessed by index with true")
        void shouldTranslateBooleanIndexer() {
            Expression firstAsBoolean = Expressions.index(flags(), Expressions.constant(0), boolean.class);

            assertEquals(Filters.eq(FieldPath.of("Flags", "0"), BsonBoolean.TRUE), translate(firstAsBoolean));
        }

        @Test
        @DisplayName("Should translate boolean constants to match-all and match-none")
        void shouldTranslateBooleanConstants() {
            assertSame(Filters.matchAll(), translate(Expressions.constant(true)));
            assertSame(Filters.matchNone(), translate(Expressions.constant(false)));
        }

        @Test
        @DisplayName("Should reject a lambda whose body is not boolean")
        void shouldRejectNonBooleanBody() {
            ExpressionNotSupportedException exception = assertThrows(ExpressionNotSupportedException.class,
                    () -> translate(age()));

            assertTrue(exception.getMessage().contains("the lambda body is not boolean"));
        }

        @Test
        @DisplayName("Should reject a predicate over the document itself")
        void shouldRejectDocumentAsPredicate() {
            ParameterExpression self = Expressions.parameter("x", Boolean.class);
            TranslationContext context = TranslationContext.create(TestModel.registry(), TranslatorConfig.defaults());

            UnresolvedFieldException exception = assertThrows(UnresolvedFieldException.class,
                    () -> dispatcher.translateLambda(context, Expressions.lambda(self, self), DOCUMENT));
            assertTrue(exception.getMessage().contains("the document itself is not a field"));
        }
    }

    // ============================================================================
    // Method calls
    // ============================================================================

    @Nested
    @DisplayName("Method calls")
    class MethodCalls {

        @Test
        @DisplayName("Should delegate to the translator the registry selects")
        void shouldDelegateToSelectedTranslator() {
            // Given
            MethodCallToFilterTranslator custom = mock(MethodCallToFilterTranslator.class);
            when(custom.supportedMethodNames()).thenReturn(Set.of("endsWith"));
            when(custom.canTranslate(any())).thenReturn(true);
            when(custom.translate(any(), any(), any())).thenReturn(Filters.matchAll());
            ExpressionToFilterTranslator customDispatcher = new ExpressionToFilterTranslator(
                    MethodCallTranslatorRegistry.builder().register(custom).build());
            MethodCallExpression call = Expressions.call(name(), "endsWith", Expressions.constant("z"));
            TranslationContext context = TranslationContext.create(TestModel.registry(), TranslatorConfig.defaults());

            // When
            FilterNode filter = customDispatcher.translateLambda(context, predicate(call), DOCUMENT);

            // Then
            assertSame(Filters.matchAll(), filter);
            verify(custom).translate(same(customDispatcher), any(TranslationContext.class), same(call));
        }

        @Test
        @DisplayName("Should reject methods no translator claims")
        void shouldRejectUnclaimedMethods() {
            Expression call = Expressions.call(name(), "isBlank");

            ExpressionNotSupportedException exception = assertThrows(ExpressionNotSupportedException.class,
                    () -> translate(call));

            assertTrue(exception.getMessage().contains("no translator supports method String.isBlank"));
            assertSame(call, exception.getExpression());
        }
    }

    // ============================================================================
    // Depth limit
    // ============================================================================

    @Test
    @DisplayName("Should reject expressions nested deeper than the configured maximum")
    void shouldEnforceMaximumDepth() {
        // Given
        Expression deep = ageAbove(0);
        for (int i = 0; i < 10; i++) {
            deep = Expressions.not(deep);
        }
        TranslatorConfig shallow = TranslatorConfig.builder().maxExpressionDepth(5).build();
        Expression expression = deep;

        // When
        ExpressionNotSupportedException exception = assertThrows(ExpressionNotSupportedException.class,
                () -> translate(shallow, expression));

        // Then
        assertTrue(exception.getMessage().contains("exceeds the configured maximum depth of 5"));
        assertDoesNotThrow(() -> translate(expression));
    }
}
