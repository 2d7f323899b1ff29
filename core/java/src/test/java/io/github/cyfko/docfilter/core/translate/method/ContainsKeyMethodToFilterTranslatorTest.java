package io.github.cyfko.docfilter.core.translate.method;

import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.config.TranslatorConfig;
import io.github.cyfko.docfilter.core.exception.InvalidKeyArgumentException;
import io.github.cyfko.docfilter.core.exception.SerializerCapabilityException;
import io.github.cyfko.docfilter.core.exception.UnresolvedFieldException;
import io.github.cyfko.docfilter.core.exception.UnsupportedRepresentationException;
import io.github.cyfko.docfilter.core.expression.Expressions;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.expression.ParameterExpression;
import io.github.cyfko.docfilter.core.fixtures.TestModel;
import io.github.cyfko.docfilter.core.render.BsonFilterRenderer;
import io.github.cyfko.docfilter.core.serialization.ClassMapSerializer;
import io.github.cyfko.docfilter.core.serialization.DictionaryRepresentation;
import io.github.cyfko.docfilter.core.serialization.DictionarySerializer;
import io.github.cyfko.docfilter.core.serialization.StringSerializer;
import io.github.cyfko.docfilter.core.serialization.ValueSerializer;
import io.github.cyfko.docfilter.core.spi.MethodCallTranslatorRegistry;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.Symbol;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.field.TranslatedField;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ContainsKeyMethodToFilterTranslator}.
 */
@DisplayName("ContainsKeyMethodToFilterTranslator Tests")
class ContainsKeyMethodToFilterTranslatorTest {

    /** A mapping-like type that is not a {@link Map}. */
    public static final class Catalog {
        public boolean containsKey(String key) {
            return false;
        }

        public boolean containsKey(String key, String section) {
            return false;
        }

        public static boolean containsKey(Object key) {
            return false;
        }

        public int indexOfKey(Object key) {
            return -1;
        }
    }

    /** Dictionary serializer for {@link Catalog}, stored as a document. */
    static final class CatalogSerializer implements DictionarySerializer<Catalog> {
        @Override
        public DictionaryRepresentation representation() {
            return DictionaryRepresentation.DOCUMENT;
        }

        @Override
        public ValueSerializer<?> keySerializer() {
            return StringSerializer.INSTANCE;
        }

        @Override
        public ValueSerializer<?> valueSerializer() {
            return StringSerializer.INSTANCE;
        }

        @Override
        public Class<Catalog> valueType() {
            return Catalog.class;
        }

        @Override
        public BsonValue serialize(Catalog value) {
            throw new UnsupportedOperationException();
        }
    }

    private final ContainsKeyMethodToFilterTranslator translator = ContainsKeyMethodToFilterTranslator.INSTANCE;
    private final ExpressionToFilterTranslator dispatcher =
            new ExpressionToFilterTranslator(MethodCallTranslatorRegistry.defaults());

    private TranslationContext context;

    @BeforeEach
    void setUp() {
        context = TranslationContext.create(TestModel.registry(), TranslatorConfig.defaults());
    }

    /**
     * Binds {@code param} as an element standing for the field {@code path} serialized by {@code serializer}.
     */
    private TranslationContext bind(ParameterExpression param, FieldPath path, ValueSerializer<?> serializer) {
        return context.withSymbol(new Symbol(param, new TranslatedField(path, serializer), Symbol.Kind.ELEMENT));
    }

    private TranslationContext bindDocument(DictionaryRepresentation representation) {
        return context.withSymbol(new Symbol(TestModel.X,
                new TranslatedField(FieldPath.empty(), new ClassMapSerializer<>(TestModel.personMap(representation))),
                Symbol.Kind.DOCUMENT));
    }

    // ============================================================================
    // Structural guard
    // ============================================================================

    @Nested
    @DisplayName("Structural guard")
    class StructuralGuard {

        @Test
        @DisplayName("Should claim Map.containsKey")
        void shouldClaimMapContainsKey() throws NoSuchMethodException {
            assertTrue(translator.canTranslate(Map.class.getMethod("containsKey", Object.class)));
        }

        @Test
        @DisplayName("Should claim containsKey on any type with the predicate shape")
        void shouldClaimAnyContainsKeyShape() throws NoSuchMethodException {
            assertTrue(translator.canTranslate(Catalog.class.getMethod("containsKey", String.class)));
        }

        @Test
        @DisplayName("Should not claim wrong arity, static or non-boolean methods")
        void shouldNotClaimOtherShapes() throws NoSuchMethodException {
            assertFalse(translator.canTranslate(Catalog.class.getMethod("containsKey", String.class, String.class)),
                    "Arity 2 must not be claimed");
            assertFalse(translator.canTranslate(Catalog.class.getMethod("containsKey", Object.class)),
                    "Static methods must not be claimed");
            assertFalse(translator.canTranslate(Catalog.class.getMethod("indexOfKey", Object.class)),
                    "Other names must not be claimed");
            assertFalse(translator.canTranslate(Map.class.getMethod("containsValue", Object.class)));
        }

        @Test
        @DisplayName("Should declare containsKey as its only method name")
        void shouldDeclareMethodName() {
            assertEquals(Set.of("containsKey"), translator.supportedMethodNames());
        }
    }

    // ============================================================================
    // Document representation
    // ============================================================================

    @Nested
    @DisplayName("Document representation")
    class DocumentRepresentation {

        @Test
        @DisplayName("Should emit an existence test on the key sub-field")
        void shouldEmitExists() {
            // Given
            MethodCallExpression call = Expressions.call(TestModel.tags(), "containsKey", Expressions.constant("red"));

            // When
            FilterNode filter = translator.translate(dispatcher, bindDocument(DictionaryRepresentation.DOCUMENT), call);

            // Then
            assertEquals(Filters.exists(FieldPath.of("Tags", "red")), filter);
        }

        @Test
        @DisplayName("Should use the key verbatim as a path segment")
        void shouldUseKeyVerbatim() {
            // Given
            MethodCallExpression call = Expressions.call(TestModel.tags(), "containsKey", Expressions.constant("a b"));

            // When
            FilterNode filter = translator.translate(dispatcher, bindDocument(DictionaryRepresentation.DOCUMENT), call);

            // Then
            assertEquals(Filters.exists(FieldPath.of("Tags", "a b")), filter);
        }

        @Test
        @DisplayName("Should keep a dotted key as one segment, which renders as a nested path")
        void shouldRenderDottedKeyAsNestedPath() {
            // Given
            MethodCallExpression call = Expressions.call(TestModel.tags(), "containsKey", Expressions.constant("a.b"));

            // When
            FilterNode filter = translator.translate(dispatcher, bindDocument(DictionaryRepresentation.DOCUMENT), call);

            // Then
            assertEquals(Filters.exists(FieldPath.of("Tags", "a.b")), filter);
            assertEquals("{\"Tags.a.b\": {\"$exists\": true}}", BsonFilterRenderer.toJson(filter));
        }

        @Test
        @DisplayName("Should translate containsKey on a non-Map mapping type")
        void shouldTranslateCustomMappingType() {
            // Given
            ParameterExpression catalog = Expressions.parameter("c", Catalog.class);
            MethodCallExpression call = Expressions.call(catalog, "containsKey", Expressions.constant("k"));

            // When
            FilterNode filter = translator.translate(dispatcher,
                    bind(catalog, FieldPath.of("Catalog"), new CatalogSerializer()), call);

            // Then
            assertEquals(Filters.exists(FieldPath.of("Catalog", "k")), filter);
        }

        @Test
        @DisplayName("Should serialize the key with the mapping's key serializer")
        @SuppressWarnings("unchecked")
        void shouldSerializeKeyWithKeySerializer() {
            // Given
            ValueSerializer<Object> keySerializer = mock(ValueSerializer.class);
            doReturn(Object.class).when(keySerializer).valueType();
            when(keySerializer.serialize("red")).thenReturn(new BsonString("RED"));
            DictionarySerializer<Object> mapping = mock(DictionarySerializer.class);
            when(mapping.representation()).thenReturn(DictionaryRepresentation.DOCUMENT);
            doReturn(keySerializer).when(mapping).keySerializer();

            ParameterExpression m = Expressions.parameter("m", Map.class);
            MethodCallExpression call = Expressions.call(m, "containsKey", Expressions.constant("red"));

            // When
            FilterNode filter = translator.translate(dispatcher, bind(m, FieldPath.of("M"), mapping), call);

            // Then
            assertEquals(Filters.exists(FieldPath.of("M", "RED")), filter);
            verify(keySerializer).serialize("red");
        }
    }

    // ============================================================================
    // Rejections
    // ============================================================================

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @ParameterizedTest
        @EnumSource(value = DictionaryRepresentation.class, names = {"ARRAY_OF_ARRAYS", "ARRAY_OF_DOCUMENTS"})
        @DisplayName("Should reject array representations and name them in the message")
        void shouldRejectArrayRepresentations(DictionaryRepresentation representation) {
            // Given
            MethodCallExpression call = Expressions.call(TestModel.tags(), "containsKey", Expressions.constant("red"));

            // When
            UnsupportedRepresentationException exception = assertThrows(UnsupportedRepresentationException.class,
                    () -> translator.translate(dispatcher, bindDocument(representation), call));

            // Then
            assertEquals(representation, exception.getRepresentation());
            assertTrue(exception.getMessage().contains(
                    "containsKey is not supported when DictionaryRepresentation is " + representation));
            assertTrue(exception.getMessage().contains(representation.getDescription()));
        }

        @Test
        @DisplayName("Should reject a non-constant key")
        void shouldRejectNonConstantKey() {
            // Given
            MethodCallExpression call = Expressions.call(TestModel.tags(), "containsKey", TestModel.name());

            // When
            InvalidKeyArgumentException exception = assertThrows(InvalidKeyArgumentException.class,
                    () -> translator.translate(dispatcher, bindDocument(DictionaryRepresentation.DOCUMENT), call));

            // Then
            assertTrue(exception.getMessage().contains("key must be a constant represented as a string"));
            assertEquals(TestModel.name(), exception.getKeyExpression());
            assertSame(call, exception.getExpression());
        }

        @Test
        @DisplayName("Should reject a key that does not serialize as a string")
        void shouldRejectNonStringKey() {
            // Given: Scores is keyed by Int32
            MethodCallExpression call = Expressions.call(TestModel.scores(), "containsKey", Expressions.constant(3));

            // When
            InvalidKeyArgumentException exception = assertThrows(InvalidKeyArgumentException.class,
                    () -> translator.translate(dispatcher, bindDocument(DictionaryRepresentation.DOCUMENT), call));

            // Then
            assertTrue(exception.getMessage().contains("key must be a constant represented as a string"));
        }

        @Test
        @DisplayName("Should reject a key the key serializer reports as non-string")
        @SuppressWarnings("unchecked")
        void shouldRejectMockedNonStringKey() {
            // Given
            ValueSerializer<Object> keySerializer = mock(ValueSerializer.class);
            doReturn(Object.class).when(keySerializer).valueType();
            when(keySerializer.serialize(any())).thenReturn(new BsonInt32(42));
            DictionarySerializer<Object> mapping = mock(DictionarySerializer.class);
            when(mapping.representation()).thenReturn(DictionaryRepresentation.DOCUMENT);
            doReturn(keySerializer).when(mapping).keySerializer();

            ParameterExpression m = Expressions.parameter("m", Map.class);
            MethodCallExpression call = Expressions.call(m, "containsKey", Expressions.constant("red"));

            // When / Then
            assertThrows(InvalidKeyArgumentException.class,
                    () -> translator.translate(dispatcher, bind(m, FieldPath.of("M"), mapping), call));
            verify(keySerializer).serialize("red");
        }

        @Test
        @DisplayName("Should reject a null key")
        void shouldRejectNullKey() {
            // Given
            MethodCallExpression call = Expressions.call(TestModel.tags(), "containsKey",
                    Expressions.constant(null, Object.class));

            // When / Then
            assertThrows(InvalidKeyArgumentException.class,
                    () -> translator.translate(dispatcher, bindDocument(DictionaryRepresentation.DOCUMENT), call));
        }

        @Test
        @DisplayName("Should reject a receiver whose serializer is not a dictionary serializer")
        void shouldRejectNonDictionarySerializer() {
            // Given
            ParameterExpression m = Expressions.parameter("m", Map.class);
            MethodCallExpression call = Expressions.call(m, "containsKey", Expressions.constant("red"));

            // When
            SerializerCapabilityException exception = assertThrows(SerializerCapabilityException.class,
                    () -> translator.translate(dispatcher, bind(m, FieldPath.of("M"), StringSerializer.INSTANCE), call));

            // Then
            assertEquals(StringSerializer.class, exception.getSerializerType());
            assertEquals(DictionarySerializer.class, exception.getRequiredCapability());
            assertTrue(exception.getMessage().contains(
                    "class " + StringSerializer.class.getName() + " does not implement the DictionarySerializer interface"));
        }

        @Test
        @DisplayName("Should reject a receiver that is not a field")
        void shouldRejectNonFieldReceiver() {
            // Given
            MethodCallExpression call = Expressions.call(Expressions.constant(Map.of("red", "1"), Map.class),
                    "containsKey", Expressions.constant("red"));

            // When / Then
            assertThrows(UnresolvedFieldException.class,
                    () -> translator.translate(dispatcher, bindDocument(DictionaryRepresentation.DOCUMENT), call));
        }
    }
}
