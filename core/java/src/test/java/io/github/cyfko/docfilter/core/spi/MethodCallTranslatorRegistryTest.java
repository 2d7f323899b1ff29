package io.github.cyfko.docfilter.core.spi;

import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.Filters;
import io.github.cyfko.docfilter.core.expression.MethodCallExpression;
import io.github.cyfko.docfilter.core.translate.ExpressionToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.TranslationContext;
import io.github.cyfko.docfilter.core.translate.method.ContainsKeyMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.ContainsMethodToFilterTranslator;
import io.github.cyfko.docfilter.core.translate.method.StringMethodToFilterTranslator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MethodCallTranslatorRegistry}.
 */
@DisplayName("MethodCallTranslatorRegistry Tests")
class MethodCallTranslatorRegistryTest {

    /** Claims {@code String.isBlank()}. */
    static class IsBlankTranslator implements MethodCallToFilterTranslator {
        @Override
        public Set<String> supportedMethodNames() {
            return Set.of("isBlank");
        }

        @Override
        public boolean canTranslate(Method method) {
            return method.getDeclaringClass() == String.class && method.getParameterCount() == 0;
        }

        @Override
        public FilterNode translate(ExpressionToFilterTranslator dispatcher, TranslationContext context,
                                    MethodCallExpression call) {
            return Filters.matchAll();
        }
    }

    // ============================================================================
    // Defaults
    // ============================================================================

    @Nested
    @DisplayName("Default registry")
    class Defaults {

        private final MethodCallTranslatorRegistry registry = MethodCallTranslatorRegistry.defaults();

        @Test
        @DisplayName("Should register the built-in method names")
        void shouldRegisterBuiltIns() {
            Set<String> names = registry.getAllRegisteredMethodNames();

            assertTrue(names.containsAll(Set.of("containsKey", "containsValue", "contains", "startsWith",
                    "endsWith", "equalsIgnoreCase", "matches", "equals", "isEmpty", "anyMatch", "noneMatch", "allMatch")));
        }

        @Test
        @DisplayName("Should select among translators sharing a name by structural guard")
        void shouldDisambiguateByGuard() throws NoSuchMethodException {
            assertSame(StringMethodToFilterTranslator.INSTANCE,
                    registry.find(String.class.getMethod("contains", CharSequence.class)).orElseThrow());
            assertSame(ContainsMethodToFilterTranslator.INSTANCE,
                    registry.find(List.class.getMethod("contains", Object.class)).orElseThrow());
            assertSame(ContainsMethodToFilterTranslator.INSTANCE,
                    registry.find(Collection.class.getMethod("contains", Object.class)).orElseThrow());
            assertEquals(2, registry.getTranslators("contains").size());
        }

        @Test
        @DisplayName("Should find the containsKey translator for Map")
        void shouldFindContainsKey() throws NoSuchMethodException {
            assertSame(ContainsKeyMethodToFilterTranslator.INSTANCE,
                    registry.find(Map.class.getMethod("containsKey", Object.class)).orElseThrow());
        }

        @Test
        @DisplayName("Should find nothing for unregistered methods")
        void shouldFindNothing() throws NoSuchMethodException {
            assertTrue(registry.find(String.class.getMethod("isBlank")).isEmpty());
            assertTrue(registry.getTranslators("isBlank").isEmpty());
        }
    }

    // ============================================================================
    // Builder
    // ============================================================================

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should extend the defaults with a custom translator")
        void shouldExtendDefaults() throws NoSuchMethodException {
            IsBlankTranslator custom = new IsBlankTranslator();

            MethodCallTranslatorRegistry registry = MethodCallTranslatorRegistry.builder()
                    .registerDefaults()
                    .register(custom)
                    .build();

            assertSame(custom, registry.find(String.class.getMethod("isBlank")).orElseThrow());
            assertTrue(MethodCallTranslatorRegistry.defaults().find(String.class.getMethod("isBlank")).isEmpty(),
                    "Default registry must not be affected");
        }

        @Test
        @DisplayName("Should reject registering the same translator twice")
        void shouldRejectDuplicateRegistration() {
            IsBlankTranslator custom = new IsBlankTranslator();
            MethodCallTranslatorRegistry.Builder builder = MethodCallTranslatorRegistry.builder().register(custom);

            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> builder.register(custom));

            assertTrue(exception.getMessage().contains("is already registered"));
        }

        @Test
        @DisplayName("Should reject a translator declaring no method name")
        void shouldRejectEmptyNames() {
            MethodCallToFilterTranslator nameless = new IsBlankTranslator() {
                @Override
                public Set<String> supportedMethodNames() {
                    return Set.of();
                }
            };

            assertThrows(IllegalArgumentException.class,
                    () -> MethodCallTranslatorRegistry.builder().register(nameless));
        }

        @Test
        @DisplayName("Should reject null translators")
        void shouldRejectNull() {
            assertThrows(NullPointerException.class, () -> MethodCallTranslatorRegistry.builder().register(null));
        }
    }
}
