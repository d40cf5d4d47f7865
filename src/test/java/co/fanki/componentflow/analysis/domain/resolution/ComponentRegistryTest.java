package co.fanki.componentflow.analysis.domain.resolution;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Unit tests for {@link ComponentRegistry}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ComponentRegistryTest {

    private static final Path CARD = Path.of("/app/src/components/Card.tsx");
    private static final Path USER_CARD =
            Path.of("/app/src/components/user-card/index.tsx");

    @Test
    void whenLookingUp_givenNameOrBaseName_shouldFindDefinition() {
        final ComponentRegistry registry = ComponentRegistry.of(List.of(
                new ComponentDefinition("ProductCard", CARD)));

        assertEquals(CARD, registry.findByName("ProductCard").filePath());
        assertEquals(CARD, registry.findByName("Card").filePath());
        assertEquals("ProductCard", registry.findByPath(CARD).name());
    }

    @Test
    void whenLookingUp_givenIndexFile_shouldUseDirectoryName() {
        final ComponentRegistry registry = ComponentRegistry.of(List.of(
                new ComponentDefinition("Profile", USER_CARD)));

        assertEquals(USER_CARD, registry.findByName("UserCard").filePath());
        assertNull(registry.findByName("index"));
    }

    @Test
    void whenRegistering_givenDuplicateNames_shouldKeepTheFirst() {
        final Path other = Path.of("/app/src/legacy/Card.tsx");
        final ComponentRegistry registry = ComponentRegistry.of(List.of(
                new ComponentDefinition("Card", CARD),
                new ComponentDefinition("Card", other)));

        assertEquals(CARD, registry.findByName("Card").filePath());
        assertEquals(2, registry.size());
        assertEquals(other, registry.definitions().get(1).filePath());
    }

    @Test
    void whenLookingUp_givenEmptyRegistryOrNull_shouldReturnNull() {
        assertNull(ComponentRegistry.empty().findByName("Card"));
        assertNull(ComponentRegistry.empty().findByPath(null));
    }

    @Test
    void whenConvertingToPascalCase_givenSeparators_shouldCapitalizeParts() {
        assertEquals("UserCard", ComponentRegistry.pascalCase("user-card"));
        assertEquals("UserCard", ComponentRegistry.pascalCase("user_card"));
        assertEquals("UserCard", ComponentRegistry.pascalCase("userCard"));
    }
}
