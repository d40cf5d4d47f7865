package co.fanki.componentflow.analysis.domain.imports;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DeclaredDependencies}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DeclaredDependenciesTest {

    @TempDir
    Path projectRoot;

    @Test
    void whenLoading_givenManifest_shouldReadEverySection() throws IOException {
        Files.writeString(projectRoot.resolve("package.json"), """
                {
                  "dependencies": { "@mui/material": "^5.0.0" },
                  "devDependencies": { "vitest": "^1.0.0" },
                  "peerDependencies": { "styled-components": "^6.0.0" }
                }
                """);

        final DeclaredDependencies dependencies =
                DeclaredDependencies.load(projectRoot);

        assertTrue(dependencies.contains("@mui/material"));
        assertTrue(dependencies.contains("vitest"));
        assertTrue(dependencies.contains("styled-components"));
        assertTrue(dependencies.contains("react"));
    }

    @Test
    void whenLoading_givenNoManifest_shouldKeepFrameworkPackages() {
        final DeclaredDependencies dependencies =
                DeclaredDependencies.load(projectRoot);

        assertTrue(dependencies.contains("react"));
        assertTrue(dependencies.contains("next"));
        assertFalse(dependencies.contains("@mui/material"));
    }

    @Test
    void whenLoading_givenMalformedManifest_shouldKeepFrameworkPackages()
            throws IOException {
        Files.writeString(projectRoot.resolve("package.json"), "{ broken");

        final DeclaredDependencies dependencies =
                DeclaredDependencies.load(projectRoot);

        assertTrue(dependencies.contains("react-dom"));
        assertFalse(dependencies.contains(null));
    }

    @Test
    void whenListingPackages_givenExplicitNames_shouldAppendThemToFramework() {
        final List<String> packages = List.copyOf(
                DeclaredDependencies.of("@mui/material").packages());

        assertEquals("react", packages.get(0));
        assertEquals("@mui/material", packages.get(packages.size() - 1));
    }
}
