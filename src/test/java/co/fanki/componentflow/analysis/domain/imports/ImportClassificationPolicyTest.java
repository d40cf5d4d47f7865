package co.fanki.componentflow.analysis.domain.imports;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ImportClassificationPolicy}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ImportClassificationPolicyTest {

    @TempDir
    Path projectRoot;

    private Path fromFile;
    private ImportClassificationPolicy policy;

    @BeforeEach
    void setUp() {
        final Path sourceRoot = projectRoot.resolve("src");
        fromFile = sourceRoot.resolve("App.tsx");
        policy = new ImportClassificationPolicy(
                DeclaredDependencies.of("@mui/material", "react-icons"),
                new ModulePathResolver(projectRoot, sourceRoot));
    }

    // -- Classification --

    @Test
    void whenClassifying_givenRelativeOrAlias_shouldBeInternal() {
        assertEquals(ImportKind.INTERNAL, policy.classify("./Card", fromFile));
        assertEquals(ImportKind.INTERNAL, policy.classify("../ui", fromFile));
        assertEquals(ImportKind.INTERNAL,
                policy.classify("@/components/Card", fromFile));
        assertEquals(ImportKind.INTERNAL, policy.classify("~/lib", fromFile));
    }

    @Test
    void whenClassifying_givenFrameworkModule_shouldBeExternal() {
        assertEquals(ImportKind.EXTERNAL, policy.classify("react", fromFile));
        assertEquals(ImportKind.EXTERNAL,
                policy.classify("next/link", fromFile));
    }

    @Test
    void whenClassifying_givenDeclaredPackageSubpath_shouldBeExternal() {
        assertEquals(ImportKind.EXTERNAL,
                policy.classify("@mui/material/Button", fromFile));
        assertEquals(ImportKind.EXTERNAL,
                policy.classify("react-icons/fa", fromFile));
    }

    @Test
    void whenClassifying_givenProjectDirectoryShape_shouldBeInternal() {
        assertEquals(ImportKind.INTERNAL,
                policy.classify("components/Header", fromFile));
    }

    @Test
    void whenClassifying_givenBareSpecifierOnDisk_shouldBeInternal()
            throws IOException {
        final Path widgets = projectRoot.resolve("src/widgets");
        Files.createDirectories(widgets);
        Files.writeString(widgets.resolve("Chart.tsx"),
                "export const Chart = () => <svg />;");

        assertEquals(ImportKind.INTERNAL,
                policy.classify("widgets/Chart", fromFile));
    }

    @Test
    void whenClassifying_givenUnknownBareSpecifier_shouldAssumeExternal() {
        assertEquals(ImportKind.EXTERNAL,
                policy.classify("left-pad", fromFile));
    }

    // -- Helpers --

    @Test
    void whenComputingPackageName_givenScopedOrPlain_shouldKeepPackage() {
        assertEquals("@mui/material",
                ImportClassificationPolicy.packageName("@mui/material/Button"));
        assertEquals("react-icons",
                ImportClassificationPolicy.packageName("react-icons/fa"));
        assertEquals("lodash", ImportClassificationPolicy.packageName("lodash"));
    }

    @Test
    void whenCheckingNativeTag_givenCase_shouldBeCaseSensitive() {
        assertTrue(ImportClassificationPolicy.isNativeTag("button"));
        assertFalse(ImportClassificationPolicy.isNativeTag("Button"));
        assertFalse(ImportClassificationPolicy.isNativeTag(null));
    }

    @Test
    void whenCheckingIntrinsic_givenFrameworkNames_shouldMatch() {
        assertTrue(ImportClassificationPolicy.isIntrinsic("Suspense"));
        assertTrue(ImportClassificationPolicy.isIntrinsic("React.Fragment"));
        assertFalse(ImportClassificationPolicy.isIntrinsic("Layout"));
    }
}
