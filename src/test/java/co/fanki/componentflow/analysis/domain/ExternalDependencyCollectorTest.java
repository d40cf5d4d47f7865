package co.fanki.componentflow.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ExternalDependencyCollector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExternalDependencyCollectorTest {

    @Test
    void whenCollecting_givenTwoEntries_shouldGroupByPackage() {
        final FlowNode shared = node("Toolbar", "/app/src/Toolbar.tsx",
                FlowNode.external("Button", "@mui/material/Button"),
                FlowNode.external("Icon", "@mui/material"));
        final FlowNode home = node("Home", "/app/src/Home.tsx", shared,
                FlowNode.external("Link", "next/link"));
        final FlowNode about = node("About", "/app/src/About.tsx", shared);

        final ExternalDependencyCollector collector =
                new ExternalDependencyCollector();
        collector.collect("src/Home.tsx", home);
        collector.collect("src/About.tsx", about);

        final List<ExternalDependency> dependencies = collector.dependencies();
        assertEquals(2, dependencies.size());

        final ExternalDependency mui = dependencies.get(0);
        assertEquals("@mui/material", mui.name());
        assertEquals(List.of("src/Home.tsx", "src/About.tsx"), mui.usedIn());
        assertEquals(4, mui.usageCount());

        final ExternalDependency next = dependencies.get(1);
        assertEquals("next", next.name());
        assertEquals(1, next.usageCount());
    }

    @Test
    void whenCollecting_givenLeafWithoutSource_shouldUseItsName() {
        final ExternalDependencyCollector collector =
                new ExternalDependencyCollector();
        collector.collect("src/App.tsx", node("App", "/app/src/App.tsx",
                FlowNode.external("Widget", null)));

        assertEquals("Widget", collector.dependencies().get(0).name());
    }

    @Test
    void whenCollecting_givenNullRoot_shouldCollectNothing() {
        final ExternalDependencyCollector collector =
                new ExternalDependencyCollector();
        collector.collect("src/App.tsx", null);

        assertTrue(collector.dependencies().isEmpty());
    }

    private static FlowNode node(final String name, final String file,
            final FlowNode... children) {
        return new FlowNode(name, file, false, null, List.of(),
                List.of(children), List.of());
    }
}
