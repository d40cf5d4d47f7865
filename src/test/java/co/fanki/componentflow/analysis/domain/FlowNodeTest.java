package co.fanki.componentflow.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FlowNode}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FlowNodeTest {

    @Test
    void whenCreatingExternal_shouldBeLeafWithoutFile() {
        final FlowNode node = FlowNode.external("Button", "@mui/material");

        assertTrue(node.external());
        assertEquals("", node.filePath());
        assertTrue(node.children().isEmpty());
        assertEquals("external:Button", node.identity());
    }

    @Test
    void whenCreatingExternal_givenChildren_shouldThrow() {
        final FlowNode child = FlowNode.leaf("Icon", "/app/src/Icon.tsx");

        assertThrows(IllegalArgumentException.class,
                () -> new FlowNode("Button", "", true, "ui", List.of(),
                        List.of(child), List.of()));
    }

    @Test
    void whenRelabeling_shouldShareSubtree() {
        final FlowNode child = FlowNode.leaf("Icon", "/app/src/Icon.tsx");
        final FlowNode node = new FlowNode("Card", "/app/src/Card.tsx", false,
                null, List.of(), List.of(child), List.of());

        final FlowNode relabeled = node.withName("ProductCard");

        assertSame(node, node.withName("Card"));
        assertEquals("ProductCard", relabeled.name());
        assertSame(node.children(), relabeled.children());
        assertEquals(node.identity(), relabeled.identity());
    }
}
