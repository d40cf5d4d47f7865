package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SharedSyntaxEngine;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ReferenceExpander}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReferenceExpanderTest {

    private final ReferenceExpander expander = new ReferenceExpander(false,
            MarkupElementFilter.defaults());

    private final ReferenceExpander markupExpander = new ReferenceExpander(
            true, MarkupElementFilter.defaults());

    @Test
    void whenExpanding_givenNestedMarkup_shouldCollectComponentsInOrder() {
        final String source = """
                const x = <Layout><Header /><main><Content /></main></Layout>;
                """;

        assertEquals(List.of("Layout", "Header", "Content"),
                names(expander.expand(init(source), source)));
    }

    @Test
    void whenExpanding_givenLogicalAnd_shouldOnlyExpandRightSide() {
        final String source = "const x = Flag && <Banner />;";

        assertEquals(List.of("Banner"),
                names(expander.expand(init(source), source)));
    }

    @Test
    void whenExpanding_givenLogicalOr_shouldExpandBothSides() {
        final String source = "const x = Custom || <Fallback />;";

        assertEquals(List.of("Custom", "Fallback"),
                names(expander.expand(init(source), source)));
    }

    @Test
    void whenExpanding_givenMapCallback_shouldExpandReturnedElements() {
        final String source = """
                const x = <ul>{items.map(item => {
                    return <Row key={item.id} />;
                })}</ul>;
                """;

        assertEquals(List.of("Row"),
                names(expander.expand(init(source), source)));
    }

    @Test
    void whenExpanding_givenLowercaseCall_shouldIgnoreIt() {
        final String source = "const x = ready && doLog();";

        assertTrue(expander.expand(init(source), source).isEmpty());
    }

    @Test
    void whenExpanding_givenCapitalizedCall_shouldReferenceCallee() {
        final String source = "const x = <div>{Render.Item()}</div>;";

        assertEquals(List.of("Render.Item"),
                names(expander.expand(init(source), source)));
    }

    @Test
    void whenExpanding_givenMarkupInAttribute_shouldExpandIt() {
        final String source =
                "const x = <Panel header={<Title />} footer=\"plain\" />;";

        assertEquals(List.of("Panel", "Title"),
                names(expander.expand(init(source), source)));
    }

    @Test
    void whenExpanding_givenProps_shouldRecordAttributeValues() {
        final String source =
                "const x = <Button variant=\"primary\" onClick={go} disabled />;";

        final ComponentReference button = expander.expand(init(source),
                source).components().get(0);

        assertEquals("primary", button.props().get("variant"));
        assertEquals("go", button.props().get("onClick"));
        assertEquals("true", button.props().get("disabled"));
    }

    @Test
    void whenExpanding_givenMarkupDisabled_shouldSkipNativeTags() {
        final String source = "const x = <section><p>Hi</p></section>;";

        assertTrue(expander.expand(init(source), source)
                .markupElements().isEmpty());
    }

    @Test
    void whenExpanding_givenMarkupEnabled_shouldTrackFilteredTags() {
        final String source =
                "const x = <section><p>Hello there</p><br /></section>;";

        final ExtractedReferences references =
                markupExpander.expand(init(source), source);

        assertEquals(2, references.markupElements().size());
        final MarkupElementReference section =
                references.markupElements().get(0);
        assertEquals("section", section.tagName());
        assertTrue(section.hasChildren());
        final MarkupElementReference paragraph =
                references.markupElements().get(1);
        assertEquals("p", paragraph.tagName());
        assertEquals("Hello there", paragraph.textContent());
    }

    @Test
    void whenExpandingStatement_givenIfElseBlocks_shouldCollectBothBranches() {
        final String source = """
                function View() {
                    if (ok) { return <Yes />; } else { return <No />; }
                }
                """;
        final SyntaxNode statement = SharedSyntaxEngine.firstStatement(source)
                .field("body").children().get(0);

        assertEquals(List.of("Yes", "No"),
                names(expander.expandStatement(statement, source)));
    }

    private static SyntaxNode init(final String source) {
        return SharedSyntaxEngine.initializer(source);
    }

    private static List<String> names(final ExtractedReferences references) {
        return references.components().stream()
                .map(ComponentReference::name)
                .toList();
    }
}
