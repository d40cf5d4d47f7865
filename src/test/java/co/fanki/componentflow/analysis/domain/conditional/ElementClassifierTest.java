package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SharedSyntaxEngine;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ElementClassifier}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ElementClassifierTest {

    // -- Names --

    @Test
    void whenClassifying_givenCapitalizedName_shouldReturnComponent() {
        assertEquals(ElementKind.COMPONENT, ElementClassifier.classify("Foo"));
    }

    @Test
    void whenClassifying_givenDottedName_shouldReturnComponent() {
        assertEquals(ElementKind.COMPONENT,
                ElementClassifier.classify("Foo.Bar"));
        assertEquals(ElementKind.COMPONENT,
                ElementClassifier.classify("motion.div"));
    }

    @Test
    void whenClassifying_givenLowercaseName_shouldReturnMarkupElement() {
        assertEquals(ElementKind.MARKUP_ELEMENT,
                ElementClassifier.classify("div"));
    }

    @Test
    void whenClassifying_givenNamespacedOrHyphenatedName_shouldReturnMarkup() {
        assertEquals(ElementKind.MARKUP_ELEMENT,
                ElementClassifier.classify("svg:rect"));
        assertEquals(ElementKind.MARKUP_ELEMENT,
                ElementClassifier.classify("my-widget"));
    }

    @Test
    void whenClassifying_givenBlankOrNull_shouldReturnUnknown() {
        assertEquals(ElementKind.UNKNOWN, ElementClassifier.classify(""));
        assertEquals(ElementKind.UNKNOWN, ElementClassifier.classify(null));
        assertEquals(ElementKind.UNKNOWN, ElementClassifier.classify("_x"));
    }

    // -- Nodes --

    @Test
    void whenReadingDottedName_givenMemberChain_shouldJoinSegments() {
        assertEquals("Icons.Home", ElementClassifier.dottedName(
                SharedSyntaxEngine.initializer("const x = Icons.Home;")));
    }

    @Test
    void whenReadingDottedName_givenComputedMember_shouldReturnNull() {
        assertNull(ElementClassifier.dottedName(
                SharedSyntaxEngine.initializer("const x = icons[name];")));
    }

    @Test
    void whenCheckingMarkup_givenMapReturningElements_shouldDetectMarkup() {
        assertTrue(ElementClassifier.containsMarkup(
                SharedSyntaxEngine.initializer(
                        "const x = items.map(i => <Row key={i} />);")));
    }

    @Test
    void whenCheckingMarkup_givenTernaryWithElementBranch_shouldDetectMarkup() {
        assertTrue(ElementClassifier.containsMarkup(
                SharedSyntaxEngine.initializer(
                        "const x = ok ? null : <Empty />;")));
    }

    @Test
    void whenCheckingMarkup_givenPlainCall_shouldNotDetectMarkup() {
        assertFalse(ElementClassifier.containsMarkup(
                SharedSyntaxEngine.initializer("const x = compute(1, 2);")));
    }
}
