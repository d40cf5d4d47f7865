package co.fanki.componentflow.analysis.domain.ast;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TypeScriptSyntaxEngine}.
 *
 * <p>Checks that the compiler WebJar loads inside GraalJS and that the
 * converted tree carries kinds, names, positions and source offsets.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TypeScriptSyntaxEngineTest {

    private static TypeScriptSyntaxEngine engine;

    @BeforeAll
    static void setUp() {
        engine = SharedSyntaxEngine.get();
    }

    // -- Engine loading --

    @Test
    void whenCreating_shouldReportCompilerVersion() {
        assertEquals(TypeScriptSyntaxEngine.DEFAULT_TYPESCRIPT_VERSION,
                engine.compilerVersion());
    }

    // -- Parsing --

    @Test
    void whenParsing_givenComponent_shouldBuildProgramTree() {
        final String source = """
                import Button from './Button';

                export default function Page() {
                    return <div><Button label="go" /></div>;
                }
                """;

        final SyntaxNode program = engine.parse(source, "Page.tsx");

        assertNotNull(program);
        assertEquals(SyntaxKind.PROGRAM, program.kind());
        assertEquals(2, program.children().size());

        final SyntaxNode importNode = program.children().get(0);
        assertEquals(SyntaxKind.IMPORT, importNode.kind());
        assertEquals("./Button", importNode.value());

        final SyntaxNode function = program.children().get(1);
        assertEquals(SyntaxKind.FUNCTION_DECLARATION, function.kind());
        assertEquals("Page", function.name());
        assertEquals("default", function.flags());
        assertEquals(3, function.position().line());
        assertEquals(0, function.position().column());
    }

    @Test
    void whenParsing_givenJsxElement_shouldExposeTagAndAttributes() {
        final String source = "const x = <Card title=\"Hi\" {...rest} />;";

        final SyntaxNode program = engine.parse(source, "Card.tsx");
        final SyntaxNode element = program.children().get(0)
                .children().get(0).field("init");

        assertEquals(SyntaxKind.JSX_ELEMENT, element.kind());
        assertEquals("Card", element.name());
        final SyntaxNode attributes = element.field("attributes");
        assertEquals(2, attributes.children().size());
        assertEquals("title", attributes.children().get(0).name());
        assertTrue(attributes.children().get(1)
                .is(SyntaxKind.JSX_SPREAD_ATTRIBUTE));
        assertEquals("<Card title=\"Hi\" {...rest} />",
                element.text(source));
    }

    @Test
    void whenParsing_givenParenthesizedAndCastExpressions_shouldUnwrapThem() {
        final String source = "const x = ((<A/>) as any);";

        final SyntaxNode init = engine.parse(source, "A.tsx")
                .children().get(0).children().get(0).field("init");

        assertEquals(SyntaxKind.JSX_ELEMENT, init.kind());
        assertEquals("A", init.name());
    }

    @Test
    void whenParsing_givenLogicalOperators_shouldKeepOperatorText() {
        final String source = "const x = a ?? b;";

        final SyntaxNode init = engine.parse(source, "x.ts")
                .children().get(0).children().get(0).field("init");

        assertEquals(SyntaxKind.LOGICAL, init.kind());
        assertEquals("??", init.operator());
    }

    @Test
    void whenParsing_givenSyntaxError_shouldReturnNull() {
        assertNull(engine.parse("function ( {", "Broken.tsx"));
    }

    @Test
    void whenParsing_givenNullSource_shouldReturnNull() {
        assertNull(engine.parse(null, "Empty.tsx"));
    }

    @Test
    void whenParsing_givenJsxInJsFile_shouldParse() {
        final SyntaxNode program = engine.parse(
                "export const Box = () => <div/>;", "Box.jsx");

        assertNotNull(program);
        assertFalse(program.children().isEmpty());
        assertEquals("export", program.children().get(0).flags());
    }
}
