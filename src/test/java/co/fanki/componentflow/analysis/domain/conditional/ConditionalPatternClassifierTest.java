package co.fanki.componentflow.analysis.domain.conditional;

import co.fanki.componentflow.analysis.domain.ast.SharedSyntaxEngine;
import co.fanki.componentflow.analysis.domain.ast.SourcePosition;
import co.fanki.componentflow.analysis.domain.ast.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ConditionalPatternClassifier}.
 *
 * <p>Sources are parsed with the shared TypeScript engine; the condition
 * text is sliced from the same source.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ConditionalPatternClassifierTest {

    private final ConditionalPatternClassifier classifier =
            new ConditionalPatternClassifier(new ReferenceExpander(false,
                    MarkupElementFilter.defaults()));

    // -- Expressions --

    @Test
    void whenClassifying_givenTernary_shouldPopulateBothBranches() {
        final String source = "const x = cond ? <A /> : <B />;";

        final List<ConditionalPattern> patterns = classify(source);

        assertEquals(1, patterns.size());
        final ConditionalPattern ternary = patterns.get(0);
        assertEquals(ConditionalKind.TERNARY, ternary.kind());
        assertEquals("cond", ternary.conditionText());
        assertEquals(List.of("A"), names(ternary.trueBranch()));
        assertEquals(List.of("B"), names(ternary.falseBranch()));
        assertEquals(new SourcePosition(1, 10), ternary.position());
    }

    @Test
    void whenClassifying_givenNestedTernary_shouldFlattenIntoBranch() {
        final String source = "const x = a ? <A /> : b ? <B /> : <C />;";

        final List<ConditionalPattern> patterns = classify(source);

        assertEquals(1, patterns.size());
        assertEquals(List.of("B", "C"), names(patterns.get(0).falseBranch()));
    }

    @Test
    void whenClassifying_givenAndWithSideEffectOnly_shouldEmitNothing() {
        assertTrue(classify("const x = cond && doLog();").isEmpty());
    }

    @Test
    void whenClassifying_givenAndWithElement_shouldEmitWithoutFalseBranch() {
        final String source = "const x = user.isAdmin && <AdminPanel />;";

        final ConditionalPattern pattern = classify(source).get(0);

        assertEquals(ConditionalKind.LOGICAL_AND_OR, pattern.kind());
        assertEquals("user.isAdmin", pattern.conditionText());
        assertEquals(List.of("AdminPanel"), names(pattern.trueBranch()));
        assertNull(pattern.falseBranch());
    }

    @Test
    void whenClassifying_givenOr_shouldUseLeftAsPrimaryBranch() {
        final String source = "const x = Custom || <Default />;";

        final ConditionalPattern pattern = classify(source).get(0);

        assertEquals(List.of("Custom"), names(pattern.trueBranch()));
        assertEquals(List.of("Default"), names(pattern.falseBranch()));
    }

    @Test
    void whenClassifying_givenNullishCoalescing_shouldBehaveLikeOr() {
        final String source = "const x = slot ?? <Placeholder />;";

        final ConditionalPattern pattern = classify(source).get(0);

        assertEquals(ConditionalKind.LOGICAL_AND_OR, pattern.kind());
        assertTrue(pattern.trueBranch().isEmpty());
        assertEquals(List.of("Placeholder"), names(pattern.falseBranch()));
    }

    @Test
    void whenClassifying_givenConditionalsInsideMarkup_shouldFindEach() {
        final String source = """
                const x = (
                    <div>
                        {loading && <Spinner />}
                        <section>{error ? <Alert /> : null}</section>
                    </div>
                );
                """;

        final List<ConditionalPattern> patterns = classify(source);

        assertEquals(2, patterns.size());
        assertEquals("loading", patterns.get(0).conditionText());
        assertEquals(ConditionalKind.TERNARY, patterns.get(1).kind());
        assertEquals("error", patterns.get(1).conditionText());
    }

    // -- Statements --

    @Test
    void whenClassifyingIf_givenElse_shouldPopulateBothPaths() {
        final String source = """
                function View() {
                    if (props.ready) {
                        return <Ready />;
                    } else {
                        return <Waiting />;
                    }
                }
                """;

        final ConditionalPattern pattern = classifier.classifyIf(
                bodyStatement(source, 0), source);

        assertEquals(ConditionalKind.IF_ELSE, pattern.kind());
        assertEquals("props.ready", pattern.conditionText());
        assertEquals(List.of("Ready"), names(pattern.trueBranch()));
        assertEquals(List.of("Waiting"), names(pattern.falseBranch()));
    }

    @Test
    void whenClassifyingIf_givenNoElse_shouldLeaveFalsePathNull() {
        final String source = """
                function View() {
                    if (busy) return <Busy />;
                    return <Idle />;
                }
                """;

        final ConditionalPattern pattern = classifier.classifyIf(
                bodyStatement(source, 0), source);

        assertNull(pattern.falseBranch());
        assertEquals(List.of("Busy"), names(pattern.trueBranch()));
    }

    @Test
    void whenClassifyingSwitch_givenCases_shouldKeepUnionAndPerCaseBranches() {
        final String source = """
                function View() {
                    switch (status) {
                        case 'loading':
                            return <Spinner />;
                        case 'error':
                            return <ErrorView />;
                        default:
                            return <Done />;
                    }
                }
                """;

        final ConditionalPattern pattern = classifier.classifySwitch(
                bodyStatement(source, 0), source);

        assertEquals(ConditionalKind.SWITCH, pattern.kind());
        assertEquals("status", pattern.conditionText());
        assertEquals(List.of("Spinner", "ErrorView", "Done"),
                names(pattern.trueBranch()));
        assertEquals(3, pattern.cases().size());
        assertEquals("'loading'", pattern.cases().get(0).label());
        assertEquals(List.of("ErrorView"),
                names(pattern.cases().get(1).references()));
        assertEquals(ConditionalPatternClassifier.DEFAULT_CASE,
                pattern.cases().get(2).label());
    }

    @Test
    void whenBuildingEarlyExit_givenReturn_shouldUseLiteralConditionText() {
        final String source = """
                function View() {
                    return <Empty />;
                }
                """;

        final ConditionalPattern pattern = classifier.earlyExit(
                bodyStatement(source, 0), source);

        assertEquals(ConditionalKind.EARLY_EXIT, pattern.kind());
        assertEquals(ConditionalPatternClassifier.EARLY_RETURN,
                pattern.conditionText());
        assertEquals(List.of("Empty"), names(pattern.trueBranch()));
    }

    @Test
    void whenClassifyingIf_givenOtherStatement_shouldThrow() {
        final String source = """
                function View() {
                    return <Empty />;
                }
                """;

        assertThrows(IllegalArgumentException.class,
                () -> classifier.classifyIf(bodyStatement(source, 0), source));
    }

    private List<ConditionalPattern> classify(final String source) {
        return classifier.classifyExpression(
                SharedSyntaxEngine.initializer(source), source);
    }

    private static SyntaxNode bodyStatement(final String source,
            final int index) {
        return SharedSyntaxEngine.firstStatement(source)
                .field("body").children().get(index);
    }

    private static List<String> names(final ExtractedReferences references) {
        return references.components().stream()
                .map(ComponentReference::name)
                .toList();
    }
}
