package co.fanki.componentflow.analysis.domain.ast;

/**
 * Turns source text into a syntax tree.
 *
 * <p>Implementations never throw across this boundary: any failure, from
 * a syntax error to an engine fault, is reported as {@code null} so the
 * caller can skip the file and go on with its siblings.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface SourceParser {

    /**
     * Parses one source file.
     *
     * @param sourceText the full text of the file
     * @param fileName the file name, used to pick the dialect
     *        (TSX, TS, JSX, JS)
     * @return the program node, or null when the text cannot be parsed
     */
    SyntaxNode parse(String sourceText, String fileName);

}
