package co.fanki.componentflow.analysis.domain.imports;

/**
 * Where an imported module lives.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ImportKind {

    /** A project source file. */
    INTERNAL,

    /** A dependency package or framework runtime module. */
    EXTERNAL
}
