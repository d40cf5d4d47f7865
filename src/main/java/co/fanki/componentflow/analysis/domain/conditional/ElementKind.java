package co.fanki.componentflow.analysis.domain.conditional;

/**
 * What a markup tag name denotes.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ElementKind {

    /** A user-defined or library component, such as {@code <Header/>}. */
    COMPONENT,

    /** A native markup tag, such as {@code <div>}. */
    MARKUP_ELEMENT,

    /** Anything that fits neither convention. */
    UNKNOWN
}
