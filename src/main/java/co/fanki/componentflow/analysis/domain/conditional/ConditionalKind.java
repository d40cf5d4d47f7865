package co.fanki.componentflow.analysis.domain.conditional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The branching constructs that render different subtrees.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ConditionalKind {

    /** {@code cond ? <A/> : <B/>}. */
    TERNARY("ternary"),

    /** {@code cond && <A/>}, {@code a || <B/>} and {@code a ?? <B/>}. */
    LOGICAL_AND_OR("logical_and_or"),

    /** An if statement whose branches return markup. */
    IF_ELSE("if_else"),

    /** A switch statement whose cases return markup. */
    SWITCH("switch"),

    /** A markup return that is not the last exit of its function. */
    EARLY_EXIT("early_exit");

    private final String code;

    ConditionalKind(final String theCode) {
        this.code = theCode;
    }

    /**
     * Returns the serialized name.
     *
     * @return the lowercase code
     */
    @JsonValue
    public String code() {
        return code;
    }
}
