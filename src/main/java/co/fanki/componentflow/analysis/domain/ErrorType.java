package co.fanki.componentflow.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kinds of failure an analysis run reports.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ErrorType {

    PARSING_ERROR("parsing_error"),
    RESOLUTION_ERROR("resolution_error"),
    FILE_NOT_FOUND("file_not_found"),
    INVALID_JSX("invalid_jsx");

    private final String code;

    ErrorType(final String theCode) {
        this.code = theCode;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
