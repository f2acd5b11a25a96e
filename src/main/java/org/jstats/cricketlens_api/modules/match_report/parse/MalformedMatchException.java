package org.jstats.cricketlens_api.modules.match_report.parse;

/**
 * The match record cannot be used at all, typically because ball-level structure is missing.
 */
public class MalformedMatchException extends RuntimeException {

    private final String fieldPath;

    public MalformedMatchException(String fieldPath, String reason) {
        super(fieldPath + ": " + reason);
        this.fieldPath = fieldPath;
    }

    public String getFieldPath() {
        return fieldPath;
    }
}
