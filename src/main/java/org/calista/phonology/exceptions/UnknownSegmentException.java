package org.calista.phonology.exceptions;

/**
 * Raised when a segment (or a character inside a word) cannot be resolved to a feature set.
 */
public class UnknownSegmentException extends RuntimeException {

    private final String identifier;

    public UnknownSegmentException(String identifier) {
        super("Unknown segment: '" + identifier + "'");
        this.identifier = identifier;
    }

    public UnknownSegmentException(String identifier, String context) {
        super("Unknown segment: '" + identifier + "' in '" + context + "'");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
