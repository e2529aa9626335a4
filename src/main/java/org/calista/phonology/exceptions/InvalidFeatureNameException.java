package org.calista.phonology.exceptions;

/**
 * A feature name outside the curated catalogue. Treated as a fatal configuration error.
 */
public class InvalidFeatureNameException extends RuntimeException {

    private final String featureName;

    public InvalidFeatureNameException(String featureName) {
        super("Invalid feature name: '" + featureName + "'");
        this.featureName = featureName;
    }

    public InvalidFeatureNameException(String featureName, String source) {
        super("Invalid feature name: '" + featureName + "' (" + source + ")");
        this.featureName = featureName;
    }

    public String getFeatureName() {
        return featureName;
    }
}
