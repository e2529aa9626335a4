package org.calista.phonology.inventory;

import java.util.List;

/**
 * Validity detail for one segment.
 * Violations read like "Labial attracts Anterior (missing)" / "Nasal rejects Lateral (present)".
 */
public final class SegmentCheck {
    public final String identifier;
    public final List<String> featureNames;
    public final boolean valid;
    public final List<String> violations;

    public SegmentCheck(String identifier, List<String> featureNames, boolean valid, List<String> violations) {
        this.identifier = identifier;
        this.featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        this.valid = valid;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    @Override
    public String toString() {
        return identifier + (valid ? " ok" : " invalid " + violations);
    }
}
