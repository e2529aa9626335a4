package org.calista.phonology.feature;

import java.util.List;
import java.util.Set;

/**
 * FeatureProvider: narrow boundary to the feature resource.
 *
 * <p>The grammar core never sees how segments are stored; it only asks for feature sets
 * and for reverse lookups. Implementations must be safe to share between sessions
 * (read-only after construction).</p>
 */
public interface FeatureProvider {

    /**
     * @param segmentIdentifier segment symbol, optionally with diacritic marks
     * @return features of the segment (may be empty)
     * @throws org.calista.phonology.exceptions.UnknownSegmentException if unresolvable
     */
    Set<Feature> featuresOf(String segmentIdentifier);

    /**
     * Splits a word into segment identifiers, left to right.
     *
     * @throws org.calista.phonology.exceptions.UnknownSegmentException on a character that starts no segment
     */
    List<String> segmentWord(String wordIdentifier);

    /**
     * Reverse lookup. Base identifiers come first, then diacritic variants (only when allowed).
     *
     * @return zero or more identifiers whose feature set equals {@code features}
     */
    List<String> identifierOf(Set<Feature> features, boolean allowDiacritics);
}
