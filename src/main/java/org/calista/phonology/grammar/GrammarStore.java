package org.calista.phonology.grammar;

import org.calista.phonology.feature.Feature;

import java.util.List;
import java.util.Set;

/**
 * GrammarStore: owner of the grammar (attract/reject sets per known feature) and of
 * every feature's observation history.
 *
 * <p>Interface + implementation, one instance per session. All mutators are idempotent
 * and total for well-formed input. A feature is known iff it has been added; Attract and
 * Reject are never both true for the same ordered pair.</p>
 */
public interface GrammarStore {

    /** @return true if the feature was not known before */
    boolean addFeature(Feature f);

    boolean isKnown(Feature f);

    /** @return true if the constraint was not present before */
    boolean setAttract(Feature f, Feature g);

    /** @return true if the constraint was present */
    boolean clearAttract(Feature f, Feature g);

    boolean setReject(Feature f, Feature g);

    boolean clearReject(Feature f, Feature g);

    /** Appends {@code segment} to the history of {@code f}. */
    void recordObservation(Feature f, Set<Feature> segment);

    /** Read-only view, empty for unknown features. */
    Set<Feature> attractSet(Feature f);

    Set<Feature> rejectSet(Feature f);

    /** Every recorded observation of {@code f}, in arrival order (duplicates kept). */
    List<Set<Feature>> observations(Feature f);

    /** Number of distinct feature sets among the observations of {@code f}. */
    int distinctObservations(Feature f);

    /** Known features in catalogue order. */
    Set<Feature> knownFeatures();

    /** Rows in catalogue order, detached snapshot. */
    List<GrammarRow> grammarTable();

    /** Clears grammar and history unconditionally. */
    void reset();
}
