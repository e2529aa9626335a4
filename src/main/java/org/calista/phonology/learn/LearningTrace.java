package org.calista.phonology.learn;

import org.calista.phonology.feature.Feature;
import org.calista.phonology.grammar.Constraint;

import java.util.*;

/**
 * LearningTrace: record of a single learn step.
 *
 * <p>Lists are sorted by catalogue order (source, then target), so two runs over the same
 * state produce equal traces.</p>
 */
public final class LearningTrace {

    private static final LearningTrace EMPTY = new LearningTrace(
            null, Set.of(), Set.of(), List.of(), List.of(), List.of(), List.of());

    /** Identifier the features were resolved from; null when learning raw feature sets. */
    public final String identifier;
    public final Set<Feature> segment;
    public final Set<Feature> newFeatures;
    public final List<Constraint> attractsAdded;
    public final List<Constraint> attractsRemoved;
    public final List<Constraint> rejectsAdded;
    public final List<Constraint> rejectsRemoved;

    public LearningTrace(String identifier,
                         Set<Feature> segment,
                         Set<Feature> newFeatures,
                         List<Constraint> attractsAdded,
                         List<Constraint> attractsRemoved,
                         List<Constraint> rejectsAdded,
                         List<Constraint> rejectsRemoved) {
        this.identifier = identifier;
        this.segment = Feature.setOf(segment);
        this.newFeatures = Feature.setOf(newFeatures);
        this.attractsAdded = sorted(attractsAdded);
        this.attractsRemoved = sorted(attractsRemoved);
        this.rejectsAdded = sorted(rejectsAdded);
        this.rejectsRemoved = sorted(rejectsRemoved);
    }

    public static LearningTrace empty() {
        return EMPTY;
    }

    /** Same trace, tagged with the identifier it came from. */
    public LearningTrace withIdentifier(String id) {
        return new LearningTrace(id, segment, newFeatures,
                attractsAdded, attractsRemoved, rejectsAdded, rejectsRemoved);
    }

    /** True when the step changed no constraint and introduced no feature. */
    public boolean isNoop() {
        return newFeatures.isEmpty()
                && attractsAdded.isEmpty() && attractsRemoved.isEmpty()
                && rejectsAdded.isEmpty() && rejectsRemoved.isEmpty();
    }

    public int changeCount() {
        return attractsAdded.size() + attractsRemoved.size() + rejectsAdded.size() + rejectsRemoved.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(128);
        sb.append("trace[");
        if (identifier != null) sb.append(identifier).append(' ');
        sb.append(Feature.names(segment));
        if (!newFeatures.isEmpty()) sb.append(" new=").append(Feature.names(newFeatures));
        if (!attractsAdded.isEmpty()) sb.append(" +A").append(attractsAdded);
        if (!attractsRemoved.isEmpty()) sb.append(" -A").append(attractsRemoved);
        if (!rejectsAdded.isEmpty()) sb.append(" +R").append(rejectsAdded);
        if (!rejectsRemoved.isEmpty()) sb.append(" -R").append(rejectsRemoved);
        return sb.append(']').toString();
    }

    private static List<Constraint> sorted(List<Constraint> xs) {
        if (xs == null || xs.isEmpty()) return List.of();
        ArrayList<Constraint> out = new ArrayList<>(xs);
        out.sort(Constraint.ORDER);
        return Collections.unmodifiableList(out);
    }
}
