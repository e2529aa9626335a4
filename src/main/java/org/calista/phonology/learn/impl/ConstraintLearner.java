package org.calista.phonology.learn.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.phonology.feature.Feature;
import org.calista.phonology.grammar.Constraint;
import org.calista.phonology.grammar.GrammarStore;
import org.calista.phonology.learn.Learner;
import org.calista.phonology.learn.LearningTrace;

import java.util.*;

/**
 * Per-segment constraint learner.
 *
 * <p>One call = one observed segment, applied in a fixed order:</p>
 * <ol>
 *   <li>partition the segment into new and known features (state before this call);</li>
 *   <li>prune: a known feature loses every attract target missing from the segment;</li>
 *   <li>acquire: each new feature is added and attracts every known co-occurring feature
 *       (new features of the same call never constrain each other);</li>
 *   <li>record the segment in the history of every feature it contains;</li>
 *   <li>recompute rejects from scratch for each feature seen in at least two distinct segments:
 *       G is rejected iff it occurs in none of them.</li>
 * </ol>
 */
public final class ConstraintLearner implements Learner {
    private static final Logger log = LogManager.getLogger(ConstraintLearner.class);

    /** Distinct observations a feature needs before rejects are derived for it. */
    public static final int REJECT_MIN_DISTINCT = 2;

    private final GrammarStore store;
    private final boolean traceEnabled;

    public ConstraintLearner(GrammarStore store) {
        this(store, true);
    }

    public ConstraintLearner(GrammarStore store, boolean traceEnabled) {
        this.store = Objects.requireNonNull(store, "store");
        this.traceEnabled = traceEnabled;
    }

    @Override
    public LearningTrace learn(Set<Feature> segment) {
        Objects.requireNonNull(segment, "segment");
        if (segment.isEmpty()) {
            if (log.isDebugEnabled()) log.debug("learn: empty segment, nothing to do");
            return LearningTrace.empty();
        }

        final EnumSet<Feature> seg = EnumSet.copyOf(segment);

        // 1) partition against the state BEFORE this call
        final EnumSet<Feature> known = EnumSet.noneOf(Feature.class);
        final EnumSet<Feature> fresh = EnumSet.noneOf(Feature.class);
        for (Feature f : seg) {
            if (store.isKnown(f)) known.add(f);
            else fresh.add(f);
        }

        final ArrayList<Constraint> attractsAdded = new ArrayList<>();
        final ArrayList<Constraint> attractsRemoved = new ArrayList<>();
        final ArrayList<Constraint> rejectsAdded = new ArrayList<>();
        final ArrayList<Constraint> rejectsRemoved = new ArrayList<>();

        // 2) pruning: counter-evidence removes a wrong generalisation
        for (Feature f : known) {
            for (Feature g : EnumSet.copyOf(nonEmpty(store.attractSet(f)))) {
                if (!seg.contains(g) && store.clearAttract(f, g)) {
                    attractsRemoved.add(Constraint.attract(f, g));
                }
            }
        }

        // 3) acquisition
        for (Feature f : fresh) {
            store.addFeature(f);
            for (Feature g : known) {
                if (store.setAttract(f, g)) attractsAdded.add(Constraint.attract(f, g));
            }
        }

        // 4) history
        for (Feature f : seg) {
            store.recordObservation(f, seg);
        }

        // 5) rejects: чистая функция накопленной истории, пересчитываем целиком
        final EnumSet<Feature> all = EnumSet.noneOf(Feature.class);
        all.addAll(store.knownFeatures());
        for (Feature f : all) {
            if (store.distinctObservations(f) < REJECT_MIN_DISTINCT) continue;

            EnumSet<Feature> seen = EnumSet.noneOf(Feature.class);
            for (Set<Feature> obs : store.observations(f)) seen.addAll(obs);

            for (Feature g : all) {
                if (g == f) continue;
                if (!seen.contains(g)) {
                    if (store.setReject(f, g)) rejectsAdded.add(Constraint.reject(f, g));
                } else if (store.clearReject(f, g)) {
                    rejectsRemoved.add(Constraint.reject(f, g));
                }
            }
        }

        LearningTrace trace = new LearningTrace(null, seg, fresh,
                attractsAdded, attractsRemoved, rejectsAdded, rejectsRemoved);

        if (traceEnabled && log.isDebugEnabled()) {
            log.debug("learn: {} (known={}, changes={})", trace, store.knownFeatures().size(), trace.changeCount());
        }
        return trace;
    }

    private static Set<Feature> nonEmpty(Set<Feature> s) {
        // EnumSet.copyOf(Collection) rejects an empty non-EnumSet collection
        return s.isEmpty() ? EnumSet.noneOf(Feature.class) : s;
    }
}
