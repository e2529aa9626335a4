package org.calista.phonology.grammar;

import org.calista.phonology.feature.Feature;

import java.util.*;

/**
 * EnumMap/EnumSet backed {@link GrammarStore}.
 *
 * <p>
 * Not thread-safe: a store is owned by exactly one session. Parallel sessions
 * each get their own instance, nothing is shared.
 * </p>
 */
public final class InMemoryGrammarStore implements GrammarStore {

    private final EnumMap<Feature, EnumSet<Feature>> attracts = new EnumMap<>(Feature.class);
    private final EnumMap<Feature, EnumSet<Feature>> rejects = new EnumMap<>(Feature.class);

    private final EnumMap<Feature, List<Set<Feature>>> history = new EnumMap<>(Feature.class);
    private final EnumMap<Feature, Set<Set<Feature>>> distinct = new EnumMap<>(Feature.class);

    @Override
    public boolean addFeature(Feature f) {
        Objects.requireNonNull(f, "f");
        if (attracts.containsKey(f)) return false;
        attracts.put(f, EnumSet.noneOf(Feature.class));
        rejects.put(f, EnumSet.noneOf(Feature.class));
        return true;
    }

    @Override
    public boolean isKnown(Feature f) {
        return f != null && attracts.containsKey(f);
    }

    @Override
    public boolean setAttract(Feature f, Feature g) {
        if (f == g) return false;
        addFeature(f);
        rejects.get(f).remove(g); // exclusivity
        return attracts.get(f).add(g);
    }

    @Override
    public boolean clearAttract(Feature f, Feature g) {
        EnumSet<Feature> s = attracts.get(f);
        return s != null && s.remove(g);
    }

    @Override
    public boolean setReject(Feature f, Feature g) {
        if (f == g) return false;
        addFeature(f);
        attracts.get(f).remove(g); // exclusivity
        return rejects.get(f).add(g);
    }

    @Override
    public boolean clearReject(Feature f, Feature g) {
        EnumSet<Feature> s = rejects.get(f);
        return s != null && s.remove(g);
    }

    @Override
    public void recordObservation(Feature f, Set<Feature> segment) {
        Objects.requireNonNull(f, "f");
        Objects.requireNonNull(segment, "segment");
        Set<Feature> copy = Feature.setOf(segment);
        history.computeIfAbsent(f, k -> new ArrayList<>()).add(copy);
        distinct.computeIfAbsent(f, k -> new HashSet<>()).add(copy);
    }

    @Override
    public Set<Feature> attractSet(Feature f) {
        EnumSet<Feature> s = attracts.get(f);
        return s == null ? Set.of() : Collections.unmodifiableSet(s);
    }

    @Override
    public Set<Feature> rejectSet(Feature f) {
        EnumSet<Feature> s = rejects.get(f);
        return s == null ? Set.of() : Collections.unmodifiableSet(s);
    }

    @Override
    public List<Set<Feature>> observations(Feature f) {
        List<Set<Feature>> h = history.get(f);
        return h == null ? List.of() : Collections.unmodifiableList(h);
    }

    @Override
    public int distinctObservations(Feature f) {
        Set<Set<Feature>> d = distinct.get(f);
        return d == null ? 0 : d.size();
    }

    @Override
    public Set<Feature> knownFeatures() {
        return Collections.unmodifiableSet(attracts.keySet());
    }

    @Override
    public List<GrammarRow> grammarTable() {
        ArrayList<GrammarRow> rows = new ArrayList<>(attracts.size());
        for (Map.Entry<Feature, EnumSet<Feature>> e : attracts.entrySet()) {
            rows.add(new GrammarRow(e.getKey(), e.getValue(), rejects.get(e.getKey())));
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public void reset() {
        attracts.clear();
        rejects.clear();
        history.clear();
        distinct.clear();
    }
}
