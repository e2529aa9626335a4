package org.calista.phonology.grammar;

import org.calista.phonology.feature.Feature;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the grammar table: a known feature with its constraint sets.
 * Snapshot, detached from the store.
 */
public final class GrammarRow {
    public final Feature feature;
    public final Set<Feature> attracts;
    public final Set<Feature> rejects;

    public GrammarRow(Feature feature, Set<Feature> attracts, Set<Feature> rejects) {
        this.feature = Objects.requireNonNull(feature, "feature");
        this.attracts = Feature.setOf(attracts);
        this.rejects = Feature.setOf(rejects);
    }

    public List<String> attractNames() {
        return Feature.names(attracts);
    }

    public List<String> rejectNames() {
        return Feature.names(rejects);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GrammarRow)) return false;
        GrammarRow r = (GrammarRow) o;
        return feature == r.feature && attracts.equals(r.attracts) && rejects.equals(r.rejects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, attracts, rejects);
    }

    @Override
    public String toString() {
        return feature.displayName() + " attracts=" + attractNames() + " rejects=" + rejectNames();
    }
}
