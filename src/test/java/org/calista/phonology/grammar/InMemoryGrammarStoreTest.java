package org.calista.phonology.grammar;

import org.calista.phonology.feature.Feature;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.calista.phonology.feature.Feature.*;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryGrammarStoreTest {

    @Test
    void testMutatorsAreIdempotent() {
        InMemoryGrammarStore store = new InMemoryGrammarStore();

        assertTrue(store.addFeature(LABIAL));
        assertFalse(store.addFeature(LABIAL));

        assertTrue(store.setAttract(LABIAL, ANTERIOR));
        assertFalse(store.setAttract(LABIAL, ANTERIOR));
        assertTrue(store.clearAttract(LABIAL, ANTERIOR));
        assertFalse(store.clearAttract(LABIAL, ANTERIOR));

        assertTrue(store.setReject(LABIAL, CORONAL));
        assertFalse(store.setReject(LABIAL, CORONAL));
        assertTrue(store.clearReject(LABIAL, CORONAL));
        assertFalse(store.clearReject(LABIAL, CORONAL));
    }

    @Test
    void testAttractAndRejectAreExclusiveForSamePair() {
        InMemoryGrammarStore store = new InMemoryGrammarStore();
        store.setAttract(NASAL, VOICE);
        store.setReject(NASAL, VOICE);

        assertEquals(Set.of(), store.attractSet(NASAL));
        assertEquals(Set.of(VOICE), store.rejectSet(NASAL));

        store.setAttract(NASAL, VOICE);
        assertEquals(Set.of(VOICE), store.attractSet(NASAL));
        assertEquals(Set.of(), store.rejectSet(NASAL));
    }

    @Test
    void testSelfConstraintsAreIgnored() {
        InMemoryGrammarStore store = new InMemoryGrammarStore();
        assertFalse(store.setAttract(HIGH, HIGH));
        assertFalse(store.setReject(HIGH, HIGH));
        assertFalse(store.isKnown(HIGH));
    }

    @Test
    void testUnknownFeatureReadsAreEmpty() {
        InMemoryGrammarStore store = new InMemoryGrammarStore();
        assertEquals(Set.of(), store.attractSet(LOW));
        assertEquals(Set.of(), store.rejectSet(LOW));
        assertEquals(List.of(), store.observations(LOW));
        assertEquals(0, store.distinctObservations(LOW));
        assertFalse(store.clearAttract(LOW, HIGH));
    }

    @Test
    void testHistoryKeepsDuplicatesButCountsDistinct() {
        InMemoryGrammarStore store = new InMemoryGrammarStore();
        Set<Feature> p = Set.of(CONSONANTAL, ANTERIOR, LABIAL);
        Set<Feature> t = Set.of(CONSONANTAL, ANTERIOR, CORONAL);

        store.recordObservation(CONSONANTAL, p);
        store.recordObservation(CONSONANTAL, p);
        assertEquals(2, store.observations(CONSONANTAL).size());
        assertEquals(1, store.distinctObservations(CONSONANTAL));

        store.recordObservation(CONSONANTAL, t);
        assertEquals(3, store.observations(CONSONANTAL).size());
        assertEquals(2, store.distinctObservations(CONSONANTAL));
    }

    @Test
    void testGrammarTableIsCatalogueOrderedSnapshot() {
        InMemoryGrammarStore store = new InMemoryGrammarStore();
        store.addFeature(ANTERIOR);
        store.addFeature(CONSONANTAL);
        store.setAttract(LABIAL, ANTERIOR);

        List<GrammarRow> table = store.grammarTable();
        assertEquals(List.of(CONSONANTAL, LABIAL, ANTERIOR), table.stream().map(r -> r.feature).toList());
        assertEquals(List.of("Anterior"), table.get(1).attractNames());

        store.clearAttract(LABIAL, ANTERIOR);
        assertEquals(Set.of(ANTERIOR), table.get(1).attracts, "rows must not follow later mutations");
    }

    @Test
    void testResetClearsEverything() {
        InMemoryGrammarStore store = new InMemoryGrammarStore();
        store.setAttract(LABIAL, ANTERIOR);
        store.setReject(ANTERIOR, DORSAL);
        store.recordObservation(LABIAL, Set.of(LABIAL, ANTERIOR));

        store.reset();

        assertTrue(store.knownFeatures().isEmpty());
        assertTrue(store.grammarTable().isEmpty());
        assertEquals(0, store.distinctObservations(LABIAL));
        assertEquals(List.of(), store.observations(LABIAL));
    }
}
