package org.calista.phonology.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.phonology.exceptions.UnknownSegmentException;
import org.calista.phonology.feature.Feature;
import org.calista.phonology.feature.FeatureProvider;
import org.calista.phonology.feature.impl.TableFeatureProvider;
import org.calista.phonology.grammar.GrammarRow;
import org.calista.phonology.inventory.InventoryEntry;
import org.calista.phonology.inventory.WordCheck;
import org.calista.phonology.learn.LearningTrace;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.calista.phonology.feature.Feature.*;
import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class GrammarSessionTest {

    private TableFeatureProvider table;
    private GrammarSession session;

    @BeforeAll
    void loadTable() throws IOException {
        table = TableFeatureProvider.defaultTable(new ObjectMapper());
    }

    @BeforeEach
    void setup() {
        session = new GrammarSession(table);
    }

    @Test
    void testLearnSegment_scenario() {
        LearningTrace first = session.learnSegment("s");
        LearningTrace second = session.learnSegment("p");

        assertEquals("s", first.identifier);
        assertEquals(Set.of(LABIAL), second.newFeatures);

        GrammarRow labial = session.grammarTable().stream()
                .filter(r -> r.feature == LABIAL).findFirst().orElseThrow();
        assertEquals(Set.of(ANTERIOR, CONSONANTAL), labial.attracts);
        assertTrue(labial.rejects.isEmpty());
        assertEquals(2, session.learnedSegments());
    }

    @Test
    void testUnknownSegment_leavesGrammarUntouched() {
        session.learnSegment("s");
        List<GrammarRow> before = session.grammarTable();

        assertThrows(UnknownSegmentException.class, () -> session.learnSegment("Q"));

        assertEquals(before, session.grammarTable());
        assertEquals(1, session.learnedSegments());
    }

    @Test
    void testLearnWord_keepsSegmentsBeforeFailure() {
        FeatureProvider flaky = new FeatureProvider() {
            @Override
            public Set<Feature> featuresOf(String id) {
                if ("?".equals(id)) throw new UnknownSegmentException(id);
                return table.featuresOf(id);
            }

            @Override
            public List<String> segmentWord(String word) {
                return List.of("p", "?", "s");
            }

            @Override
            public List<String> identifierOf(Set<Feature> features, boolean allowDiacritics) {
                return table.identifierOf(features, allowDiacritics);
            }
        };
        GrammarSession s = new GrammarSession(flaky);

        assertThrows(UnknownSegmentException.class, () -> s.learnWord("p?s"));

        assertEquals(Set.of(CONSONANTAL, LABIAL, ANTERIOR), s.knownFeatures());
        assertEquals(1, s.learnedSegments());
    }

    @Test
    void testLearnWord_tracesInSegmentOrder() {
        List<LearningTrace> traces = session.learnWord("pata");

        assertEquals(List.of("p", "a", "t", "a"), traces.stream().map(t -> t.identifier).toList());
        assertTrue(traces.get(3).isNoop());
    }

    @Test
    void testEmptyInputs_areNoops() {
        assertTrue(session.learnSegment("").isNoop());
        assertTrue(session.learnSegment("   ").isNoop());
        assertEquals(List.of(), session.learnWord(""));
        assertTrue(session.validSegment(""));

        WordCheck wc = session.checkWord("");
        assertTrue(wc.valid);
        assertTrue(wc.details.isEmpty());

        assertTrue(session.knownFeatures().isEmpty());
        assertEquals(0, session.learnedSegments());
    }

    @Test
    void testValidSegmentAndCheckWord() {
        session.learnSegment("s");
        session.learnSegment("p");

        assertTrue(session.validSegment("t"));
        assertTrue(session.validSegment("p"));
        assertTrue(session.validFeatures(Set.of(ANTERIOR, CONSONANTAL, CORONAL)));
        assertFalse(session.validFeatures(Set.of(LABIAL)));

        WordCheck wc = session.checkWord("tps");
        assertTrue(wc.valid);
        assertEquals(3, wc.details.size());
    }

    @Test
    void testPredictedInventory_isSound() {
        session.learnWord("sapimu");

        List<InventoryEntry> inv = session.predictedInventory(true);
        assertFalse(inv.isEmpty());
        for (InventoryEntry e : inv) {
            if (e.isEmpty) continue;
            assertTrue(session.validSegment(e.identifier), e.identifier + " must be valid");
        }
    }

    @Test
    void testReset_clearsGrammar() {
        session.learnWord("sapa");
        session.reset();

        assertTrue(session.knownFeatures().isEmpty());
        assertTrue(session.grammarTable().isEmpty());
        assertEquals(0, session.learnedSegments());
        List<InventoryEntry> inv = session.predictedInventory(true);
        assertEquals(1, inv.size());
        assertTrue(inv.get(0).isEmpty);
    }

    @Test
    void testSessions_doNotShareGrammar() {
        GrammarSession other = new GrammarSession(table);
        session.learnSegment("p");

        assertTrue(other.knownFeatures().isEmpty());
        assertNotEquals(session.store(), other.store());
    }
}
