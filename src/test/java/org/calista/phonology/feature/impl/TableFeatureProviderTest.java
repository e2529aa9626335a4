package org.calista.phonology.feature.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.phonology.exceptions.InvalidFeatureNameException;
import org.calista.phonology.exceptions.UnknownSegmentException;
import org.calista.phonology.feature.Feature;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static org.calista.phonology.feature.Feature.*;
import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TableFeatureProviderTest {

    private TableFeatureProvider provider;

    @BeforeAll
    void setup() throws IOException {
        provider = TableFeatureProvider.defaultTable(new ObjectMapper());
    }

    @Test
    void testFeaturesOf_baseSymbol() {
        assertEquals(Set.of(ANTERIOR, CONSONANTAL, CONTINUANT, CORONAL, STRIDENT), provider.featuresOf("s"));
        assertEquals(Set.of(ANTERIOR, CONSONANTAL, LABIAL), provider.featuresOf("p"));
    }

    @Test
    void testFeaturesOf_appliesDiacritics() {
        assertEquals(Set.of(ANTERIOR, CONSONANTAL, LABIAL, SPREAD_GLOTTIS), provider.featuresOf("pʰ"));
        assertEquals(Set.of(CONSONANTAL, DORSAL, HIGH, BACK, LABIAL, ROUND), provider.featuresOf("kʷ"));
        assertEquals(Set.of(CONSONANTAL, DORSAL, HIGH, BACK, LABIAL, ROUND, SPREAD_GLOTTIS), provider.featuresOf("kʷʰ"));
    }

    @Test
    void testFeaturesOf_unknownSegmentFails() {
        UnknownSegmentException e = assertThrows(UnknownSegmentException.class, () -> provider.featuresOf("Q"));
        assertEquals("Q", e.getIdentifier());
        assertThrows(UnknownSegmentException.class, () -> provider.featuresOf("pQ"));
        assertThrows(UnknownSegmentException.class, () -> provider.featuresOf(""));
    }

    @Test
    void testSegmentWord_longestMatchAndDiacritics() {
        assertEquals(List.of("tʃ", "a", "p"), provider.segmentWord("tʃap"));
        assertEquals(List.of("kʷ", "a", "m", "a"), provider.segmentWord("kʷama"));
        assertEquals(List.of("p", "a", "p", "a"), provider.segmentWord("pa pa"));
        assertEquals(List.of(), provider.segmentWord("   "));
    }

    @Test
    void testSegmentWord_unknownCharacterFails() {
        UnknownSegmentException e = assertThrows(UnknownSegmentException.class, () -> provider.segmentWord("paQa"));
        assertEquals("Q", e.getIdentifier());
    }

    @Test
    void testIdentifierOf_basicAndDiacriticVariants() {
        assertEquals(List.of("p"), provider.identifierOf(Set.of(ANTERIOR, CONSONANTAL, LABIAL), false));

        Set<Feature> aspirated = Set.of(ANTERIOR, CONSONANTAL, LABIAL, SPREAD_GLOTTIS);
        assertEquals(List.of(), provider.identifierOf(aspirated, false));
        assertEquals(List.of("pʰ"), provider.identifierOf(aspirated, true));

        assertEquals(List.of(), provider.identifierOf(Set.of(LABIAL), true));
    }

    @Test
    void testConstruction_rejectsUnknownFeatureName() {
        FeatureTable t = new FeatureTable();
        t.segments.add(new FeatureTable.Entry("p", List.of("Consonantal", "Bilabial")));
        InvalidFeatureNameException e = assertThrows(InvalidFeatureNameException.class, () -> new TableFeatureProvider(t));
        assertEquals("Bilabial", e.getFeatureName());
    }

    @Test
    void testConstruction_rejectsDuplicateSymbol() {
        FeatureTable t = new FeatureTable();
        t.segments.add(new FeatureTable.Entry("p", List.of("Consonantal")));
        t.segments.add(new FeatureTable.Entry("p", List.of("Labial")));
        assertThrows(IllegalStateException.class, () -> new TableFeatureProvider(t));
    }

    @Test
    void testFromJson_readsSegmentsAndDiacritics() throws IOException {
        String json = "{\"segments\":[{\"symbol\":\"a\",\"features\":[\"Syllabic\"]}],"
                + "\"diacritics\":[{\"mark\":\"~\",\"features\":[\"Nasal\"]}]}";
        TableFeatureProvider p = TableFeatureProvider.fromJson(json, new ObjectMapper());

        assertEquals(Set.of(SYLLABIC, NASAL), p.featuresOf("a~"));
        assertEquals(List.of("a~"), p.segmentWord("a~"));
        assertEquals(Set.of("a"), p.symbols());
        assertEquals(Set.of("~"), p.marks());
    }
}
