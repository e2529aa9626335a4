package org.calista.phonology.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.phonology.feature.Feature;
import org.calista.phonology.feature.FeatureProvider;
import org.calista.phonology.grammar.GrammarRow;
import org.calista.phonology.grammar.GrammarStore;
import org.calista.phonology.grammar.InMemoryGrammarStore;
import org.calista.phonology.inventory.InventoryEntry;
import org.calista.phonology.inventory.InventoryGenerator;
import org.calista.phonology.inventory.WordCheck;
import org.calista.phonology.learn.Learner;
import org.calista.phonology.learn.LearningTrace;
import org.calista.phonology.learn.impl.ConstraintLearner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * GrammarSession: the in-process call surface over one grammar.
 *
 * <p>
 * Owns its {@link GrammarStore}; the {@link FeatureProvider} is shared and read-only.
 * Not thread-safe: concurrent learners use separate sessions.
 * </p>
 *
 * <p>
 * Identifiers are resolved before the grammar is touched, so an unknown segment leaves the
 * grammar exactly as it was for that call. Words are learned segment by segment: a failure
 * at segment k keeps what segments before k already taught.
 * </p>
 */
public final class GrammarSession {
    private static final Logger log = LogManager.getLogger(GrammarSession.class);

    private final String id;
    private final FeatureProvider provider;
    private final GrammarStore store;
    private final Learner learner;
    private final InventoryGenerator inventory;

    private long learnedSegments = 0L;

    public GrammarSession(FeatureProvider provider) {
        this("sess-" + Long.toHexString(System.nanoTime()), provider, new InMemoryGrammarStore(),
                true, new InventoryGenerator.Config());
    }

    public GrammarSession(String id,
                          FeatureProvider provider,
                          GrammarStore store,
                          boolean traceEnabled,
                          InventoryGenerator.Config inventoryConfig) {
        this.id = Objects.requireNonNull(id, "id");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.store = Objects.requireNonNull(store, "store");
        this.learner = new ConstraintLearner(store, traceEnabled);
        this.inventory = new InventoryGenerator(store, provider, inventoryConfig);
    }

    // ---------------------------------------------------------------------
    // Learning
    // ---------------------------------------------------------------------

    /** Learns one segment. Blank identifier is a no-op with an empty trace. */
    public LearningTrace learnSegment(String identifier) {
        if (identifier == null || identifier.isBlank()) return LearningTrace.empty();

        Set<Feature> features = provider.featuresOf(identifier);
        LearningTrace trace = learner.learn(features).withIdentifier(identifier.trim());
        learnedSegments++;
        return trace;
    }

    /** Learns every segment of a word, in order. Blank word gives an empty list. */
    public List<LearningTrace> learnWord(String word) {
        if (word == null || word.isBlank()) return List.of();

        List<String> segments = provider.segmentWord(word);
        ArrayList<LearningTrace> out = new ArrayList<>(segments.size());
        for (String seg : segments) {
            out.add(learnSegment(seg));
        }

        if (log.isDebugEnabled()) {
            log.debug("[{}] learnWord '{}': segments={}, known={}", id, word, segments.size(), store.knownFeatures().size());
        }
        return Collections.unmodifiableList(out);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /** Blank identifier is the empty segment, which is always valid. */
    public boolean validSegment(String identifier) {
        if (identifier == null || identifier.isBlank()) return true;
        return inventory.validSegment(provider.featuresOf(identifier));
    }

    public boolean validFeatures(Set<Feature> features) {
        return inventory.validSegment(features);
    }

    /** Blank word is valid with no details. */
    public WordCheck checkWord(String word) {
        if (word == null || word.isBlank()) return new WordCheck(word == null ? "" : word, true, List.of());
        return inventory.checkWord(word);
    }

    public List<InventoryEntry> predictedInventory(boolean basicOnly) {
        return inventory.predictedInventory(basicOnly);
    }

    public List<GrammarRow> grammarTable() {
        return store.grammarTable();
    }

    public Set<Feature> knownFeatures() {
        return store.knownFeatures();
    }

    public void reset() {
        store.reset();
        learnedSegments = 0L;
        log.info("[{}] grammar reset", id);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String id() { return id; }

    public long learnedSegments() { return learnedSegments; }

    public GrammarStore store() { return store; }
}
