package org.calista.phonology.inventory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.phonology.feature.Feature;
import org.calista.phonology.feature.FeatureProvider;
import org.calista.phonology.grammar.GrammarStore;

import java.util.*;

/**
 * InventoryGenerator: validity checks and inventory prediction over a {@link GrammarStore}.
 *
 * <p>
 * Validity: a bundle S is valid iff for every F in S, attract(F) ⊆ S and reject(F) ∩ S = ∅.
 * Absent features impose nothing.
 * </p>
 *
 * <p>
 * Prediction enumerates the power set of the known features, so the cost is 2^|known|.
 * Fine for the 20-feature catalogue; a larger catalogue would explode, hence the
 * {@link Config#maxKnownFeatures} guard. Known features are mapped to bit positions in
 * catalogue order and masks are walked in ascending order, which fixes the output order
 * for an unchanged grammar.
 * </p>
 */
public final class InventoryGenerator {
    private static final Logger log = LogManager.getLogger(InventoryGenerator.class);

    public static final class Config {
        /** Upper bound on |known features| for enumeration (2^n candidates). */
        public int maxKnownFeatures = 20;

        /** Whether the featureless bundle takes part in the inventory (it is always valid). */
        public boolean includeEmptyBundle = true;
    }

    private final GrammarStore store;
    private final FeatureProvider provider;
    private final Config cfg;

    public InventoryGenerator(GrammarStore store, FeatureProvider provider) {
        this(store, provider, new Config());
    }

    public InventoryGenerator(GrammarStore store, FeatureProvider provider, Config cfg) {
        this.store = Objects.requireNonNull(store, "store");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.cfg = (cfg == null ? new Config() : cfg);
        if (this.cfg.maxKnownFeatures < 1 || this.cfg.maxKnownFeatures > 62) {
            throw new IllegalArgumentException("maxKnownFeatures must be in [1..62]");
        }
    }

    // =========================
    // Validation
    // =========================

    public boolean validSegment(Set<Feature> segment) {
        Objects.requireNonNull(segment, "segment");
        for (Feature f : segment) {
            if (!segment.containsAll(store.attractSet(f))) return false;
            if (!Collections.disjoint(store.rejectSet(f), segment)) return false;
        }
        return true;
    }

    /** Human-readable list of broken constraints, empty for a valid segment. */
    public List<String> violations(Set<Feature> segment) {
        Objects.requireNonNull(segment, "segment");
        if (segment.isEmpty()) return List.of();

        ArrayList<String> out = new ArrayList<>();
        for (Feature f : EnumSet.copyOf(segment)) {
            for (Feature g : store.attractSet(f)) {
                if (!segment.contains(g)) {
                    out.add(f.displayName() + " attracts " + g.displayName() + " (missing)");
                }
            }
            for (Feature g : store.rejectSet(f)) {
                if (segment.contains(g)) {
                    out.add(f.displayName() + " rejects " + g.displayName() + " (present)");
                }
            }
        }
        return out;
    }

    public SegmentCheck check(String identifier, Set<Feature> segment) {
        List<String> v = violations(segment);
        return new SegmentCheck(identifier, Feature.names(segment), v.isEmpty(), v);
    }

    /**
     * Checks already segmented identifiers, one detail row each, in input order.
     *
     * @throws org.calista.phonology.exceptions.UnknownSegmentException on the first unresolvable identifier
     */
    public List<SegmentCheck> checkSegments(List<String> identifiers) {
        Objects.requireNonNull(identifiers, "identifiers");
        ArrayList<SegmentCheck> details = new ArrayList<>(identifiers.size());
        for (String id : identifiers) {
            details.add(check(id, provider.featuresOf(id)));
        }
        return details;
    }

    /**
     * Word-level validity: the provider segments the word, each segment is checked on its own
     * and the word is valid iff every segment is.
     *
     * @throws org.calista.phonology.exceptions.UnknownSegmentException if the word cannot be segmented
     */
    public WordCheck checkWord(String word) {
        WordCheck wc = WordCheck.of(word, checkSegments(provider.segmentWord(word)));
        if (log.isDebugEnabled()) log.debug("checkWord: {}", wc);
        return wc;
    }

    // =========================
    // Enumeration
    // =========================

    /**
     * Every valid bundle over the known features, in ascending mask order.
     *
     * @throws IllegalStateException if more features are known than {@link Config#maxKnownFeatures}
     */
    public List<Set<Feature>> validBundles() {
        final Feature[] known = store.knownFeatures().toArray(new Feature[0]);
        final int n = known.length;
        if (n > cfg.maxKnownFeatures) {
            throw new IllegalStateException("Inventory enumeration over " + n
                    + " features exceeds maxKnownFeatures=" + cfg.maxKnownFeatures);
        }

        final EnumMap<Feature, Integer> bit = new EnumMap<>(Feature.class);
        for (int i = 0; i < n; i++) bit.put(known[i], i);

        final long[] attractMask = new long[n];
        final long[] rejectMask = new long[n];
        for (int i = 0; i < n; i++) {
            attractMask[i] = maskOf(store.attractSet(known[i]), bit);
            rejectMask[i] = maskOf(store.rejectSet(known[i]), bit);
        }

        final long limit = 1L << n;
        final ArrayList<Set<Feature>> out = new ArrayList<>();
        for (long mask = cfg.includeEmptyBundle ? 0L : 1L; mask < limit; mask++) {
            if (isValidMask(mask, attractMask, rejectMask)) {
                out.add(bundleOf(mask, known));
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("validBundles: known={}, candidates={}, valid={}", n, limit, out.size());
        }
        return out;
    }

    /**
     * Predicted inventory. Every valid bundle is resolved through the provider:
     * no identifier gives one {@code isEmpty} entry; with {@code basicOnly} only the first
     * base identifier is kept, otherwise every base and diacritic variant is listed.
     */
    public List<InventoryEntry> predictedInventory(boolean basicOnly) {
        List<Set<Feature>> bundles = validBundles();
        ArrayList<InventoryEntry> out = new ArrayList<>(bundles.size());

        int unresolved = 0;
        for (Set<Feature> b : bundles) {
            List<String> names = Feature.names(b);
            List<String> ids = provider.identifierOf(b, !basicOnly);
            if (ids.isEmpty()) {
                out.add(InventoryEntry.unresolved(names));
                unresolved++;
            } else if (basicOnly) {
                out.add(InventoryEntry.resolved(ids.get(0), names));
            } else {
                for (String id : ids) out.add(InventoryEntry.resolved(id, names));
            }
        }

        log.info("Predicted inventory: bundles={}, entries={}, unresolved={}, basicOnly={}",
                bundles.size(), out.size(), unresolved, basicOnly);
        return out;
    }

    // ---------- bit helpers ----------

    private static boolean isValidMask(long mask, long[] attractMask, long[] rejectMask) {
        long rest = mask;
        while (rest != 0L) {
            int i = Long.numberOfTrailingZeros(rest);
            rest &= rest - 1;
            if ((attractMask[i] & ~mask) != 0L) return false;
            if ((rejectMask[i] & mask) != 0L) return false;
        }
        return true;
    }

    private static long maskOf(Set<Feature> fs, Map<Feature, Integer> bit) {
        long m = 0L;
        for (Feature f : fs) {
            Integer i = bit.get(f);
            if (i != null) m |= 1L << i;
        }
        return m;
    }

    private static Set<Feature> bundleOf(long mask, Feature[] known) {
        EnumSet<Feature> s = EnumSet.noneOf(Feature.class);
        long rest = mask;
        while (rest != 0L) {
            int i = Long.numberOfTrailingZeros(rest);
            rest &= rest - 1;
            s.add(known[i]);
        }
        return Collections.unmodifiableSet(s);
    }
}
