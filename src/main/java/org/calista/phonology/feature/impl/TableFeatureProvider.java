package org.calista.phonology.feature.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.phonology.exceptions.InvalidFeatureNameException;
import org.calista.phonology.exceptions.UnknownSegmentException;
import org.calista.phonology.feature.Feature;
import org.calista.phonology.feature.FeatureProvider;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Table-backed {@link FeatureProvider}.
 *
 * <p>
 * Holds base segments and diacritic marks from a {@link FeatureTable}. Immutable after
 * construction, so one instance may serve any number of sessions.
 * All feature names are validated up front: a bad name fails construction, never a lookup.
 * </p>
 */
public final class TableFeatureProvider implements FeatureProvider {
    private static final Logger log = LogManager.getLogger(TableFeatureProvider.class);

    public static final String DEFAULT_RESOURCE = "features/segments.json";

    // insertion order = table order (reverse lookup is deterministic)
    private final LinkedHashMap<String, Set<Feature>> segments = new LinkedHashMap<>();
    private final LinkedHashMap<String, Set<Feature>> diacritics = new LinkedHashMap<>();
    private final int maxSymbolLength;

    public TableFeatureProvider(FeatureTable table) {
        Objects.requireNonNull(table, "table");

        int maxLen = 1;
        if (table.segments != null) {
            for (FeatureTable.Entry e : table.segments) {
                if (e == null || e.symbol == null || e.symbol.isBlank()) {
                    throw new IllegalStateException("Feature table contains a segment without symbol");
                }
                String symbol = e.symbol.trim();
                Set<Feature> fs = parseFeatures(e.features, "segment " + symbol);
                if (segments.putIfAbsent(symbol, fs) != null) {
                    throw new IllegalStateException("Duplicate segment symbol in feature table: " + symbol);
                }
                maxLen = Math.max(maxLen, symbol.length());
            }
        }
        if (table.diacritics != null) {
            for (FeatureTable.Diacritic d : table.diacritics) {
                if (d == null || d.mark == null || d.mark.isEmpty()) {
                    throw new IllegalStateException("Feature table contains a diacritic without mark");
                }
                Set<Feature> fs = parseFeatures(d.features, "diacritic " + d.mark);
                if (fs.isEmpty()) {
                    throw new IllegalStateException("Diacritic adds no features: " + d.mark);
                }
                if (diacritics.putIfAbsent(d.mark, fs) != null) {
                    throw new IllegalStateException("Duplicate diacritic mark in feature table: " + d.mark);
                }
            }
        }
        this.maxSymbolLength = maxLen;

        if (log.isDebugEnabled()) {
            log.debug("TableFeatureProvider ready: segments={}, diacritics={}, maxSymbolLength={}",
                    segments.size(), diacritics.size(), maxSymbolLength);
        }
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static TableFeatureProvider fromJson(String json, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(mapper, "mapper");
        FeatureTable t = mapper.readValue(json, FeatureTable.class);
        if (t == null) throw new IOException("Feature table is empty");
        return new TableFeatureProvider(t);
    }

    public static TableFeatureProvider fromClasspath(String resource, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(mapper, "mapper");

        ClassLoader cl = TableFeatureProvider.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new IOException("Feature table resource not found: " + resource);
            FeatureTable t = mapper.readValue(in, FeatureTable.class);
            if (t == null) throw new IOException("Feature table is empty: " + resource);
            return new TableFeatureProvider(t);
        }
    }

    public static TableFeatureProvider defaultTable(ObjectMapper mapper) throws IOException {
        return fromClasspath(DEFAULT_RESOURCE, mapper);
    }

    // ---------------------------------------------------------------------
    // FeatureProvider
    // ---------------------------------------------------------------------

    @Override
    public Set<Feature> featuresOf(String segmentIdentifier) {
        if (segmentIdentifier == null) throw new UnknownSegmentException("null");
        String id = segmentIdentifier.trim();

        Set<Feature> base = segments.get(id);
        if (base != null) return base;

        // base + diacritic marks: longest base prefix whose tail consists only of marks
        for (int len = Math.min(maxSymbolLength, id.length()); len >= 1; len--) {
            Set<Feature> fs = segments.get(id.substring(0, len));
            if (fs == null) continue;

            EnumSet<Feature> acc = fs.isEmpty() ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(fs);
            if (applyMarks(id.substring(len), acc)) {
                return Collections.unmodifiableSet(acc);
            }
        }
        throw new UnknownSegmentException(segmentIdentifier);
    }

    @Override
    public List<String> segmentWord(String wordIdentifier) {
        if (wordIdentifier == null || wordIdentifier.isBlank()) return List.of();

        final String w = wordIdentifier.trim();
        final int n = w.length();
        final ArrayList<String> out = new ArrayList<>(n);

        int i = 0;
        while (i < n) {
            char c = w.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            int matched = 0;
            for (int len = Math.min(maxSymbolLength, n - i); len >= 1; len--) {
                if (segments.containsKey(w.substring(i, i + len))) {
                    matched = len;
                    break;
                }
            }
            if (matched == 0) {
                throw new UnknownSegmentException(w.substring(i, i + 1), w);
            }

            int end = i + matched;
            // diacritics stick to the preceding segment
            while (end < n) {
                int markLen = markAt(w, end);
                if (markLen == 0) break;
                end += markLen;
            }

            out.add(w.substring(i, end));
            i = end;
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public List<String> identifierOf(Set<Feature> features, boolean allowDiacritics) {
        Objects.requireNonNull(features, "features");

        ArrayList<String> out = new ArrayList<>(2);
        for (Map.Entry<String, Set<Feature>> e : segments.entrySet()) {
            if (e.getValue().equals(features)) out.add(e.getKey());
        }
        if (!allowDiacritics) return out;

        for (Map.Entry<String, Set<Feature>> e : segments.entrySet()) {
            Set<Feature> base = e.getValue();
            for (Map.Entry<String, Set<Feature>> d : diacritics.entrySet()) {
                Set<Feature> added = d.getValue();
                if (!Collections.disjoint(base, added)) continue;
                if (base.size() + added.size() != features.size()) continue;
                if (features.containsAll(base) && features.containsAll(added)) {
                    out.add(e.getKey() + d.getKey());
                }
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public Set<String> symbols() {
        return Collections.unmodifiableSet(segments.keySet());
    }

    public Set<String> marks() {
        return Collections.unmodifiableSet(diacritics.keySet());
    }

    // ---------------------------------------------------------------------
    // internals
    // ---------------------------------------------------------------------

    private boolean applyMarks(String tail, EnumSet<Feature> acc) {
        int i = 0;
        while (i < tail.length()) {
            int markLen = markAt(tail, i);
            if (markLen == 0) return false;
            acc.addAll(diacritics.get(tail.substring(i, i + markLen)));
            i += markLen;
        }
        return true;
    }

    /** Length of the longest diacritic mark starting at {@code i}, 0 if none. */
    private int markAt(String s, int i) {
        int best = 0;
        for (String mark : diacritics.keySet()) {
            if (mark.length() > best && s.startsWith(mark, i)) best = mark.length();
        }
        return best;
    }

    private static Set<Feature> parseFeatures(List<String> names, String where) {
        EnumSet<Feature> fs = EnumSet.noneOf(Feature.class);
        if (names == null) return Collections.unmodifiableSet(fs);
        for (String name : names) {
            Optional<Feature> f = Feature.tryFromName(name);
            if (f.isEmpty()) throw new InvalidFeatureNameException(String.valueOf(name), where);
            fs.add(f.get());
        }
        return Collections.unmodifiableSet(fs);
    }
}
