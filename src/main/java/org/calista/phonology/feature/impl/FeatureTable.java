package org.calista.phonology.feature.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * FeatureTable: JSON shape of the segment resource.
 *
 * <pre>
 * {
 *   "segments":   [ {"symbol":"p", "features":["Consonantal","Anterior","Labial"]}, ... ],
 *   "diacritics": [ {"mark":"ʰ", "features":["SpreadGlottis"]}, ... ]
 * }
 * </pre>
 *
 * Public fields for Jackson, names validated by {@link TableFeatureProvider}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FeatureTable {

    public List<Entry> segments = new ArrayList<>();
    public List<Diacritic> diacritics = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Entry {
        public String symbol;
        public List<String> features = new ArrayList<>();

        public Entry() {}

        public Entry(String symbol, List<String> features) {
            this.symbol = symbol;
            this.features = features;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Diacritic {
        public String mark;
        public List<String> features = new ArrayList<>();

        public Diacritic() {}

        public Diacritic(String mark, List<String> features) {
            this.mark = mark;
            this.features = features;
        }
    }
}
