package org.calista.phonology.feature;

import org.calista.phonology.exceptions.InvalidFeatureNameException;

import java.util.*;

/**
 * Closed catalogue of privative features.
 *
 * <p>Declaration order is the canonical order of the project: grammar table rows,
 * trace lists and inventory bit positions all follow it.</p>
 */
public enum Feature {
    CONSONANTAL("Consonantal"),
    SONORANT("Sonorant"),
    SYLLABIC("Syllabic"),
    CONTINUANT("Continuant"),
    NASAL("Nasal"),
    LATERAL("Lateral"),
    STRIDENT("Strident"),
    DELAYED_RELEASE("DelayedRelease"),
    VOICE("Voice"),
    SPREAD_GLOTTIS("SpreadGlottis"),
    CONSTRICTED_GLOTTIS("ConstrictedGlottis"),
    LABIAL("Labial"),
    ROUND("Round"),
    CORONAL("Coronal"),
    ANTERIOR("Anterior"),
    DISTRIBUTED("Distributed"),
    DORSAL("Dorsal"),
    HIGH("High"),
    LOW("Low"),
    BACK("Back");

    private static final Map<String, Feature> BY_KEY;

    static {
        HashMap<String, Feature> m = new HashMap<>();
        for (Feature f : values()) {
            m.put(key(f.displayName), f);
        }
        BY_KEY = Collections.unmodifiableMap(m);
    }

    private final String displayName;

    Feature(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a feature by name. Case-insensitive; '_', '-' and spaces are ignored,
     * so "delayed_release", "Delayed-Release" and "DelayedRelease" are the same feature.
     *
     * @throws InvalidFeatureNameException if the name is not in the catalogue
     */
    public static Feature fromName(String name) {
        if (name == null || name.isBlank()) throw new InvalidFeatureNameException(String.valueOf(name));
        Feature f = BY_KEY.get(key(name));
        if (f == null) throw new InvalidFeatureNameException(name);
        return f;
    }

    public static Optional<Feature> tryFromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(BY_KEY.get(key(name)));
    }

    /** Display names in catalogue order. */
    public static List<String> names(Collection<Feature> features) {
        if (features == null || features.isEmpty()) return List.of();
        EnumSet<Feature> sorted = EnumSet.copyOf(features);
        ArrayList<String> out = new ArrayList<>(sorted.size());
        for (Feature f : sorted) out.add(f.displayName);
        return Collections.unmodifiableList(out);
    }

    /** Immutable, catalogue-ordered copy. */
    public static Set<Feature> setOf(Collection<Feature> features) {
        if (features == null || features.isEmpty()) return Collections.unmodifiableSet(EnumSet.noneOf(Feature.class));
        return Collections.unmodifiableSet(EnumSet.copyOf(features));
    }

    public static Set<Feature> setOf(Feature... features) {
        return setOf(Arrays.asList(features));
    }

    private static String key(String s) {
        return s.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-]+", "");
    }
}
