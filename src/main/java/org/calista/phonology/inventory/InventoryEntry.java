package org.calista.phonology.inventory;

import java.util.List;
import java.util.Objects;

/**
 * One predicted inventory element: a valid feature bundle and the identifier it resolves to.
 * {@code isEmpty} marks a bundle the feature resource has no symbol for
 * ({@code identifier} is then null).
 */
public final class InventoryEntry {
    public final String identifier;
    public final List<String> featureNames;
    public final boolean isEmpty;

    public InventoryEntry(String identifier, List<String> featureNames, boolean isEmpty) {
        this.identifier = identifier;
        this.featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        this.isEmpty = isEmpty;
    }

    public static InventoryEntry resolved(String identifier, List<String> featureNames) {
        return new InventoryEntry(Objects.requireNonNull(identifier, "identifier"), featureNames, false);
    }

    public static InventoryEntry unresolved(List<String> featureNames) {
        return new InventoryEntry(null, featureNames, true);
    }

    @Override
    public String toString() {
        return (isEmpty ? "<none>" : identifier) + " " + featureNames;
    }
}
