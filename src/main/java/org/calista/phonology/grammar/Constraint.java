package org.calista.phonology.grammar;

import org.calista.phonology.feature.Feature;

import java.util.Comparator;
import java.util.Objects;

/**
 * Directed, typed relation between two features. Immutable value.
 */
public final class Constraint implements Comparable<Constraint> {

    /** Catalogue order of source, then target, then kind. */
    public static final Comparator<Constraint> ORDER = Comparator
            .comparing((Constraint c) -> c.source)
            .thenComparing(c -> c.target)
            .thenComparing(c -> c.kind);

    public final ConstraintKind kind;
    public final Feature source;
    public final Feature target;

    public Constraint(ConstraintKind kind, Feature source, Feature target) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public static Constraint attract(Feature source, Feature target) {
        return new Constraint(ConstraintKind.ATTRACT, source, target);
    }

    public static Constraint reject(Feature source, Feature target) {
        return new Constraint(ConstraintKind.REJECT, source, target);
    }

    @Override
    public int compareTo(Constraint o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constraint)) return false;
        Constraint c = (Constraint) o;
        return kind == c.kind && source == c.source && target == c.target;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, source, target);
    }

    @Override
    public String toString() {
        String rel = kind == ConstraintKind.ATTRACT ? "attracts" : "rejects";
        return source.displayName() + " " + rel + " " + target.displayName();
    }
}
