package org.calista.phonology.grammar;

/** Attract(F,G): F requires G. Reject(F,G): F forbids G. */
public enum ConstraintKind {
    ATTRACT,
    REJECT
}
