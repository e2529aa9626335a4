package org.calista.phonology.learn;

import org.calista.phonology.feature.Feature;

import java.util.Set;

/**
 * Learner: updates the grammar from one observed segment at a time.
 * Deterministic, no randomness; the resulting constraint sets do not depend on
 * internal iteration order.
 */
public interface Learner {

    /**
     * Applies one observation to the grammar.
     *
     * @param segment features of the observed segment (empty set is a valid no-op input)
     * @return what changed in this step
     */
    LearningTrace learn(Set<Feature> segment);
}
