package org.replaymem.api.contracts;

import java.util.Objects;

/**
 * A batch drawn from a prioritized memory: the transitions, the tree leaf index of every
 * draw (to report errors back later), the priority each draw was made with, and the
 * normalized importance-sampling weights (the largest weight of a batch is exactly 1).
 */
public final class PrioritizedBatch {

    private final TransitionBatch transitions;
    private final int[] leafIndices;
    private final double[] priorities;
    private final double[] importanceWeights;

    public PrioritizedBatch(TransitionBatch transitions, int[] leafIndices, double[] priorities,
                            double[] importanceWeights) {
        this.transitions = Objects.requireNonNull(transitions, "transitions cannot be null");
        this.leafIndices = Objects.requireNonNull(leafIndices, "leafIndices cannot be null");
        this.priorities = Objects.requireNonNull(priorities, "priorities cannot be null");
        this.importanceWeights = Objects.requireNonNull(importanceWeights, "importanceWeights cannot be null");
        int n = transitions.size();
        if (leafIndices.length != n || priorities.length != n || importanceWeights.length != n) {
            throw new IllegalArgumentException("All prioritized batch arrays must have length " + n);
        }
    }

    public TransitionBatch transitions() {
        return transitions;
    }

    public int[] leafIndices() {
        return leafIndices;
    }

    public double[] priorities() {
        return priorities;
    }

    public double[] importanceWeights() {
        return importanceWeights;
    }

    public int size() {
        return transitions.size();
    }
}
