package org.replaymem.api.contracts;

import java.util.List;
import java.util.Objects;

/**
 * A sampled batch of transitions laid out as six parallel field arrays aligned by position.
 * <p>
 * The arrays are owned by the caller once the batch has been returned; they are not copied
 * again on access.
 */
public final class TransitionBatch {

    private final double[][] states;
    private final double[][] actions;
    private final double[] rewards;
    private final double[][] nextStates;
    private final boolean[] absorbing;
    private final boolean[] last;

    private TransitionBatch(int n) {
        this.states = new double[n][];
        this.actions = new double[n][];
        this.rewards = new double[n];
        this.nextStates = new double[n][];
        this.absorbing = new boolean[n];
        this.last = new boolean[n];
    }

    /**
     * Builds a batch from transitions in sampling order.
     *
     * @param transitions the sampled transitions, duplicates allowed
     * @return the batch
     */
    public static TransitionBatch of(List<Transition> transitions) {
        Objects.requireNonNull(transitions, "transitions cannot be null");
        TransitionBatch batch = new TransitionBatch(transitions.size());
        for (int i = 0; i < transitions.size(); i++) {
            Transition t = transitions.get(i);
            batch.states[i] = t.stateView().clone();
            batch.actions[i] = t.actionView().clone();
            batch.rewards[i] = t.reward();
            batch.nextStates[i] = t.nextStateView().clone();
            batch.absorbing[i] = t.absorbing();
            batch.last[i] = t.last();
        }
        return batch;
    }

    public int size() {
        return rewards.length;
    }

    public double[][] states() {
        return states;
    }

    public double[][] actions() {
        return actions;
    }

    public double[] rewards() {
        return rewards;
    }

    public double[][] nextStates() {
        return nextStates;
    }

    public boolean[] absorbing() {
        return absorbing;
    }

    public boolean[] last() {
        return last;
    }

    /**
     * Reassembles the transition at the given batch position.
     *
     * @param i batch position
     * @return the transition
     */
    public Transition get(int i) {
        return new Transition(states[i], actions[i], rewards[i], nextStates[i], absorbing[i], last[i]);
    }
}
