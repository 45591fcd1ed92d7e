package org.replaymem.api.contracts;

import java.util.List;
import java.util.Objects;

/**
 * A batch of fixed-length windows cut from stored episodes.
 * <p>
 * Each field is a two-level array whose index order is given by {@link #layout()}.
 * Windows are supplied batch-major (one list of consecutive transitions per sample) and
 * transposed here when a time-major batch is requested.
 */
public final class SequenceBatch {

    private final SequenceLayout layout;
    private final int batchSize;
    private final int unrollSteps;
    private final double[][][] states;
    private final double[][][] actions;
    private final double[][] rewards;
    private final double[][][] nextStates;
    private final boolean[][] absorbing;
    private final boolean[][] last;

    private SequenceBatch(SequenceLayout layout, int batchSize, int unrollSteps) {
        this.layout = layout;
        this.batchSize = batchSize;
        this.unrollSteps = unrollSteps;
        int outer = layout == SequenceLayout.TIME_MAJOR ? unrollSteps : batchSize;
        int inner = layout == SequenceLayout.TIME_MAJOR ? batchSize : unrollSteps;
        this.states = new double[outer][inner][];
        this.actions = new double[outer][inner][];
        this.rewards = new double[outer][inner];
        this.nextStates = new double[outer][inner][];
        this.absorbing = new boolean[outer][inner];
        this.last = new boolean[outer][inner];
    }

    /**
     * Assembles a batch from windows.
     *
     * @param layout      requested index order
     * @param unrollSteps length of every window
     * @param windows     one window per batch position, each holding {@code unrollSteps} transitions
     * @return the batch
     * @throws IllegalArgumentException if a window has the wrong length
     */
    public static SequenceBatch of(SequenceLayout layout, int unrollSteps, List<List<Transition>> windows) {
        Objects.requireNonNull(layout, "layout cannot be null");
        Objects.requireNonNull(windows, "windows cannot be null");
        SequenceBatch batch = new SequenceBatch(layout, windows.size(), unrollSteps);
        for (int b = 0; b < windows.size(); b++) {
            List<Transition> window = windows.get(b);
            if (window.size() != unrollSteps) {
                throw new IllegalArgumentException("Window " + b + " has " + window.size()
                        + " steps, expected " + unrollSteps);
            }
            for (int t = 0; t < unrollSteps; t++) {
                Transition tr = window.get(t);
                int i = layout == SequenceLayout.TIME_MAJOR ? t : b;
                int j = layout == SequenceLayout.TIME_MAJOR ? b : t;
                batch.states[i][j] = tr.stateView().clone();
                batch.actions[i][j] = tr.actionView().clone();
                batch.rewards[i][j] = tr.reward();
                batch.nextStates[i][j] = tr.nextStateView().clone();
                batch.absorbing[i][j] = tr.absorbing();
                batch.last[i][j] = tr.last();
            }
        }
        return batch;
    }

    public SequenceLayout layout() {
        return layout;
    }

    public int batchSize() {
        return batchSize;
    }

    public int unrollSteps() {
        return unrollSteps;
    }

    public double[][][] states() {
        return states;
    }

    public double[][][] actions() {
        return actions;
    }

    public double[][] rewards() {
        return rewards;
    }

    public double[][][] nextStates() {
        return nextStates;
    }

    public boolean[][] absorbing() {
        return absorbing;
    }

    public boolean[][] last() {
        return last;
    }

    /**
     * Returns the transition at the given batch position and unroll step, independent of layout.
     *
     * @param batchPosition position in the batch
     * @param step          unroll step within the window
     * @return the transition
     */
    public Transition get(int batchPosition, int step) {
        int i = layout == SequenceLayout.TIME_MAJOR ? step : batchPosition;
        int j = layout == SequenceLayout.TIME_MAJOR ? batchPosition : step;
        return new Transition(states[i][j], actions[i][j], rewards[i][j], nextStates[i][j],
                absorbing[i][j], last[i][j]);
    }
}
