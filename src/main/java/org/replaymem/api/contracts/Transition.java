package org.replaymem.api.contracts;

import java.util.Arrays;
import java.util.Objects;

/**
 * One environment step as observed by an agent: the state, the action taken, the
 * reward received, the resulting state and two episode flags.
 * <p>
 * {@code absorbing} marks that the MDP terminated; the episodic buffer also uses it as
 * the episode boundary when splitting a stream. {@code last} marks the final step of an
 * episode, including truncation. Discrete actions are carried as length-1 vectors.
 * <p>
 * Instances are immutable: arrays are copied on the way in and on the way out.
 */
public final class Transition {

    private final double[] state;
    private final double[] action;
    private final double reward;
    private final double[] nextState;
    private final boolean absorbing;
    private final boolean last;

    public Transition(double[] state, double[] action, double reward, double[] nextState,
                      boolean absorbing, boolean last) {
        this.state = Objects.requireNonNull(state, "state cannot be null").clone();
        this.action = Objects.requireNonNull(action, "action cannot be null").clone();
        this.reward = reward;
        this.nextState = Objects.requireNonNull(nextState, "nextState cannot be null").clone();
        this.absorbing = absorbing;
        this.last = last;
    }

    /**
     * Convenience constructor for discrete action spaces.
     */
    public Transition(double[] state, int action, double reward, double[] nextState,
                      boolean absorbing, boolean last) {
        this(state, new double[]{action}, reward, nextState, absorbing, last);
    }

    public double[] state() {
        return state.clone();
    }

    public double[] action() {
        return action.clone();
    }

    public double reward() {
        return reward;
    }

    public double[] nextState() {
        return nextState.clone();
    }

    public boolean absorbing() {
        return absorbing;
    }

    public boolean last() {
        return last;
    }

    // Package-private views without copying, for batch assembly and encoding.
    double[] stateView() {
        return state;
    }

    double[] actionView() {
        return action;
    }

    double[] nextStateView() {
        return nextState;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition other = (Transition) o;
        return Double.compare(reward, other.reward) == 0
                && absorbing == other.absorbing
                && last == other.last
                && Arrays.equals(state, other.state)
                && Arrays.equals(action, other.action)
                && Arrays.equals(nextState, other.nextState);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(reward, absorbing, last);
        result = 31 * result + Arrays.hashCode(state);
        result = 31 * result + Arrays.hashCode(action);
        result = 31 * result + Arrays.hashCode(nextState);
        return result;
    }

    @Override
    public String toString() {
        return "Transition{state=" + Arrays.toString(state)
                + ", action=" + Arrays.toString(action)
                + ", reward=" + reward
                + ", nextState=" + Arrays.toString(nextState)
                + ", absorbing=" + absorbing
                + ", last=" + last + '}';
    }
}
