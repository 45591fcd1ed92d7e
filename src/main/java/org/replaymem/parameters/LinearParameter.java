package org.replaymem.parameters;

import org.replaymem.spi.IParameter;

import java.nio.ByteBuffer;

/**
 * A parameter that moves linearly from an initial to an end value over a fixed number of
 * {@link #next()} calls and then stays at the end value.
 * <p>
 * Typical use is annealing the importance-sampling exponent of a prioritized memory
 * towards 1 over the course of training.
 */
public final class LinearParameter implements IParameter {

    private final double initial;
    private final double end;
    private final long steps;
    private long step;

    /**
     * @param initial value before the first call to {@link #next()}
     * @param end     value reached after {@code steps} calls
     * @param steps   length of the schedule, must be positive
     */
    public LinearParameter(double initial, double end, long steps) {
        if (steps <= 0) {
            throw new IllegalArgumentException("Linear schedule needs a positive number of steps, got " + steps);
        }
        this.initial = initial;
        this.end = end;
        this.steps = steps;
    }

    @Override
    public double get() {
        if (step >= steps) {
            return end;
        }
        return initial + (end - initial) * ((double) step / steps);
    }

    @Override
    public double next() {
        double value = get();
        if (step < steps) {
            step++;
        }
        return value;
    }

    @Override
    public byte[] saveState() {
        return ByteBuffer.allocate(8).putLong(step).array();
    }

    @Override
    public void loadState(byte[] state) {
        if (state == null || state.length != 8) {
            throw new IllegalArgumentException("LinearParameter state must be exactly 8 bytes");
        }
        long restored = ByteBuffer.wrap(state).getLong();
        if (restored < 0) {
            throw new IllegalArgumentException("LinearParameter step cannot be negative: " + restored);
        }
        this.step = Math.min(restored, steps);
    }

    @Override
    public String toString() {
        return "LinearParameter{initial=" + initial + ", end=" + end + ", steps=" + steps + ", step=" + step + '}';
    }
}
