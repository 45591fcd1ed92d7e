package org.replaymem.spi;

/**
 * A scalar hyperparameter whose value may change as it is consumed,
 * e.g. the importance-sampling exponent annealed towards 1 during training.
 * <p>
 * Schedules are {@link ISerializable} so their progress survives a checkpoint.
 */
public interface IParameter extends ISerializable {

    /**
     * Returns the current value without advancing the schedule.
     *
     * @return the current value
     */
    double get();

    /**
     * Returns the current value and advances the schedule by one step.
     *
     * @return the value before advancing
     */
    double next();
}
