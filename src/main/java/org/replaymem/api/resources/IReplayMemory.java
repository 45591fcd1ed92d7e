package org.replaymem.api.resources;

import org.replaymem.spi.ISerializable;

/**
 * Common surface of every replay memory variant.
 * <p>
 * A memory is created once with a fixed capacity, filled by a training loop and sampled
 * from once {@link #isInitialized()} reports that enough data has been collected.
 * Implementations are single-writer, single-reader: callers sharing one memory between
 * threads must serialize every add, sample and priority update themselves.
 */
public interface IReplayMemory extends ISerializable, IMonitorable {

    /**
     * @return the configured name of this memory
     */
    String getName();

    /**
     * @return the number of transitions currently stored
     */
    int size();

    /**
     * @return whether more than {@link #getInitialSize()} transitions are stored
     */
    boolean isInitialized();

    /**
     * @return the readiness threshold
     */
    int getInitialSize();

    /**
     * @return the capacity in transitions
     */
    int getMaxSize();

    /**
     * Clears all stored data. Capacity and hyperparameters are kept.
     */
    void reset();
}
