package org.replaymem.spi;

/**
 * Interface for components that support state serialization for checkpointing.
 * <p>
 * Replay memories and random providers implement this interface so a training run
 * can be stopped and resumed with identical subsequent sampling behavior. The
 * serialized state must be complete enough to restore the component to its exact
 * state at the time of serialization.
 * </p>
 * <p>
 * Implementations use binary serialization via {@link java.nio.ByteBuffer} and
 * must be deterministic for a given state.
 * </p>
 */
public interface ISerializable {

    /**
     * Serializes the complete internal state of this component.
     * <p>
     * For stateless components, this should return an empty byte array.
     * </p>
     *
     * @return Byte array containing the complete internal state, or empty array if stateless.
     */
    byte[] saveState();

    /**
     * Restores the internal state of this component from previously saved state.
     *
     * @param state The state bytes previously returned by saveState()
     * @throws IllegalArgumentException if state is null, invalid, or incompatible with this component
     */
    void loadState(byte[] state);
}
