package org.replaymem.api.contracts;

/**
 * Index order of a {@link SequenceBatch}.
 */
public enum SequenceLayout {
    /** Fields are indexed {@code [unrollStep][batchPosition]}, as recurrent unrolling consumes them. */
    TIME_MAJOR,
    /** Fields are indexed {@code [batchPosition][unrollStep]}, one contiguous sequence per example. */
    BATCH_MAJOR
}
