package org.replaymem.resources;

import org.replaymem.api.contracts.Transition;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Binary layout shared by all memory snapshots.
 * <p>
 * A transition is written as {@code int len, double[len]} for state, action and next state
 * (in that order, with the reward between action and next state) followed by one byte each
 * for {@code absorbing} and {@code last}. Nested component state (random providers,
 * parameter schedules) is written as {@code int len, byte[len]}.
 */
final class TransitionCodec {

    static final byte TAG_UNIFORM = 1;
    static final byte TAG_PRIORITIZED = 2;
    static final byte TAG_EPISODIC = 3;

    private TransitionCodec() {
        // Utility class
    }

    static int sizeOf(Transition t) {
        return vectorSize(t.state()) + vectorSize(t.action()) + 8 + vectorSize(t.nextState()) + 2;
    }

    static void write(ByteBuffer buffer, Transition t) {
        writeVector(buffer, t.state());
        writeVector(buffer, t.action());
        buffer.putDouble(t.reward());
        writeVector(buffer, t.nextState());
        buffer.put((byte) (t.absorbing() ? 1 : 0));
        buffer.put((byte) (t.last() ? 1 : 0));
    }

    static Transition read(ByteBuffer buffer) {
        double[] state = readVector(buffer);
        double[] action = readVector(buffer);
        double reward = buffer.getDouble();
        double[] nextState = readVector(buffer);
        boolean absorbing = buffer.get() != 0;
        boolean last = buffer.get() != 0;
        return new Transition(state, action, reward, nextState, absorbing, last);
    }

    static int blobSize(byte[] blob) {
        return 4 + blob.length;
    }

    static void writeBlob(ByteBuffer buffer, byte[] blob) {
        buffer.putInt(blob.length);
        buffer.put(blob);
    }

    static byte[] readBlob(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new IllegalArgumentException("Corrupt snapshot: blob length " + length
                    + " exceeds remaining " + buffer.remaining() + " bytes");
        }
        byte[] blob = new byte[length];
        buffer.get(blob);
        return blob;
    }

    /**
     * Reads the snapshot header and checks it matches the expected memory type and capacity.
     *
     * @return a buffer positioned after the header
     */
    static ByteBuffer openSnapshot(byte[] state, byte expectedTag, int expectedMaxSize, String memoryName) {
        ByteBuffer buffer = ByteBuffer.wrap(state);
        try {
            byte tag = buffer.get();
            if (tag != expectedTag) {
                throw new IllegalArgumentException("Snapshot type " + tag + " cannot be restored into memory '"
                        + memoryName + "' (expected type " + expectedTag + ")");
            }
            int maxSize = buffer.getInt();
            if (maxSize != expectedMaxSize) {
                throw new IllegalArgumentException("Snapshot capacity " + maxSize + " does not match capacity "
                        + expectedMaxSize + " of memory '" + memoryName + "'");
            }
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Corrupt snapshot header for memory '" + memoryName + "'", e);
        }
        return buffer;
    }

    private static int vectorSize(double[] v) {
        return 4 + 8 * v.length;
    }

    private static void writeVector(ByteBuffer buffer, double[] v) {
        buffer.putInt(v.length);
        for (double d : v) {
            buffer.putDouble(d);
        }
    }

    private static double[] readVector(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0 || (long) length * 8 > buffer.remaining()) {
            throw new IllegalArgumentException("Corrupt snapshot: vector length " + length);
        }
        double[] v = new double[length];
        for (int i = 0; i < length; i++) {
            v[i] = buffer.getDouble();
        }
        return v;
    }
}
