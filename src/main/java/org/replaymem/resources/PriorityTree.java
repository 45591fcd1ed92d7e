package org.replaymem.resources;

import org.replaymem.spi.IRandomProvider;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * A sum tree over a fixed number of priority slots, each carrying a payload.
 * <p>
 * The complete binary tree is stored flat in an array of length {@code 2 * maxSize - 1}:
 * node {@code i} has children {@code 2i + 1} and {@code 2i + 2}, and the last {@code maxSize}
 * entries are the leaves. Leaf {@code maxSize - 1 + k} belongs to payload slot {@code k}.
 * Slots are written round-robin by a cursor that wraps once the tree is full, overwriting
 * the oldest payload. Every leaf change recomputes its ancestors from their children, so each
 * internal node is exactly the sum of its two children and the root holds the total priority.
 * <p>
 * Insert, update and weighted lookup are O(log maxSize) and iterative.
 *
 * @param <T> payload type
 */
public final class PriorityTree<T> {

    /**
     * Result of a weighted lookup.
     *
     * @param leafIndex tree index of the selected leaf, accepted by {@link #update(int[], double[])}
     * @param priority  value stored at that leaf
     * @param payload   payload of the leaf's slot
     * @param <T>       payload type
     */
    public record Sample<T>(int leafIndex, double priority, T payload) {
    }

    private final int maxSize;
    private final IRandomProvider random;
    private final double[] tree;
    private final Object[] data;
    private int cursor;
    private boolean full;

    /**
     * @param maxSize number of leaves, must be positive
     * @param random  source for tie-breaking between equal subtrees
     */
    public PriorityTree(int maxSize, IRandomProvider random) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("PriorityTree size must be positive, got " + maxSize);
        }
        this.maxSize = maxSize;
        this.random = Objects.requireNonNull(random, "Random provider cannot be null");
        this.tree = new double[2 * maxSize - 1];
        this.data = new Object[maxSize];
    }

    /**
     * Stores {@code payload} in the slot under the cursor with the given priority and
     * advances the cursor, wrapping at capacity.
     *
     * @param priority non-negative finite priority
     * @param payload  the payload, not null
     * @return tree index of the written leaf
     */
    public int insertNext(double priority, T payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        int leaf = cursor + maxSize - 1;
        data[cursor] = payload;
        setLeaf(leaf, priority);

        cursor++;
        if (cursor == maxSize) {
            cursor = 0;
            full = true;
        }
        return leaf;
    }

    /**
     * Replaces the priorities of the given leaves.
     *
     * @param leafIndices tree indices of populated leaves
     * @param priorities  new non-negative priorities, same length as {@code leafIndices}
     */
    public void update(int[] leafIndices, double[] priorities) {
        Objects.requireNonNull(leafIndices, "leafIndices cannot be null");
        Objects.requireNonNull(priorities, "priorities cannot be null");
        if (leafIndices.length != priorities.length) {
            throw new IllegalArgumentException("Got " + leafIndices.length + " leaf indices but "
                    + priorities.length + " priorities");
        }
        for (int i = 0; i < leafIndices.length; i++) {
            int leaf = leafIndices[i];
            int slot = leaf - (maxSize - 1);
            if (slot < 0 || slot >= maxSize) {
                throw new IllegalArgumentException("Index " + leaf + " is not a leaf of a tree with "
                        + maxSize + " slots");
            }
            if (data[slot] == null) {
                throw new IllegalArgumentException("Leaf " + leaf + " has never been written");
            }
            setLeaf(leaf, priorities[i]);
        }
    }

    private void setLeaf(int leaf, double priority) {
        if (!(priority >= 0.0) || Double.isInfinite(priority)) {
            throw new IllegalArgumentException("Priority must be finite and non-negative, got " + priority);
        }
        tree[leaf] = priority;
        int node = leaf;
        while (node > 0) {
            node = (node - 1) / 2;
            // Exact sum of the children; an all-zero subtree sums to 0.0.
            tree[node] = tree[2 * node + 1] + tree[2 * node + 2];
        }
    }

    /**
     * Finds the leaf whose cumulative priority range contains {@code s}.
     * <p>
     * At each node the walk goes left when {@code s} falls within the left subtree's sum and
     * right otherwise, subtracting the left sum. Subtrees holding equal sums are chosen between
     * uniformly at random. A subtree whose sum is zero is never entered while its sibling
     * holds priority.
     *
     * @param s value in {@code [0, totalPriority())}
     * @return the selected leaf
     * @throws IllegalArgumentException if {@code s} lies outside {@code [0, totalPriority())}
     */
    @SuppressWarnings("unchecked")
    public Sample<T> sampleByValue(double s) {
        double total = totalPriority();
        if (!(s >= 0.0 && s < total)) {
            throw new IllegalArgumentException("Lookup value " + s + " outside [0, " + total + ")");
        }
        int node = 0;
        while (true) {
            int left = 2 * node + 1;
            int right = left + 1;
            if (left >= tree.length) {
                break;
            }
            double leftSum = tree[left];
            double rightSum = tree[right];
            if (leftSum == rightSum) {
                if (s > leftSum) {
                    s -= leftSum;
                }
                node = random.nextInt(2) == 0 ? left : right;
            } else if (rightSum <= 0.0 || (s <= leftSum && leftSum > 0.0)) {
                node = left;
            } else {
                s -= leftSum;
                node = right;
            }
        }
        return new Sample<>(node, tree[node], (T) data[node - (maxSize - 1)]);
    }

    /**
     * @return the sum of all leaf priorities (the root value)
     */
    public double totalPriority() {
        return tree[0];
    }

    /**
     * @return the largest priority among populated leaves, or 0 when the tree is empty
     */
    public double maxPriority() {
        int populated = size();
        double max = 0.0;
        int first = maxSize - 1;
        for (int i = 0; i < populated; i++) {
            max = Math.max(max, tree[first + i]);
        }
        return max;
    }

    /**
     * @param leafIndex tree index of a leaf
     * @return the priority stored at that leaf
     */
    public double priorityAt(int leafIndex) {
        if (leafIndex < maxSize - 1 || leafIndex >= tree.length) {
            throw new IllegalArgumentException("Index " + leafIndex + " is not a leaf");
        }
        return tree[leafIndex];
    }

    public int size() {
        return full ? maxSize : cursor;
    }

    public boolean isFull() {
        return full;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Number of bytes {@link #writeTo} will produce.
     */
    @SuppressWarnings("unchecked")
    int encodedSize(ToIntFunction<T> payloadSize) {
        int bytes = 4 + 1 + 4 + tree.length * 8;
        for (int i = 0; i < size(); i++) {
            bytes += payloadSize.applyAsInt((T) data[i]);
        }
        return bytes;
    }

    /**
     * Writes cursor, full flag, the whole node array and the populated payloads.
     * Internal sums are written as they are so a restored tree descends identically.
     */
    @SuppressWarnings("unchecked")
    void writeTo(ByteBuffer buffer, BiConsumer<ByteBuffer, T> payloadWriter) {
        buffer.putInt(cursor);
        buffer.put((byte) (full ? 1 : 0));
        int populated = size();
        buffer.putInt(populated);
        for (double node : tree) {
            buffer.putDouble(node);
        }
        for (int i = 0; i < populated; i++) {
            payloadWriter.accept(buffer, (T) data[i]);
        }
    }

    /**
     * Restores a tree written by {@link #writeTo} into a fresh tree of the same capacity.
     */
    static <T> PriorityTree<T> readFrom(ByteBuffer buffer, int maxSize, IRandomProvider random,
                                        Function<ByteBuffer, T> payloadReader) {
        PriorityTree<T> restored = new PriorityTree<>(maxSize, random);
        int cursor = buffer.getInt();
        boolean full = buffer.get() != 0;
        int populated = buffer.getInt();
        if (cursor < 0 || cursor >= maxSize || populated != (full ? maxSize : cursor)) {
            throw new IllegalArgumentException("Inconsistent tree cursor in snapshot");
        }
        for (int i = 0; i < restored.tree.length; i++) {
            restored.tree[i] = buffer.getDouble();
        }
        for (int i = 0; i < populated; i++) {
            restored.data[i] = payloadReader.apply(buffer);
        }
        restored.cursor = cursor;
        restored.full = full;
        return restored;
    }
}
