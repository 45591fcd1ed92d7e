package org.replaymem.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.replaymem.api.contracts.Transition;
import org.replaymem.api.contracts.TransitionBatch;
import org.replaymem.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fixed-capacity ring of transitions with uniform sampling, as used by DQN-style agents.
 * <p>
 * Six parallel arrays share one write cursor. Once the ring has wrapped, every insertion
 * silently overwrites the oldest transition. Sampling draws indices uniformly with
 * replacement from {@code [0, size)}.
 */
public class CircularReplayBuffer extends AbstractReplayMemory {

    private static final Logger log = LoggerFactory.getLogger(CircularReplayBuffer.class);

    private double[][] states;
    private double[][] actions;
    private double[] rewards;
    private double[][] nextStates;
    private boolean[] absorbing;
    private boolean[] last;

    private int writeIndex;
    private boolean full;

    /**
     * @param name        The name of the memory.
     * @param initialSize Number of transitions that must be exceeded before the memory reports itself initialized.
     * @param maxSize     Capacity of the ring.
     * @param random      Source of randomness for sampling.
     */
    public CircularReplayBuffer(String name, int initialSize, int maxSize, IRandomProvider random) {
        this(name, ConfigFactory.empty(), random, initialSize, maxSize);
    }

    /**
     * Config-based constructor used by {@link ReplayMemoryFactory}.
     *
     * @param name    The name of the memory.
     * @param options Options {@code initialSize} (default 0) and {@code maxSize} (required).
     * @param random  Source of randomness for sampling.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public CircularReplayBuffer(String name, Config options, IRandomProvider random) {
        this(name, options, random, readInitialSize(name, options), readMaxSize(name, options));
        log.info("Created uniform replay memory '{}' with maxSize={}, initialSize={}", name, maxSize, initialSize);
    }

    private CircularReplayBuffer(String name, Config options, IRandomProvider random, int initialSize, int maxSize) {
        super(name, options, random, initialSize, maxSize);
        reset();
    }

    private static int readInitialSize(String name, Config options) {
        try {
            return withDefaults(options, Map.of("initialSize", 0)).getInt("initialSize");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for CircularReplayBuffer '" + name + "'", e);
        }
    }

    private static int readMaxSize(String name, Config options) {
        try {
            return options.getInt("maxSize");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for CircularReplayBuffer '" + name + "'", e);
        }
    }

    /**
     * Appends transitions at the write cursor, wrapping and overwriting the oldest entries when full.
     *
     * @param dataset transitions in arrival order
     */
    public void add(List<Transition> dataset) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        for (Transition t : dataset) {
            Objects.requireNonNull(t, "dataset cannot contain null transitions");
            states[writeIndex] = t.state();
            actions[writeIndex] = t.action();
            rewards[writeIndex] = t.reward();
            nextStates[writeIndex] = t.nextState();
            absorbing[writeIndex] = t.absorbing();
            last[writeIndex] = t.last();

            writeIndex++;
            if (writeIndex == maxSize) {
                full = true;
                writeIndex = 0;
            }
        }
        transitionsAdded += dataset.size();
    }

    /**
     * Draws {@code n} transitions uniformly at random, with replacement.
     *
     * @param n number of transitions to draw
     * @return the batch in draw order
     * @throws IllegalStateException    if the memory is empty
     * @throws IllegalArgumentException if {@code n} is not positive
     */
    public TransitionBatch sample(int n) {
        requirePositive(n, "Sample count");
        requireNotEmpty();
        int size = size();
        List<Transition> drawn = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            drawn.add(slot(random.nextInt(size)));
        }
        return TransitionBatch.of(drawn);
    }

    /**
     * Returns the transition stored in ring slot {@code index}.
     *
     * @param index slot in {@code [0, size)}
     * @return the stored transition
     */
    public Transition get(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Slot " + index + " outside [0, " + size() + ") of memory '" + name + "'");
        }
        return slot(index);
    }

    private Transition slot(int i) {
        return new Transition(states[i], actions[i], rewards[i], nextStates[i], absorbing[i], last[i]);
    }

    @Override
    public int size() {
        return full ? maxSize : writeIndex;
    }

    @Override
    public void reset() {
        writeIndex = 0;
        full = false;
        transitionsAdded = 0;
        states = new double[maxSize][];
        actions = new double[maxSize][];
        rewards = new double[maxSize];
        nextStates = new double[maxSize][];
        absorbing = new boolean[maxSize];
        last = new boolean[maxSize];
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("write_index", writeIndex);
        metrics.put("full", full ? 1 : 0);
    }

    @Override
    public byte[] saveState() {
        int size = size();
        List<Transition> stored = new ArrayList<>(size);
        int bufferSize = 1 + 4 + 4 + 4 + 1 + 8 + 4;
        for (int i = 0; i < size; i++) {
            Transition t = slot(i);
            stored.add(t);
            bufferSize += TransitionCodec.sizeOf(t);
        }
        byte[] rngState = random.saveState();
        bufferSize += TransitionCodec.blobSize(rngState);

        ByteBuffer buffer = ByteBuffer.allocate(bufferSize);
        buffer.put(TransitionCodec.TAG_UNIFORM);
        buffer.putInt(maxSize);
        buffer.putInt(initialSize);
        buffer.putInt(writeIndex);
        buffer.put((byte) (full ? 1 : 0));
        buffer.putLong(transitionsAdded);
        buffer.putInt(size);
        for (Transition t : stored) {
            TransitionCodec.write(buffer, t);
        }
        TransitionCodec.writeBlob(buffer, rngState);
        return buffer.array();
    }

    @Override
    public void loadState(byte[] state) {
        if (state == null) {
            throw new IllegalArgumentException("State for memory '" + name + "' cannot be null");
        }
        if (state.length == 0) {
            reset();
            return;
        }
        ByteBuffer buffer = TransitionCodec.openSnapshot(state, TransitionCodec.TAG_UNIFORM, maxSize, name);
        try {
            int savedInitialSize = buffer.getInt();
            int savedWriteIndex = buffer.getInt();
            boolean savedFull = buffer.get() != 0;
            long savedAdded = buffer.getLong();
            int count = buffer.getInt();
            if (savedWriteIndex < 0 || savedWriteIndex >= maxSize || count != (savedFull ? maxSize : savedWriteIndex)) {
                throw new IllegalArgumentException("Inconsistent ring cursor in snapshot for memory '" + name + "'");
            }
            List<Transition> restored = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                restored.add(TransitionCodec.read(buffer));
            }
            byte[] rngState = TransitionCodec.readBlob(buffer);
            random.loadState(rngState);

            reset();
            for (int i = 0; i < count; i++) {
                Transition t = restored.get(i);
                states[i] = t.state();
                actions[i] = t.action();
                rewards[i] = t.reward();
                nextStates[i] = t.nextState();
                absorbing[i] = t.absorbing();
                last[i] = t.last();
            }
            writeIndex = savedWriteIndex;
            full = savedFull;
            transitionsAdded = savedAdded;
            if (savedInitialSize != initialSize) {
                log.info("Memory '{}' restored with initialSize={} (snapshot had {})", name, initialSize, savedInitialSize);
            }
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated snapshot for memory '" + name + "'", e);
        }
        log.debug("Restored memory '{}' with {} transitions", name, size());
    }
}
