package org.replaymem.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.replaymem.api.contracts.PrioritizedBatch;
import org.replaymem.api.contracts.Transition;
import org.replaymem.api.contracts.TransitionBatch;
import org.replaymem.parameters.ConstantParameter;
import org.replaymem.parameters.ParameterFactory;
import org.replaymem.spi.IParameter;
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
 * Prioritized experience replay (Schaul et al.): transitions are drawn proportionally to a
 * priority derived from their last TD-error, and every draw carries an importance-sampling
 * weight that corrects the resulting bias.
 * <p>
 * Storage is a {@link PriorityTree} of transitions. The priority of an error {@code e} is
 * {@code (|e| + epsilon)^alpha}. Sampling is stratified: the priority mass is split into
 * {@code n} equal segments and one value is drawn uniformly inside each. The weight of a
 * draw with priority {@code p} is {@code (size * p / total)^-beta}, divided by the batch
 * maximum so the largest weight is exactly 1.
 */
public class PrioritizedReplayBuffer extends AbstractReplayMemory {

    private static final Logger log = LoggerFactory.getLogger(PrioritizedReplayBuffer.class);

    private final double alpha;
    private final IParameter beta;
    private final double epsilon;

    private PriorityTree<Transition> tree;
    private long priorityUpdates;
    private double lastBeta;

    /**
     * @param name        The name of the memory.
     * @param initialSize Readiness threshold.
     * @param maxSize     Capacity of the tree.
     * @param alpha       Prioritization exponent.
     * @param beta        Importance-sampling exponent, advanced once per {@link #sample(int)}.
     * @param epsilon     Added to every absolute error so no transition gets zero priority.
     * @param random      Source of randomness for sampling and tie-breaking.
     */
    public PrioritizedReplayBuffer(String name, int initialSize, int maxSize, double alpha, IParameter beta,
                                   double epsilon, IRandomProvider random) {
        this(name, ConfigFactory.empty(), random, initialSize, maxSize, alpha, beta, epsilon);
    }

    /**
     * Convenience constructor with a constant beta and the default epsilon of 0.01.
     */
    public PrioritizedReplayBuffer(String name, int initialSize, int maxSize, double alpha, double beta,
                                   IRandomProvider random) {
        this(name, initialSize, maxSize, alpha, new ConstantParameter(beta), 0.01, random);
    }

    /**
     * Config-based constructor used by {@link ReplayMemoryFactory}.
     *
     * @param name    The name of the memory.
     * @param options Options {@code initialSize}, {@code maxSize}, {@code alpha}, {@code beta}
     *                (number or schedule, see {@link ParameterFactory}) and {@code epsilon}.
     * @param random  Source of randomness.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public PrioritizedReplayBuffer(String name, Config options, IRandomProvider random) {
        this(name, options, random, resolve(name, options));
        log.info("Created prioritized replay memory '{}' with maxSize={}, initialSize={}, alpha={}, beta={}, epsilon={}",
                name, maxSize, initialSize, alpha, beta, epsilon);
    }

    private PrioritizedReplayBuffer(String name, Config options, IRandomProvider random, Config resolved) {
        this(name, options, random,
                resolved.getInt("initialSize"),
                resolved.getInt("maxSize"),
                resolved.getDouble("alpha"),
                ParameterFactory.fromConfig(resolved, "beta", 0.4),
                resolved.getDouble("epsilon"));
    }

    private PrioritizedReplayBuffer(String name, Config options, IRandomProvider random, int initialSize, int maxSize,
                                    double alpha, IParameter beta, double epsilon) {
        super(name, options, random, initialSize, maxSize);
        if (!(alpha >= 0.0)) {
            throw new IllegalArgumentException("alpha must be non-negative for memory '" + name + "', got " + alpha);
        }
        if (!(epsilon >= 0.0)) {
            throw new IllegalArgumentException("epsilon must be non-negative for memory '" + name + "', got " + epsilon);
        }
        this.alpha = alpha;
        this.beta = Objects.requireNonNull(beta, "beta cannot be null");
        this.epsilon = epsilon;
        this.lastBeta = beta.get();
        this.tree = new PriorityTree<>(maxSize, random);
    }

    private static Config resolve(String name, Config options) {
        try {
            Config resolved = withDefaults(options, Map.of(
                    "initialSize", 0,
                    "alpha", 0.6,
                    "epsilon", 0.01));
            resolved.getInt("maxSize");
            resolved.getInt("initialSize");
            resolved.getDouble("alpha");
            resolved.getDouble("epsilon");
            return resolved;
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for PrioritizedReplayBuffer '" + name + "'", e);
        }
    }

    private PriorityTree<Transition> tree() {
        if (tree == null) {
            tree = new PriorityTree<>(maxSize, random);
        }
        return tree;
    }

    /**
     * Inserts transitions with explicit priorities, overwriting the oldest when full.
     * Use {@link #maxPriority()} for transitions that have no error yet.
     *
     * @param dataset    transitions in arrival order
     * @param priorities one priority per transition
     */
    public void add(List<Transition> dataset, double[] priorities) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(priorities, "priorities cannot be null");
        if (dataset.size() != priorities.length) {
            throw new IllegalArgumentException("Memory '" + name + "' got " + dataset.size()
                    + " transitions but " + priorities.length + " priorities");
        }
        PriorityTree<Transition> t = tree();
        for (int i = 0; i < priorities.length; i++) {
            t.insertNext(priorities[i], Objects.requireNonNull(dataset.get(i), "dataset cannot contain null transitions"));
        }
        transitionsAdded += dataset.size();
    }

    /**
     * Draws {@code n} transitions by stratified priority sampling.
     *
     * @param n number of transitions
     * @return transitions, their leaf indices, priorities and normalized importance weights
     * @throws IllegalStateException    if the memory is empty or all priorities are zero
     * @throws IllegalArgumentException if {@code n} is not positive
     */
    public PrioritizedBatch sample(int n) {
        requirePositive(n, "Sample count");
        requireNotEmpty();
        PriorityTree<Transition> t = tree();
        double total = t.totalPriority();
        if (!(total > 0.0)) {
            throw new IllegalStateException("Memory '" + name + "' has zero total priority; nothing can be sampled");
        }

        List<Transition> drawn = new ArrayList<>(n);
        int[] leafIndices = new int[n];
        double[] priorities = new double[n];
        double segment = total / n;
        for (int i = 0; i < n; i++) {
            double low = segment * i;
            double high = Math.min(segment * (i + 1), total);
            double s = low + random.nextDouble() * (high - low);
            if (s >= total) {
                s = Math.nextDown(total);
            }
            PriorityTree.Sample<Transition> picked = t.sampleByValue(s);
            leafIndices[i] = picked.leafIndex();
            priorities[i] = picked.priority();
            drawn.add(picked.payload());
        }

        lastBeta = beta.next();
        int size = t.size();
        double[] weights = new double[n];
        double maxWeight = 0.0;
        for (int i = 0; i < n; i++) {
            double probability = priorities[i] / total;
            weights[i] = Math.pow(size * probability, -lastBeta);
            maxWeight = Math.max(maxWeight, weights[i]);
        }
        for (int i = 0; i < n; i++) {
            weights[i] /= maxWeight;
        }
        return new PrioritizedBatch(TransitionBatch.of(drawn), leafIndices, priorities, weights);
    }

    /**
     * Converts errors to priorities and writes them to the given leaves.
     *
     * @param errors      TD-errors, one per leaf
     * @param leafIndices leaf indices from a previous {@link #sample(int)}
     */
    public void updatePriorities(double[] errors, int[] leafIndices) {
        Objects.requireNonNull(errors, "errors cannot be null");
        double[] p = new double[errors.length];
        for (int i = 0; i < errors.length; i++) {
            p[i] = priorityOf(errors[i]);
        }
        tree().update(leafIndices, p);
        priorityUpdates += errors.length;
    }

    /**
     * @param error a TD-error
     * @return {@code (|error| + epsilon)^alpha}
     */
    public double priorityOf(double error) {
        return Math.pow(Math.abs(error) + epsilon, alpha);
    }

    /**
     * @return the largest stored priority once initialized, 1 before that
     */
    public double maxPriority() {
        return isInitialized() ? tree().maxPriority() : 1.0;
    }

    public double totalPriority() {
        return tree().totalPriority();
    }

    public double getAlpha() {
        return alpha;
    }

    public IParameter getBeta() {
        return beta;
    }

    public double getEpsilon() {
        return epsilon;
    }

    @Override
    public int size() {
        return tree == null ? 0 : tree.size();
    }

    @Override
    public void reset() {
        tree = new PriorityTree<>(maxSize, random);
        transitionsAdded = 0;
        priorityUpdates = 0;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("total_priority", totalPriority());
        metrics.put("max_priority", maxPriority());
        metrics.put("beta", lastBeta);
        metrics.put("priority_updates", priorityUpdates);
    }

    @Override
    public byte[] saveState() {
        boolean hasTree = tree != null && tree.size() > 0;
        byte[] betaState = beta.saveState();
        byte[] rngState = random.saveState();
        int bufferSize = 1 + 4 + 4 + 8 + 8 + 8 + 8 + 8
                + TransitionCodec.blobSize(betaState) + 1 + TransitionCodec.blobSize(rngState);
        if (hasTree) {
            bufferSize += tree.encodedSize(TransitionCodec::sizeOf);
        }

        ByteBuffer buffer = ByteBuffer.allocate(bufferSize);
        buffer.put(TransitionCodec.TAG_PRIORITIZED);
        buffer.putInt(maxSize);
        buffer.putInt(initialSize);
        buffer.putDouble(alpha);
        buffer.putDouble(epsilon);
        buffer.putDouble(lastBeta);
        buffer.putLong(transitionsAdded);
        buffer.putLong(priorityUpdates);
        TransitionCodec.writeBlob(buffer, betaState);
        buffer.put((byte) (hasTree ? 1 : 0));
        if (hasTree) {
            tree.writeTo(buffer, TransitionCodec::write);
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
        ByteBuffer buffer = TransitionCodec.openSnapshot(state, TransitionCodec.TAG_PRIORITIZED, maxSize, name);
        try {
            buffer.getInt(); // initialSize is taken from this memory's configuration
            double savedAlpha = buffer.getDouble();
            double savedEpsilon = buffer.getDouble();
            double savedLastBeta = buffer.getDouble();
            long savedAdded = buffer.getLong();
            long savedUpdates = buffer.getLong();
            byte[] betaState = TransitionCodec.readBlob(buffer);
            boolean hasTree = buffer.get() != 0;
            PriorityTree<Transition> restored = hasTree
                    ? PriorityTree.readFrom(buffer, maxSize, random, TransitionCodec::read)
                    : null;
            byte[] rngState = TransitionCodec.readBlob(buffer);

            restoreComponents(betaState, rngState);
            if (savedAlpha != alpha || savedEpsilon != epsilon) {
                log.warn("Memory '{}' restored a snapshot taken with alpha={}, epsilon={}; keeping configured alpha={}, epsilon={}",
                        name, savedAlpha, savedEpsilon, alpha, epsilon);
                recordError("HYPERPARAMETER_MISMATCH", "Snapshot hyperparameters differ from configuration",
                        "alpha=" + savedAlpha + ", epsilon=" + savedEpsilon);
            }
            // An absent tree is rebuilt on first use.
            tree = restored;
            lastBeta = savedLastBeta;
            transitionsAdded = savedAdded;
            priorityUpdates = savedUpdates;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated snapshot for memory '" + name + "'", e);
        }
        log.debug("Restored memory '{}' with {} transitions", name, size());
    }

    /**
     * Loads the beta schedule and random state together; if either rejects its state both
     * are put back to where they were.
     */
    private void restoreComponents(byte[] betaState, byte[] rngState) {
        byte[] previousBeta = beta.saveState();
        byte[] previousRng = random.saveState();
        try {
            beta.loadState(betaState);
            random.loadState(rngState);
        } catch (RuntimeException e) {
            beta.loadState(previousBeta);
            random.loadState(previousRng);
            throw e;
        }
    }
}
