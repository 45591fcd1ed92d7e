package org.replaymem.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.replaymem.api.resources.IReplayMemory;
import org.replaymem.api.resources.OperationalError;
import org.replaymem.spi.IRandomProvider;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Abstract base class for all replay memories, providing name, configuration and
 * random-provider handling together with the monitoring infrastructure.
 * <p>
 * Subclasses own their storage; this class tracks operational errors, the readiness
 * threshold and the base metrics shared by every variant.
 */
public abstract class AbstractReplayMemory implements IReplayMemory {

    protected final String name;
    protected final Config options;
    protected final IRandomProvider random;
    protected final int initialSize;
    protected final int maxSize;

    /** Total number of transitions offered to {@code add} since construction or the last reset. */
    protected long transitionsAdded;

    /**
     * Operational errors, bounded by {@link #getMaxErrors()}.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. When exceeded, oldest errors are removed.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * @param name        The name of the memory instance.
     * @param options     The configuration the memory was built from (may be empty).
     * @param random      Source of randomness for sampling.
     * @param initialSize Readiness threshold, must be non-negative.
     * @param maxSize     Capacity in transitions, must be positive.
     */
    protected AbstractReplayMemory(String name, Config options, IRandomProvider random, int initialSize, int maxSize) {
        this.name = Objects.requireNonNull(name, "Memory name cannot be null");
        this.options = Objects.requireNonNull(options, "Memory options cannot be null");
        this.random = Objects.requireNonNull(random, "Random provider cannot be null");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive for memory '" + name + "', got " + maxSize);
        }
        if (initialSize < 0) {
            throw new IllegalArgumentException("initialSize cannot be negative for memory '" + name + "', got " + initialSize);
        }
        this.initialSize = initialSize;
        this.maxSize = maxSize;
    }

    /**
     * Merges {@code options} over {@code defaults}.
     */
    protected static Config withDefaults(Config options, Map<String, ?> defaults) {
        return Objects.requireNonNull(options, "Memory options cannot be null")
                .withFallback(ConfigFactory.parseMap(defaults));
    }

    @Override
    public String getName() {
        return name;
    }

    public Config getOptions() {
        return options;
    }

    @Override
    public int getInitialSize() {
        return initialSize;
    }

    @Override
    public int getMaxSize() {
        return maxSize;
    }

    @Override
    public boolean isInitialized() {
        return size() > initialSize;
    }

    /**
     * Records an operational error for tracking and monitoring.
     * <p>
     * Use this method ONLY for transient conditions where the memory keeps working, such as
     * an episode that can never fit the capacity. Contract violations are thrown instead.
     *
     * @param code    Error code for categorization (e.g., "EPISODE_TOO_LONG")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int limit = getMaxErrors();
        while (errors.size() > limit) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        metrics.put("size", size());
        metrics.put("max_size", maxSize);
        metrics.put("initial_size", initialSize);
        metrics.put("initialized", isInitialized() ? 1 : 0);
        metrics.put("transitions_added", transitionsAdded);
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add variant-specific metrics.
     * <p>
     * Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }

    /**
     * Throws unless {@code n} is a positive sample count.
     */
    protected void requirePositive(int n, String what) {
        if (n <= 0) {
            throw new IllegalArgumentException(what + " must be positive for memory '" + name + "', got " + n);
        }
    }

    /**
     * Throws unless the memory holds at least one transition.
     */
    protected void requireNotEmpty() {
        if (size() == 0) {
            throw new IllegalStateException("Cannot sample from empty replay memory '" + name + "'");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', size=" + size() + ", maxSize=" + maxSize + '}';
    }
}
