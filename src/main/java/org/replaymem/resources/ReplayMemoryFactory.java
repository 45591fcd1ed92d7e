package org.replaymem.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.replaymem.api.resources.IReplayMemory;
import org.replaymem.internal.services.SeededRandomProvider;
import org.replaymem.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Instantiates replay memories declared in configuration.
 * <p>
 * Expects the {@code replay} section:
 * <pre>
 * replay {
 *   seed = 42
 *   memories {
 *     dqn {
 *       className = "org.replaymem.resources.CircularReplayBuffer"
 *       options { initialSize = 500, maxSize = 50000 }
 *     }
 *   }
 * }
 * </pre>
 * Every memory class must expose a public {@code (String, Config, IRandomProvider)}
 * constructor. Each memory receives its own random stream derived from the root seed and
 * its name, so adding or removing a memory does not change the others' draws.
 */
public final class ReplayMemoryFactory {

    private static final Logger log = LoggerFactory.getLogger(ReplayMemoryFactory.class);

    private final Config memoriesConfig;
    private final IRandomProvider rootRandom;

    /**
     * @param replayConfig the {@code replay} section
     */
    public ReplayMemoryFactory(Config replayConfig) {
        this(replayConfig, new SeededRandomProvider(readSeed(replayConfig)));
    }

    /**
     * @param replayConfig the {@code replay} section
     * @param rootRandom   provider every memory's stream is derived from
     */
    public ReplayMemoryFactory(Config replayConfig, IRandomProvider rootRandom) {
        Objects.requireNonNull(replayConfig, "replay configuration cannot be null");
        this.memoriesConfig = replayConfig.hasPath("memories")
                ? replayConfig.getConfig("memories")
                : ConfigFactory.empty();
        this.rootRandom = Objects.requireNonNull(rootRandom, "Random provider cannot be null");
    }

    private static long readSeed(Config replayConfig) {
        return replayConfig.hasPath("seed") ? replayConfig.getLong("seed") : 0L;
    }

    /**
     * @return names of all declared memories, sorted
     */
    public TreeSet<String> memoryNames() {
        return new TreeSet<>(memoriesConfig.root().keySet());
    }

    /**
     * Builds every declared memory.
     *
     * @return memories by name, in name order
     * @throws IllegalArgumentException if any memory cannot be built
     */
    public Map<String, IReplayMemory> createAll() {
        Map<String, IReplayMemory> memories = new LinkedHashMap<>();
        for (String memoryName : memoryNames()) {
            memories.put(memoryName, create(memoryName));
        }
        return memories;
    }

    /**
     * Builds one declared memory.
     *
     * @param memoryName key under {@code replay.memories}
     * @return the memory
     * @throws IllegalArgumentException if the memory is not declared, its class is unknown or
     *                                  its options are rejected
     */
    public IReplayMemory create(String memoryName) {
        if (!memoriesConfig.hasPath(memoryName)) {
            throw new IllegalArgumentException("No replay memory named '" + memoryName + "' is configured");
        }
        String className;
        Config options;
        try {
            Config definition = memoriesConfig.getConfig(memoryName);
            className = definition.getString("className");
            options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid definition for replay memory '" + memoryName + "'", e);
        }

        IRandomProvider memoryRandom = rootRandom.deriveFor("replay-memory/" + memoryName, 0L);
        try {
            Class<?> type = Class.forName(className);
            if (!IReplayMemory.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException("Class " + className + " of memory '" + memoryName
                        + "' does not implement IReplayMemory");
            }
            IReplayMemory memory = (IReplayMemory) type
                    .getConstructor(String.class, Config.class, IRandomProvider.class)
                    .newInstance(memoryName, options, memoryRandom);
            log.info("Instantiated replay memory '{}' of type {}", memoryName, className);
            return memory;
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Failed to instantiate replay memory '{}': {}", memoryName, cause.getMessage());
            throw new IllegalArgumentException("Failed to instantiate replay memory '" + memoryName + "'", cause);
        } catch (ReflectiveOperationException e) {
            log.error("Failed to instantiate replay memory '{}': {}", memoryName, e.getMessage());
            throw new IllegalArgumentException("Cannot instantiate " + className + " for memory '" + memoryName + "'", e);
        }
    }
}
