package org.replaymem.cli.commands;

import com.typesafe.config.Config;
import org.replaymem.api.contracts.PrioritizedBatch;
import org.replaymem.api.contracts.Transition;
import org.replaymem.api.resources.IReplayMemory;
import org.replaymem.cli.CommandLineInterface;
import org.replaymem.internal.services.SeededRandomProvider;
import org.replaymem.resources.CircularReplayBuffer;
import org.replaymem.resources.EpisodicSequenceBuffer;
import org.replaymem.resources.PrioritizedReplayBuffer;
import org.replaymem.resources.ReplayMemoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Feeds synthetic episodes into every configured memory, samples from it the way a training
 * loop would, and prints each memory's metrics.
 */
@Command(name = "bench", mixinStandardHelpOptions = true,
        description = "Fills the configured replay memories with synthetic episodes and samples from them.")
public class BenchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BenchCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--transitions", defaultValue = "10000", description = "Transitions fed into each memory (default: ${DEFAULT-VALUE}).")
    int transitions;

    @Option(names = "--batch-size", defaultValue = "32", description = "Batch size per sample call (default: ${DEFAULT-VALUE}).")
    int batchSize;

    @Option(names = "--state-dim", defaultValue = "4", description = "Dimension of synthetic states (default: ${DEFAULT-VALUE}).")
    int stateDim;

    @Option(names = "--episode-length", defaultValue = "50", description = "Length of synthetic episodes (default: ${DEFAULT-VALUE}).")
    int episodeLength;

    @Option(names = "--seed", description = "Overrides replay.seed for data generation and sampling.")
    Long seed;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (transitions <= 0 || batchSize <= 0 || stateDim <= 0 || episodeLength <= 0) {
            spec.commandLine().getErr().println("All numeric options must be positive.");
            return 2;
        }

        Config replayConfig = parent.getConfig().getConfig("replay");
        long effectiveSeed = seed != null ? seed : (replayConfig.hasPath("seed") ? replayConfig.getLong("seed") : 0L);
        SeededRandomProvider root = new SeededRandomProvider(effectiveSeed);
        ReplayMemoryFactory factory = new ReplayMemoryFactory(replayConfig, root);

        Map<String, IReplayMemory> memories;
        try {
            memories = factory.createAll();
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Cannot build replay memories: " + e.getMessage());
            return 1;
        }
        if (memories.isEmpty()) {
            out.println("No replay memories configured under replay.memories.");
            return 0;
        }

        for (Map.Entry<String, IReplayMemory> entry : memories.entrySet()) {
            Random data = root.deriveFor("bench-data", 0L).asJavaRandom();
            long started = System.nanoTime();
            int batches = run(entry.getValue(), data);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

            out.printf("%s (%s): %d transitions, %d sampled batches in %d ms%n", entry.getKey(),
                    entry.getValue().getClass().getSimpleName(), transitions, batches, elapsedMs);
            entry.getValue().getMetrics().forEach((k, v) -> out.printf("  %-24s %s%n", k, v));
        }
        out.flush();
        return 0;
    }

    private int run(IReplayMemory memory, Random data) {
        int batches = 0;
        int fed = 0;
        while (fed < transitions) {
            List<Transition> episode = syntheticEpisode(data, Math.min(episodeLength, transitions - fed));
            fed += episode.size();

            if (memory instanceof CircularReplayBuffer uniform) {
                uniform.add(episode);
                if (uniform.isInitialized()) {
                    uniform.sample(batchSize);
                    batches++;
                }
            } else if (memory instanceof PrioritizedReplayBuffer prioritized) {
                double[] priorities = new double[episode.size()];
                Arrays.fill(priorities, prioritized.maxPriority());
                prioritized.add(episode, priorities);
                if (prioritized.isInitialized()) {
                    PrioritizedBatch batch = prioritized.sample(batchSize);
                    double[] errors = new double[batch.size()];
                    for (int i = 0; i < errors.length; i++) {
                        errors[i] = data.nextGaussian();
                    }
                    prioritized.updatePriorities(errors, batch.leafIndices());
                    batches++;
                }
            } else if (memory instanceof EpisodicSequenceBuffer episodic) {
                episodic.add(episode);
                if (episodic.isInitialized() && episodic.getInitialSize() > 0) {
                    episodic.sample(Math.min(batchSize, episodic.getInitialSize()));
                    batches++;
                }
            } else {
                log.warn("Memory '{}' has unsupported type {}; skipping", memory.getName(), memory.getClass().getName());
                return batches;
            }
        }
        return batches;
    }

    private List<Transition> syntheticEpisode(Random data, int length) {
        List<Transition> episode = new ArrayList<>(length);
        double[] state = gaussian(data);
        for (int t = 0; t < length; t++) {
            double[] next = gaussian(data);
            boolean end = t == length - 1;
            episode.add(new Transition(state, data.nextInt(4), data.nextGaussian(), next, end, end));
            state = next;
        }
        return episode;
    }

    private double[] gaussian(Random data) {
        double[] v = new double[stateDim];
        for (int i = 0; i < stateDim; i++) {
            v[i] = data.nextGaussian();
        }
        return v;
    }
}
