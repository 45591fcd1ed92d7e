package org.replaymem.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.replaymem.api.contracts.SequenceBatch;
import org.replaymem.api.contracts.SequenceLayout;
import org.replaymem.api.contracts.Transition;
import org.replaymem.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Episode-aware replay for recurrent agents (Hausknecht and Stone, DRQN).
 * <p>
 * Transitions arrive as a stream that may start or stop in the middle of an episode. The
 * stream is cut after every transition whose {@code absorbing} flag is set; the trailing
 * incomplete part is carried over and prepended to the next call. A complete episode is
 * stored only if {@code unrollSteps <= length < maxSize}; other episodes are dropped and
 * counted. After each stored episode the oldest whole episodes are evicted until at most
 * {@code maxSize} transitions remain.
 * <p>
 * Samples are windows of {@code unrollSteps} consecutive transitions from uniformly chosen
 * episodes, returned time-major by {@link #sample(int)} and batch-major by
 * {@link #sampleBatchFirst(int)}.
 */
public class EpisodicSequenceBuffer extends AbstractReplayMemory {

    private static final Logger log = LoggerFactory.getLogger(EpisodicSequenceBuffer.class);

    private final int unrollSteps;
    private final SamplingMode samplingMode;

    private final List<List<Transition>> episodes = new ArrayList<>();
    private List<Transition> unfinishedEpisode = new ArrayList<>();
    private int totalSize;

    private long episodesDroppedShort;
    private long episodesDroppedLong;
    private long episodesEvicted;

    /**
     * @param name         The name of the memory.
     * @param initialSize  Readiness threshold; also the largest allowed batch size.
     * @param maxSize      Capacity in transitions; episodes of this length or longer are never stored.
     * @param unrollSteps  Window length and minimum stored episode length.
     * @param samplingMode Requested sampling mode.
     * @param random       Source of randomness for sampling.
     */
    public EpisodicSequenceBuffer(String name, int initialSize, int maxSize, int unrollSteps,
                                  SamplingMode samplingMode, IRandomProvider random) {
        this(name, ConfigFactory.empty(), random, initialSize, maxSize, unrollSteps, samplingMode);
    }

    /**
     * Windowed-sampling convenience constructor.
     */
    public EpisodicSequenceBuffer(String name, int initialSize, int maxSize, int unrollSteps, IRandomProvider random) {
        this(name, initialSize, maxSize, unrollSteps, SamplingMode.WINDOWED, random);
    }

    /**
     * Config-based constructor used by {@link ReplayMemoryFactory}.
     *
     * @param name    The name of the memory.
     * @param options Options {@code initialSize}, {@code maxSize}, {@code unrollSteps} and
     *                {@code samplingMode} ({@code windowed} or {@code sequential}).
     * @param random  Source of randomness.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public EpisodicSequenceBuffer(String name, Config options, IRandomProvider random) {
        this(name, options, random, resolve(name, options));
        log.info("Created episodic replay memory '{}' with maxSize={}, initialSize={}, unrollSteps={}",
                name, maxSize, initialSize, unrollSteps);
    }

    private EpisodicSequenceBuffer(String name, Config options, IRandomProvider random, Config resolved) {
        this(name, options, random,
                resolved.getInt("initialSize"),
                resolved.getInt("maxSize"),
                resolved.getInt("unrollSteps"),
                SamplingMode.fromConfig(resolved.getString("samplingMode")));
    }

    private EpisodicSequenceBuffer(String name, Config options, IRandomProvider random, int initialSize, int maxSize,
                                   int unrollSteps, SamplingMode samplingMode) {
        super(name, options, random, initialSize, maxSize);
        if (unrollSteps <= 0 || unrollSteps >= maxSize) {
            throw new IllegalArgumentException("unrollSteps must be in [1, maxSize) for memory '" + name
                    + "', got " + unrollSteps);
        }
        this.unrollSteps = unrollSteps;
        Objects.requireNonNull(samplingMode, "samplingMode cannot be null");
        if (samplingMode == SamplingMode.SEQUENTIAL) {
            log.warn("Memory '{}' requested sequential sampling, which is not supported; sampling windows of {} steps",
                    name, unrollSteps);
            this.samplingMode = SamplingMode.WINDOWED;
        } else {
            this.samplingMode = samplingMode;
        }
    }

    private static Config resolve(String name, Config options) {
        try {
            Config resolved = withDefaults(options, Map.of(
                    "initialSize", 0,
                    "unrollSteps", 1,
                    "samplingMode", "windowed"));
            resolved.getInt("maxSize");
            resolved.getInt("initialSize");
            resolved.getInt("unrollSteps");
            resolved.getString("samplingMode");
            return resolved;
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for EpisodicSequenceBuffer '" + name + "'", e);
        }
    }

    /**
     * Adds a stream of transitions, storing every episode it completes.
     *
     * @param dataset transitions in arrival order, possibly starting or ending mid-episode
     * @return number of episodes stored by this call
     */
    public int add(List<Transition> dataset) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        List<Transition> stream = new ArrayList<>(unfinishedEpisode.size() + dataset.size());
        stream.addAll(unfinishedEpisode);
        for (Transition t : dataset) {
            stream.add(Objects.requireNonNull(t, "dataset cannot contain null transitions"));
        }
        transitionsAdded += dataset.size();

        int added = 0;
        int start = 0;
        for (int i = 0; i < stream.size(); i++) {
            if (stream.get(i).absorbing()) {
                if (store(new ArrayList<>(stream.subList(start, i + 1)))) {
                    added++;
                }
                start = i + 1;
            }
        }
        unfinishedEpisode = new ArrayList<>(stream.subList(start, stream.size()));
        return added;
    }

    private boolean store(List<Transition> episode) {
        int length = episode.size();
        if (length < unrollSteps) {
            episodesDroppedShort++;
            log.debug("Memory '{}' dropped episode of length {} (shorter than {} unroll steps)", name, length, unrollSteps);
            return false;
        }
        if (length >= maxSize) {
            episodesDroppedLong++;
            log.warn("Memory '{}' dropped episode of length {}, which exceeds its capacity of {}", name, length, maxSize);
            recordError("EPISODE_TOO_LONG", "Episode cannot fit into the memory", "length=" + length + ", maxSize=" + maxSize);
            return false;
        }

        episodes.add(episode);
        totalSize += length;
        while (totalSize > maxSize) {
            List<Transition> oldest = episodes.remove(0);
            totalSize -= oldest.size();
            episodesEvicted++;
            log.debug("Memory '{}' evicted oldest episode of length {}", name, oldest.size());
        }
        return true;
    }

    /**
     * Samples windows laid out time-major, {@code [unrollStep][batchPosition]}.
     * <p>
     * One start offset is drawn for every stored episode per call; every draw of the same
     * episode within the call uses that offset.
     *
     * @param batchSize number of windows, at most {@link #getInitialSize()}
     * @return the batch
     * @throws IllegalArgumentException if {@code batchSize} is not positive or exceeds the initial size
     * @throws IllegalStateException    if no episode is stored
     */
    public SequenceBatch sample(int batchSize) {
        requireSampleable(batchSize, "batchSize");
        int[] picks = new int[batchSize];
        for (int b = 0; b < batchSize; b++) {
            picks[b] = random.nextInt(episodes.size());
        }
        int[] starts = new int[episodes.size()];
        for (int e = 0; e < episodes.size(); e++) {
            starts[e] = random.nextInt(episodes.get(e).size() - unrollSteps + 1);
        }

        List<List<Transition>> windows = new ArrayList<>(batchSize);
        for (int ep : picks) {
            windows.add(episodes.get(ep).subList(starts[ep], starts[ep] + unrollSteps));
        }
        return SequenceBatch.of(SequenceLayout.TIME_MAJOR, unrollSteps, windows);
    }

    /**
     * Samples windows laid out batch-major, {@code [batchPosition][unrollStep]}, drawing an
     * independent start offset for every window.
     *
     * @param nSamples number of windows, at most {@link #getInitialSize()}
     * @return the batch
     * @throws IllegalArgumentException if {@code nSamples} is not positive or exceeds the initial size
     * @throws IllegalStateException    if no episode is stored
     */
    public SequenceBatch sampleBatchFirst(int nSamples) {
        requireSampleable(nSamples, "nSamples");
        List<List<Transition>> windows = new ArrayList<>(nSamples);
        for (int b = 0; b < nSamples; b++) {
            List<Transition> episode = episodes.get(random.nextInt(episodes.size()));
            int start = random.nextInt(episode.size() - unrollSteps + 1);
            windows.add(episode.subList(start, start + unrollSteps));
        }
        return SequenceBatch.of(SequenceLayout.BATCH_MAJOR, unrollSteps, windows);
    }

    private void requireSampleable(int n, String what) {
        requirePositive(n, what);
        if (n > initialSize) {
            throw new IllegalArgumentException(what + " " + n + " must not exceed the initial size "
                    + initialSize + " of memory '" + name + "'");
        }
        if (episodes.isEmpty()) {
            throw new IllegalStateException("Cannot sample from empty replay memory '" + name + "'");
        }
    }

    @Override
    public int size() {
        return totalSize;
    }

    public int episodeCount() {
        return episodes.size();
    }

    /**
     * @return lengths of the stored episodes, oldest first
     */
    public List<Integer> episodeLengths() {
        List<Integer> lengths = new ArrayList<>(episodes.size());
        for (List<Transition> episode : episodes) {
            lengths.add(episode.size());
        }
        return Collections.unmodifiableList(lengths);
    }

    /**
     * @return number of carried-over transitions still waiting for their episode boundary
     */
    public int unfinishedLength() {
        return unfinishedEpisode.size();
    }

    public int getUnrollSteps() {
        return unrollSteps;
    }

    public SamplingMode getSamplingMode() {
        return samplingMode;
    }

    @Override
    public void reset() {
        episodes.clear();
        unfinishedEpisode = new ArrayList<>();
        totalSize = 0;
        transitionsAdded = 0;
        episodesDroppedShort = 0;
        episodesDroppedLong = 0;
        episodesEvicted = 0;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("episodes", episodes.size());
        metrics.put("unfinished_length", unfinishedEpisode.size());
        metrics.put("episodes_dropped_short", episodesDroppedShort);
        metrics.put("episodes_dropped_long", episodesDroppedLong);
        metrics.put("episodes_evicted", episodesEvicted);
    }

    @Override
    public byte[] saveState() {
        byte[] rngState = random.saveState();
        int bufferSize = 1 + 4 + 4 + 4 + 8 * 4 + 4 + 4 + TransitionCodec.blobSize(rngState);
        for (List<Transition> episode : episodes) {
            bufferSize += 4;
            for (Transition t : episode) {
                bufferSize += TransitionCodec.sizeOf(t);
            }
        }
        for (Transition t : unfinishedEpisode) {
            bufferSize += TransitionCodec.sizeOf(t);
        }

        ByteBuffer buffer = ByteBuffer.allocate(bufferSize);
        buffer.put(TransitionCodec.TAG_EPISODIC);
        buffer.putInt(maxSize);
        buffer.putInt(initialSize);
        buffer.putInt(unrollSteps);
        buffer.putLong(transitionsAdded);
        buffer.putLong(episodesDroppedShort);
        buffer.putLong(episodesDroppedLong);
        buffer.putLong(episodesEvicted);
        buffer.putInt(episodes.size());
        for (List<Transition> episode : episodes) {
            buffer.putInt(episode.size());
            for (Transition t : episode) {
                TransitionCodec.write(buffer, t);
            }
        }
        buffer.putInt(unfinishedEpisode.size());
        for (Transition t : unfinishedEpisode) {
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
        ByteBuffer buffer = TransitionCodec.openSnapshot(state, TransitionCodec.TAG_EPISODIC, maxSize, name);
        try {
            buffer.getInt(); // initialSize is taken from this memory's configuration
            int savedUnrollSteps = buffer.getInt();
            if (savedUnrollSteps != unrollSteps) {
                throw new IllegalArgumentException("Snapshot unrollSteps " + savedUnrollSteps
                        + " does not match " + unrollSteps + " of memory '" + name + "'");
            }
            long savedAdded = buffer.getLong();
            long savedShort = buffer.getLong();
            long savedLong = buffer.getLong();
            long savedEvicted = buffer.getLong();

            int episodeCount = buffer.getInt();
            List<List<Transition>> restored = new ArrayList<>();
            int restoredSize = 0;
            for (int e = 0; e < episodeCount; e++) {
                int length = buffer.getInt();
                if (length < unrollSteps || length >= maxSize) {
                    throw new IllegalArgumentException("Snapshot episode " + e + " has invalid length " + length);
                }
                List<Transition> episode = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    episode.add(TransitionCodec.read(buffer));
                }
                restored.add(episode);
                restoredSize += length;
            }
            if (restoredSize > maxSize) {
                throw new IllegalArgumentException("Snapshot holds " + restoredSize + " transitions, more than capacity " + maxSize);
            }
            int unfinishedCount = buffer.getInt();
            List<Transition> unfinished = new ArrayList<>(Math.max(0, unfinishedCount));
            for (int i = 0; i < unfinishedCount; i++) {
                unfinished.add(TransitionCodec.read(buffer));
            }
            random.loadState(TransitionCodec.readBlob(buffer));

            episodes.clear();
            episodes.addAll(restored);
            unfinishedEpisode = unfinished;
            totalSize = restoredSize;
            transitionsAdded = savedAdded;
            episodesDroppedShort = savedShort;
            episodesDroppedLong = savedLong;
            episodesEvicted = savedEvicted;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated snapshot for memory '" + name + "'", e);
        }
        log.debug("Restored memory '{}' with {} episodes and {} transitions", name, episodes.size(), totalSize);
    }
}
