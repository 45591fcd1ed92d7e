package org.replaymem.resources;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.replaymem.api.contracts.SequenceBatch;
import org.replaymem.api.contracts.SequenceLayout;
import org.replaymem.api.contracts.Transition;
import org.replaymem.internal.services.SeededRandomProvider;
import org.replaymem.junit.extensions.logging.ExpectLog;
import org.replaymem.junit.extensions.logging.LogLevel;
import org.replaymem.junit.extensions.logging.LogWatchExtension;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.replaymem.resources.TransitionFixtures.episode;
import static org.replaymem.resources.TransitionFixtures.idOf;
import static org.replaymem.resources.TransitionFixtures.step;
import static org.replaymem.resources.TransitionFixtures.steps;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EpisodicSequenceBufferTest {

    private static EpisodicSequenceBuffer memory(int initialSize, int maxSize, int unrollSteps, long seed) {
        return new EpisodicSequenceBuffer("drqn", initialSize, maxSize, unrollSteps, new SeededRandomProvider(seed));
    }

    @Test
    void splitsStreamAtAbsorbingTransitions() {
        EpisodicSequenceBuffer memory = memory(4, 20, 2, 1L);
        List<Transition> stream = List.of(
                step(0), step(1), step(2, true),
                step(3), step(4), step(5, true),
                step(6));

        int stored = memory.add(stream);

        assertThat(stored).isEqualTo(2);
        assertThat(memory.episodeLengths()).containsExactly(3, 3);
        assertThat(memory.unfinishedLength()).isEqualTo(1);
        assertThat(memory.size()).isEqualTo(6);
        assertThat(memory.getMetrics().get("transitions_added")).isEqualTo(7L);
    }

    @Test
    void carriesUnfinishedEpisodeIntoNextCall() {
        EpisodicSequenceBuffer memory = memory(4, 20, 4, 1L);

        assertThat(memory.add(steps(0, 3))).isZero();
        assertThat(memory.unfinishedLength()).isEqualTo(3);

        assertThat(memory.add(List.of(step(3, true), step(4)))).isEqualTo(1);
        assertThat(memory.episodeLengths()).containsExactly(4);
        assertThat(memory.unfinishedLength()).isEqualTo(1);

        SequenceBatch batch = memory.sampleBatchFirst(1);
        for (int t = 0; t < 4; t++) {
            assertThat(idOf(batch.get(0, t).state())).isEqualTo(t);
        }
        assertThat(batch.absorbing()[0]).containsExactly(false, false, false, true);
    }

    @Test
    void dropsEpisodesShorterThanUnroll() {
        EpisodicSequenceBuffer memory = memory(1, 20, 3, 1L);

        assertThat(memory.add(episode(0, 2))).isZero();

        assertThat(memory.episodeCount()).isZero();
        assertThat(memory.size()).isZero();
        assertThat(memory.getMetrics().get("episodes_dropped_short")).isEqualTo(1L);
        assertThat(memory.isHealthy()).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*exceeds its capacity.*")
    void dropsEpisodesThatCannotFit() {
        EpisodicSequenceBuffer memory = memory(1, 10, 2, 1L);

        assertThat(memory.add(episode(0, 10))).isZero();

        assertThat(memory.episodeCount()).isZero();
        assertThat(memory.getMetrics().get("episodes_dropped_long")).isEqualTo(1L);
        assertThat(memory.getErrors()).hasSize(1);
        assertThat(memory.getErrors().get(0).errorType()).isEqualTo("EPISODE_TOO_LONG");

        assertThat(memory.add(episode(10, 9))).isEqualTo(1);
        assertThat(memory.size()).isEqualTo(9);
    }

    @Test
    void evictsOldestWholeEpisodes() {
        EpisodicSequenceBuffer memory = memory(1, 10, 2, 1L);
        List<Transition> stream = new ArrayList<>();
        stream.addAll(episode(0, 4));
        stream.addAll(episode(100, 4));
        stream.addAll(episode(200, 4));

        assertThat(memory.add(stream)).isEqualTo(3);

        assertThat(memory.episodeLengths()).containsExactly(4, 4);
        assertThat(memory.size()).isEqualTo(8);
        assertThat(memory.getMetrics().get("episodes_evicted")).isEqualTo(1L);

        Set<Integer> seen = new HashSet<>();
        for (int round = 0; round < 50; round++) {
            SequenceBatch batch = memory.sampleBatchFirst(1);
            seen.add(idOf(batch.get(0, 0).state()) / 100);
        }
        assertThat(seen).containsExactlyInAnyOrder(1, 2);
    }

    @Test
    void timeMajorBatchHasStepsOutermost() {
        EpisodicSequenceBuffer memory = memory(8, 100, 3, 5L);
        memory.add(episode(0, 10));
        memory.add(episode(100, 12));

        SequenceBatch batch = memory.sample(5);

        assertThat(batch.layout()).isEqualTo(SequenceLayout.TIME_MAJOR);
        assertThat(batch.states()).hasNumberOfRows(3);
        assertThat(batch.states()[0]).hasNumberOfRows(5);
        assertThat(batch.states()[0][0]).hasSize(2);
        assertThat(batch.rewards()).hasNumberOfRows(3);
        assertThat(batch.rewards()[0]).hasSize(5);
        for (int b = 0; b < 5; b++) {
            int first = idOf(batch.states()[0][b]);
            for (int t = 1; t < 3; t++) {
                assertThat(idOf(batch.states()[t][b])).isEqualTo(first + t);
            }
        }
    }

    @Test
    void batchMajorBatchHasBatchOutermost() {
        EpisodicSequenceBuffer memory = memory(8, 100, 3, 5L);
        memory.add(episode(0, 10));
        memory.add(episode(100, 12));

        SequenceBatch batch = memory.sampleBatchFirst(6);

        assertThat(batch.layout()).isEqualTo(SequenceLayout.BATCH_MAJOR);
        assertThat(batch.states()).hasNumberOfRows(6);
        assertThat(batch.states()[0]).hasNumberOfRows(3);
        assertThat(batch.absorbing()).hasNumberOfRows(6);
        for (int b = 0; b < 6; b++) {
            int first = idOf(batch.states()[b][0]);
            assertThat(first % 100).isBetween(0, first < 100 ? 7 : 9);
            for (int t = 1; t < 3; t++) {
                assertThat(idOf(batch.states()[b][t])).isEqualTo(first + t);
            }
        }
    }

    @Test
    void timeMajorDrawsShareOneOffsetPerEpisode() {
        EpisodicSequenceBuffer memory = memory(8, 100, 3, 11L);
        memory.add(episode(0, 20));

        for (int round = 0; round < 10; round++) {
            SequenceBatch batch = memory.sample(8);
            int first = idOf(batch.states()[0][0]);
            for (int b = 1; b < 8; b++) {
                assertThat(idOf(batch.states()[0][b])).isEqualTo(first);
            }
        }
    }

    @Test
    void rejectsBatchesLargerThanInitialSize() {
        EpisodicSequenceBuffer memory = memory(4, 100, 2, 1L);
        memory.add(episode(0, 10));

        assertThatThrownBy(() -> memory.sample(5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> memory.sampleBatchFirst(5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> memory.sample(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(memory.sample(4).batchSize()).isEqualTo(4);
    }

    @Test
    void samplingEmptyMemoryFails() {
        EpisodicSequenceBuffer memory = memory(4, 100, 2, 1L);
        memory.add(steps(0, 5));

        assertThatThrownBy(() -> memory.sample(2)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> memory.sampleBatchFirst(2)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*sequential sampling.*")
    void sequentialModeFallsBackToWindows() {
        EpisodicSequenceBuffer memory = new EpisodicSequenceBuffer("seq", 2, 50, 4, SamplingMode.SEQUENTIAL,
                new SeededRandomProvider(1L));
        memory.add(episode(0, 10));

        assertThat(memory.getSamplingMode()).isEqualTo(SamplingMode.WINDOWED);
        assertThat(memory.sampleBatchFirst(2).unrollSteps()).isEqualTo(4);
    }

    @Test
    void validatesUnrollSteps() {
        SeededRandomProvider random = new SeededRandomProvider(1L);
        assertThatThrownBy(() -> new EpisodicSequenceBuffer("bad", 1, 10, 0, random))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EpisodicSequenceBuffer("bad", 1, 10, 10, random))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void configConstructorAppliesDefaults() {
        EpisodicSequenceBuffer memory = new EpisodicSequenceBuffer("cfg",
                ConfigFactory.parseString("maxSize = 64, unrollSteps = 8"), new SeededRandomProvider(0L));

        assertThat(memory.getMaxSize()).isEqualTo(64);
        assertThat(memory.getInitialSize()).isZero();
        assertThat(memory.getUnrollSteps()).isEqualTo(8);
        assertThat(memory.getSamplingMode()).isEqualTo(SamplingMode.WINDOWED);

        assertThatThrownBy(() -> new EpisodicSequenceBuffer("cfg",
                ConfigFactory.parseString("maxSize = 64, samplingMode = shuffled"), new SeededRandomProvider(0L)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void snapshotRestoresEpisodesTailAndSampling() {
        EpisodicSequenceBuffer original = memory(6, 40, 3, 21L);
        original.add(episode(0, 7));
        original.add(episode(100, 9));
        original.add(steps(200, 2));
        original.sample(3);
        byte[] snapshot = original.saveState();

        EpisodicSequenceBuffer restored = memory(6, 40, 3, 77L);
        restored.loadState(snapshot);

        assertThat(restored.episodeLengths()).containsExactly(7, 9);
        assertThat(restored.unfinishedLength()).isEqualTo(2);
        assertThat(restored.getMetrics()).isEqualTo(original.getMetrics());

        SequenceBatch expected = original.sample(6);
        SequenceBatch actual = restored.sample(6);
        assertThat(actual.states()).isDeepEqualTo(expected.states());

        restored.add(List.of(step(202, true)));
        assertThat(restored.episodeLengths()).containsExactly(7, 9, 3);
    }

    @Test
    void snapshotFromDifferentCapacityIsRejected() {
        EpisodicSequenceBuffer small = memory(1, 20, 2, 1L);
        small.add(episode(0, 5));

        EpisodicSequenceBuffer large = memory(1, 30, 2, 1L);
        assertThatThrownBy(() -> large.loadState(small.saveState())).isInstanceOf(IllegalArgumentException.class);

        EpisodicSequenceBuffer otherUnroll = memory(1, 20, 3, 1L);
        assertThatThrownBy(() -> otherUnroll.loadState(small.saveState())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetForgetsEpisodesAndTail() {
        EpisodicSequenceBuffer memory = memory(1, 20, 2, 1L);
        memory.add(episode(0, 5));
        memory.add(steps(10, 3));

        memory.reset();

        assertThat(memory.size()).isZero();
        assertThat(memory.episodeCount()).isZero();
        assertThat(memory.unfinishedLength()).isZero();

        memory.add(List.of(step(20), step(21, true)));
        assertThat(memory.episodeLengths()).containsExactly(2);
    }
}
