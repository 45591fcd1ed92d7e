package org.replaymem.internal.services;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.replaymem.spi.IRandomProvider;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SeededRandomProviderTest {

    private static int[] draws(IRandomProvider random, int count) {
        int[] values = new int[count];
        for (int i = 0; i < count; i++) {
            values[i] = random.nextInt(1_000_000);
        }
        return values;
    }

    @Test
    void sameSeedGivesSameSequence() {
        assertThat(draws(new SeededRandomProvider(123L), 50)).containsExactly(draws(new SeededRandomProvider(123L), 50));
        assertThat(draws(new SeededRandomProvider(123L), 50)).isNotEqualTo(draws(new SeededRandomProvider(124L), 50));
    }

    @Test
    void restoredStateContinuesTheStream() {
        SeededRandomProvider original = new SeededRandomProvider(5L);
        draws(original, 777);
        byte[] state = original.saveState();
        int[] expected = draws(original, 100);
        double expectedDouble = original.nextDouble();

        SeededRandomProvider restored = new SeededRandomProvider(99L);
        restored.loadState(state);

        assertThat(draws(restored, 100)).containsExactly(expected);
        assertThat(restored.nextDouble()).isEqualTo(expectedDouble);
    }

    @Test
    void rejectsMalformedState() {
        SeededRandomProvider random = new SeededRandomProvider(5L);
        assertThatThrownBy(() -> random.loadState(new byte[12])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> random.loadState(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void derivedProvidersAreStableAndIndependent() {
        SeededRandomProvider root = new SeededRandomProvider(42L);

        int[] first = draws(root.deriveFor("replay-memory/uniform", 0L), 20);
        draws(root, 10);
        int[] again = draws(root.deriveFor("replay-memory/uniform", 0L), 20);
        int[] otherScope = draws(root.deriveFor("replay-memory/recurrent", 0L), 20);
        int[] otherKey = draws(root.deriveFor("replay-memory/uniform", 1L), 20);

        assertThat(again).containsExactly(first);
        assertThat(otherScope).isNotEqualTo(first);
        assertThat(otherKey).isNotEqualTo(first);
    }

    @Test
    void javaRandomViewDrawsFromTheSameGenerator() {
        Random a = new SeededRandomProvider(9L).asJavaRandom();
        Random b = new SeededRandomProvider(9L).asJavaRandom();
        for (int i = 0; i < 10; i++) {
            assertThat(a.nextGaussian()).isEqualTo(b.nextGaussian());
        }
        assertThat(new SeededRandomProvider(9L).getSeed()).isEqualTo(9L);
    }
}
