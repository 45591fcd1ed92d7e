package org.replaymem.resources;

import java.util.Locale;

/**
 * How an {@link EpisodicSequenceBuffer} cuts samples out of stored episodes.
 */
public enum SamplingMode {
    /** Fixed-length windows starting at a random offset inside the episode. */
    WINDOWED,
    /** Whole episodes, for sequential recurrent updates. Not supported yet; configuring it falls back to {@link #WINDOWED}. */
    SEQUENTIAL;

    /**
     * Parses a configuration value such as {@code "windowed"}.
     *
     * @param value the configured name, case-insensitive
     * @return the mode
     * @throws IllegalArgumentException for unknown names
     */
    public static SamplingMode fromConfig(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sampling mode '" + value + "'. Supported: windowed, sequential", e);
        }
    }
}
