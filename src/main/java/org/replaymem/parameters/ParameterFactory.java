package org.replaymem.parameters;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValueType;
import org.replaymem.spi.IParameter;

/**
 * Builds {@link IParameter}s from configuration.
 * <p>
 * A parameter is either a plain number ({@code beta = 0.4}) or an object describing a
 * schedule:
 * <pre>
 * beta {
 *   type = linear
 *   initial = 0.4
 *   end = 1.0
 *   steps = 100000
 * }
 * </pre>
 */
public final class ParameterFactory {

    private ParameterFactory() {
        // Utility class
    }

    /**
     * Reads a parameter at {@code path}, falling back to a constant default when absent.
     *
     * @param config       the configuration to read from
     * @param path         path of the parameter
     * @param defaultValue constant used when the path is missing
     * @return the parameter
     * @throws IllegalArgumentException if the value is neither a number nor a known schedule
     */
    public static IParameter fromConfig(Config config, String path, double defaultValue) {
        if (!config.hasPath(path)) {
            return new ConstantParameter(defaultValue);
        }
        try {
            ConfigValueType type = config.getValue(path).valueType();
            if (type == ConfigValueType.NUMBER) {
                return new ConstantParameter(config.getDouble(path));
            }
            if (type != ConfigValueType.OBJECT) {
                throw new IllegalArgumentException("Parameter '" + path + "' must be a number or an object, got " + type);
            }
            Config schedule = config.getConfig(path);
            String kind = schedule.hasPath("type") ? schedule.getString("type") : "constant";
            return switch (kind) {
                case "constant" -> new ConstantParameter(schedule.getDouble("value"));
                case "linear" -> new LinearParameter(
                        schedule.getDouble("initial"),
                        schedule.getDouble("end"),
                        schedule.getLong("steps"));
                default -> throw new IllegalArgumentException(
                        "Unknown parameter type '" + kind + "' for '" + path + "'. Supported: constant, linear");
            };
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid parameter configuration at '" + path + "'", e);
        }
    }
}
