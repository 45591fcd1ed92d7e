package org.replaymem.parameters;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.replaymem.spi.IParameter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ParameterFactoryTest {

    @Test
    void plainNumberIsConstant() {
        IParameter beta = ParameterFactory.fromConfig(ConfigFactory.parseString("beta = 0.7"), "beta", 0.4);
        assertThat(beta).isInstanceOf(ConstantParameter.class);
        assertThat(beta.get()).isEqualTo(0.7);
    }

    @Test
    void missingPathUsesDefault() {
        IParameter beta = ParameterFactory.fromConfig(ConfigFactory.empty(), "beta", 0.4);
        assertThat(beta.get()).isEqualTo(0.4);
    }

    @Test
    void objectDescribesSchedule() {
        Config config = ConfigFactory.parseString(
                "linear { type = linear, initial = 0.2, end = 1.0, steps = 8 }\n"
                        + "fixed { type = constant, value = 0.3 }\n"
                        + "untyped { value = 0.9 }");

        IParameter linear = ParameterFactory.fromConfig(config, "linear", 0.4);
        assertThat(linear).isInstanceOf(LinearParameter.class);
        assertThat(linear.next()).isEqualTo(0.2);

        assertThat(ParameterFactory.fromConfig(config, "fixed", 0.4).get()).isEqualTo(0.3);
        assertThat(ParameterFactory.fromConfig(config, "untyped", 0.4).get()).isEqualTo(0.9);
    }

    @Test
    void rejectsUnknownOrMalformedParameters() {
        Config config = ConfigFactory.parseString(
                "cosine { type = cosine }\n"
                        + "text = high\n"
                        + "incomplete { type = linear, initial = 0.2 }");

        assertThatThrownBy(() -> ParameterFactory.fromConfig(config, "cosine", 0.4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cosine");
        assertThatThrownBy(() -> ParameterFactory.fromConfig(config, "text", 0.4))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ParameterFactory.fromConfig(config, "incomplete", 0.4))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
