package org.glyphstack.runtime;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.glyphstack.runtime.model.RationalBackend;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RuntimeOptionsTest {

    @Test
    void referenceConfigurationMatchesDefaults() {
        RuntimeOptions options = RuntimeOptions.fromConfig(ConfigFactory.load());
        assertThat(options).isEqualTo(RuntimeOptions.defaults());
        assertThat(options.backend()).isEqualTo(RationalBackend.ARBITRARY_PRECISION);
        assertThat(options.maxSteps()).isZero();
        assertThat(options.traceEnabled()).isFalse();
    }

    @Test
    void readsRuntimeBlock() {
        RuntimeOptions options = RuntimeOptions.fromConfig(ConfigFactory.parseString(
                "runtime { numeric-backend = bounded, max-steps = 500, trace = true }"));
        assertThat(options).isEqualTo(new RuntimeOptions(RationalBackend.BOUNDED, 500, true));
    }

    @Test
    void missingKeysFallBackToDefaults() {
        RuntimeOptions options = RuntimeOptions.fromConfig(ConfigFactory.parseString("runtime { max-steps = 10 }"));
        assertThat(options.backend()).isEqualTo(RationalBackend.ARBITRARY_PRECISION);
        assertThat(options.maxSteps()).isEqualTo(10);
        assertThat(RuntimeOptions.fromConfig(ConfigFactory.empty())).isEqualTo(RuntimeOptions.defaults());
    }

    @Test
    void unknownBackendIsABadValue() {
        assertThatThrownBy(() -> RuntimeOptions.fromConfig(
                ConfigFactory.parseString("runtime.numeric-backend = double")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("runtime.numeric-backend");
    }

    @Test
    void negativeStepLimitIsRejected() {
        assertThatThrownBy(() -> RuntimeOptions.defaults().withMaxSteps(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withersReplaceOneField() {
        RuntimeOptions options = RuntimeOptions.defaults()
                .withBackend(RationalBackend.BOUNDED)
                .withTraceEnabled(true)
                .withMaxSteps(3);
        assertThat(options).isEqualTo(new RuntimeOptions(RationalBackend.BOUNDED, 3, true));
    }
}
