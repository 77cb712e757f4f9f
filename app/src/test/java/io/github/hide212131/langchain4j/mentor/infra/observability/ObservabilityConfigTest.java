package io.github.hide212131.langchain4j.mentor.infra.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ObservabilityConfigTest {

    @Test
    void fromEnvironment_withoutEndpoint_shouldDisableTracing() {
        ObservabilityConfig config = ObservabilityConfig.fromEnvironment(key -> null);

        assertThat(config.isEnabled()).isFalse();
        assertThat(config.workflowTracer().isEnabled()).isFalse();
    }

    @Test
    void fromEnvironment_withBlankEndpoint_shouldDisableTracing() {
        Map<String, String> env = Map.of(ObservabilityConfig.ENV_ENDPOINT, "  ");

        ObservabilityConfig config = ObservabilityConfig.fromEnvironment(env::get);

        assertThat(config.isEnabled()).isFalse();
    }

    @Test
    void fromEnvironment_withEndpoint_shouldEnableTracing() {
        Map<String, String> env = Map.of(
                ObservabilityConfig.ENV_ENDPOINT, "http://localhost:4318/v1/traces",
                ObservabilityConfig.ENV_SERVICE_NAME, "mentor-test");

        ObservabilityConfig config = ObservabilityConfig.fromEnvironment(env::get);

        assertThat(config.isEnabled()).isTrue();
        assertThat(config.workflowTracer().isEnabled()).isTrue();
        assertThat(config.tracer()).isNotNull();
    }

    @Test
    void parseHeaders_shouldSkipMalformedPairs() {
        Map<String, String> headers =
                ObservabilityConfig.parseHeaders("authorization=Bearer abc, broken, =nokey ,x-team = core");

        assertThat(headers)
                .containsExactly(Map.entry("authorization", "Bearer abc"), Map.entry("x-team", "core"));
    }
}
