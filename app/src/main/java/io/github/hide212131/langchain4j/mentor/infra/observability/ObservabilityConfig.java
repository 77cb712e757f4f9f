package io.github.hide212131.langchain4j.mentor.infra.observability;

import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Configures OpenTelemetry tracing for orchestration turns. Spans are exported over OTLP/HTTP when an
 * endpoint is configured; otherwise a no-op tracer is used.
 */
public final class ObservabilityConfig {

    static final String ENV_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
    static final String ENV_HEADERS = "OTEL_EXPORTER_OTLP_HEADERS";
    static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";
    private static final String DEFAULT_SERVICE_NAME = "mentor-orchestrator";
    private static final String INSTRUMENTATION_NAME = "io.github.hide212131.langchain4j.mentor";

    private static final WorkflowLogger LOGGER = new WorkflowLogger(ObservabilityConfig.class);

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final boolean enabled;

    private ObservabilityConfig(OpenTelemetry openTelemetry, Tracer tracer, boolean enabled) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.enabled = enabled;
    }

    /**
     * Builds the configuration from the standard OpenTelemetry exporter variables.
     *
     * <ul>
     *   <li>OTEL_EXPORTER_OTLP_ENDPOINT: OTLP HTTP traces endpoint. Tracing is off when unset.</li>
     *   <li>OTEL_EXPORTER_OTLP_HEADERS: optional {@code key=value} pairs separated by commas.</li>
     *   <li>OTEL_SERVICE_NAME: service name, defaults to {@value #DEFAULT_SERVICE_NAME}.</li>
     * </ul>
     */
    public static ObservabilityConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ObservabilityConfig fromEnvironment(EnvironmentVariables environment) {
        String endpoint = environment.get(ENV_ENDPOINT);
        if (endpoint == null || endpoint.isBlank()) {
            LOGGER.debug("{} is not set; tracing is disabled", ENV_ENDPOINT);
            return disabled();
        }

        String serviceName = environment.get(ENV_SERVICE_NAME);
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }

        Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
                AttributeKey.stringKey("service.name"), serviceName)));

        Map<String, String> headers = parseHeaders(environment.get(ENV_HEADERS));
        OtlpHttpSpanExporter spanExporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint.trim())
                .setTimeout(30, TimeUnit.SECONDS)
                .setHeaders(() -> headers)
                .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setResource(resource)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(openTelemetry::close, "opentelemetry-shutdown"));

        LOGGER.info("Exporting orchestration spans to {} as service {}", endpoint, serviceName);
        return new ObservabilityConfig(openTelemetry, openTelemetry.getTracer(INSTRUMENTATION_NAME), true);
    }

    public static ObservabilityConfig disabled() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new ObservabilityConfig(noop, noop.getTracer("noop"), false);
    }

    public WorkflowTracer workflowTracer() {
        return new WorkflowTracer(tracer, enabled);
    }

    public OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    public Tracer tracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return enabled;
    }

    static Map<String, String> parseHeaders(String raw) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return headers;
        }
        for (String pair : raw.split(",")) {
            int separator = pair.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = pair.substring(0, separator).trim();
            String value = pair.substring(separator + 1).trim();
            if (!key.isEmpty()) {
                headers.put(key, value);
            }
        }
        return headers;
    }

    @FunctionalInterface
    interface EnvironmentVariables {
        String get(String key);
    }
}
