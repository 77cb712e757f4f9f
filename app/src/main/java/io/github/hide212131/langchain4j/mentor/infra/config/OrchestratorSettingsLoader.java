package io.github.hide212131.langchain4j.mentor.infra.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Reads {@link OrchestratorSettings} from the bundled {@code orchestrator.yaml}, optionally overlaid
 * with a user supplied YAML file. Keys missing from both fall back to {@link OrchestratorSettings#defaults()}.
 */
public final class OrchestratorSettingsLoader {

    static final String DEFAULT_RESOURCE = "orchestrator.yaml";

    private final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    private final String resourceName;

    public OrchestratorSettingsLoader() {
        this(DEFAULT_RESOURCE);
    }

    OrchestratorSettingsLoader(String resourceName) {
        this.resourceName = Objects.requireNonNull(resourceName, "resourceName");
    }

    public OrchestratorSettings load() {
        return load(null);
    }

    public OrchestratorSettings load(Path overrideFile) {
        Map<String, Object> merged = new LinkedHashMap<>(readClasspath());
        if (overrideFile != null) {
            deepMerge(merged, readFile(overrideFile));
        }
        return toSettings(merged);
    }

    private Map<String, Object> readClasspath() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = OrchestratorSettingsLoader.class.getClassLoader();
        }
        try (InputStream stream = loader.getResourceAsStream(resourceName)) {
            if (stream == null) {
                return Map.of();
            }
            return asMap(yaml.load(stream));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings resource: " + resourceName, e);
        }
    }

    private Map<String, Object> readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Settings file not found: " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return asMap(yaml.load(reader));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    private OrchestratorSettings toSettings(Map<String, Object> root) {
        OrchestratorSettings defaults = OrchestratorSettings.defaults();
        Map<String, Object> planner = section(root, "planner");
        Map<String, Object> classifier = section(root, "classifier");
        Map<String, Object> catalog = section(root, "catalog");
        Map<String, Object> store = section(root, "store");

        long timeoutSeconds = longValue(
                classifier, "timeout-seconds", defaults.classifierTimeout().toSeconds());
        return new OrchestratorSettings(
                booleanValue(planner, "expand-downstream", defaults.expandDownstream()),
                booleanValue(planner, "unknown-intent-pipeline", defaults.unknownIntentPipeline()),
                booleanValue(classifier, "llm-enabled", defaults.llmClassifierEnabled()),
                Duration.ofSeconds(timeoutSeconds),
                stringValue(catalog, "capabilities", defaults.capabilitiesResource()),
                stringValue(catalog, "intents", defaults.intentsResource()),
                stringValue(store, "directory", defaults.storeDirectory()));
    }

    @SuppressWarnings("unchecked")
    private static void deepMerge(Map<String, Object> target, Map<String, Object> overlay) {
        overlay.forEach((key, value) -> {
            Object existing = target.get(key);
            if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> overlayMap) {
                Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existingMap);
                deepMerge(merged, (Map<String, Object>) overlayMap);
                target.put(key, merged);
            } else {
                target.put(key, value);
            }
        });
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object loaded) {
        if (loaded == null) {
            return Map.of();
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new IllegalStateException("Settings must be a YAML mapping but was " + loaded.getClass().getSimpleName());
        }
        return (Map<String, Object>) map;
    }

    private static Map<String, Object> section(Map<String, Object> root, String name) {
        Object value = root.get(name);
        if (value == null) {
            return Map.of();
        }
        return asMap(value);
    }

    private static boolean booleanValue(Map<String, Object> section, String key, boolean fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static long longValue(Map<String, Object> section, String key, long fallback) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Setting '" + key + "' must be a whole number: " + value, e);
        }
    }

    private static String stringValue(Map<String, Object> section, String key, String fallback) {
        Object value = section.get(key);
        return value == null ? fallback : value.toString();
    }
}
