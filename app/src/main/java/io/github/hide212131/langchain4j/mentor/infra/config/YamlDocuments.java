package io.github.hide212131.langchain4j.mentor.infra.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Reads a YAML mapping from a classpath resource or, when no such resource exists, from a file path.
 */
public final class YamlDocuments {

    private YamlDocuments() {
    }

    public static Map<String, Object> load(String location) {
        Objects.requireNonNull(location, "location");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try (Reader reader = open(location)) {
            Object loaded = yaml.load(reader);
            if (loaded == null) {
                return Map.of();
            }
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new IllegalStateException("Expected a YAML mapping in " + location);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> result = (Map<String, Object>) map;
            return result;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + location, e);
        }
    }

    private static Reader open(String location) throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = YamlDocuments.class.getClassLoader();
        }
        InputStream stream = loader.getResourceAsStream(location);
        if (stream != null) {
            return new InputStreamReader(stream, StandardCharsets.UTF_8);
        }
        Path file = Path.of(location);
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("No classpath resource or file named " + location);
        }
        return Files.newBufferedReader(file, StandardCharsets.UTF_8);
    }
}
