package org.aid.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.aid.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads {@link ClusteringConfig} from JSON.
 *
 * The classpath resource {@value #DEFAULTS_RESOURCE} holds every default;
 * a user file only needs the keys it changes. Objects are replaced as a
 * whole, so a user file with {@code vulnerability_weights} replaces all
 * default weights.
 */
public final class ConfigLoader {

    public static final String DEFAULTS_RESOURCE = "clustering-defaults.json";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public ClusteringConfig defaults() {
        return bind(defaultsTree());
    }

    /**
     * Defaults overridden by the keys present in the file.
     *
     * @throws IOException if the file cannot be read or is not a JSON object
     * @throws ConfigurationException if a key is unknown or a value is invalid
     */
    public ClusteringConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        JsonNode overrides;
        try (InputStream in = Files.newInputStream(file)) {
            overrides = mapper.readTree(in);
        }
        if (overrides == null || !overrides.isObject()) {
            throw new IOException("Configuration file must contain a JSON object: " + file);
        }
        log.info("Loading configuration overrides from {}", file);
        return override(defaultsTree(), (ObjectNode) overrides);
    }

    /**
     * Defaults overridden by the given keys, for callers that build settings in code.
     */
    public ClusteringConfig withOverrides(Map<String, ?> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        return override(defaultsTree(), mapper.valueToTree(overrides));
    }

    private ClusteringConfig override(ObjectNode base, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!base.has(field.getKey())) {
                throw ConfigurationException.of(field.getKey(), field.getValue(), "unknown setting");
            }
            base.set(field.getKey(), field.getValue());
        }
        return bind(base);
    }

    private ObjectNode defaultsTree() {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + DEFAULTS_RESOURCE);
            }
            return (ObjectNode) mapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    private ClusteringConfig bind(ObjectNode tree) {
        try {
            return mapper.treeToValue(tree, ClusteringConfig.class).validate();
        } catch (JsonProcessingException e) {
            for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
                if (t instanceof ConfigurationException ce) {
                    throw ce;
                }
            }
            ConfigurationException wrapped = new ConfigurationException(fieldOf(e), e.getOriginalMessage());
            wrapped.initCause(e);
            throw wrapped;
        }
    }

    private static String fieldOf(JsonProcessingException e) {
        if (e instanceof JsonMappingException jme && !jme.getPath().isEmpty()) {
            String name = jme.getPath().get(0).getFieldName();
            if (name != null) return name;
        }
        return "config";
    }
}
