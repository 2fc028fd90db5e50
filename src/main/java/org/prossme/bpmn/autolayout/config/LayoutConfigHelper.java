package org.prossme.bpmn.autolayout.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class LayoutConfigHelper {
    private static final String DEFAULTS_RESOURCE = "autolayout/layout-config.json";
    private static final String SCHEMA_RESOURCE = "autolayout/layout-config.schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static volatile LayoutConfig defaults;

    /**
     * Returns the bundled default configuration. Loaded once, then shared.
     */
    public static LayoutConfig loadDefault() {
        LayoutConfig result = defaults;
        if (result == null) {
            synchronized (LayoutConfigHelper.class) {
                result = defaults;
                if (result == null) {
                    result = toConfig(readDefaults());
                    defaults = result;
                }
            }
        }
        return result;
    }

    /**
     * Loads a configuration file. Keys missing from the file keep their default values.
     *
     * @param configFilePath path to a JSON file with any subset of the configuration keys
     * @return the merged configuration
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the merged configuration is invalid
     */
    public static LayoutConfig loadConfigFile(String configFilePath) throws IOException {
        JsonNode overrides = mapper.readTree(new File(configFilePath));
        if (overrides == null || !overrides.isObject()) {
            throw new IllegalArgumentException("Layout config must be a JSON object: " + configFilePath);
        }

        ObjectNode merged = readDefaults();
        merged.setAll((ObjectNode) overrides);
        log.info("Loaded layout config overrides from {}", configFilePath);
        return toConfig(merged);
    }

    private static LayoutConfig toConfig(ObjectNode configNode) {
        Set<ValidationMessage> errors = loadSchema().validate(configNode);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Layout config is invalid: " + details);
        }

        LayoutConfig config = mapper.convertValue(configNode, LayoutConfig.class);
        if (config.startX() < config.laneHeaderWidth() + config.poolHeaderWidth()) {
            throw new IllegalArgumentException(
                    "Layout config startX must leave room for lane and pool headers (>= "
                            + (config.laneHeaderWidth() + config.poolHeaderWidth()) + ")");
        }
        return config;
    }

    private static ObjectNode readDefaults() {
        try (InputStream stream = LayoutConfigHelper.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Default layout config not found: " + DEFAULTS_RESOURCE);
            }
            return (ObjectNode) mapper.readTree(stream);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read default layout config", e);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream stream = LayoutConfigHelper.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return factory.getSchema(mapper.readTree(stream));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load schema: " + SCHEMA_RESOURCE, e);
        }
    }
}
