package org.bpmnbridge.converter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

public class ConverterConfigHelper {
    public static final String CONFIG_RESOURCE = "converter-config.json";
    public static final String SCHEMA_RESOURCE = "converter-config-schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads the converter config bundled on the classpath. Falls back to the
     * defaults when the resource is not there.
     */
    public static ConverterConfig loadConfig() throws IOException {
        try (InputStream is = ConverterConfigHelper.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                return ConverterConfig.defaults();
            }
            return readValidated(mapper.readTree(is), CONFIG_RESOURCE);
        }
    }

    /**
     * Loads a converter config from a file on disk.
     *
     * @param configPath path of the JSON config file
     * @return the loaded config
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the file does not match the config schema
     */
    public static ConverterConfig loadConfig(Path configPath) throws IOException {
        if (!Files.isRegularFile(configPath)) {
            throw new IllegalArgumentException("Config file not found: " + configPath);
        }
        return readValidated(mapper.readTree(configPath.toFile()), configPath.toString());
    }

    /**
     * Validates a config document against the bundled JSON schema.
     *
     * @throws IllegalArgumentException if the document is invalid
     */
    public static void validateConfig(JsonNode configNode, String source) throws IOException {
        Set<ValidationMessage> errors = loadSchema().validate(configNode);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Converter config '" + source + "' is INVALID: " + errors);
        }
    }

    private static ConverterConfig readValidated(JsonNode configNode, String source) throws IOException {
        validateConfig(configNode, source);
        return mapper.treeToValue(configNode, ConverterConfig.class);
    }

    private static JsonSchema loadSchema() throws IOException {
        try (InputStream schemaStream = ConverterConfigHelper.class.getClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema not found: " + SCHEMA_RESOURCE);
            }
            return factory.getSchema(mapper.readTree(schemaStream));
        }
    }
}
