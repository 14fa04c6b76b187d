package org.bpmnbridge.converter.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConverterConfigHelperTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBundledConfig() throws IOException {
        ConverterConfig config = ConverterConfigHelper.loadConfig();

        assertNotNull(config);
        assertEquals("_camunda", config.outputSuffix);
        assertEquals("*.bpmn", config.inputGlob);
        assertEquals("_camunda", config.convertedMarker);
        assertFalse(config.validateOutput);
        assertEquals("Camunda Modeler", config.exporter);
        assertEquals("8.8.0", config.executionPlatformVersion);
    }

    @Test
    void shouldApplyDefaultsForMissingFields() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{\"outputSuffix\": \"_c8\", \"validateOutput\": true, \"comment\": \"ignored\"}");

        ConverterConfig config = ConverterConfigHelper.loadConfig(configFile);

        assertEquals("_c8", config.outputSuffix);
        assertTrue(config.validateOutput);
        assertEquals("*.bpmn", config.inputGlob);
        assertEquals("5.42.0", config.exporterVersion);
    }

    @Test
    void shouldThrowWhenConfigViolatesSchema() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{\"validateOutput\": \"yes\"}");

        assertThrows(IllegalArgumentException.class, () -> ConverterConfigHelper.loadConfig(configFile));
    }

    @Test
    void shouldThrowWhenConfigFileMissing() {
        Path missing = tempDir.resolve("missing.json");

        assertThrows(IllegalArgumentException.class, () -> ConverterConfigHelper.loadConfig(missing));
    }
}
