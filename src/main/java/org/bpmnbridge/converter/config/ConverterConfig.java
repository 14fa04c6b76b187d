package org.bpmnbridge.converter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Converter settings. Every field has a default, so a config file only needs
 * to list what it changes.
 * Example: {"outputSuffix": "_c8", "validateOutput": true}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    /**
     * Appended to the input file name (before the extension) to name the output file.
     */
    public String outputSuffix = "_camunda";

    /**
     * Glob used to pick candidate files when a directory is given.
     */
    public String inputGlob = "*.bpmn";

    /**
     * Files whose name contains this marker are previous outputs and are skipped
     * during directory discovery.
     */
    public String convertedMarker = "_camunda";

    /**
     * Re-read every generated document with the Camunda model API before accepting it.
     */
    public boolean validateOutput = false;

    public String exporter = "Camunda Modeler";
    public String exporterVersion = "5.42.0";
    public String executionPlatform = "Camunda Cloud";
    public String executionPlatformVersion = "8.8.0";

    public static ConverterConfig defaults() {
        return new ConverterConfig();
    }
}
