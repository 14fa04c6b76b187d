package org.bpmnbridge.converter;

import org.bpmnbridge.converter.config.ConverterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {
    private static final String ORDER_BPMN = "src/test/resources/diagrams/order_process.bpmn";
    private static final String NO_PROCESS_BPMN = "src/test/resources/diagrams/no_process.bpmn";

    @TempDir
    Path tempDir;

    private final Main main = new Main(ConverterConfig.defaults());

    @Test
    void shouldDeriveOutputPathBeforeExtension() {
        assertEquals(Path.of("dir", "order_camunda.bpmn"), Main.outputPathFor(Path.of("dir", "order.bpmn"), "_camunda"));
        assertEquals(Path.of("order_camunda.xml"), Main.outputPathFor(Path.of("order.xml"), "_camunda"));
        assertEquals(Path.of("order_camunda.bpmn"), Main.outputPathFor(Path.of("order"), "_camunda"));
    }

    @Test
    void shouldDiscoverBpmnFilesAndSkipPreviousOutputs() throws IOException {
        Files.writeString(tempDir.resolve("b.bpmn"), "");
        Files.writeString(tempDir.resolve("a.bpmn"), "");
        Files.writeString(tempDir.resolve("a_camunda.bpmn"), "");
        Files.writeString(tempDir.resolve("notes.txt"), "");

        List<Path> inputs = main.discoverInputs(tempDir);

        assertEquals(List.of(tempDir.resolve("a.bpmn"), tempDir.resolve("b.bpmn")), inputs);
    }

    @Test
    void shouldConvertDirectoryAndContinuePastFailures() throws IOException {
        Path order = tempDir.resolve("order.bpmn");
        Path empty = tempDir.resolve("empty.bpmn");
        Files.copy(Path.of(ORDER_BPMN), order);
        Files.copy(Path.of(NO_PROCESS_BPMN), empty);
        String originalContent = Files.readString(order);

        int exitCode = main.run(List.of(tempDir.toString()));

        assertEquals(2, exitCode);
        assertTrue(Files.exists(tempDir.resolve("order_camunda.bpmn")));
        assertFalse(Files.exists(tempDir.resolve("empty_camunda.bpmn")));
        assertEquals(originalContent, Files.readString(order));
    }

    @Test
    void shouldConvertExplicitFile() throws IOException {
        Path order = tempDir.resolve("order.bpmn");
        Files.copy(Path.of(ORDER_BPMN), order);

        int exitCode = main.run(List.of(order.toString()));

        assertEquals(0, exitCode);
        String output = Files.readString(tempDir.resolve("order_camunda.bpmn"));
        assertTrue(output.contains("modeler:executionPlatform=\"Camunda Cloud\""));
    }

    @Test
    void shouldReportUnreadableInput() {
        int exitCode = main.run(List.of(tempDir.resolve("missing.bpmn").toString()));

        assertEquals(2, exitCode);
    }

    @Test
    void shouldRequireArguments() {
        assertEquals(1, main.run(List.of()));
    }
}
