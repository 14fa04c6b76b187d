package org.bpmnbridge.converter;

import org.bpmnbridge.converter.config.ConverterConfig;
import org.bpmnbridge.converter.config.ConverterConfigHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point: converts every file named on the command line and
 * every matching file inside named directories, writing each result next to its input.
 */
public class Main {
    private final ConverterConfig config;
    private final BpmnConverter converter;

    public Main(ConverterConfig config) {
        this.config = config;
        this.converter = new BpmnConverter(config);
    }

    /**
     * @param args input files and/or directories
     * @return 0 when everything converted, 1 without arguments, 2 if any input failed
     */
    public int run(List<String> args) {
        if (args.isEmpty()) {
            System.err.println("Usage: bpmn-camunda-converter <file.bpmn|directory>...");
            return 1;
        }

        boolean allConverted = true;
        for (String arg : args) {
            Path path = Paths.get(arg);
            List<Path> inputs;
            if (Files.isDirectory(path)) {
                try {
                    inputs = discoverInputs(path);
                } catch (IOException e) {
                    System.err.println("✗ Cannot list directory " + path + ": " + e.getMessage());
                    allConverted = false;
                    continue;
                }
            } else {
                inputs = List.of(path);
            }

            for (Path input : inputs) {
                allConverted &= convertFile(input);
            }
        }
        return allConverted ? 0 : 2;
    }

    /**
     * Lists the candidate documents of a directory, skipping earlier outputs.
     */
    List<Path> discoverInputs(Path directory) throws IOException {
        List<Path> inputs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, config.inputGlob)) {
            for (Path candidate : stream) {
                String fileName = candidate.getFileName().toString();
                if (Files.isRegularFile(candidate) && !fileName.contains(config.convertedMarker)) {
                    inputs.add(candidate);
                }
            }
        }
        inputs.sort(null);
        return inputs;
    }

    /**
     * Converts one file and writes the result beside it.
     *
     * @return true if an output file was written
     */
    boolean convertFile(Path input) {
        String content;
        try {
            content = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("✗ Error reading " + input + ": " + e.getMessage());
            return false;
        }

        ConversionResult result = converter.convert(content, input.toString());
        if (!result.succeeded()) {
            System.err.println("✗ " + result.label() + ": " + result.reason());
            return false;
        }

        Path output = outputPathFor(input, config.outputSuffix);
        try {
            Files.writeString(output, result.output(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("✗ Error writing " + output + ": " + e.getMessage());
            return false;
        }
        System.out.println("✓ " + input + " -> " + output);
        return true;
    }

    /**
     * Derives the output path: the suffix goes before the extension, e.g.
     * {@code order.bpmn -> order_camunda.bpmn}. Inputs without extension get {@code .bpmn}.
     */
    static Path outputPathFor(Path input, String suffix) {
        String fileName = input.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String outputName = lastDot > 0
                ? fileName.substring(0, lastDot) + suffix + fileName.substring(lastDot)
                : fileName + suffix + ".bpmn";
        return input.resolveSibling(outputName);
    }

    public static void main(String[] args) throws Exception {
        Main main = new Main(ConverterConfigHelper.loadConfig());
        System.exit(main.run(Arrays.asList(args)));
    }
}
