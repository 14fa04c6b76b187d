package org.bpmnbridge.converter.bpmn;

import org.bpmnbridge.converter.bpmn.models.BpmnData;
import org.bpmnbridge.converter.bpmn.models.DiagramShape;
import org.bpmnbridge.converter.bpmn.models.FlowNode;
import org.bpmnbridge.converter.bpmn.models.ProcessDef;
import org.bpmnbridge.converter.bpmn.models.SequenceFlow;
import org.bpmnbridge.converter.util.IdGenerator;
import org.bpmnbridge.converter.util.MarkupScanner;
import org.bpmnbridge.converter.util.MarkupScanner.TagMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts processes, flow nodes, sequence flows and diagram shapes from BPMN text.
 * The input does not have to be well-formed XML: every field falls back to a
 * default or is dropped instead of failing the whole document.
 */
public class BpmnHelper {
    private static final Logger log = LoggerFactory.getLogger(BpmnHelper.class);

    public static final String DEFAULT_DEFINITIONS_ID = "Definitions_1";
    public static final String DEFAULT_PROCESS_NAME = "Process_Name";
    // larger magnitudes would overflow the offset and waypoint arithmetic
    public static final int MAX_COORDINATE = 100_000_000;

    /**
     * Parses BPMN content and returns the extracted structure.
     *
     * @param content the raw document text
     * @return BpmnData with at least one process
     * @throws NoProcessFoundException if the content holds no process block
     */
    public static BpmnData parseBpmnContent(String content) {
        String definitionsId = extractDefinitionsId(content);

        List<ProcessDef> processes = parseProcesses(content);
        if (processes.isEmpty()) {
            throw new NoProcessFoundException("No process found in the document");
        }

        List<DiagramShape> shapes = parseShapes(content);

        log.debug("Extracted {} process(es) and {} shape(s) from definitions '{}'",
                processes.size(), shapes.size(), definitionsId);
        return new BpmnData(definitionsId, processes, shapes);
    }

    /**
     * Reads the id of the root definitions element, whatever its prefix.
     */
    static String extractDefinitionsId(String content) {
        String attributes = MarkupScanner.findOpeningTagAttributes(content, "definitions");
        String id = MarkupScanner.extractAttribute(attributes, "id");
        return id != null ? id : DEFAULT_DEFINITIONS_ID;
    }

    /**
     * Parses every process block in document order. A process repeating an id
     * that was already seen is skipped.
     */
    private static List<ProcessDef> parseProcesses(String content) {
        Map<String, ProcessDef> processesById = new LinkedHashMap<>();

        for (TagMatch processMatch : MarkupScanner.findElements(content, "process")) {
            String attributes = processMatch.attributes();
            String id = MarkupScanner.extractAttribute(attributes, "id");
            if (id == null) {
                id = IdGenerator.randomId("Process");
            }
            String name = MarkupScanner.extractAttribute(attributes, "name");
            if (name == null) {
                name = DEFAULT_PROCESS_NAME;
            }

            if (processesById.containsKey(id)) {
                log.debug("Skipping duplicate process '{}'", id);
                continue;
            }

            String body = processMatch.body();
            List<FlowNode> nodes = parseFlowNodes(body);
            List<SequenceFlow> flows = parseSequenceFlows(body);
            processesById.put(id, new ProcessDef(id, name, nodes, flows));
        }

        return new ArrayList<>(processesById.values());
    }

    /**
     * Parses all flow nodes of a process body. Standard types are read first, in
     * vocabulary order, then the custom tags, which are rewritten to their canonical
     * type. The first node claiming an id keeps it.
     */
    static List<FlowNode> parseFlowNodes(String processBody) {
        Map<String, FlowNode> nodesById = new LinkedHashMap<>();

        for (String tagName : FlowNodeTypes.extractableTags()) {
            String type = FlowNodeTypes.canonicalType(tagName);

            // Normal blocks
            for (TagMatch match : MarkupScanner.findPairedElements(processBody, tagName)) {
                FlowNode node = toFlowNode(match, type);
                addNode(nodesById, node, tagName);
            }

            // Self-closing
            for (TagMatch match : MarkupScanner.findSelfClosingElements(processBody, tagName)) {
                FlowNode node = toFlowNode(match, type);
                addNode(nodesById, node, tagName);
            }
        }

        return new ArrayList<>(nodesById.values());
    }

    private static FlowNode toFlowNode(TagMatch match, String type) {
        String id = MarkupScanner.extractAttribute(match.attributes(), "id");
        if (id == null) {
            return null;
        }
        return FlowNode.builder()
                .id(id)
                .type(type)
                .name(MarkupScanner.extractAttribute(match.attributes(), "name"))
                .incoming(MarkupScanner.extractMarkerTexts(match.body(), "incoming"))
                .outgoing(MarkupScanner.extractMarkerTexts(match.body(), "outgoing"))
                .build();
    }

    private static void addNode(Map<String, FlowNode> nodesById, FlowNode node, String tagName) {
        if (node == null) {
            log.debug("Dropping <{}> without id", tagName);
            return;
        }
        if (nodesById.putIfAbsent(node.id(), node) != null) {
            log.debug("Dropping <{}> '{}': id already used in this process", tagName, node.id());
        }
    }

    /**
     * Parses all sequence flows of a process body. Flows without id get a
     * synthesized one; a flow repeating an explicit id is dropped.
     */
    static List<SequenceFlow> parseSequenceFlows(String processBody) {
        Map<String, SequenceFlow> flowsById = new LinkedHashMap<>();

        for (TagMatch match : MarkupScanner.findElements(processBody, "sequenceFlow")) {
            String attributes = match.attributes();
            String id = MarkupScanner.extractAttribute(attributes, "id");
            if (id == null) {
                id = IdGenerator.randomId("Flow");
            }

            // Extract condition expression if present
            String expression = MarkupScanner.extractMarkerText(match.body(), "conditionExpression");

            SequenceFlow flow = new SequenceFlow(
                    id,
                    MarkupScanner.extractAttribute(attributes, "name"),
                    MarkupScanner.extractAttribute(attributes, "sourceRef"),
                    MarkupScanner.extractAttribute(attributes, "targetRef"),
                    expression
            );
            if (flowsById.putIfAbsent(id, flow) != null) {
                log.debug("Dropping sequence flow '{}': id already used in this process", id);
            }
        }

        return new ArrayList<>(flowsById.values());
    }

    /**
     * Parses every BPMNShape that wraps a Bounds marker. Shapes that do not name
     * the element they annotate are dropped. Bounds values beyond
     * {@link #MAX_COORDINATE} are treated as missing.
     */
    static List<DiagramShape> parseShapes(String content) {
        List<DiagramShape> shapes = new ArrayList<>();

        for (TagMatch match : MarkupScanner.findPairedElements(content, "BPMNShape")) {
            String boundsAttributes = MarkupScanner.findOpeningTagAttributes(match.body(), "Bounds");
            if (boundsAttributes == null) {
                continue;
            }
            String bpmnElement = MarkupScanner.extractAttribute(match.attributes(), "bpmnElement");
            if (bpmnElement == null) {
                continue;
            }
            String id = MarkupScanner.extractAttribute(match.attributes(), "id");

            shapes.add(DiagramShape.builder()
                    .bpmnElement(bpmnElement)
                    .id(id != null ? id : IdGenerator.randomId("Shape"))
                    .x(extractBoundsValue(boundsAttributes, "x"))
                    .y(extractBoundsValue(boundsAttributes, "y"))
                    .width(extractBoundsValue(boundsAttributes, "width"))
                    .height(extractBoundsValue(boundsAttributes, "height"))
                    .build());
        }

        return shapes;
    }

    private static Integer extractBoundsValue(String boundsAttributes, String name) {
        Integer value = MarkupScanner.extractIntAttribute(boundsAttributes, name);
        if (value != null && (value < -MAX_COORDINATE || value > MAX_COORDINATE)) {
            log.debug("Ignoring out-of-range bounds {}={}", name, value);
            return null;
        }
        return value;
    }
}
