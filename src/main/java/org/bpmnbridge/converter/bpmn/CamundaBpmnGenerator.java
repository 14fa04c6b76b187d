package org.bpmnbridge.converter.bpmn;

import org.bpmnbridge.converter.bpmn.models.BpmnData;
import org.bpmnbridge.converter.bpmn.models.DiagramLayout;
import org.bpmnbridge.converter.bpmn.models.FlowNode;
import org.bpmnbridge.converter.bpmn.models.ProcessDef;
import org.bpmnbridge.converter.bpmn.models.SequenceFlow;
import org.bpmnbridge.converter.bpmn.models.ShapeBounds;
import org.bpmnbridge.converter.config.ConverterConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.bpmnbridge.converter.util.XmlText.escape;

/**
 * Writes the Camunda Modeler flavour of BPMN: every namespace declared on the
 * root, elements before flows in each process, and a DI layer built from the
 * reconciled layout.
 */
public class CamundaBpmnGenerator {
    public static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";
    public static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    public static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    public static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String ZEEBE_NS = "http://camunda.org/schema/zeebe/1.0";
    public static final String MODELER_NS = "http://camunda.org/schema/modeler/1.0";
    public static final String TARGET_NAMESPACE = "http://bpmn.io/schema/bpmn";

    public static String generateBpmnXml(BpmnData bpmnData, DiagramLayout layout) {
        return generateBpmnXml(bpmnData, layout, ConverterConfig.defaults());
    }

    /**
     * Renders the document.
     *
     * @param bpmnData the extracted document
     * @param layout   render records from {@link BpmnLayoutHelper#reconcileLayout(BpmnData)}
     * @param config   supplies the exporter and execution platform metadata
     * @return the BPMN text, newline terminated
     */
    public static String generateBpmnXml(BpmnData bpmnData, DiagramLayout layout, ConverterConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        lines.add(definitionsStartTag(bpmnData.definitionsId(), config));

        for (ProcessDef process : bpmnData.processes()) {
            appendProcess(lines, process, layout);
        }

        if (!bpmnData.processes().isEmpty()) {
            appendDiagram(lines, bpmnData, layout);
        }

        lines.add("</bpmn:definitions>");
        return String.join("\n", lines) + "\n";
    }

    private static String definitionsStartTag(String definitionsId, ConverterConfig config) {
        return "<bpmn:definitions"
                + " xmlns:bpmn=\"" + BPMN_NS + "\""
                + " xmlns:bpmndi=\"" + BPMNDI_NS + "\""
                + " xmlns:dc=\"" + DC_NS + "\""
                + " xmlns:xsi=\"" + XSI_NS + "\""
                + " xmlns:zeebe=\"" + ZEEBE_NS + "\""
                + " xmlns:di=\"" + DI_NS + "\""
                + " xmlns:modeler=\"" + MODELER_NS + "\""
                + " id=\"" + escape(definitionsId) + "\""
                + " targetNamespace=\"" + TARGET_NAMESPACE + "\""
                + " exporter=\"" + escape(config.exporter) + "\""
                + " exporterVersion=\"" + escape(config.exporterVersion) + "\""
                + " modeler:executionPlatform=\"" + escape(config.executionPlatform) + "\""
                + " modeler:executionPlatformVersion=\"" + escape(config.executionPlatformVersion) + "\">";
    }

    private static void appendProcess(List<String> lines, ProcessDef process, DiagramLayout layout) {
        lines.add("  <bpmn:process id=\"" + escape(process.id()) + "\" name=\"" + escape(process.name())
                + "\" isExecutable=\"true\">");

        for (FlowNode node : process.nodes()) {
            String tag = "bpmn:" + node.type();
            lines.add("    <" + tag + " id=\"" + escape(node.id()) + "\"" + nameAttribute(node.name()) + ">");
            for (String incoming : node.incoming()) {
                lines.add("      <bpmn:incoming>" + escape(incoming) + "</bpmn:incoming>");
            }
            for (String outgoing : node.outgoing()) {
                lines.add("      <bpmn:outgoing>" + escape(outgoing) + "</bpmn:outgoing>");
            }
            lines.add("    </" + tag + ">");
        }

        for (SequenceFlow flow : process.flows()) {
            lines.add("    <bpmn:sequenceFlow id=\"" + escape(flow.id()) + "\" sourceRef=\"" + escape(flow.sourceRef())
                    + "\" targetRef=\"" + escape(flow.targetRef()) + "\"" + nameAttribute(flow.name()) + ">");
            // conditions are only meaningful on flows leaving a gateway
            if (flow.hasCondition() && layout.isGateway(flow.sourceRef())) {
                lines.add("      <bpmn:conditionExpression xsi:type=\"bpmn:tFormalExpression\">"
                        + escape(toFeelExpression(flow.expression())) + "</bpmn:conditionExpression>");
            }
            lines.add("    </bpmn:sequenceFlow>");
        }

        lines.add("  </bpmn:process>");
    }

    private static void appendDiagram(List<String> lines, BpmnData bpmnData, DiagramLayout layout) {
        lines.add("  <bpmndi:BPMNDiagram id=\"BPMNDiagram_1\">");
        lines.add("    <bpmndi:BPMNPlane id=\"BPMNPlane_1\" bpmnElement=\""
                + escape(bpmnData.processes().get(0).id()) + "\">");

        for (Map.Entry<String, ShapeBounds> entry : layout.boundsById().entrySet()) {
            ShapeBounds bounds = entry.getValue();
            if (!bounds.hasGeometry()) {
                continue;
            }
            lines.add("      <bpmndi:BPMNShape id=\"" + escape(bounds.diagramId()) + "\" bpmnElement=\""
                    + escape(entry.getKey()) + "\">");
            lines.add("        <dc:Bounds x=\"" + bounds.x() + "\" y=\"" + bounds.y() + "\" width=\""
                    + bounds.width() + "\" height=\"" + bounds.height() + "\" />");
            lines.add("      </bpmndi:BPMNShape>");
        }

        for (ProcessDef process : bpmnData.processes()) {
            for (SequenceFlow flow : process.flows()) {
                ShapeBounds source = layout.placedBounds(flow.sourceRef());
                ShapeBounds target = layout.placedBounds(flow.targetRef());
                if (source == null || target == null) {
                    continue;
                }
                lines.add("      <bpmndi:BPMNEdge id=\"" + escape(flow.id()) + "_di\" bpmnElement=\""
                        + escape(flow.id()) + "\">");
                lines.add("        <di:waypoint x=\"" + source.rightX() + "\" y=\"" + source.middleY() + "\" />");
                lines.add("        <di:waypoint x=\"" + target.x() + "\" y=\"" + target.middleY() + "\" />");
                lines.add("      </bpmndi:BPMNEdge>");
            }
        }

        lines.add("    </bpmndi:BPMNPlane>");
        lines.add("  </bpmndi:BPMNDiagram>");
    }

    /**
     * Camunda 8 evaluates conditions as FEEL, marked by a leading '='.
     */
    static String toFeelExpression(String expression) {
        return expression.startsWith("=") ? expression : "=" + expression;
    }

    private static String nameAttribute(String name) {
        return name == null || name.isEmpty() ? "" : " name=\"" + escape(name) + "\"";
    }
}
