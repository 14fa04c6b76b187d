package org.bpmnbridge.converter.bpmn;

import org.bpmnbridge.converter.bpmn.models.BpmnData;
import org.bpmnbridge.converter.bpmn.models.DiagramShape;
import org.bpmnbridge.converter.bpmn.models.FlowNode;
import org.bpmnbridge.converter.bpmn.models.ProcessDef;
import org.bpmnbridge.converter.bpmn.models.SequenceFlow;
import org.bpmnbridge.converter.config.ConverterConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CamundaBpmnGeneratorTest {

    private static String generate(BpmnData data) {
        return CamundaBpmnGenerator.generateBpmnXml(data, BpmnLayoutHelper.reconcileLayout(data));
    }

    private static BpmnData conditionalFlowFrom(String sourceType, String expression) {
        ProcessDef process = new ProcessDef("P", "Routing",
                List.of(new FlowNode("source", sourceType, ""), new FlowNode("target", "endEvent", "")),
                List.of(new SequenceFlow("f1", "", "source", "target", expression)));
        return new BpmnData("Definitions_1", List.of(process), List.of());
    }

    @Test
    void shouldDropConditionOnFlowLeavingTask() {
        String xml = generate(conditionalFlowFrom("userTask", "amount > 100"));

        assertFalse(xml.contains("conditionExpression"));
        assertTrue(xml.contains("<bpmn:sequenceFlow id=\"f1\" sourceRef=\"source\" targetRef=\"target\">"));
    }

    @Test
    void shouldPrefixConditionOnFlowLeavingGateway() {
        String xml = generate(conditionalFlowFrom("exclusiveGateway", "amount > 100"));

        assertTrue(xml.contains("<bpmn:conditionExpression xsi:type=\"bpmn:tFormalExpression\">"
                + "=amount &gt; 100</bpmn:conditionExpression>"), xml);
    }

    @Test
    void shouldNotDoublePrefixFeelConditions() {
        String xml = generate(conditionalFlowFrom("inclusiveGateway", "=approved"));

        assertTrue(xml.contains(">=approved</bpmn:conditionExpression>"));
        assertFalse(xml.contains("==approved"));
    }

    @Test
    void shouldEscapeReservedCharacters() {
        ProcessDef process = new ProcessDef("P", "Tom & Jerry's \"<process>\"",
                List.of(new FlowNode("t", "task", "a < b")), List.of());
        String xml = generate(new BpmnData("Definitions_1", List.of(process), List.of()));

        assertTrue(xml.contains("name=\"Tom &amp; Jerry&apos;s &quot;&lt;process&gt;&quot;\""), xml);
        assertTrue(xml.contains("<bpmn:task id=\"t\" name=\"a &lt; b\">"));
    }

    @Test
    void shouldOmitEmptyNames() {
        String xml = generate(conditionalFlowFrom("task", null));

        assertTrue(xml.contains("<bpmn:task id=\"source\">"));
        assertTrue(xml.contains("<bpmn:endEvent id=\"target\">"));
    }

    @Test
    void shouldEmitEmptyPlaneWithoutShapes() {
        String xml = generate(conditionalFlowFrom("task", null));

        assertTrue(xml.contains("<bpmndi:BPMNPlane id=\"BPMNPlane_1\" bpmnElement=\"P\">"));
        assertFalse(xml.contains("BPMNShape"));
        assertFalse(xml.contains("BPMNEdge"));
    }

    @Test
    void shouldEmitEdgeOnlyWhenBothEndsArePlaced() {
        ProcessDef process = new ProcessDef("P", "P",
                List.of(new FlowNode("a", "startEvent", ""), new FlowNode("b", "task", ""),
                        new FlowNode("c", "endEvent", "")),
                List.of(new SequenceFlow("ab", "", "a", "b"), new SequenceFlow("bc", "", "b", "c")));
        List<DiagramShape> shapes = List.of(
                DiagramShape.builder().bpmnElement("a").id("sa").x(100).y(100).build(),
                DiagramShape.builder().bpmnElement("b").id("sb").x(200).y(78).build());

        String xml = generate(new BpmnData("Definitions_1", List.of(process), shapes));

        assertTrue(xml.contains("<bpmndi:BPMNShape id=\"a_di\" bpmnElement=\"a\">"));
        assertTrue(xml.contains("<dc:Bounds x=\"100\" y=\"122\" width=\"36\" height=\"36\" />"), xml);
        assertTrue(xml.contains("<bpmndi:BPMNEdge id=\"ab_di\" bpmnElement=\"ab\">"));
        assertTrue(xml.contains("<di:waypoint x=\"136\" y=\"140\" />"));
        assertTrue(xml.contains("<di:waypoint x=\"200\" y=\"140\" />"));
        assertFalse(xml.contains("bc_di"));
    }

    @Test
    void shouldWriteExporterMetadataFromConfig() {
        ConverterConfig config = ConverterConfig.defaults();
        config.exporterVersion = "5.1.0";
        BpmnData data = conditionalFlowFrom("task", null);

        String xml = CamundaBpmnGenerator.generateBpmnXml(data, BpmnLayoutHelper.reconcileLayout(data), config);

        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<bpmn:definitions "));
        assertTrue(xml.contains(" exporterVersion=\"5.1.0\""));
        assertTrue(xml.contains(" id=\"Definitions_1\" targetNamespace=\"http://bpmn.io/schema/bpmn\""));
        assertTrue(xml.endsWith("</bpmn:definitions>\n"));
    }

    @Test
    void shouldConvertToFeelExpression() {
        assertEquals("=x", CamundaBpmnGenerator.toFeelExpression("x"));
        assertEquals("=x", CamundaBpmnGenerator.toFeelExpression("=x"));
    }
}
