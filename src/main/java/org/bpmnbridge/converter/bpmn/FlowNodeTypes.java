package org.bpmnbridge.converter.bpmn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The canonical flow node vocabulary and the mapping of tool specific tags onto it.
 */
public class FlowNodeTypes {

    // Standard BPMN flow node types, in extraction order
    public static final List<String> STANDARD_TYPES = List.of(
            "startEvent", "endEvent", "userTask", "serviceTask", "scriptTask",
            "sendTask", "receiveTask", "manualTask", "businessRuleTask", "task",
            "exclusiveGateway", "parallelGateway", "inclusiveGateway",
            "eventBasedGateway", "complexGateway", "subProcess", "callActivity",
            "intermediateCatchEvent", "intermediateThrowEvent", "boundaryEvent"
    );

    // Non-standard tags written by some modelers (e.g. countersignTask inside extensionElements)
    public static final Map<String, String> CUSTOM_TAG_MAP;

    static {
        Map<String, String> customTags = new LinkedHashMap<>();
        customTags.put("countersignTask", "userTask");
        customTags.put("multiInstanceTask", "userTask");
        CUSTOM_TAG_MAP = Collections.unmodifiableMap(customTags);
    }

    /**
     * Every tag name the extractor looks for: the standard types first, then the custom tags.
     */
    public static List<String> extractableTags() {
        List<String> tags = new ArrayList<>(STANDARD_TYPES);
        tags.addAll(CUSTOM_TAG_MAP.keySet());
        return tags;
    }

    /**
     * Maps a tag name to its canonical flow node type.
     *
     * @param tagName the local tag name, without namespace prefix
     * @return the canonical type, or null for tags outside both tables
     */
    public static String canonicalType(String tagName) {
        if (tagName == null) {
            return null;
        }
        if (STANDARD_TYPES.contains(tagName)) {
            return tagName;
        }
        return CUSTOM_TAG_MAP.get(tagName);
    }
}
