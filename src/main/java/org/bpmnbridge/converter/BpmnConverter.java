package org.bpmnbridge.converter;

import org.bpmnbridge.converter.ConversionResult.FailureKind;
import org.bpmnbridge.converter.bpmn.BpmnHelper;
import org.bpmnbridge.converter.bpmn.BpmnLayoutHelper;
import org.bpmnbridge.converter.bpmn.BpmnValidator;
import org.bpmnbridge.converter.bpmn.CamundaBpmnGenerator;
import org.bpmnbridge.converter.bpmn.NoProcessFoundException;
import org.bpmnbridge.converter.bpmn.models.BpmnData;
import org.bpmnbridge.converter.bpmn.models.DiagramLayout;
import org.bpmnbridge.converter.config.ConverterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs extraction, layout reconciliation and generation for one document.
 * Holds nothing but its config, so one instance can serve any number of
 * documents and threads.
 */
public class BpmnConverter {
    private static final Logger log = LoggerFactory.getLogger(BpmnConverter.class);

    private final ConverterConfig config;

    public BpmnConverter() {
        this(ConverterConfig.defaults());
    }

    public BpmnConverter(ConverterConfig config) {
        this.config = config;
    }

    /**
     * Converts BPMN content. Never throws: every failure comes back as a failed result.
     *
     * @param content the input document text
     * @param label   name of the input, used in failure messages
     * @return the conversion result
     */
    public ConversionResult convert(String content, String label) {
        try {
            BpmnData bpmnData = BpmnHelper.parseBpmnContent(content);
            DiagramLayout layout = BpmnLayoutHelper.reconcileLayout(bpmnData);
            String xml = CamundaBpmnGenerator.generateBpmnXml(bpmnData, layout, config);

            if (config.validateOutput) {
                BpmnValidator.validate(xml);
            }
            return ConversionResult.success(label, xml);
        } catch (NoProcessFoundException e) {
            log.warn("No processes found in {}", label);
            return ConversionResult.failure(label, FailureKind.STRUCTURAL, e.getMessage());
        } catch (Exception e) {
            log.error("Conversion error in {}", label, e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ConversionResult.failure(label, FailureKind.UNEXPECTED, reason);
        }
    }
}
