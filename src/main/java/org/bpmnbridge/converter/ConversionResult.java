package org.bpmnbridge.converter;

/**
 * Outcome of converting one document: either the generated text or the reason
 * there is none.
 *
 * @param label       the input label (usually the file name) used in messages
 * @param output      the converted document, null on failure
 * @param failureKind why the conversion failed, null on success
 * @param reason      human readable failure reason, null on success
 */
public record ConversionResult(
        String label,
        String output,
        FailureKind failureKind,
        String reason
) {
    public enum FailureKind {
        STRUCTURAL,  // nothing process-shaped in the input
        UNEXPECTED
    }

    public static ConversionResult success(String label, String output) {
        return new ConversionResult(label, output, null, null);
    }

    public static ConversionResult failure(String label, FailureKind failureKind, String reason) {
        return new ConversionResult(label, null, failureKind, reason);
    }

    public boolean succeeded() {
        return failureKind == null;
    }
}
