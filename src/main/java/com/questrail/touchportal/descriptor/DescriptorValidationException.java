package com.questrail.touchportal.descriptor;

import java.util.Objects;

/**
 * Thrown when a generated descriptor does not pass validation. The generated
 * document is never handed out in that case.
 */
public final class DescriptorValidationException extends RuntimeException
{
    private final ValidationReport report;

    public DescriptorValidationException(ValidationReport report) {
        super("Descriptor failed validation with " + Objects.requireNonNull(report, "report").violations().size()
                + " violation(s):" + System.lineSeparator() + report);
        this.report = report;
    }

    public ValidationReport report() {
        return report;
    }
}
