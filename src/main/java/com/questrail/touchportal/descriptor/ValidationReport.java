package com.questrail.touchportal.descriptor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Complete result of one validation pass. An empty violation list means the
 * descriptor is valid.
 *
 * @param sdkVersion schema version the rules were applied for
 * @param violations every problem found, in discovery order
 */
public record ValidationReport(int sdkVersion, List<Violation> violations)
{
    public ValidationReport {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<Violation> violationsOf(Violation.Rule rule) {
        return violations.stream()
                .filter(v -> v.rule() == rule)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        if (isValid()) {
            return "No problems found (sdk " + sdkVersion + ")";
        }
        return violations.stream()
                .map(Violation::toString)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
