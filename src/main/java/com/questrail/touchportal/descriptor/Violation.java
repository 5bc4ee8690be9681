package com.questrail.touchportal.descriptor;

import java.util.Objects;

/**
 * A single descriptor problem.
 *
 * @param path      location of the offending entity, e.g. {@code $.categories[0].actions[1]}
 * @param attribute attribute name the problem concerns
 * @param rule      the rule that was violated
 * @param message   human readable detail
 */
public record Violation(String path, String attribute, Rule rule, String message)
{
    public enum Rule
    {
        MISSING_REQUIRED,
        UNKNOWN_ATTRIBUTE,
        UNSUPPORTED_VERSION,
        WRONG_TYPE,
        INVALID_VALUE,
        DOMAIN,
        DUPLICATE_ID,
        UNRESOLVED_REFERENCE,
        MALFORMED
    }

    public Violation {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Path and attribute joined, e.g. {@code $.categories[0].name}.
     */
    public String location() {
        return attribute.isEmpty() ? path : path + "." + attribute;
    }

    @Override
    public String toString() {
        return location() + " [" + rule + "] " + message;
    }
}
