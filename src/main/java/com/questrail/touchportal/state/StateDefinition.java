package com.questrail.touchportal.state;

import java.util.Objects;

/**
 * Input for bulk state creation.
 */
public record StateDefinition(String id, String description, String value)
{
    public StateDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(value, "value");
    }
}
