package com.questrail.touchportal.state;

import java.util.Objects;

/**
 * Snapshot of one state as the store last saw it.
 *
 * @param value the last value written (or recorded) for this id
 */
public record RuntimeStateRecord(String id, String description, String value, StateOrigin origin)
{
    public RuntimeStateRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(origin, "origin");
    }

    RuntimeStateRecord withValue(String newValue) {
        return new RuntimeStateRecord(id, description, newValue, origin);
    }
}
