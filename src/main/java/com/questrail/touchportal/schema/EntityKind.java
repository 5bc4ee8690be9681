package com.questrail.touchportal.schema;

import java.util.Arrays;
import java.util.Objects;

/**
 * Kinds of entities that appear in a plugin descriptor.
 *
 * <p>Each kind names the attribute that carries its identifier. Identifiers
 * of every kind share one namespace across the whole descriptor.</p>
 */
public enum EntityKind
{
    PLUGIN("plugin", "id"),
    SETTING("setting", "name"),
    STATE("state", "id"),
    EVENT("event", "id"),
    ACTION_DATA("data", "id"),
    ACTION("action", "id"),
    CONNECTOR("connector", "id"),
    CATEGORY("category", "id");

    private final String displayName;
    private final String identifierAttribute;

    EntityKind(String displayName, String identifierAttribute) {
        this.displayName = displayName;
        this.identifierAttribute = identifierAttribute;
    }

    public String displayName() {
        return displayName;
    }

    public String identifierAttribute() {
        return identifierAttribute;
    }

    /**
     * Resolves a kind by its display name.
     *
     * @throws IllegalArgumentException for any name that is not a known kind
     */
    public static EntityKind fromName(String name) {
        Objects.requireNonNull(name, "name");
        return Arrays.stream(values())
                .filter(k -> k.displayName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity kind: " + name));
    }
}
