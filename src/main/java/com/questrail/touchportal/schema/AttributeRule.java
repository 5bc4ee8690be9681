package com.questrail.touchportal.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of the descriptor rule table: what an attribute of a given entity
 * kind must look like.
 *
 * @param name         attribute name as it appears in the descriptor
 * @param minSdk       first schema version in which the attribute is legal
 * @param required     whether the attribute must be present (once legal)
 * @param type         JSON type of the value
 * @param defaultValue value filled in by the generator when absent, or {@code null}
 * @param choices      permitted values (compared by text), empty when unrestricted
 * @param childKind    entity kind of array members, or {@code null} for leaf attributes
 */
public record AttributeRule(
        String name,
        int minSdk,
        boolean required,
        ValueType type,
        JsonNode defaultValue,
        List<String> choices,
        EntityKind childKind
) {
    public AttributeRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        choices = List.copyOf(choices);
        if (childKind != null && type != ValueType.LIST) {
            throw new IllegalArgumentException("Nested entities require a list attribute: " + name);
        }
    }

    static AttributeRule required(String name, int minSdk, ValueType type) {
        return new AttributeRule(name, minSdk, true, type, null, List.of(), null);
    }

    static AttributeRule optional(String name, int minSdk, ValueType type) {
        return new AttributeRule(name, minSdk, false, type, null, List.of(), null);
    }

    AttributeRule withDefault(JsonNode value) {
        return new AttributeRule(name, minSdk, required, type, value, choices, childKind);
    }

    AttributeRule withChoices(String... permitted) {
        return new AttributeRule(name, minSdk, required, type, defaultValue, List.of(permitted), childKind);
    }

    AttributeRule withChildren(EntityKind kind) {
        return new AttributeRule(name, minSdk, required, type, defaultValue, choices, kind);
    }

    /**
     * Whether the attribute is legal in a descriptor targeting {@code sdk}.
     */
    public boolean appliesAt(int sdk) {
        return sdk >= minSdk;
    }

    public Optional<JsonNode> defaultValueCopy() {
        return Optional.ofNullable(defaultValue).map(JsonNode::deepCopy);
    }

    /**
     * Whether {@code value} is within the permitted value list, if one exists.
     */
    public boolean permits(JsonNode value) {
        return choices.isEmpty() || (value != null && choices.contains(value.asText()));
    }

    public boolean hasChildren() {
        return childKind != null;
    }
}
