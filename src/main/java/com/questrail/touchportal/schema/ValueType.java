package com.questrail.touchportal.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON value types an attribute may carry.
 */
public enum ValueType
{
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    LIST("array"),
    OBJECT("object"),
    /** String, number or boolean. */
    SCALAR("string, number or boolean");

    private final String description;

    ValueType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public boolean matches(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        return switch (this) {
            case STRING -> value.isTextual();
            case INTEGER -> value.isIntegralNumber();
            case BOOLEAN -> value.isBoolean();
            case LIST -> value.isArray();
            case OBJECT -> value.isObject();
            case SCALAR -> value.isTextual() || value.isNumber() || value.isBoolean();
        };
    }
}
