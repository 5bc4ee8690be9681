package com.questrail.touchportal.schema;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.touchportal.schema.AttributeRule.optional;
import static com.questrail.touchportal.schema.AttributeRule.required;
import static com.questrail.touchportal.schema.ValueType.BOOLEAN;
import static com.questrail.touchportal.schema.ValueType.INTEGER;
import static com.questrail.touchportal.schema.ValueType.LIST;
import static com.questrail.touchportal.schema.ValueType.OBJECT;
import static com.questrail.touchportal.schema.ValueType.SCALAR;
import static com.questrail.touchportal.schema.ValueType.STRING;

/**
 * SdkSchema
 * =============================================================================
 * Versioned attribute rule table for plugin descriptors.
 *
 * <p>The table maps (entity kind, attribute name) to an {@link AttributeRule}.
 * A descriptor declares the schema version it targets in its root {@code sdk}
 * attribute; a rule applies only when its minimum version is at or below that
 * target.</p>
 *
 * <h2>Fail-closed lookups</h2>
 * An attribute that has no row for its entity kind is {@link AttributeStatus#UNKNOWN}.
 * Callers must treat unknown attributes as errors rather than skip them.
 *
 * <p>The table is built once during class initialization and is immutable.</p>
 */
public final class SdkSchema
{
    /** Schema version used when a descriptor does not declare one. */
    public static final int DEFAULT_VERSION = 6;

    public static final int MIN_VERSION = 1;
    public static final int MAX_VERSION = 6;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Map<EntityKind, Map<String, AttributeRule>> TABLE = buildTable();

    private SdkSchema() {}

    /**
     * All rules of an entity kind, in descriptor order.
     */
    public static Map<String, AttributeRule> rulesFor(EntityKind kind) {
        Objects.requireNonNull(kind, "kind");
        return TABLE.get(kind);
    }

    public static Optional<AttributeRule> rule(EntityKind kind, String attribute) {
        Objects.requireNonNull(attribute, "attribute");
        return Optional.ofNullable(rulesFor(kind).get(attribute));
    }

    /**
     * Looks up how an attribute is treated at a schema version.
     */
    public static AttributeStatus status(EntityKind kind, String attribute, int sdk) {
        return rule(kind, attribute)
                .map(r -> !r.appliesAt(sdk)
                        ? AttributeStatus.NOT_YET_AVAILABLE
                        : r.required() ? AttributeStatus.REQUIRED : AttributeStatus.OPTIONAL)
                .orElse(AttributeStatus.UNKNOWN);
    }

    public static boolean isSupportedVersion(int sdk) {
        return sdk >= MIN_VERSION && sdk <= MAX_VERSION;
    }

    // -------------------------------------------------------------------------
    // Table
    // -------------------------------------------------------------------------

    private static Map<EntityKind, Map<String, AttributeRule>> buildTable() {
        Map<EntityKind, Map<String, AttributeRule>> table = new EnumMap<>(EntityKind.class);

        table.put(EntityKind.SETTING, rows(
                required("name", 3, STRING),
                required("type", 3, STRING).withDefault(NODES.textNode("text")).withChoices("text", "number"),
                optional("default", 3, STRING),
                optional("maxLength", 3, INTEGER),
                optional("isPassword", 3, BOOLEAN),
                optional("minValue", 3, INTEGER),
                optional("maxValue", 3, INTEGER),
                optional("readOnly", 3, BOOLEAN).withDefault(NODES.booleanNode(false))
        ));

        table.put(EntityKind.STATE, rows(
                required("id", 1, STRING),
                required("type", 1, STRING).withDefault(NODES.textNode("text")).withChoices("text", "choice"),
                required("desc", 1, STRING),
                required("default", 1, STRING).withDefault(NODES.textNode("")),
                optional("parentGroup", 6, STRING),
                optional("valueChoices", 1, LIST)
        ));

        table.put(EntityKind.EVENT, rows(
                required("id", 1, STRING),
                required("name", 1, STRING),
                required("format", 1, STRING),
                required("type", 1, STRING).withDefault(NODES.textNode("communicate")).withChoices("communicate"),
                required("valueChoices", 1, LIST).withDefault(NODES.arrayNode()),
                required("valueType", 1, STRING).withDefault(NODES.textNode("choice")).withChoices("choice"),
                required("valueStateId", 1, STRING)
        ));

        table.put(EntityKind.ACTION_DATA, rows(
                required("id", 1, STRING),
                required("type", 1, STRING).withDefault(NODES.textNode("text"))
                        .withChoices("text", "number", "switch", "choice", "file", "folder", "color"),
                required("label", 1, STRING),
                required("default", 1, SCALAR).withDefault(NODES.textNode("")),
                optional("valueChoices", 1, LIST),
                optional("extensions", 2, LIST),
                optional("allowDecimals", 2, BOOLEAN),
                optional("minValue", 3, INTEGER),
                optional("maxValue", 3, INTEGER)
        ));

        table.put(EntityKind.ACTION, rows(
                required("id", 1, STRING),
                required("name", 1, STRING),
                required("prefix", 1, STRING),
                required("type", 1, STRING).withDefault(NODES.textNode("communicate")).withChoices("communicate", "execute"),
                optional("description", 1, STRING),
                optional("format", 1, STRING),
                optional("executionType", 1, STRING),
                optional("execution_cmd", 1, STRING),
                optional("tryInline", 1, BOOLEAN),
                optional("hasHoldFunctionality", 3, BOOLEAN),
                optional("data", 1, LIST).withChildren(EntityKind.ACTION_DATA)
        ));

        table.put(EntityKind.CONNECTOR, rows(
                required("id", 4, STRING),
                required("name", 4, STRING),
                optional("format", 4, STRING),
                optional("data", 4, LIST).withChildren(EntityKind.ACTION_DATA)
        ));

        table.put(EntityKind.CATEGORY, rows(
                required("id", 1, STRING),
                required("name", 1, STRING),
                optional("imagepath", 1, STRING),
                optional("actions", 1, LIST).withChildren(EntityKind.ACTION),
                optional("connectors", 4, LIST).withChildren(EntityKind.CONNECTOR),
                optional("states", 1, LIST).withChildren(EntityKind.STATE),
                optional("events", 1, LIST).withChildren(EntityKind.EVENT)
        ));

        table.put(EntityKind.PLUGIN, rows(
                required("sdk", 1, INTEGER).withDefault(NODES.numberNode(DEFAULT_VERSION))
                        .withChoices("1", "2", "3", "4", "5", "6"),
                required("version", 1, INTEGER).withDefault(NODES.numberNode(1)),
                required("name", 1, STRING),
                required("id", 1, STRING),
                optional("configuration", 1, OBJECT),
                optional("plugin_start_cmd", 1, STRING),
                optional("plugin_start_cmd_windows", 4, STRING),
                optional("plugin_start_cmd_linux", 4, STRING),
                optional("plugin_start_cmd_mac", 4, STRING),
                required("categories", 1, LIST).withDefault(NODES.arrayNode()).withChildren(EntityKind.CATEGORY),
                optional("settings", 3, LIST).withDefault(NODES.arrayNode()).withChildren(EntityKind.SETTING)
        ));

        return Collections.unmodifiableMap(table);
    }

    private static Map<String, AttributeRule> rows(AttributeRule... rules) {
        Map<String, AttributeRule> rows = new LinkedHashMap<>();
        for (AttributeRule rule : rules) {
            rows.put(rule.name(), rule);
        }
        return Collections.unmodifiableMap(rows);
    }
}
