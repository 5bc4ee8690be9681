package com.questrail.touchportal.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative plugin definition consumed by {@link DescriptorGenerator}.
 *
 * <p>Mirrors the descriptor shape but keys every entity by a local name so that
 * identifiers can be derived instead of repeated. Entities name their owning
 * category through a {@code category} attribute holding the category's local
 * name.</p>
 *
 * <pre>
 * {
 *   "info":       { "name": "...", "id": "com.example.plugin", "sdk": 6 },
 *   "categories": { "main": { "name": "Example" } },
 *   "actions":    { "beep": { "category": "main", "name": "Beep", "prefix": "Ex",
 *                             "format": "Beep at $[volume]",
 *                             "data": { "volume": { "type": "number", "label": "Volume", "default": 50 } } } },
 *   "states":     { ... },
 *   "events":     { ... },
 *   "connectors": { ... },
 *   "settings":   { "Host": { "type": "text", "default": "localhost" } }
 * }
 * </pre>
 */
public record PluginDeclaration(
        ObjectNode info,
        Map<String, ObjectNode> categories,
        Map<String, ObjectNode> actions,
        Map<String, ObjectNode> states,
        Map<String, ObjectNode> events,
        Map<String, ObjectNode> connectors,
        Map<String, ObjectNode> settings
) {
    private static final Set<String> SECTIONS =
            Set.of("info", "categories", "actions", "states", "events", "connectors", "settings");

    public PluginDeclaration {
        Objects.requireNonNull(info, "info");
        categories = ordered(categories);
        actions = ordered(actions);
        states = ordered(states);
        events = ordered(events);
        connectors = ordered(connectors);
        settings = ordered(settings);
        if (categories.isEmpty()) {
            throw new IllegalArgumentException("At least one category is required");
        }
    }

    /**
     * Reads a declaration document.
     *
     * @throws IllegalArgumentException if the document has unknown sections or
     *         sections that are not objects of objects
     */
    public static PluginDeclaration fromJson(JsonNode document) {
        Objects.requireNonNull(document, "document");
        if (!document.isObject()) {
            throw new IllegalArgumentException("Declaration must be a JSON object");
        }
        document.fieldNames().forEachRemaining(name -> {
            if (!SECTIONS.contains(name)) {
                throw new IllegalArgumentException("Unknown declaration section: " + name);
            }
        });
        JsonNode info = document.get("info");
        if (info == null || !info.isObject()) {
            throw new IllegalArgumentException("Declaration requires an 'info' object");
        }
        return new PluginDeclaration(
                (ObjectNode) info,
                section(document, "categories"),
                section(document, "actions"),
                section(document, "states"),
                section(document, "events"),
                section(document, "connectors"),
                section(document, "settings"));
    }

    public static Builder builder(ObjectNode info) {
        return new Builder(info);
    }

    private static Map<String, ObjectNode> section(JsonNode document, String name) {
        Map<String, ObjectNode> entries = new LinkedHashMap<>();
        JsonNode section = document.get(name);
        if (section == null) {
            return entries;
        }
        if (!section.isObject()) {
            throw new IllegalArgumentException("Section '" + name + "' must be an object keyed by local name");
        }
        Iterator<Map.Entry<String, JsonNode>> it = section.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!entry.getValue().isObject()) {
                throw new IllegalArgumentException("Entry '" + name + "." + entry.getKey() + "' must be an object");
            }
            entries.put(entry.getKey(), (ObjectNode) entry.getValue());
        }
        return entries;
    }

    private static Map<String, ObjectNode> ordered(Map<String, ObjectNode> entries) {
        return entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static final class Builder
    {
        private final ObjectNode info;
        private final Map<String, ObjectNode> categories = new LinkedHashMap<>();
        private final Map<String, ObjectNode> actions = new LinkedHashMap<>();
        private final Map<String, ObjectNode> states = new LinkedHashMap<>();
        private final Map<String, ObjectNode> events = new LinkedHashMap<>();
        private final Map<String, ObjectNode> connectors = new LinkedHashMap<>();
        private final Map<String, ObjectNode> settings = new LinkedHashMap<>();

        private Builder(ObjectNode info) {
            this.info = Objects.requireNonNull(info, "info");
        }

        public Builder category(String localName, ObjectNode category) {
            categories.put(localName, category);
            return this;
        }

        public Builder action(String localName, ObjectNode action) {
            actions.put(localName, action);
            return this;
        }

        public Builder state(String localName, ObjectNode state) {
            states.put(localName, state);
            return this;
        }

        public Builder event(String localName, ObjectNode event) {
            events.put(localName, event);
            return this;
        }

        public Builder connector(String localName, ObjectNode connector) {
            connectors.put(localName, connector);
            return this;
        }

        public Builder setting(String localName, ObjectNode setting) {
            settings.put(localName, setting);
            return this;
        }

        public PluginDeclaration build() {
            return new PluginDeclaration(info, categories, actions, states, events, connectors, settings);
        }
    }
}
