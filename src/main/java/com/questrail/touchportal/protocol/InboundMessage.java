package com.questrail.touchportal.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.touchportal.api.MessageKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A decoded controller message.
 *
 * <p>Wraps the full JSON object so that fields this runtime does not model
 * remain reachable through {@link #get(String)} and {@link #fields()}. The
 * wrapped tree is a private copy; instances are immutable and safe to share
 * between handler threads.</p>
 */
public final class InboundMessage
{
    private final MessageKind kind;
    private final String type;
    private final ObjectNode fields;

    public InboundMessage(ObjectNode fields) {
        Objects.requireNonNull(fields, "fields");
        JsonNode type = fields.get("type");
        if (type == null || !type.isTextual()) {
            throw new IllegalArgumentException("Message requires a textual 'type'");
        }
        this.fields = fields.deepCopy();
        this.type = type.asText();
        this.kind = MessageKind.fromWire(this.type);
    }

    public MessageKind kind() {
        return kind;
    }

    /**
     * The raw discriminator as received, useful for {@link MessageKind#UNKNOWN} messages.
     */
    public String type() {
        return type;
    }

    /**
     * A copy of the named field, or {@code null} when absent.
     */
    public JsonNode get(String field) {
        JsonNode value = fields.get(field);
        return value == null ? null : value.deepCopy();
    }

    /**
     * The named field as text, when present and scalar.
     */
    public Optional<String> text(String field) {
        JsonNode value = fields.get(field);
        return value != null && value.isValueNode() && !value.isNull()
                ? Optional.of(value.asText())
                : Optional.empty();
    }

    public Optional<String> pluginId() {
        return text("pluginId");
    }

    public Optional<String> actionId() {
        return text("actionId");
    }

    public Optional<String> instanceId() {
        return text("instanceId");
    }

    public Optional<String> connectorId() {
        return text("connectorId");
    }

    /**
     * The {@code data} array of action, hold and connector messages. Entries
     * without an {@code id} are skipped.
     */
    public List<ActionDataItem> data() {
        JsonNode data = fields.get("data");
        if (data == null || !data.isArray()) {
            return List.of();
        }
        List<ActionDataItem> items = new ArrayList<>();
        for (JsonNode entry : data) {
            JsonNode id = entry.get("id");
            if (id == null || !id.isValueNode()) {
                continue;
            }
            JsonNode value = entry.get("value");
            items.add(new ActionDataItem(id.asText(),
                    value == null || value.isNull() ? null : value.asText()));
        }
        return Collections.unmodifiableList(items);
    }

    /**
     * Value of the data item with the given id. For a {@code null} or blank id,
     * the first item that has a value.
     */
    public Optional<String> dataValue(String dataId) {
        boolean any = dataId == null || dataId.isBlank();
        return data().stream()
                .filter(item -> any ? item.value() != null : item.id().equals(dataId))
                .map(ActionDataItem::value)
                .filter(Objects::nonNull)
                .findFirst();
    }

    /**
     * Setting values carried by {@code settings} ({@code values}) and
     * {@code info} ({@code settings}) messages. Both arrive as arrays of
     * single-entry objects; they are flattened in order.
     */
    public Map<String, String> settingValues() {
        Map<String, String> values = new LinkedHashMap<>();
        for (String field : List.of("values", "settings")) {
            JsonNode array = fields.get(field);
            if (array == null || !array.isArray()) {
                continue;
            }
            for (JsonNode entry : array) {
                Iterator<Map.Entry<String, JsonNode>> it = entry.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    if (e.getValue().isValueNode() && !e.getValue().isNull()) {
                        values.put(e.getKey(), e.getValue().asText());
                    }
                }
            }
        }
        return Collections.unmodifiableMap(values);
    }

    /**
     * A copy of the whole message.
     */
    public ObjectNode fields() {
        return fields.deepCopy();
    }

    @Override
    public String toString() {
        return "InboundMessage" + fields;
    }
}
