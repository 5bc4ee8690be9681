package com.questrail.touchportal.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A message to the controller, held as an ordered field map whose first entry
 * is always the {@code type} discriminator.
 *
 * <p>Instances are immutable. Use the static factories; each produces exactly
 * the fields the controller expects for that message type.</p>
 */
public final class OutboundMessage
{
    public static final int CONNECTOR_MIN = 0;
    public static final int CONNECTOR_MAX = 100;

    private final OutboundKind kind;
    private final Map<String, Object> fields;

    private OutboundMessage(OutboundKind kind, Map<String, Object> fields) {
        this.kind = kind;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public OutboundKind kind() {
        return kind;
    }

    public String type() {
        return (String) fields.get("type");
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Map<String, Object> fields() {
        return fields;
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    public static OutboundMessage pair(String pluginId) {
        return of(OutboundKind.PAIR).with("id", pluginId).build();
    }

    public static OutboundMessage stateUpdate(String stateId, String value) {
        return of(OutboundKind.STATE_UPDATE).with("id", stateId).with("value", value).build();
    }

    public static OutboundMessage createState(String stateId, String description, String defaultValue) {
        return of(OutboundKind.CREATE_STATE)
                .with("id", stateId)
                .with("desc", description)
                .with("defaultValue", defaultValue)
                .build();
    }

    public static OutboundMessage removeState(String stateId) {
        return of(OutboundKind.REMOVE_STATE).with("id", stateId).build();
    }

    public static OutboundMessage choiceUpdate(String choiceId, List<String> values) {
        return of(OutboundKind.CHOICE_UPDATE)
                .with("id", choiceId)
                .with("value", List.copyOf(values))
                .build();
    }

    /**
     * Choice list update for one action instance only.
     */
    public static OutboundMessage choiceUpdate(String choiceId, List<String> values, String instanceId) {
        return of(OutboundKind.CHOICE_UPDATE)
                .with("id", choiceId)
                .with("instanceId", instanceId)
                .with("value", List.copyOf(values))
                .build();
    }

    public static OutboundMessage settingUpdate(String name, String value) {
        return of(OutboundKind.SETTING_UPDATE).with("name", name).with("value", value).build();
    }

    /**
     * @param connectorId the plugin-local connector id; the controller's
     *                    {@code pc_<pluginId>_} prefix is added here
     * @throws IllegalArgumentException if {@code value} is outside 0..100
     */
    public static OutboundMessage connectorUpdate(String pluginId, String connectorId, int value) {
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(connectorId, "connectorId");
        if (value < CONNECTOR_MIN || value > CONNECTOR_MAX) {
            throw new IllegalArgumentException("Connector value must be between "
                    + CONNECTOR_MIN + " and " + CONNECTOR_MAX + ", got " + value);
        }
        return of(OutboundKind.CONNECTOR_UPDATE)
                .with("connectorId", "pc_" + pluginId + "_" + connectorId + "_")
                .with("value", Integer.toString(value))
                .build();
    }

    public static OutboundMessage showNotification(
            String notificationId, String title, String msg, List<NotificationOption> options) {
        List<Map<String, Object>> encoded = new ArrayList<>();
        for (NotificationOption option : options) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("id", option.id());
            o.put("title", option.title());
            encoded.add(Collections.unmodifiableMap(o));
        }
        return of(OutboundKind.SHOW_NOTIFICATION)
                .with("notificationId", notificationId)
                .with("title", title)
                .with("msg", msg)
                .with("options", Collections.unmodifiableList(encoded))
                .build();
    }

    /**
     * Changes the numeric range of a data item of one action instance.
     */
    public static OutboundMessage updateActionData(String instanceId, String dataId, Number minValue, Number maxValue) {
        Objects.requireNonNull(minValue, "minValue");
        Objects.requireNonNull(maxValue, "maxValue");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("minValue", minValue);
        data.put("maxValue", maxValue);
        data.put("id", Objects.requireNonNull(dataId, "dataId"));
        data.put("type", "number");
        return of(OutboundKind.UPDATE_ACTION_DATA)
                .with("instanceId", instanceId)
                .with("data", Collections.unmodifiableMap(data))
                .build();
    }

    /**
     * Wraps a caller-built message.
     *
     * @throws IllegalArgumentException if {@code message} has no textual {@code type}
     */
    public static OutboundMessage passthrough(Map<String, ?> message) {
        Objects.requireNonNull(message, "message");
        Object type = message.get("type");
        if (!(type instanceof String) || ((String) type).isBlank()) {
            throw new IllegalArgumentException("Outbound message requires a textual 'type'");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", type);
        message.forEach((k, v) -> {
            if (!k.equals("type")) {
                fields.put(k, v);
            }
        });
        return new OutboundMessage(OutboundKind.PASSTHROUGH, fields);
    }

    private static Builder of(OutboundKind kind) {
        return new Builder(kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OutboundMessage)) {
            return false;
        }
        OutboundMessage other = (OutboundMessage) o;
        return kind == other.kind && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fields);
    }

    @Override
    public String toString() {
        return "OutboundMessage" + fields;
    }

    private static final class Builder
    {
        private final OutboundKind kind;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        Builder(OutboundKind kind) {
            this.kind = kind;
            fields.put("type", kind.wireName());
        }

        Builder with(String name, Object value) {
            fields.put(name, Objects.requireNonNull(value, name));
            return this;
        }

        OutboundMessage build() {
            return new OutboundMessage(kind, fields);
        }
    }
}
