package com.questrail.touchportal.api;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * MessageKind
 * -----------------------------------------------------------------------------
 * Closed set of inbound message kinds sent by the controller, selected by the
 * {@code type} discriminator of each JSON line.
 *
 * <p>Each kind has one primary wire name and may accept aliases. Any
 * discriminator that matches no known kind decodes to {@link #UNKNOWN}; such
 * messages are still delivered to all-messages handlers.</p>
 */
public enum MessageKind
{
    /** Pairing acknowledgement returned after the plugin sends {@code pair}. */
    INFO("info", "pair"),

    /** A user triggered one of the plugin's actions. */
    ACTION("action"),

    /** Hold-start of an action declared with hold functionality. */
    HOLD_DOWN("down", "on"),

    /** Hold-end of an action declared with hold functionality. */
    HOLD_UP("up", "off"),

    /** A choice-type data item changed and dependent lists should refresh. */
    LIST_CHANGE("listChange"),

    /** A connector (slider) value changed. */
    CONNECTOR_CHANGE("connectorChange"),

    /** The plugin's settings were changed in the controller. */
    SETTINGS("settings"),

    /** Controller broadcast, e.g. the visible page changed. */
    BROADCAST("broadcast"),

    /** The user clicked an option of a plugin notification. */
    NOTIFICATION_OPTION_CLICKED("notificationOptionClicked"),

    /** The controller asks the plugin to shut down. */
    CLOSE_PLUGIN("closePlugin"),

    /** Catch-all for discriminators this runtime does not know. */
    UNKNOWN();

    private final List<String> wireNames;

    MessageKind(String... wireNames) {
        this.wireNames = List.of(wireNames);
    }

    /**
     * Primary wire name, or {@code null} for {@link #UNKNOWN}.
     */
    public String wireName() {
        return wireNames.isEmpty() ? null : wireNames.get(0);
    }

    public List<String> wireNames() {
        return wireNames;
    }

    /**
     * Resolves a wire discriminator to its kind. Never returns {@code null}.
     */
    public static MessageKind fromWire(String type) {
        Objects.requireNonNull(type, "type");
        return Arrays.stream(values())
                .filter(k -> k.wireNames.contains(type))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
