package com.questrail.touchportal.protocol;

/**
 * Messages the plugin sends to the controller.
 */
public enum OutboundKind
{
    PAIR("pair"),
    STATE_UPDATE("stateUpdate"),
    CREATE_STATE("createState"),
    REMOVE_STATE("removeState"),
    CHOICE_UPDATE("choiceUpdate"),
    SETTING_UPDATE("settingUpdate"),
    CONNECTOR_UPDATE("connectorUpdate"),
    SHOW_NOTIFICATION("showNotification"),
    UPDATE_ACTION_DATA("updateActionData"),

    /** Caller-built message; the {@code type} field comes from the caller. */
    PASSTHROUGH(null);

    private final String wireName;

    OutboundKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
