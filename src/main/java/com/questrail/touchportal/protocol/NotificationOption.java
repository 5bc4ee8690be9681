package com.questrail.touchportal.protocol;

/**
 * A clickable option of a plugin notification. Both fields must be non-blank.
 */
public record NotificationOption(String id, String title)
{
    public NotificationOption {
        if (id == null || id.isBlank() || title == null || title.isBlank()) {
            throw new IllegalArgumentException("Notification options require an id and a title");
        }
    }
}
