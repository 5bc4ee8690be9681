package com.questrail.touchportal.protocol;

/**
 * One entry of the {@code data} array carried by action, hold and connector
 * messages.
 *
 * @param value the user supplied value, or {@code null} when the entry has none
 */
public record ActionDataItem(String id, String value) {}
