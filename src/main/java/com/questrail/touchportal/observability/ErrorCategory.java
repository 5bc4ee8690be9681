package com.questrail.touchportal.observability;

/**
 * Where an error-kind event originated.
 */
public enum ErrorCategory
{
    /** Socket failure or unexpected loss of the controller connection. */
    TRANSPORT,
    /** An inbound line that could not be decoded or was addressed to another plugin. */
    PROTOCOL,
    /** A user handler threw. */
    HANDLER
}
