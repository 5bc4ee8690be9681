package com.questrail.touchportal.state;

/**
 * How a state became known to the store.
 */
public enum StateOrigin
{
    /** Declared in the descriptor; the controller already knows it. */
    STATIC,
    /** Created at runtime through {@code createState}. */
    DYNAMIC
}
