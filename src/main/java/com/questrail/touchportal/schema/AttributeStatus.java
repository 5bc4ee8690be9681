package com.questrail.touchportal.schema;

/**
 * Result of looking up an attribute for a given schema version.
 */
public enum AttributeStatus
{
    /** The attribute is not part of the entity kind at all. */
    UNKNOWN,
    /** The attribute exists but only in a later schema version. */
    NOT_YET_AVAILABLE,
    REQUIRED,
    OPTIONAL
}
