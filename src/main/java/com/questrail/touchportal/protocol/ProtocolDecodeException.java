package com.questrail.touchportal.protocol;

/**
 * Indicates that an inbound line could not be translated into an
 * {@link InboundMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not valid JSON</li>
 *   <li>A JSON value that is not an object</li>
 *   <li>A missing or non-textual {@code type} discriminator</li>
 * </ul>
 */
public final class ProtocolDecodeException extends RuntimeException
{
    public ProtocolDecodeException(String message) {
        super(message);
    }

    public ProtocolDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
