package com.questrail.touchportal.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks are delivered serially, usually on a transport thread. They must
 * return quickly and must not block.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called for every chunk read from the stream. Chunks carry no framing;
     * a line may span several chunks and a chunk may hold several lines.
     */
    void onBytes(byte[] chunk);

    /**
     * Called once when an open stream closes.
     *
     * @param cause the failure that closed the stream; {@code null} when it was
     *              closed locally or by the peer
     */
    void onClosed(Throwable cause);
}
