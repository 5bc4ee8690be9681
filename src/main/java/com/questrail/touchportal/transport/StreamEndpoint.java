package com.questrail.touchportal.transport;

import java.io.IOException;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a bidirectional byte stream to the controller.
 *
 * <p>An endpoint may be opened again after it was closed.</p>
 */
public interface StreamEndpoint
{
    /**
     * Register the listener that receives inbound bytes and the closed signal.
     *
     * <p>This must be called before {@link #open()}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * Open the stream, blocking until it is established.
     *
     * @throws IOException if the stream cannot be established
     */
    void open() throws IOException;

    /**
     * Queue bytes for writing. Callers serialize writes.
     *
     * @return {@code false} if the stream is not open, or cannot accept more
     *         outbound data, and the bytes were dropped
     */
    boolean write(byte[] payload);

    /**
     * Close the stream. Idempotent.
     *
     * <p>After an open stream closes, by this call or otherwise, the listener
     * MUST be notified via {@link StreamEndpointListener#onClosed(Throwable)}
     * exactly once.</p>
     */
    void close();
}
