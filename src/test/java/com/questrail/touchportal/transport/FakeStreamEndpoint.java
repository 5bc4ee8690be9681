package com.questrail.touchportal.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint} implementation.
 *
 * <p>Contains no protocol semantics: it stores outbound bytes and lets tests
 * inject inbound chunks and closed signals.</p>
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    private volatile StreamEndpointListener listener;
    private final List<byte[]> written = new ArrayList<>();
    private volatile CountDownLatch opened = new CountDownLatch(1);

    private volatile boolean open;
    private volatile Exception openFailure;
    private volatile Runnable duringOpen = () -> { };
    private volatile boolean refuseWrites;
    private int openCount;
    private int closeCount;

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void open() throws IOException {
        openCount++;
        duringOpen.run();
        Exception failure = openFailure;
        if (failure instanceof IOException io) {
            throw io;
        }
        if (failure != null) {
            throw (RuntimeException) failure;
        }
        open = true;
        opened.countDown();
    }

    @Override
    public synchronized boolean write(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (!open || refuseWrites) {
            return false;
        }
        written.add(payload.clone());
        return true;
    }

    @Override
    public void close() {
        boolean wasOpen;
        synchronized (this) {
            closeCount++;
            wasOpen = open;
            open = false;
        }
        if (wasOpen) {
            listener.onClosed(null);
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void failOpenWith(IOException failure) {
        this.openFailure = failure;
    }

    public void failOpenWith(RuntimeException failure) {
        this.openFailure = failure;
    }

    /**
     * Runs {@code action} inside {@link #open()}, before the stream is open.
     */
    public void duringOpen(Runnable action) {
        this.duringOpen = Objects.requireNonNull(action, "action");
    }

    /**
     * Makes {@link #write(byte[])} report a full outbound buffer.
     */
    public void refuseWrites(boolean refuse) {
        this.refuseWrites = refuse;
    }

    /**
     * Blocks until {@link #open()} succeeded.
     */
    public boolean awaitOpen(long timeout, TimeUnit unit) throws InterruptedException {
        return opened.await(timeout, unit);
    }

    public void inject(byte[] chunk) {
        requireListener().onBytes(chunk);
    }

    public void inject(String text) {
        inject(text.getBytes(StandardCharsets.UTF_8));
    }

    public void injectLine(String json) {
        inject(json + "\n");
    }

    /**
     * Simulates the peer closing the stream, or failing with {@code cause}.
     */
    public void closeFromPeer(Throwable cause) {
        synchronized (this) {
            open = false;
        }
        requireListener().onClosed(cause);
    }

    public synchronized List<String> writtenLines() {
        List<String> lines = new ArrayList<>();
        for (byte[] chunk : written) {
            String text = new String(chunk, StandardCharsets.UTF_8);
            lines.add(text.endsWith("\n") ? text.substring(0, text.length() - 1) : text);
        }
        return lines;
    }

    public synchronized int openCount() {
        return openCount;
    }

    public synchronized int closeCount() {
        return closeCount;
    }

    public boolean isOpen() {
        return open;
    }

    public synchronized void clear() {
        written.clear();
    }

    private StreamEndpointListener requireListener() {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        return l;
    }
}
