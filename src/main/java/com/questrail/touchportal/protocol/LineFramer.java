package com.questrail.touchportal.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reassembles newline-terminated lines from arbitrarily split byte chunks.
 *
 * <p>Bytes are buffered until a {@code '\n'} arrives, so multi-byte UTF-8
 * sequences split across chunks decode correctly. A trailing {@code '\r'} is
 * removed. Incomplete trailing bytes stay buffered for the next chunk.</p>
 *
 * <p>Not thread-safe; owned by the connection loop thread.</p>
 */
public final class LineFramer
{
    private static final int INITIAL_CAPACITY = 4096;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;

    /**
     * Appends a chunk and returns every line it completes, in order.
     */
    public List<String> append(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        ensureCapacity(length + chunk.length);
        System.arraycopy(chunk, 0, buffer, length, chunk.length);
        length += chunk.length;

        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (buffer[i] == '\n') {
                int end = i;
                if (end > start && buffer[end - 1] == '\r') {
                    end--;
                }
                lines.add(new String(buffer, start, end - start, StandardCharsets.UTF_8));
                start = i + 1;
            }
        }
        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, length - start);
            length -= start;
        }
        return lines;
    }

    /**
     * Number of buffered bytes not yet terminated by a newline.
     */
    public int pending() {
        return length;
    }

    public void reset() {
        length = 0;
        if (buffer.length > INITIAL_CAPACITY) {
            buffer = new byte[INITIAL_CAPACITY];
        }
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
