package com.alterante.filexfer.transport;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Inbound byte buffer shared by control-line and raw reads.
 *
 * Bytes are appended as they arrive; {@link #pollLine()} takes everything up to the next
 * {@code '\n'}, {@link #drain(int)} takes raw bytes. Whatever is not taken stays buffered for the
 * next call, so raw bytes read ahead together with a control line are never lost.
 *
 * Thread-safety: callers must synchronize externally.
 */
public class LineFramer {

    /** Longest control line accepted, terminator excluded. */
    public static final int MAX_LINE_LENGTH = 8192;

    private byte[] buf = new byte[8192];
    private int start;
    private int end;

    public void append(byte[] src, int offset, int length) {
        ensureCapacity(length);
        System.arraycopy(src, offset, buf, end, length);
        end += length;
    }

    /** Append all remaining bytes of {@code src}. */
    public void append(ByteBuffer src) {
        int length = src.remaining();
        ensureCapacity(length);
        src.get(buf, end, length);
        end += length;
    }

    /**
     * Take the next complete line.
     *
     * @return the line without {@code "\n"} or {@code "\r\n"}, or null if no full line is buffered
     * @throws FramingException if more than {@link #MAX_LINE_LENGTH} bytes arrive without a newline
     */
    public String pollLine() throws FramingException {
        for (int i = start; i < end; i++) {
            if (buf[i] == '\n') {
                int lineEnd = i;
                if (lineEnd > start && buf[lineEnd - 1] == '\r') {
                    lineEnd--;
                }
                String line = new String(buf, start, lineEnd - start, StandardCharsets.UTF_8);
                start = i + 1;
                compactIfEmpty();
                return line;
            }
        }
        if (end - start > MAX_LINE_LENGTH) {
            throw new FramingException("control line exceeds " + MAX_LINE_LENGTH + " bytes");
        }
        return null;
    }

    /** Take up to {@code max} buffered raw bytes (possibly none). */
    public byte[] drain(int max) {
        int n = Math.min(max, buffered());
        byte[] out = Arrays.copyOfRange(buf, start, start + n);
        start += n;
        compactIfEmpty();
        return out;
    }

    /** Number of bytes currently buffered. */
    public int buffered() {
        return end - start;
    }

    private void compactIfEmpty() {
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    private void ensureCapacity(int extra) {
        if (end + extra <= buf.length) return;
        int live = end - start;
        if (live + extra <= buf.length) {
            System.arraycopy(buf, start, buf, 0, live);
        } else {
            byte[] grown = new byte[Math.max(buf.length * 2, live + extra)];
            System.arraycopy(buf, start, grown, 0, live);
            buf = grown;
        }
        start = 0;
        end = live;
    }
}
