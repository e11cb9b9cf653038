package com.alterante.filexfer.transfer;

import java.util.Locale;

/**
 * Byte counters and speed of one transfer, for whatever presentation layer is listening.
 */
public class TransferProgress {

    private final long totalBytes;
    private final long startOffset;
    private volatile long transferredBytes;
    private final long startTimeMs;

    public TransferProgress(long totalBytes, long startOffset) {
        this.totalBytes = totalBytes;
        this.startOffset = startOffset;
        this.startTimeMs = System.currentTimeMillis();
    }

    public void addBytes(long bytes) {
        this.transferredBytes += bytes;
    }

    /** Bytes moved on the wire by this transfer (excludes the resumed prefix). */
    public long transferredBytes() { return transferredBytes; }
    public long totalBytes() { return totalBytes; }
    public long startOffset() { return startOffset; }

    /** Position in the file: resumed prefix plus bytes moved. */
    public long position() {
        return startOffset + transferredBytes;
    }

    public double percentComplete() {
        if (totalBytes == 0) return 100.0;
        return (position() * 100.0) / totalBytes;
    }

    /** Bytes per second. */
    public double speed() {
        long elapsed = System.currentTimeMillis() - startTimeMs;
        if (elapsed <= 0) return 0;
        return (transferredBytes * 1000.0) / elapsed;
    }

    /** Human-readable speed string. */
    public String speedString() {
        return formatSpeed(speed());
    }

    static String formatSpeed(double bps) {
        if (bps >= 1_000_000) return String.format(Locale.ROOT, "%.1f MB/s", bps / 1_000_000);
        if (bps >= 1_000) return String.format(Locale.ROOT, "%.1f KB/s", bps / 1_000);
        return String.format(Locale.ROOT, "%.0f B/s", bps);
    }

    public boolean isComplete() {
        return position() >= totalBytes;
    }

    /** One-line status, e.g. {@code " 42% 440401/1048576 bytes 3.1 MB/s"}. */
    public String statusLine() {
        return String.format(Locale.ROOT, "%3.0f%% %d/%d bytes %s", percentComplete(), position(), totalBytes, speedString());
    }
}
