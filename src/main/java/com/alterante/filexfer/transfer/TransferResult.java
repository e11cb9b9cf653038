package com.alterante.filexfer.transfer;

/**
 * What a client-side upload or download did.
 *
 * @param bytesTransferred bytes moved on the wire; {@code totalBytes - offset} on success
 * @param restarted        whether a checksum mismatch forced a restart from offset 0
 * @param reason           the server's ERROR line when {@link TransferOutcome#REFUSED}, else null
 */
public record TransferResult(String name,
                             Direction direction,
                             TransferOutcome outcome,
                             long totalBytes,
                             long offset,
                             long bytesTransferred,
                             boolean restarted,
                             long elapsedMs,
                             String reason) {

    public enum Direction { UPLOAD, DOWNLOAD }

    static TransferResult refused(String name, Direction direction, String reply) {
        return new TransferResult(name, direction, TransferOutcome.REFUSED, 0, 0, 0, false, 0, reply);
    }

    public boolean succeeded() {
        return outcome != TransferOutcome.REFUSED;
    }

    /** Average bytes per second over the raw-byte phase. */
    public double speed() {
        if (elapsedMs <= 0) return 0;
        return bytesTransferred * 1000.0 / elapsedMs;
    }

    /**
     * @return this result if the transfer was not refused
     * @throws TransferRefusedException carrying the server's reply otherwise
     */
    public TransferResult requireSucceeded() throws TransferRefusedException {
        if (!succeeded()) {
            throw new TransferRefusedException(reason);
        }
        return this;
    }

    /** One-line summary: name, bytes, resume offset, speed. */
    public String summary() {
        String verb = direction == Direction.UPLOAD ? "Uploaded" : "Downloaded";
        switch (outcome) {
            case ALREADY_COMPLETE:
                return String.format("%s: already complete (%d bytes)", name, totalBytes);
            case REFUSED:
                return String.format("%s: refused (%s)", name, reason);
            default:
                return String.format("%s %s: %d bytes (from offset %d%s) in %d ms, %s",
                        verb, name, bytesTransferred, offset, restarted ? ", restarted" : "",
                        elapsedMs, TransferProgress.formatSpeed(speed()));
        }
    }
}
