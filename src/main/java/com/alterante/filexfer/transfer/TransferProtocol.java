package com.alterante.filexfer.transfer;

/**
 * Wire vocabulary of the session protocol: reply lines and their parsers.
 *
 * <pre>
 * UPLOAD   C: UPLOAD name size      S: OFFSET cur checksum | ERROR: reason
 *          C: OK | RESTART | ABORT  S: (RESTART) READY
 *          C: size - offset raw bytes
 *                                   S: UPLOAD COMPLETE
 * DOWNLOAD C: DOWNLOAD name         S: SIZE n | ERROR: not found
 *          C: OFFSET cur checksum | ABORT
 *                                   S: OK | RESTART (client resends OFFSET 0 0)
 *                                   S: n - offset raw bytes
 * </pre>
 */
public final class TransferProtocol {

    /** Raw bytes per chunk on the wire; each chunk is one blob in datagram mode. */
    public static final int CHUNK_SIZE = 64 * 1024;

    public static final String OK = "OK";
    public static final String RESTART = "RESTART";
    public static final String READY = "READY";
    public static final String ABORT = "ABORT";
    public static final String UPLOAD_COMPLETE = "UPLOAD COMPLETE";
    public static final String BYE = "BYE";
    public static final String ERROR_PREFIX = "ERROR:";

    /** Parsed {@code OFFSET <n> [checksum]} line. */
    public record Offset(long offset, String checksum) {}

    private TransferProtocol() {}

    public static String offset(long offset, String checksum) {
        return "OFFSET " + offset + " " + checksum;
    }

    public static String size(long size) {
        return "SIZE " + size;
    }

    public static String error(String reason) {
        return ERROR_PREFIX + " " + reason;
    }

    public static boolean isError(String line) {
        return line.startsWith(ERROR_PREFIX);
    }

    public static Offset parseOffset(String line) throws ProtocolException {
        String[] parts = line.trim().split(" +");
        if (parts.length < 2 || parts.length > 3 || !parts[0].equalsIgnoreCase("OFFSET")) {
            throw new ProtocolException("expected OFFSET <n> [checksum], got: " + line);
        }
        long offset = parseNonNegative(parts[1], "offset");
        String checksum = parts.length == 3 ? parts[2] : Checksums.EMPTY;
        return new Offset(offset, checksum);
    }

    public static long parseSize(String line) throws ProtocolException {
        String[] parts = line.trim().split(" +");
        if (parts.length != 2 || !parts[0].equalsIgnoreCase("SIZE")) {
            throw new ProtocolException("expected SIZE <n>, got: " + line);
        }
        return parseNonNegative(parts[1], "size");
    }

    static long parseNonNegative(String token, String what) throws ProtocolException {
        long value;
        try {
            value = Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new ProtocolException("invalid " + what + ": " + token);
        }
        if (value < 0) {
            throw new ProtocolException("invalid " + what + ": " + token);
        }
        return value;
    }
}
