package com.alterante.filexfer.transfer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Prefix checksums used by resume negotiation.
 *
 * MD5 hex digest of the first {@code length} bytes of a file; {@code "0"} for an empty prefix or
 * a missing file. Only detects divergence between two copies; not an integrity guarantee.
 */
public final class Checksums {

    public static final String EMPTY = "0";

    private static final int READ_CHUNK = 65536;

    private Checksums() {}

    public static String prefix(Path file, long length) throws IOException {
        if (length <= 0 || !Files.exists(file)) {
            return EMPTY;
        }
        MessageDigest md = newDigest();
        byte[] buf = new byte[READ_CHUNK];
        long remaining = length;
        try (InputStream is = Files.newInputStream(file)) {
            while (remaining > 0) {
                int n = is.read(buf, 0, (int) Math.min(buf.length, remaining));
                if (n < 0) break;
                md.update(buf, 0, n);
                remaining -= n;
            }
        }
        return hex(md.digest());
    }

    /** Checksum of the first {@code length} bytes of an in-memory copy. */
    public static String prefix(byte[] data, int length) {
        if (length <= 0) {
            return EMPTY;
        }
        MessageDigest md = newDigest();
        md.update(data, 0, Math.min(length, data.length));
        return hex(md.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String hex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
