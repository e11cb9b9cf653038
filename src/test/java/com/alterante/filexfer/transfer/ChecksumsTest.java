package com.alterante.filexfer.transfer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumsTest {

    @TempDir
    Path dir;

    @Test
    void md5HexOfPrefix() throws Exception {
        Path f = dir.resolve("f");
        Files.writeString(f, "0123456789");
        // md5("0123")
        assertEquals("eb62f6b9306db575c2d596b1279627a4", Checksums.prefix(f, 4));
        assertEquals(Checksums.prefix("0123".getBytes(StandardCharsets.US_ASCII), 4), Checksums.prefix(f, 4));
    }

    @Test
    void emptyPrefixIsZero() throws Exception {
        assertEquals("0", Checksums.prefix(dir.resolve("absent"), 10));
        assertEquals("0", Checksums.prefix(new byte[5], 0));
        Path f = dir.resolve("f");
        Files.writeString(f, "data");
        assertEquals("0", Checksums.prefix(f, 0));
    }

    @Test
    void largePrefixSpansReadChunks() throws Exception {
        byte[] data = new byte[200_000];
        for (int i = 0; i < data.length; i++) data[i] = (byte) (i * 31);
        Path f = dir.resolve("big");
        Files.write(f, data);
        assertEquals(Checksums.prefix(data, 150_001), Checksums.prefix(f, 150_001));
    }
}
