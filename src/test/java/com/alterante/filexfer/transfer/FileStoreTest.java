package com.alterante.filexfer.transfer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileStoreTest {

    @TempDir
    Path dir;

    @Test
    void sanitizeKeepsBasenameOnly() throws Exception {
        assertEquals("a.bin", FileStore.sanitize("a.bin"));
        assertEquals("passwd", FileStore.sanitize("../../etc/passwd"));
        assertEquals("x.txt", FileStore.sanitize("C:\\temp\\x.txt"));
        assertEquals("b", FileStore.sanitize("/abs/dir/b"));
    }

    @Test
    void sanitizeRejectsNonFiles() {
        assertThrows(ProtocolException.class, () -> FileStore.sanitize(""));
        assertThrows(ProtocolException.class, () -> FileStore.sanitize("."));
        assertThrows(ProtocolException.class, () -> FileStore.sanitize(".."));
        assertThrows(ProtocolException.class, () -> FileStore.sanitize("dir/"));
        assertThrows(ProtocolException.class, () -> FileStore.sanitize("a/.."));
    }

    @Test
    void traversalStaysInsideRoot() throws Exception {
        FileStore store = new FileStore(dir.resolve("store"));
        store.createRoot();
        assertEquals(dir.resolve("store").resolve("evil"), store.resolve("../evil"));
    }

    @Test
    void appendTruncateAndSize() throws Exception {
        FileStore store = new FileStore(dir);
        assertEquals(0, store.size("f"));
        assertFalse(store.exists("f"));

        try (FileChannel ch = store.openAppend("f")) {
            byte[] data = "0123456789".getBytes(StandardCharsets.US_ASCII);
            FileStore.writeDurably(ch, data, 0, 4);
            FileStore.writeDurably(ch, data, 4, 6);
        }
        assertTrue(store.exists("f"));
        assertEquals(10, store.size("f"));
        assertEquals(Checksums.prefix("0123".getBytes(StandardCharsets.US_ASCII), 4), store.checksum("f", 4));

        store.truncate("f");
        assertEquals(0, store.size("f"));
        assertTrue(store.exists("f"));
    }

    @Test
    void openReadAtOffset() throws Exception {
        FileStore store = new FileStore(dir);
        Files.writeString(dir.resolve("r"), "abcdef");
        try (FileChannel ch = store.openRead("r", 4)) {
            assertEquals(4, ch.position());
        }
        assertThrows(StorageException.class, () -> store.openRead("missing", 0));
    }

    @Test
    void listIsSortedAndSkipsDirectories() throws Exception {
        FileStore store = new FileStore(dir);
        assertEquals(List.of(), store.list());
        Files.writeString(dir.resolve("b"), "1");
        Files.writeString(dir.resolve("a"), "2");
        Files.createDirectory(dir.resolve("sub"));
        assertEquals(List.of("a", "b"), store.list());
    }

    @Test
    void missingRootListsNothing() throws Exception {
        assertEquals(List.of(), new FileStore(dir.resolve("nope")).list());
    }

    @Test
    void uploadLocksAreExclusivePerName() {
        UploadLocks locks = new UploadLocks();
        UploadLocks.Lease first = locks.tryAcquire("a");
        assertNotNull(first);
        assertNull(locks.tryAcquire("a"));
        assertNotNull(locks.tryAcquire("b"));

        first.close();
        first.close();
        assertFalse(locks.isHeld("a"));
        assertNotNull(locks.tryAcquire("a"));
    }
}
