package com.alterante.filexfer.transfer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ResumePolicyTest {

    @TempDir
    Path dir;

    @Test
    void uploadOffsetIsStoredSize() throws Exception {
        assertEquals(0, ResumePolicy.uploadOffset(0, 10));
        assertEquals(4, ResumePolicy.uploadOffset(4, 10));
        assertEquals(0, ResumePolicy.uploadOffset(0, 0));
    }

    @Test
    void completeOrLongerStoredFileCollides() {
        ProtocolException e = assertThrows(ProtocolException.class, () -> ResumePolicy.uploadOffset(10, 10));
        assertEquals("file already exists", e.getMessage());
        assertThrows(ProtocolException.class, () -> ResumePolicy.uploadOffset(12, 10));
    }

    @Test
    void offerUploadCarriesPrefixChecksum() throws Exception {
        Files.writeString(dir.resolve("a.bin"), "0123");
        FileStore store = new FileStore(dir);
        String offer = ResumePolicy.offerUpload(store, new Request.Upload("a.bin", 10));
        assertEquals("OFFSET 4 " + Checksums.prefix(dir.resolve("a.bin"), 4), offer);
        assertEquals("OFFSET 0 0", ResumePolicy.offerUpload(store, new Request.Upload("new.bin", 10)));
    }

    @Test
    void downloadResumeRequiresMatchingPrefix() throws Exception {
        Files.writeString(dir.resolve("d"), "0123456789");
        FileStore store = new FileStore(dir);
        String good = Checksums.prefix(dir.resolve("d"), 3);

        assertTrue(ResumePolicy.downloadResumable(store, "d", 10, new TransferProtocol.Offset(3, good)));
        assertTrue(ResumePolicy.downloadResumable(store, "d", 10, new TransferProtocol.Offset(0, "0")));
        assertFalse(ResumePolicy.downloadResumable(store, "d", 10, new TransferProtocol.Offset(3, "bad")));
        assertFalse(ResumePolicy.downloadResumable(store, "d", 10, new TransferProtocol.Offset(11, good)));
    }

    @Test
    void localPrefixMatch() throws Exception {
        Path local = dir.resolve("l");
        Files.writeString(local, "0123456789");
        String cs = Checksums.prefix(local, 4);

        assertTrue(ResumePolicy.localPrefixMatches(local, new TransferProtocol.Offset(4, cs)));
        assertFalse(ResumePolicy.localPrefixMatches(local, new TransferProtocol.Offset(4, "other")));
        assertFalse(ResumePolicy.localPrefixMatches(local, new TransferProtocol.Offset(20, cs)));
    }
}
