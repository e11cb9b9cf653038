package com.alterante.filexfer.transfer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransferProgressTest {

    @Test
    void resumedPrefixCountsTowardPositionButNotTransferred() {
        TransferProgress progress = new TransferProgress(1000, 400);
        progress.addBytes(100);
        assertEquals(100, progress.transferredBytes());
        assertEquals(500, progress.position());
        assertEquals(50.0, progress.percentComplete(), 0.001);
        assertFalse(progress.isComplete());

        progress.addBytes(500);
        assertTrue(progress.isComplete());
    }

    @Test
    void emptyTransferIsComplete() {
        TransferProgress progress = new TransferProgress(0, 0);
        assertEquals(100.0, progress.percentComplete(), 0.001);
        assertTrue(progress.isComplete());
    }

    @Test
    void speedFormatting() {
        assertEquals("512 B/s", TransferProgress.formatSpeed(512));
        assertEquals("2.5 KB/s", TransferProgress.formatSpeed(2_500));
        assertEquals("3.2 MB/s", TransferProgress.formatSpeed(3_200_000));
    }
}
