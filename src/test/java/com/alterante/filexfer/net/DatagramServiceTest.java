package com.alterante.filexfer.net;

import com.alterante.filexfer.transfer.FileStore;
import com.alterante.filexfer.transfer.FileTransferClient;
import com.alterante.filexfer.transfer.TransferOutcome;
import com.alterante.filexfer.transfer.TransferResult;
import com.alterante.filexfer.transport.ArqConfig;
import com.alterante.filexfer.transport.TransportKind;
import com.alterante.filexfer.transport.UdpDatagramLink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The session protocol over the reliable datagram engine, on loopback UDP.
 */
class DatagramServiceTest {

    private static final ArqConfig ARQ = new ArqConfig(ArqConfig.DEFAULT_SEGMENT_SIZE, 20, 100, 3_000, 3, 10);

    @TempDir
    Path serverDir;

    @TempDir
    Path clientDir;

    private DatagramService service;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        UdpDatagramLink link = UdpDatagramLink.open();
        port = link.localPort();
        FileStore store = new FileStore(serverDir);
        store.createRoot();
        service = new DatagramService(link, store, ARQ);
        service.start();
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private FileTransferClient client() throws Exception {
        return FileTransferClient.connect(TransportKind.UDP, "127.0.0.1", port, ARQ);
    }

    @Test
    void oneLineCommands() throws Exception {
        try (FileTransferClient client = client()) {
            assertEquals("over udp", client.echo("over udp"));
            assertTrue(client.time().matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}"));
            assertEquals(List.of(), client.list());
            assertEquals("ERROR: unknown command PING", client.exec("PING"));
            client.quit();
        }
    }

    @Test
    void uploadAndDownloadSpanningChunks() throws Exception {
        byte[] content = new byte[200_000];
        new Random(4).nextBytes(content);
        Path file = clientDir.resolve("u.bin");
        Files.write(file, content);
        Path downloads = Files.createDirectory(clientDir.resolve("downloads"));

        try (FileTransferClient client = client()) {
            TransferResult up = client.upload(file);
            assertEquals(TransferOutcome.COMPLETED, up.outcome());
            TransferResult down = client.download("u.bin", downloads);
            assertEquals(TransferOutcome.COMPLETED, down.outcome());
        }
        assertArrayEquals(content, Files.readAllBytes(serverDir.resolve("u.bin")));
        assertArrayEquals(content, Files.readAllBytes(downloads.resolve("u.bin")));
    }

    @Test
    void resumeAndRestartOverDatagrams() throws Exception {
        byte[] content = "0123456789".getBytes(StandardCharsets.US_ASCII);
        Files.write(serverDir.resolve("a.bin"), Arrays.copyOf(content, 4));
        Path file = clientDir.resolve("a.bin");
        Files.write(file, content);

        try (FileTransferClient client = client()) {
            TransferResult up = client.upload(file);
            assertEquals(4, up.offset());
            assertFalse(up.restarted());

            Files.writeString(file, "abc");
            TransferResult down = client.download("a.bin", clientDir);
            assertTrue(down.restarted());
        }
        assertArrayEquals(content, Files.readAllBytes(serverDir.resolve("a.bin")));
        assertArrayEquals(content, Files.readAllBytes(file));
    }

    @Test
    void emptyFileOverDatagrams() throws Exception {
        Path file = Files.createFile(clientDir.resolve("empty"));
        try (FileTransferClient client = client()) {
            assertEquals(TransferOutcome.COMPLETED, client.upload(file).outcome());
        }
        assertEquals(0, Files.size(serverDir.resolve("empty")));
    }

    @Test
    void sequentialClientsAreServed() throws Exception {
        for (int i = 0; i < 3; i++) {
            try (FileTransferClient client = client()) {
                assertEquals("client " + i, client.echo("client " + i));
            }
        }
    }
}
