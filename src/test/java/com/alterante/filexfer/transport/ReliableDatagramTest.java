package com.alterante.filexfer.transport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the ARQ engine over real loopback sockets.
 */
class ReliableDatagramTest {

    private static final ArqConfig FAST = new ArqConfig(200, 20, 50, 3_000, 3, 10);

    private UdpDatagramLink socketA;
    private UdpDatagramLink socketB;
    private InetSocketAddress addrA;
    private InetSocketAddress addrB;
    private ExecutorService exec;

    @BeforeEach
    void setUp() throws Exception {
        socketA = UdpDatagramLink.open();
        socketB = UdpDatagramLink.open();
        addrA = new InetSocketAddress("127.0.0.1", socketA.localPort());
        addrB = new InetSocketAddress("127.0.0.1", socketB.localPort());
        exec = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        exec.shutdownNow();
        socketA.close();
        socketB.close();
    }

    private static byte[] randomBytes(int n, long seed) {
        byte[] b = new byte[n];
        new Random(seed).nextBytes(b);
        return b;
    }

    @Test
    void deliversBlobOverCleanLink() throws Exception {
        ReliableDatagram sender = new ReliableDatagram(socketA, ArqConfig.defaults());
        ReliableDatagram receiver = new ReliableDatagram(socketB, ArqConfig.defaults());
        byte[] data = randomBytes(100_000, 1);

        Future<ReliableDatagram.Delivery> rx = exec.submit(() -> receiver.receive());
        sender.send(addrB, data);

        ReliableDatagram.Delivery delivery = rx.get(10, TimeUnit.SECONDS);
        assertArrayEquals(data, delivery.data());
        assertEquals(addrA, delivery.peer());
        assertEquals(0, sender.totalRetransmissions());
    }

    @Test
    void emptyBlobIsDelivered() throws Exception {
        ReliableDatagram sender = new ReliableDatagram(socketA, FAST);
        ReliableDatagram receiver = new ReliableDatagram(socketB, FAST);

        Future<ReliableDatagram.Delivery> rx = exec.submit(() -> receiver.receive());
        sender.send(addrB, new byte[0]);

        assertEquals(0, rx.get(10, TimeUnit.SECONDS).data().length);
    }

    @Test
    void exactlyOnceInOrderUnderLossAndDuplication() throws Exception {
        LossyDatagramLink lossyA = new LossyDatagramLink(socketA, 42, 0.15, 0.10);
        LossyDatagramLink lossyB = new LossyDatagramLink(socketB, 43, 0.15, 0.10);
        ReliableDatagram sender = new ReliableDatagram(lossyA, FAST);
        ReliableDatagram receiver = new ReliableDatagram(lossyB, FAST);

        List<byte[]> blobs = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            blobs.add(randomBytes(1_000 + i * 1_733, 100 + i));
        }

        Future<List<byte[]>> rx = exec.submit(() -> {
            List<byte[]> got = new ArrayList<>();
            for (int i = 0; i < blobs.size(); i++) {
                got.add(receiver.receive(addrA).data());
            }
            return got;
        });
        for (byte[] blob : blobs) {
            sender.send(addrB, blob);
        }

        List<byte[]> received = rx.get(30, TimeUnit.SECONDS);
        assertEquals(blobs.size(), received.size());
        for (int i = 0; i < blobs.size(); i++) {
            assertArrayEquals(blobs.get(i), received.get(i), "blob " + i);
        }
        assertTrue(lossyA.dropped > 0, "the test link should have dropped something");
        assertTrue(lossyA.duplicated > 0, "the test link should have duplicated something");
        assertTrue(sender.totalRetransmissions() > 0);
    }

    @Test
    void exactlyOnceInOrderUnderReordering() throws Exception {
        LossyDatagramLink shuffledA = new LossyDatagramLink(socketA, 11, 0.05, 0.05, 0.3);
        LossyDatagramLink shuffledB = new LossyDatagramLink(socketB, 12, 0.05, 0.05, 0.3);
        ReliableDatagram sender = new ReliableDatagram(shuffledA, FAST);
        ReliableDatagram receiver = new ReliableDatagram(shuffledB, FAST);

        List<byte[]> blobs = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            blobs.add(randomBytes(5_000 + i * 997, 200 + i));
        }

        Future<List<byte[]>> rx = exec.submit(() -> {
            List<byte[]> got = new ArrayList<>();
            for (int i = 0; i < blobs.size(); i++) {
                got.add(receiver.receive(addrA).data());
            }
            return got;
        });
        for (byte[] blob : blobs) {
            sender.send(addrB, blob);
        }

        List<byte[]> received = rx.get(30, TimeUnit.SECONDS);
        for (int i = 0; i < blobs.size(); i++) {
            assertArrayEquals(blobs.get(i), received.get(i), "blob " + i);
        }
        assertTrue(shuffledA.reordered > 0, "the test link should have reordered something");
    }

    @Test
    void alternatingExchangeUnderLoss() throws Exception {
        ReliableDatagram a = new ReliableDatagram(new LossyDatagramLink(socketA, 7, 0.2, 0.05), FAST);
        ReliableDatagram b = new ReliableDatagram(new LossyDatagramLink(socketB, 8, 0.2, 0.05), FAST);

        Future<?> echo = exec.submit(() -> {
            for (int i = 0; i < 10; i++) {
                ReliableDatagram.Delivery d = b.receive();
                b.send(d.peer(), d.data());
            }
            return null;
        });
        for (int i = 0; i < 10; i++) {
            byte[] msg = ("message-" + i).getBytes(StandardCharsets.UTF_8);
            a.send(addrB, msg);
            assertArrayEquals(msg, a.receive(addrB).data());
        }
        echo.get(30, TimeUnit.SECONDS);
    }

    @Test
    void sendFailsWhenNobodyAcknowledges() {
        ArqConfig config = new ArqConfig(200, 10, 3, 500, 3, 10);
        ReliableDatagram sender = new ReliableDatagram(socketA, config);

        // socketB exists but nothing reads from it
        long start = System.currentTimeMillis();
        assertThrows(TransportTimeoutException.class, () -> sender.send(addrB, new byte[1000]));
        assertTrue(System.currentTimeMillis() - start < 5_000);
    }

    @Test
    void receiveFailsAfterIdleTimeout() {
        ReliableDatagram receiver = new ReliableDatagram(socketB, FAST.withReceiveTimeout(200));
        assertThrows(TransportTimeoutException.class, receiver::receive);
    }

    @Test
    void expectedPeerFiltersOtherSenders() throws Exception {
        try (UdpDatagramLink socketC = UdpDatagramLink.open()) {
            ReliableDatagram intruder = new ReliableDatagram(socketC, new ArqConfig(200, 10, 5, 500, 3, 10));
            ReliableDatagram sender = new ReliableDatagram(socketA, FAST);
            ReliableDatagram receiver = new ReliableDatagram(socketB, FAST);

            Future<ReliableDatagram.Delivery> rx = exec.submit(() -> receiver.receive(addrA));
            assertThrows(TransportTimeoutException.class,
                    () -> intruder.send(addrB, "intruder".getBytes(StandardCharsets.UTF_8)));

            byte[] data = "expected".getBytes(StandardCharsets.UTF_8);
            sender.send(addrB, data);

            ReliableDatagram.Delivery delivery = rx.get(10, TimeUnit.SECONDS);
            assertArrayEquals(data, delivery.data());
            assertEquals(addrA, delivery.peer());
        }
    }

    @Test
    void malformedDatagramsAreIgnored() throws Exception {
        ReliableDatagram sender = new ReliableDatagram(socketA, FAST);
        ReliableDatagram receiver = new ReliableDatagram(socketB, FAST);

        Future<ReliableDatagram.Delivery> rx = exec.submit(() -> receiver.receive());
        socketA.send(new byte[]{1, 2}, 2, addrB);
        socketA.send(new byte[]{0, 0, 0, 0, 'Z', 9}, 6, addrB);
        byte[] data = randomBytes(3_000, 5);
        sender.send(addrB, data);

        assertArrayEquals(data, rx.get(10, TimeUnit.SECONDS).data());
    }

    @Test
    void oversizedBlobRejected() {
        ArqConfig tiny = new ArqConfig(1, 10, 3, 500, 3, 10);
        ReliableDatagram sender = new ReliableDatagram(socketA, tiny);
        byte[] tooMany = new byte[ReliableDatagram.MAX_SEGMENTS + 1];
        assertThrows(IllegalArgumentException.class, () -> sender.send(addrB, tooMany));
    }
}
