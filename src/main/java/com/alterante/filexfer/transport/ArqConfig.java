package com.alterante.filexfer.transport;

/**
 * Tuning knobs of the reliable datagram engine.
 *
 * @param segmentSize          max payload bytes per DATA packet (kept below path MTU)
 * @param ackWaitMillis        how long a sender waits for a bitmap ACK after each round
 * @param maxRetries           consecutive rounds without new acknowledgments before giving up
 * @param receiveTimeoutMillis idle period with no datagrams after which a receive fails
 * @param finCopies            FIN packets sent at the end of every round
 * @param finalAckCopies       full-bitmap ACKs sent once a blob is complete
 */
public record ArqConfig(int segmentSize,
                        int ackWaitMillis,
                        int maxRetries,
                        int receiveTimeoutMillis,
                        int finCopies,
                        int finalAckCopies) {

    public static final int DEFAULT_SEGMENT_SIZE = 1400;

    public ArqConfig {
        if (segmentSize <= 0) throw new IllegalArgumentException("segmentSize must be positive");
        if (ackWaitMillis <= 0) throw new IllegalArgumentException("ackWaitMillis must be positive");
        if (maxRetries <= 0) throw new IllegalArgumentException("maxRetries must be positive");
        if (receiveTimeoutMillis <= 0) throw new IllegalArgumentException("receiveTimeoutMillis must be positive");
        if (finCopies <= 0 || finalAckCopies <= 0) throw new IllegalArgumentException("copy counts must be positive");
    }

    public static ArqConfig defaults() {
        return new ArqConfig(DEFAULT_SEGMENT_SIZE, 50, 100, 5_000, 3, 10);
    }

    public ArqConfig withReceiveTimeout(int millis) {
        return new ArqConfig(segmentSize, ackWaitMillis, maxRetries, millis, finCopies, finalAckCopies);
    }

    public ArqConfig withMaxRetries(int retries) {
        return new ArqConfig(segmentSize, ackWaitMillis, retries, receiveTimeoutMillis, finCopies, finalAckCopies);
    }
}
