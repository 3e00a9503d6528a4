package dev.pagecraft.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-ordered 64-bit id generator used for pages and components.
 *
 * <pre>
 * | 1 bit (unused) | 41 bits (timestamp) | 10 bits (node id) | 12 bits (sequence) |
 * </pre>
 *
 * <p>Ids are never reused within a node: once the sequence of a millisecond is
 * used up the generator spins until the clock reaches the next one, and a
 * clock that moves backwards more than a few milliseconds is rejected.</p>
 */
public final class SnowflakeId {

    // 2025-01-01T00:00:00Z
    private static final long CUSTOM_EPOCH = 1735689600000L;

    private static final int NODE_ID_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    public static final long MAX_NODE_ID = (1L << NODE_ID_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_ID_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_ID_BITS;

    private static final long MAX_BACKWARD_DRIFT_MS = 5;

    private final long nodeId;
    // (timestamp << SEQUENCE_BITS) | sequence of the last issued id
    private final AtomicLong lastState = new AtomicLong(0);

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException(
                    "Node ID must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * Issues the next id. Lock-free; safe to call from any thread.
     *
     * @throws IllegalStateException if the clock moved backwards beyond the tolerated drift
     */
    public long nextId() {
        long now = currentTimestamp();
        while (true) {
            long oldState = lastState.get();
            long lastTimestamp = oldState >>> SEQUENCE_BITS;
            long lastSequence = oldState & MAX_SEQUENCE;

            long timestamp;
            long sequence;
            if (now > lastTimestamp) {
                timestamp = now;
                sequence = 0;
            } else if (now == lastTimestamp) {
                sequence = (lastSequence + 1) & MAX_SEQUENCE;
                if (sequence == 0) {
                    // sequence exhausted for this millisecond
                    now = waitNextMillis(lastTimestamp);
                }
                timestamp = now;
            } else {
                long drift = lastTimestamp - now;
                if (drift > MAX_BACKWARD_DRIFT_MS) {
                    throw new IllegalStateException(
                            "Clock moved backwards by " + drift + "ms. Refusing to generate ID.");
                }
                timestamp = lastTimestamp;
                sequence = (lastSequence + 1) & MAX_SEQUENCE;
                if (sequence == 0) {
                    timestamp = lastTimestamp + 1;
                }
            }

            long newState = (timestamp << SEQUENCE_BITS) | sequence;
            if (lastState.compareAndSet(oldState, newState)) {
                return (timestamp << TIMESTAMP_SHIFT) | (nodeId << NODE_ID_SHIFT) | sequence;
            }
            now = currentTimestamp();
        }
    }

    public long getNodeId() {
        return nodeId;
    }

    public static Instant extractInstant(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + CUSTOM_EPOCH);
    }

    public static int extractNodeId(long id) {
        return (int) ((id >>> NODE_ID_SHIFT) & MAX_NODE_ID);
    }

    public static int extractSequence(long id) {
        return (int) (id & MAX_SEQUENCE);
    }

    private static long waitNextMillis(long lastTimestamp) {
        long timestamp = currentTimestamp();
        while (timestamp <= lastTimestamp) {
            Thread.onSpinWait();
            timestamp = currentTimestamp();
        }
        return timestamp;
    }

    private static long currentTimestamp() {
        return System.currentTimeMillis() - CUSTOM_EPOCH;
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
