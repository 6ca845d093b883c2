package dev.blogplatform.util;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-ordered 64-bit id generator used for every primary key.
 *
 * <pre>
 * | 1 bit (unused) | 41 bits (timestamp) | 10 bits (node id) | 12 bits (sequence) |
 * </pre>
 *
 * Ids sort by creation time, so "newest first" listings can order on the key
 * as well as on {@code date_added}. Generation is lock-free (CAS on a packed
 * timestamp/sequence state).
 */
public final class SnowflakeId {

    // 2025-01-01T00:00:00Z
    private static final long CUSTOM_EPOCH = 1735689600000L;

    private static final int NODE_ID_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    private static final long MAX_NODE_ID = (1L << NODE_ID_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_ID_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_ID_BITS;

    private static final long MAX_BACKWARD_DRIFT_MS = 5;

    private final long nodeId;
    private final AtomicLong lastState = new AtomicLong(0);

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException(
                    "Node ID must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * @throws IllegalStateException if the clock moved backwards by more than a few milliseconds
     */
    public long nextId() {
        long currentTimestamp = currentTimestamp();

        while (true) {
            long oldState = lastState.get();
            long oldTimestamp = oldState >>> SEQUENCE_BITS;
            long oldSequence = oldState & MAX_SEQUENCE;

            long newTimestamp;
            long newSequence;

            if (currentTimestamp > oldTimestamp) {
                newTimestamp = currentTimestamp;
                newSequence = 0;
            } else if (currentTimestamp == oldTimestamp) {
                newSequence = (oldSequence + 1) & MAX_SEQUENCE;
                newTimestamp = newSequence == 0 ? waitNextMillis(currentTimestamp) : currentTimestamp;
            } else {
                long drift = oldTimestamp - currentTimestamp;
                if (drift > MAX_BACKWARD_DRIFT_MS) {
                    throw new IllegalStateException(
                            "Clock moved backwards by " + drift + "ms. Refusing to generate ID.");
                }
                newSequence = (oldSequence + 1) & MAX_SEQUENCE;
                newTimestamp = newSequence == 0 ? oldTimestamp + 1 : oldTimestamp;
            }

            long newState = (newTimestamp << SEQUENCE_BITS) | newSequence;
            if (lastState.compareAndSet(oldState, newState)) {
                return (newTimestamp << TIMESTAMP_SHIFT) | (nodeId << NODE_ID_SHIFT) | newSequence;
            }
            currentTimestamp = currentTimestamp();
        }
    }

    public static Instant extractInstant(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + CUSTOM_EPOCH);
    }

    public static int extractNodeId(long id) {
        return (int) ((id >>> NODE_ID_SHIFT) & MAX_NODE_ID);
    }

    public long getNodeId() {
        return nodeId;
    }

    private long currentTimestamp() {
        return System.currentTimeMillis() - CUSTOM_EPOCH;
    }

    private long waitNextMillis(long currentTimestamp) {
        long newTimestamp = currentTimestamp();
        while (newTimestamp <= currentTimestamp) {
            Thread.onSpinWait();
            newTimestamp = currentTimestamp();
        }
        return newTimestamp;
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
