package corridorlabs.settlement.state;

import java.math.BigInteger;

import corridorlabs.settlement.dto.intent.IntentDirection;
import corridorlabs.settlement.dto.intent.IntentStatus;

/**
 * A recorded trade intent. Everything except the settlement fields is fixed at creation;
 * {@code settled} flips to true at most once.
 */
public class IntentRecord {
    private final long id;
    private final String owner;
    private final String corridorId;
    private final IntentDirection direction;
    private final BigInteger magnitude;
    private final BigInteger priceLimit;
    private final BigInteger minOut;
    private final long deadline;
    private final long createdAt;
    private volatile Settlement settlement;

    public IntentRecord(
        long id,
        String owner,
        String corridorId,
        IntentDirection direction,
        BigInteger magnitude,
        BigInteger priceLimit,
        BigInteger minOut,
        long deadline,
        long createdAt
    ) {
        this.id = id;
        this.owner = owner;
        this.corridorId = corridorId;
        this.direction = direction;
        this.magnitude = magnitude;
        this.priceLimit = priceLimit;
        this.minOut = minOut;
        this.deadline = deadline;
        this.createdAt = createdAt;
    }

    public long getId() {
        return id;
    }

    public String getOwner() {
        return owner;
    }

    public String getCorridorId() {
        return corridorId;
    }

    public IntentDirection getDirection() {
        return direction;
    }

    public BigInteger getMagnitude() {
        return magnitude;
    }

    public BigInteger getPriceLimit() {
        return priceLimit;
    }

    public BigInteger getMinOut() {
        return minOut;
    }

    public long getDeadline() {
        return deadline;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public boolean isSettled() {
        return settlement != null;
    }

    /**
     * @return the settlement outcome, or null while unsettled; read once for a consistent view
     */
    public Settlement getSettlement() {
        return settlement;
    }

    public BigInteger getSettledOutput() {
        Settlement current = settlement;
        return current == null ? null : current.output();
    }

    public Long getSettledAt() {
        Settlement current = settlement;
        return current == null ? null : current.settledAt();
    }

    public boolean isExpiredAt(long now) {
        return now > deadline;
    }

    public IntentStatus statusAt(long now) {
        if (settlement != null) {
            return IntentStatus.SETTLED;
        }
        return isExpiredAt(now) ? IntentStatus.EXPIRED : IntentStatus.PENDING;
    }

    void markSettled(BigInteger output, long now) {
        if (settlement != null) {
            throw new IllegalStateException("Intent " + id + " is already settled");
        }
        this.settlement = new Settlement(output, now);
    }

    Snapshot toSnapshot() {
        Settlement current = settlement;
        return new Snapshot(id, owner, corridorId, direction, magnitude, priceLimit, minOut,
            deadline, createdAt, current != null,
            current == null ? null : current.output(),
            current == null ? null : current.settledAt());
    }

    static IntentRecord fromSnapshot(Snapshot snapshot) {
        IntentRecord record = new IntentRecord(
            snapshot.id(),
            snapshot.owner(),
            snapshot.corridorId(),
            snapshot.direction(),
            snapshot.magnitude(),
            snapshot.priceLimit(),
            snapshot.minOut(),
            snapshot.deadline(),
            snapshot.createdAt()
        );
        if (snapshot.settled()) {
            long settledAt = snapshot.settledAt() == null ? snapshot.createdAt() : snapshot.settledAt();
            record.settlement = new Settlement(snapshot.settledOutput(), settledAt);
        }
        return record;
    }

    public record Settlement(BigInteger output, long settledAt) {
    }

    /** Serialized form used by state snapshots. */
    public record Snapshot(
        long id,
        String owner,
        String corridorId,
        IntentDirection direction,
        BigInteger magnitude,
        BigInteger priceLimit,
        BigInteger minOut,
        long deadline,
        long createdAt,
        boolean settled,
        BigInteger settledOutput,
        Long settledAt
    ) {
    }
}
