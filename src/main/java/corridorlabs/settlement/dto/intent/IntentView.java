package corridorlabs.settlement.dto.intent;

import java.math.BigInteger;

import com.fasterxml.jackson.annotation.JsonInclude;

import corridorlabs.settlement.state.IntentRecord;

/**
 * Read-only view of an intent with its status resolved at query time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntentView(
    long id,
    String owner,
    String corridorId,
    IntentDirection direction,
    BigInteger magnitude,
    BigInteger priceLimit,
    BigInteger minOut,
    long deadline,
    long createdAt,
    IntentStatus status,
    boolean settled,
    BigInteger settledOutput,
    Long settledAt
) {

    public static IntentView of(IntentRecord record, long now) {
        IntentRecord.Settlement settlement = record.getSettlement();
        IntentStatus status = settlement != null
            ? IntentStatus.SETTLED
            : record.isExpiredAt(now) ? IntentStatus.EXPIRED : IntentStatus.PENDING;
        return new IntentView(
            record.getId(),
            record.getOwner(),
            record.getCorridorId(),
            record.getDirection(),
            record.getMagnitude(),
            record.getPriceLimit(),
            record.getMinOut(),
            record.getDeadline(),
            record.getCreatedAt(),
            status,
            settlement != null,
            settlement == null ? null : settlement.output(),
            settlement == null ? null : settlement.settledAt()
        );
    }
}
