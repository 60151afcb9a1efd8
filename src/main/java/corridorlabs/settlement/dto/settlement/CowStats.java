package corridorlabs.settlement.dto.settlement;

import java.math.BigInteger;
import java.util.List;

import corridorlabs.settlement.dto.intent.IntentDirection;

/**
 * Result of one netting call. Not persisted.
 *
 * <p>{@code residualDirection} is ZERO_FOR_ONE whenever totalLeg0 >= totalLeg1, so a perfectly
 * balanced batch reports ZERO_FOR_ONE with a zero residual. The tie value carries no meaning.</p>
 */
public record CowStats(
    String corridorId,
    int validCount,
    BigInteger totalLeg0,
    BigInteger totalLeg1,
    BigInteger matchedAmount,
    BigInteger residualToVenue,
    IntentDirection residualDirection,
    long costSavedEstimate,
    List<Long> settledIds
) {
}
