package corridorlabs.settlement.state;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * On-disk layout of the engine state: intents by id, owner index, fee params and flow by corridor.
 */
public record StateSnapshot(
    long lastIntentId,
    List<IntentRecord.Snapshot> intents,
    Map<String, List<Long>> intentsByOwner,
    Map<String, FeeParams> feeParams,
    Map<String, BigInteger> flows,
    Set<String> nettableCorridors
) {
}
