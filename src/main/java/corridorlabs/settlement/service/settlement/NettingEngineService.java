package corridorlabs.settlement.service.settlement;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import corridorlabs.settlement.config.SettlementProperties;
import corridorlabs.settlement.dto.intent.IntentDirection;
import corridorlabs.settlement.dto.settlement.CowStats;
import corridorlabs.settlement.event.BatchSettledEvent;
import corridorlabs.settlement.event.IntentSettledEvent;
import corridorlabs.settlement.exception.CorridorConfigurationException;
import corridorlabs.settlement.exception.IntentStateException;
import corridorlabs.settlement.exception.SettlementErrorCode;
import corridorlabs.settlement.exception.SettlementValidationException;
import corridorlabs.settlement.service.corridor.CorridorRegistryService;
import corridorlabs.settlement.service.intent.IntentLedgerService;
import corridorlabs.settlement.state.IntentRecord;
import corridorlabs.settlement.state.SettlementStateRepository;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Coincidence-of-Wants settlement.
 *
 * <p>The two entry points fail differently on purpose. {@link #settleOne} aborts on any intent
 * state problem. {@link #settleBatch} skips entries that are missing, settled, expired or below
 * their minimum output, and only aborts for structural problems: batch shape, corridor mixing,
 * a corridor not registered for netting, or nothing left to settle.</p>
 *
 * <p>Matched volume never reaches the venue; the caller routes {@code residualToVenue} in
 * {@code residualDirection} and pays owners from the per-intent settlement events.</p>
 */
@Service
@Slf4j
public class NettingEngineService {

    private final IntentLedgerService ledger;
    private final CorridorRegistryService corridorRegistry;
    private final SettlementStateRepository state;
    private final ApplicationEventPublisher eventPublisher;
    private final long perIntentCost;

    public NettingEngineService(
        IntentLedgerService ledger,
        CorridorRegistryService corridorRegistry,
        SettlementStateRepository state,
        ApplicationEventPublisher eventPublisher,
        SettlementProperties properties
    ) {
        this.ledger = ledger;
        this.corridorRegistry = corridorRegistry;
        this.state = state;
        this.eventPublisher = eventPublisher;
        this.perIntentCost = properties.getNetting().getPerIntentCost();
    }

    public IntentRecord settleOne(long id, BigInteger proposedOutput) {
        return state.inLock(() -> {
            IntentRecord record = ledger.findById(id).orElseThrow(() -> IntentStateException.notFound(id));
            if (record.isSettled()) {
                throw IntentStateException.alreadySettled(id);
            }
            long now = ledger.currentTime();
            if (record.isExpiredAt(now)) {
                throw IntentStateException.expired(id, record.getDeadline());
            }
            if (proposedOutput == null || proposedOutput.compareTo(record.getMinOut()) < 0) {
                throw IntentStateException.minOutputNotMet(record.getMinOut(), proposedOutput);
            }
            commit(record, proposedOutput, now);
            log.info("Intent {} settled individually with output {}", id, proposedOutput);
            return record;
        });
    }

    public CowStats settleBatch(List<Long> ids, List<BigInteger> proposedOutputs) {
        int idCount = ids == null ? 0 : ids.size();
        int outputCount = proposedOutputs == null ? 0 : proposedOutputs.size();
        if (idCount != outputCount) {
            throw new SettlementValidationException(SettlementErrorCode.LENGTH_MISMATCH,
                "ids and proposedOutputs differ in length", Map.of("ids", idCount, "proposedOutputs", outputCount));
        }
        if (idCount == 0) {
            throw new SettlementValidationException(SettlementErrorCode.EMPTY_BATCH, "Batch is empty");
        }

        return state.inLock(() -> {
            long now = ledger.currentTime();
            List<BatchEntry> included = new ArrayList<>();
            Set<Long> claimed = new HashSet<>();
            String corridorId = null;
            BigInteger totalLeg0 = BigInteger.ZERO;
            BigInteger totalLeg1 = BigInteger.ZERO;

            // Inclusion is decided once; the commit loop below only walks this list.
            for (int i = 0; i < idCount; i++) {
                Long id = ids.get(i);
                BigInteger output = proposedOutputs.get(i);
                IntentRecord record = id == null ? null : ledger.findById(id).orElse(null);
                String exclusion = exclusionReason(record, output, now, claimed);
                if (exclusion != null) {
                    log.debug("Batch entry {} (intent {}) excluded: {}", i, id, exclusion);
                    continue;
                }
                if (corridorId == null) {
                    corridorId = record.getCorridorId();
                    if (!corridorRegistry.isNettable(corridorId)) {
                        throw CorridorConfigurationException.notNettable(corridorId);
                    }
                } else if (!corridorId.equals(record.getCorridorId())) {
                    throw CorridorConfigurationException.mixedCorridors(corridorId, record.getCorridorId());
                }
                claimed.add(record.getId());
                included.add(new BatchEntry(record, output));
                if (record.getDirection().isZeroForOne()) {
                    totalLeg0 = totalLeg0.add(record.getMagnitude());
                } else {
                    totalLeg1 = totalLeg1.add(record.getMagnitude());
                }
            }

            if (included.isEmpty()) {
                throw IntentStateException.noValidIntents();
            }

            BigInteger matchedAmount = totalLeg0.min(totalLeg1);
            BigInteger residualToVenue = totalLeg0.subtract(totalLeg1).abs();
            IntentDirection residualDirection = IntentDirection.of(totalLeg0.compareTo(totalLeg1) >= 0);

            List<Long> settledIds = new ArrayList<>(included.size());
            for (BatchEntry entry : included) {
                commit(entry.record(), entry.output(), now);
                settledIds.add(entry.record().getId());
            }

            int validCount = included.size();
            CowStats stats = new CowStats(
                corridorId,
                validCount,
                totalLeg0,
                totalLeg1,
                matchedAmount,
                residualToVenue,
                residualDirection,
                validCount * perIntentCost,
                List.copyOf(settledIds)
            );
            if (validCount > 1 && matchedAmount.signum() > 0) {
                eventPublisher.publishEvent(new BatchSettledEvent(this, corridorId, stats));
            }
            log.info("Batch netted on corridor {}: {}/{} intents, matched={} residual={} ({})",
                LogSanitizer.sanitize(corridorId), validCount, idCount, matchedAmount, residualToVenue,
                residualDirection.getWireValue());
            return stats;
        });
    }

    /**
     * @return null when the entry is settleable, otherwise a short reason used for debug logging
     */
    private static String exclusionReason(IntentRecord record, BigInteger output, long now, Set<Long> claimed) {
        if (record == null) {
            return "not found";
        }
        // a repeated id counts as settled by its first occurrence
        if (record.isSettled() || claimed.contains(record.getId())) {
            return "already settled";
        }
        if (record.isExpiredAt(now)) {
            return "expired";
        }
        if (output == null || output.compareTo(record.getMinOut()) < 0) {
            return "below minOut";
        }
        return null;
    }

    private void commit(IntentRecord record, BigInteger output, long now) {
        state.markSettled(record, output, now);
        eventPublisher.publishEvent(new IntentSettledEvent(this, record.getId(), record.getOwner(),
            record.getCorridorId(), record.getMagnitude(), output));
    }

    private record BatchEntry(IntentRecord record, BigInteger output) {
    }
}
