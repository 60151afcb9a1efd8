package corridorlabs.settlement.service.intent;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import corridorlabs.settlement.dto.intent.IntentDirection;
import corridorlabs.settlement.event.IntentCreatedEvent;
import corridorlabs.settlement.exception.IntentStateException;
import corridorlabs.settlement.exception.SettlementErrorCode;
import corridorlabs.settlement.exception.SettlementValidationException;
import corridorlabs.settlement.service.corridor.CorridorRegistryService;
import corridorlabs.settlement.state.IntentRecord;
import corridorlabs.settlement.state.SettlementStateRepository;
import corridorlabs.settlement.util.AddressValidator;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Intent ledger: validated creation with monotonic ids starting at 1, lookup by id and a
 * per-owner index kept in creation order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentLedgerService {

    /** Magnitudes must fit an unsigned 128-bit integer. */
    public static final BigInteger MAX_MAGNITUDE = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private final SettlementStateRepository state;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public long create(
        String owner,
        String corridorId,
        IntentDirection direction,
        BigInteger magnitude,
        BigInteger priceLimit,
        BigInteger minOut,
        long deadline
    ) {
        String normalizedOwner = requireOwner(owner);
        CorridorRegistryService.requireCorridorId(corridorId);
        if (direction == null) {
            throw new IllegalArgumentException("direction is required");
        }
        if (priceLimit != null && priceLimit.signum() < 0) {
            throw new SettlementValidationException(SettlementErrorCode.INVALID_AMOUNT, "priceLimit cannot be negative");
        }

        return state.inLock(() -> {
            long now = clock.instant().getEpochSecond();
            if (deadline <= now) {
                throw new SettlementValidationException(SettlementErrorCode.INVALID_DEADLINE,
                    "Deadline must be in the future", Map.of("deadline", deadline, "now", now));
            }
            requirePositive(magnitude, "magnitude");
            requirePositive(minOut, "minOut");
            if (magnitude.compareTo(MAX_MAGNITUDE) > 0) {
                throw new SettlementValidationException(SettlementErrorCode.AMOUNT_TOO_LARGE,
                    "magnitude exceeds 128-bit bound", Map.of("magnitude", magnitude));
            }

            long id = state.nextIntentId();
            IntentRecord record = new IntentRecord(id, normalizedOwner, corridorId, direction,
                magnitude, priceLimit, minOut, deadline, now);
            state.insertIntent(record);
            eventPublisher.publishEvent(new IntentCreatedEvent(this, id, normalizedOwner, corridorId,
                direction, magnitude, minOut, deadline));
            log.info("Intent {} created: owner={} corridor={} direction={} magnitude={} minOut={} deadline={}",
                id, LogSanitizer.maskAddress(normalizedOwner), LogSanitizer.sanitize(corridorId),
                direction.getWireValue(), magnitude, minOut, deadline);
            return id;
        });
    }

    /**
     * Empty when no intent was ever created under {@code id}; id 0 never exists.
     */
    public Optional<IntentRecord> findById(long id) {
        if (id <= 0) {
            return Optional.empty();
        }
        return state.findIntent(id);
    }

    public IntentRecord getRequired(long id) {
        return findById(id).orElseThrow(() -> IntentStateException.notFound(id));
    }

    /**
     * Ids created for {@code owner}, oldest first, at most {@code maxResults} of them.
     */
    public List<Long> intentsOf(String owner, int maxResults) {
        return state.intentIdsOf(requireOwner(owner), maxResults);
    }

    public long currentTime() {
        return clock.instant().getEpochSecond();
    }

    private static String requireOwner(String owner) {
        if (!AddressValidator.isValidAddress(owner) || AddressValidator.isZeroAddress(owner)) {
            throw new SettlementValidationException(SettlementErrorCode.INVALID_OWNER,
                "Owner must be a non-zero address", Map.of("owner", LogSanitizer.sanitize(owner)));
        }
        return AddressValidator.normalize(owner);
    }

    private static void requirePositive(BigInteger amount, String field) {
        if (amount == null || amount.signum() == 0) {
            throw new SettlementValidationException(SettlementErrorCode.ZERO_AMOUNT, field + " must be greater than zero");
        }
        if (amount.signum() < 0) {
            throw new SettlementValidationException(SettlementErrorCode.INVALID_AMOUNT, field + " cannot be negative");
        }
    }
}
