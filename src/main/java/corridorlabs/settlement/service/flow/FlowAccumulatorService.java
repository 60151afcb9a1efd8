package corridorlabs.settlement.service.flow;

import java.math.BigInteger;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import corridorlabs.settlement.dto.intent.IntentDirection;
import corridorlabs.settlement.event.FlowResetEvent;
import corridorlabs.settlement.event.FlowUpdatedEvent;
import corridorlabs.settlement.exception.SettlementErrorCode;
import corridorlabs.settlement.exception.SettlementValidationException;
import corridorlabs.settlement.service.auth.AdminAuthorizationService;
import corridorlabs.settlement.service.corridor.CorridorRegistryService;
import corridorlabs.settlement.state.SettlementStateRepository;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Signed running sum of executed trade volume per corridor. leg0-to-leg1 adds, leg1-to-leg0 subtracts.
 * No decay; only an administrator reset brings it back to zero.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowAccumulatorService {

    private final SettlementStateRepository state;
    private final AdminAuthorizationService adminAuthorization;
    private final ApplicationEventPublisher eventPublisher;

    public BigInteger onTradeExecuted(String corridorId, IntentDirection direction, BigInteger magnitudePaid) {
        CorridorRegistryService.requireCorridorId(corridorId);
        if (direction == null) {
            throw new IllegalArgumentException("direction is required");
        }
        if (magnitudePaid == null || magnitudePaid.signum() < 0) {
            throw new SettlementValidationException(SettlementErrorCode.INVALID_AMOUNT,
                "magnitudePaid must be a non-negative amount");
        }
        return state.inLock(() -> {
            BigInteger previous = state.flowOf(corridorId);
            BigInteger current = direction.isZeroForOne() ? previous.add(magnitudePaid) : previous.subtract(magnitudePaid);
            if (!current.equals(previous)) {
                state.putFlow(corridorId, current);
                eventPublisher.publishEvent(new FlowUpdatedEvent(this, corridorId, previous, current));
                log.debug("Flow for corridor {} moved {} -> {}", LogSanitizer.sanitize(corridorId), previous, current);
            }
            return current;
        });
    }

    public void reset(String caller, String corridorId) {
        adminAuthorization.requireAdmin(caller, "reset flow");
        CorridorRegistryService.requireCorridorId(corridorId);
        state.runInLock(() -> {
            BigInteger previous = state.flowOf(corridorId);
            state.putFlow(corridorId, BigInteger.ZERO);
            eventPublisher.publishEvent(new FlowResetEvent(this, corridorId, previous, caller));
            log.info("Flow for corridor {} reset from {} by {}",
                LogSanitizer.sanitize(corridorId), previous, LogSanitizer.maskAddress(caller));
        });
    }

    public BigInteger currentFlow(String corridorId) {
        return state.flowOf(corridorId);
    }
}
