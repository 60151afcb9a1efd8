package corridorlabs.settlement.service.corridor;

import java.util.Set;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import corridorlabs.settlement.event.CorridorRegistrationEvent;
import corridorlabs.settlement.exception.SettlementErrorCode;
import corridorlabs.settlement.exception.SettlementValidationException;
import corridorlabs.settlement.service.auth.AdminAuthorizationService;
import corridorlabs.settlement.state.SettlementStateRepository;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks which corridors may be settled through batch netting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorridorRegistryService {

    private final SettlementStateRepository state;
    private final AdminAuthorizationService adminAuthorization;
    private final ApplicationEventPublisher eventPublisher;

    public void setNettable(String caller, String corridorId, boolean nettable) {
        adminAuthorization.requireAdmin(caller, "register corridors");
        requireCorridorId(corridorId);
        state.runInLock(() -> {
            if (state.setNettable(corridorId, nettable)) {
                log.info("Corridor {} netting {}", LogSanitizer.sanitize(corridorId), nettable ? "enabled" : "disabled");
            }
            eventPublisher.publishEvent(new CorridorRegistrationEvent(this, corridorId, nettable));
        });
    }

    public boolean isNettable(String corridorId) {
        return corridorId != null && state.isNettable(corridorId);
    }

    public Set<String> listNettable() {
        return state.nettableCorridors();
    }

    public static void requireCorridorId(String corridorId) {
        if (corridorId == null || corridorId.isBlank()) {
            throw new SettlementValidationException(SettlementErrorCode.INVALID_CORRIDOR, "corridorId is required");
        }
    }
}
