package corridorlabs.settlement.service.auth;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import corridorlabs.settlement.config.SettlementProperties;
import corridorlabs.settlement.exception.UnauthorizedOperationException;
import corridorlabs.settlement.util.AddressValidator;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Administrator identity check shared by every admin-only operation.
 */
@Service
@Slf4j
public class AdminAuthorizationService {

    private final Set<String> administrators;

    public AdminAuthorizationService(SettlementProperties properties) {
        this.administrators = properties.getAdmin().getAddresses().stream()
            .filter(AddressValidator::isValidAddress)
            .map(a -> a.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        if (administrators.size() != properties.getAdmin().getAddresses().size()) {
            log.warn("Ignored {} malformed administrator address(es)",
                properties.getAdmin().getAddresses().size() - administrators.size());
        }
        if (administrators.isEmpty()) {
            log.warn("No administrator configured; admin operations will be rejected");
        }
    }

    public boolean isAdmin(String caller) {
        return caller != null && administrators.contains(caller.toLowerCase(Locale.ROOT));
    }

    public void requireAdmin(String caller, String operation) {
        if (!isAdmin(caller)) {
            log.warn("Rejected {} from non-admin caller {}", operation, LogSanitizer.maskAddress(caller));
            throw new UnauthorizedOperationException(operation);
        }
    }
}
