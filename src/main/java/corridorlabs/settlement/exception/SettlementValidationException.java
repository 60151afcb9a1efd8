package corridorlabs.settlement.exception;

import java.util.Map;

/**
 * Malformed input: batch shape, intent creation arguments or hook payloads.
 */
public class SettlementValidationException extends SettlementException {

    public SettlementValidationException(SettlementErrorCode code, String message) {
        super(code, message);
    }

    public SettlementValidationException(SettlementErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details);
    }
}
