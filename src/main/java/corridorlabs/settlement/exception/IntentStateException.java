package corridorlabs.settlement.exception;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The targeted intent cannot be settled in its current state.
 */
public class IntentStateException extends SettlementException {

    public IntentStateException(SettlementErrorCode code, String message) {
        super(code, message);
    }

    public IntentStateException(SettlementErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details);
    }

    public static IntentStateException notFound(long id) {
        return new IntentStateException(SettlementErrorCode.NOT_FOUND, "Intent " + id + " not found", Map.of("id", id));
    }

    public static IntentStateException alreadySettled(long id) {
        return new IntentStateException(SettlementErrorCode.ALREADY_SETTLED, "Intent " + id + " is already settled", Map.of("id", id));
    }

    public static IntentStateException expired(long id, long deadline) {
        return new IntentStateException(
            SettlementErrorCode.EXPIRED,
            "Intent " + id + " expired at " + deadline,
            Map.of("id", id, "deadline", deadline)
        );
    }

    public static IntentStateException minOutputNotMet(BigInteger minOut, BigInteger proposedOutput) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("minOut", minOut);
        details.put("proposedOutput", proposedOutput);
        return new IntentStateException(
            SettlementErrorCode.MIN_OUTPUT_NOT_MET,
            "Proposed output " + proposedOutput + " is below minimum " + minOut,
            details
        );
    }

    public static IntentStateException noValidIntents() {
        return new IntentStateException(SettlementErrorCode.NO_VALID_INTENTS, "Batch contains no settleable intents");
    }
}
