package corridorlabs.settlement.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure raised by the settlement engine.
 * A thrown SettlementException always means the whole call was rejected and no state was committed.
 */
public abstract class SettlementException extends RuntimeException {

    private final SettlementErrorCode code;
    private final Map<String, Object> details;

    protected SettlementException(SettlementErrorCode code, String message) {
        this(code, message, Map.of());
    }

    protected SettlementException(SettlementErrorCode code, String message, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public SettlementErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
