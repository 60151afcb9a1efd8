package corridorlabs.settlement.exception;

import java.util.Map;

/**
 * Thrown when a non-administrator invokes an administrator-only operation.
 */
public class UnauthorizedOperationException extends SettlementException {

    private final String operation;

    public UnauthorizedOperationException(String operation) {
        super(SettlementErrorCode.UNAUTHORIZED, "Caller is not allowed to " + operation, Map.of("operation", operation));
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
