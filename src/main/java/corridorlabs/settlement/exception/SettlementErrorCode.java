package corridorlabs.settlement.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable error identifiers surfaced to callers of the settlement engine.
 */
public enum SettlementErrorCode {
    // batch shape and request validation
    LENGTH_MISMATCH("LengthMismatch"),
    EMPTY_BATCH("EmptyBatch"),
    INVALID_DEADLINE("InvalidDeadline"),
    ZERO_AMOUNT("ZeroAmount"),
    AMOUNT_TOO_LARGE("AmountTooLarge"),
    INVALID_OWNER("InvalidOwner"),
    INVALID_AMOUNT("InvalidAmount"),
    INVALID_CORRIDOR("InvalidCorridor"),

    UNAUTHORIZED("Unauthorized"),

    // corridor configuration
    INVALID_FEE_PARAMS("InvalidFeeParams"),
    NOT_NETTABLE("NotNettable"),
    MIXED_CORRIDORS("MixedCorridors"),

    // intent state
    NOT_FOUND("NotFound"),
    ALREADY_SETTLED("AlreadySettled"),
    EXPIRED("Expired"),
    MIN_OUTPUT_NOT_MET("MinOutputNotMet"),
    NO_VALID_INTENTS("NoValidIntents");

    private final String wireValue;

    SettlementErrorCode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
