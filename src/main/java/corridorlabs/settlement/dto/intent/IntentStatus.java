package corridorlabs.settlement.dto.intent;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived at query time; expiry is never written back to the ledger.
 */
public enum IntentStatus {
    PENDING("pending"),
    SETTLED("settled"),
    EXPIRED("expired");

    private final String wireValue;

    IntentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
