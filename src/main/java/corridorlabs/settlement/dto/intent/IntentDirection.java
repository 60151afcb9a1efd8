package corridorlabs.settlement.dto.intent;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two legs of a corridor. ZERO_FOR_ONE sells leg0 for leg1 and pushes flow positive.
 */
public enum IntentDirection {
    ZERO_FOR_ONE("leg0_to_leg1"),
    ONE_FOR_ZERO("leg1_to_leg0");

    private final String wireValue;

    IntentDirection(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isZeroForOne() {
        return this == ZERO_FOR_ONE;
    }

    public static IntentDirection of(boolean zeroForOne) {
        return zeroForOne ? ZERO_FOR_ONE : ONE_FOR_ZERO;
    }

    public static Optional<IntentDirection> fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(d -> d.wireValue.equals(normalized) || d.name().toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst();
    }

    @JsonCreator
    static IntentDirection fromJson(String value) {
        return fromWireValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown direction: " + value));
    }
}
