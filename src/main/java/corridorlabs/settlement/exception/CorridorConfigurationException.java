package corridorlabs.settlement.exception;

import java.util.Map;

/**
 * Corridor-level misconfiguration: bad fee parameters, a corridor that is not registered
 * for netting, or a batch spanning more than one corridor.
 */
public class CorridorConfigurationException extends SettlementException {

    public CorridorConfigurationException(SettlementErrorCode code, String message) {
        super(code, message);
    }

    public CorridorConfigurationException(SettlementErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details);
    }

    public static CorridorConfigurationException notNettable(String corridorId) {
        return new CorridorConfigurationException(
            SettlementErrorCode.NOT_NETTABLE,
            "Corridor " + corridorId + " is not registered for netting",
            Map.of("corridorId", corridorId)
        );
    }

    public static CorridorConfigurationException mixedCorridors(String expected, String found) {
        return new CorridorConfigurationException(
            SettlementErrorCode.MIXED_CORRIDORS,
            "Batch mixes corridors " + expected + " and " + found,
            Map.of("expected", expected, "found", found)
        );
    }
}
