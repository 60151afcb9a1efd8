package corridorlabs.settlement.dto.corridor;

public record CorridorRegistrationResponse(String corridorId, boolean nettable) {
}
