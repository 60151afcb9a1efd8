package corridorlabs.settlement.dto.intent;

import java.util.List;

public record OwnerIntentsResponse(String owner, List<Long> intentIds) {
}
