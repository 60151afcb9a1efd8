package corridorlabs.settlement.dto.corridor;

import java.math.BigInteger;

public record FlowResponse(String corridorId, BigInteger flow) {
}
