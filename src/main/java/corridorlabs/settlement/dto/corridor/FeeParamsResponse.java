package corridorlabs.settlement.dto.corridor;

import java.math.BigInteger;

import corridorlabs.settlement.state.FeeParams;

public record FeeParamsResponse(String corridorId, int baseFee, int maxExtraFee, BigInteger netFlowThreshold, boolean dynamic) {

    public static FeeParamsResponse of(String corridorId, FeeParams params) {
        return new FeeParamsResponse(corridorId, params.baseFee(), params.maxExtraFee(),
            params.netFlowThreshold(), params.dynamicEnabled());
    }
}
