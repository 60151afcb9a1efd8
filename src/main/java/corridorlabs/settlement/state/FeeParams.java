package corridorlabs.settlement.state;

import java.math.BigInteger;

/**
 * Per-corridor dynamic fee configuration. Fees are in venue fee units (1,000,000 = 100%).
 * A zero threshold disables the flow-driven component.
 */
public record FeeParams(int baseFee, int maxExtraFee, BigInteger netFlowThreshold) {

    public static final FeeParams NONE = new FeeParams(0, 0, BigInteger.ZERO);

    public boolean dynamicEnabled() {
        return netFlowThreshold != null && netFlowThreshold.signum() > 0;
    }
}
