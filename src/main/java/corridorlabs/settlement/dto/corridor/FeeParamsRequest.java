package corridorlabs.settlement.dto.corridor;

import java.math.BigInteger;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeeParamsRequest {

    @NotNull
    private Integer baseFee;

    @NotNull
    private Integer maxExtraFee;

    // zero disables the dynamic component
    private BigInteger netFlowThreshold;
}
