package corridorlabs.settlement.dto.settlement;

import java.math.BigInteger;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SettleOneRequest {

    @NotNull
    private Long intentId;

    @NotNull
    private BigInteger proposedOutput;
}
