package corridorlabs.settlement.dto.hook;

import java.math.BigInteger;

import corridorlabs.settlement.dto.intent.IntentDirection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Post-trade report: the executed direction and the magnitude paid into the venue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradeExecution {

    @NotBlank
    private String corridorId;

    @NotNull
    private IntentDirection direction;

    @NotNull
    @PositiveOrZero
    private BigInteger amountPaid;
}
