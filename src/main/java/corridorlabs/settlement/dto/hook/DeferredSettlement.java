package corridorlabs.settlement.dto.hook;

import java.math.BigInteger;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Opt-in to deferred mode: record an intent instead of trading now.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeferredSettlement {

    @NotNull
    private BigInteger minOut;

    @NotNull
    private Long deadline;      // epoch seconds
}
