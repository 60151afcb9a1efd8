package corridorlabs.settlement.dto.hook;

import java.math.BigInteger;

import com.fasterxml.jackson.annotation.JsonIgnore;

import corridorlabs.settlement.dto.intent.IntentDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trade request forwarded by the execution host before it trades.
 * {@code owner} is the requester declared by the host's caller, never the host itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {

    @NotBlank
    private String owner;

    @NotBlank
    private String corridorId;

    @NotNull
    private IntentDirection direction;

    @NotNull
    private BigInteger amountSpecified;

    private BigInteger priceLimit;

    @Valid
    private DeferredSettlement deferred;

    @JsonIgnore
    public boolean isDeferredMode() {
        return deferred != null;
    }
}
