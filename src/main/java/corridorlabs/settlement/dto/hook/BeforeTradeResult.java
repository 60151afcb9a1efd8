package corridorlabs.settlement.dto.hook;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer to the pre-trade callback. When {@code deferred} is true the host must not execute the
 * trade: the request now lives in the ledger as intent {@code intentId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BeforeTradeResult(
    boolean deferred,
    Long intentId,
    int fee,
    boolean feeOverride,
    int encodedFee
) {
}
