package corridorlabs.settlement.dto.corridor;

import java.math.BigInteger;

import corridorlabs.settlement.service.fee.FeeQuote;

/**
 * Current effective fee of a corridor, together with the flow it was computed from.
 */
public record FeeQuoteResponse(String corridorId, int fee, boolean override, int encodedFee, BigInteger flow) {

    public static FeeQuoteResponse of(String corridorId, FeeQuote quote, BigInteger flow) {
        return new FeeQuoteResponse(corridorId, quote.fee(), quote.override(), quote.encoded(), flow);
    }
}
