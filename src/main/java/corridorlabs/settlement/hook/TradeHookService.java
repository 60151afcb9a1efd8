package corridorlabs.settlement.hook;

import java.math.BigInteger;

import org.springframework.stereotype.Service;

import corridorlabs.settlement.dto.hook.BeforeTradeResult;
import corridorlabs.settlement.dto.hook.DeferredSettlement;
import corridorlabs.settlement.dto.hook.TradeExecution;
import corridorlabs.settlement.dto.hook.TradeRequest;
import corridorlabs.settlement.service.fee.FeePolicyService;
import corridorlabs.settlement.service.fee.FeeQuote;
import corridorlabs.settlement.service.flow.FlowAccumulatorService;
import corridorlabs.settlement.service.intent.IntentLedgerService;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Host-facing side of the engine. Deferred requests become intents and are never traded in the
 * same call; immediate requests get the corridor's current effective fee.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeHookService implements BeforeTradeHook, AfterTradeHook {

    private final IntentLedgerService ledger;
    private final FeePolicyService feePolicy;
    private final FlowAccumulatorService flowAccumulator;

    @Override
    public BeforeTradeResult onBeforeTrade(TradeRequest request) {
        if (request.isDeferredMode()) {
            DeferredSettlement deferred = request.getDeferred();
            BigInteger magnitude = request.getAmountSpecified() == null ? null : request.getAmountSpecified().abs();
            long deadline = deferred.getDeadline() == null ? 0L : deferred.getDeadline();
            long intentId = ledger.create(
                request.getOwner(),
                request.getCorridorId(),
                request.getDirection(),
                magnitude,
                request.getPriceLimit(),
                deferred.getMinOut(),
                deadline
            );
            FeeQuote zero = FeeQuote.override(0);
            return new BeforeTradeResult(true, intentId, zero.fee(), zero.override(), zero.encoded());
        }

        FeeQuote quote = feePolicy.effectiveFee(request.getCorridorId());
        log.debug("Immediate trade on corridor {} priced at {} (override={})",
            LogSanitizer.sanitize(request.getCorridorId()), quote.fee(), quote.override());
        return new BeforeTradeResult(false, null, quote.fee(), quote.override(), quote.encoded());
    }

    @Override
    public BigInteger onAfterTrade(TradeExecution execution) {
        return flowAccumulator.onTradeExecuted(execution.getCorridorId(), execution.getDirection(), execution.getAmountPaid());
    }
}
