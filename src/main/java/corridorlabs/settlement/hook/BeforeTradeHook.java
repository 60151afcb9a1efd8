package corridorlabs.settlement.hook;

import corridorlabs.settlement.dto.hook.BeforeTradeResult;
import corridorlabs.settlement.dto.hook.TradeRequest;

/**
 * Called synchronously by the execution host before every trade on a corridor.
 */
public interface BeforeTradeHook {

    BeforeTradeResult onBeforeTrade(TradeRequest request);
}
