package corridorlabs.settlement.hook;

import java.math.BigInteger;

import corridorlabs.settlement.dto.hook.TradeExecution;

/**
 * Called synchronously by the execution host after a trade executed.
 */
public interface AfterTradeHook {

    /**
     * @return the corridor's flow after the update
     */
    BigInteger onAfterTrade(TradeExecution execution);
}
