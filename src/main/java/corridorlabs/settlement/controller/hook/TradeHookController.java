package corridorlabs.settlement.controller.hook;

import java.math.BigInteger;

import corridorlabs.settlement.dto.corridor.FlowResponse;
import corridorlabs.settlement.dto.hook.BeforeTradeResult;
import corridorlabs.settlement.dto.hook.TradeExecution;
import corridorlabs.settlement.dto.hook.TradeRequest;
import corridorlabs.settlement.hook.AfterTradeHook;
import corridorlabs.settlement.hook.BeforeTradeHook;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Callbacks invoked by the execution host around each trade. Secured with the host token.
 */
@RestController
@RequestMapping("${endpoint.hooks:/hooks}")
@RequiredArgsConstructor
@Slf4j
public class TradeHookController {

    private final BeforeTradeHook beforeTradeHook;
    private final AfterTradeHook afterTradeHook;

    @PostMapping("/before-trade")
    public ResponseEntity<BeforeTradeResult> beforeTrade(@RequestBody @Valid TradeRequest request) {
        BeforeTradeResult result = beforeTradeHook.onBeforeTrade(request);
        if (result.deferred()) {
            log.info("Trade deferred as intent {}", result.intentId());
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/after-trade")
    public ResponseEntity<FlowResponse> afterTrade(@RequestBody @Valid TradeExecution execution) {
        BigInteger flow = afterTradeHook.onAfterTrade(execution);
        return ResponseEntity.ok(new FlowResponse(execution.getCorridorId(), flow));
    }
}
