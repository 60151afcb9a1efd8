package corridorlabs.settlement.controller.corridor;

import java.util.Set;

import corridorlabs.settlement.dto.corridor.FeeParamsResponse;
import corridorlabs.settlement.dto.corridor.FeeQuoteResponse;
import corridorlabs.settlement.dto.corridor.FlowResponse;
import corridorlabs.settlement.service.corridor.CorridorRegistryService;
import corridorlabs.settlement.service.fee.FeePolicyService;
import corridorlabs.settlement.service.flow.FlowAccumulatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("${endpoint.corridors:/corridors}")
@RequiredArgsConstructor
public class CorridorQueryController {

    private final CorridorRegistryService corridorRegistry;
    private final FeePolicyService feePolicy;
    private final FlowAccumulatorService flowAccumulator;

    @GetMapping("/nettable")
    public ResponseEntity<Set<String>> listNettable() {
        return ResponseEntity.ok(corridorRegistry.listNettable());
    }

    @GetMapping("/{corridorId}/fee")
    public ResponseEntity<FeeQuoteResponse> currentFee(@PathVariable String corridorId) {
        return ResponseEntity.ok(FeeQuoteResponse.of(corridorId, feePolicy.effectiveFee(corridorId),
            flowAccumulator.currentFlow(corridorId)));
    }

    @GetMapping("/{corridorId}/fee-params")
    public ResponseEntity<FeeParamsResponse> feeParams(@PathVariable String corridorId) {
        return ResponseEntity.ok(FeeParamsResponse.of(corridorId, feePolicy.getParams(corridorId)));
    }

    @GetMapping("/{corridorId}/flow")
    public ResponseEntity<FlowResponse> flow(@PathVariable String corridorId) {
        return ResponseEntity.ok(new FlowResponse(corridorId, flowAccumulator.currentFlow(corridorId)));
    }
}
