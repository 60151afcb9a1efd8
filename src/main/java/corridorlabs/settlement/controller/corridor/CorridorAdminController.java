package corridorlabs.settlement.controller.corridor;

import java.security.Principal;

import corridorlabs.settlement.dto.corridor.CorridorRegistrationRequest;
import corridorlabs.settlement.dto.corridor.CorridorRegistrationResponse;
import corridorlabs.settlement.dto.corridor.FeeParamsRequest;
import corridorlabs.settlement.dto.corridor.FeeParamsResponse;
import corridorlabs.settlement.dto.corridor.FlowResponse;
import corridorlabs.settlement.service.corridor.CorridorRegistryService;
import corridorlabs.settlement.service.fee.FeePolicyService;
import corridorlabs.settlement.service.flow.FlowAccumulatorService;
import corridorlabs.settlement.state.FeeParams;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrator operations on corridors. The authenticated principal is the caller address the
 * engine checks against its administrator list.
 */
@RestController
@RequestMapping("${endpoint.admin:/admin}/corridors")
@RequiredArgsConstructor
public class CorridorAdminController {

    private final CorridorRegistryService corridorRegistry;
    private final FeePolicyService feePolicy;
    private final FlowAccumulatorService flowAccumulator;

    @PutMapping("/{corridorId}/registration")
    public ResponseEntity<CorridorRegistrationResponse> register(
        @PathVariable String corridorId,
        @RequestBody(required = false) CorridorRegistrationRequest request,
        Principal principal
    ) {
        boolean nettable = request == null || request.isNettable();
        corridorRegistry.setNettable(callerOf(principal), corridorId, nettable);
        return ResponseEntity.ok(new CorridorRegistrationResponse(corridorId, nettable));
    }

    @PutMapping("/{corridorId}/fee-params")
    public ResponseEntity<FeeParamsResponse> setFeeParams(
        @PathVariable String corridorId,
        @RequestBody @Valid FeeParamsRequest request,
        Principal principal
    ) {
        FeeParams params = feePolicy.setParams(callerOf(principal), corridorId,
            request.getBaseFee(), request.getMaxExtraFee(), request.getNetFlowThreshold());
        return ResponseEntity.ok(FeeParamsResponse.of(corridorId, params));
    }

    @PostMapping("/{corridorId}/flow/reset")
    public ResponseEntity<FlowResponse> resetFlow(@PathVariable String corridorId, Principal principal) {
        flowAccumulator.reset(callerOf(principal), corridorId);
        return ResponseEntity.ok(new FlowResponse(corridorId, flowAccumulator.currentFlow(corridorId)));
    }

    private static String callerOf(Principal principal) {
        return principal == null ? null : principal.getName();
    }
}
