package corridorlabs.settlement.controller.settlement;

import corridorlabs.settlement.dto.intent.IntentView;
import corridorlabs.settlement.dto.settlement.CowStats;
import corridorlabs.settlement.dto.settlement.SettleBatchRequest;
import corridorlabs.settlement.dto.settlement.SettleOneRequest;
import corridorlabs.settlement.service.intent.IntentLedgerService;
import corridorlabs.settlement.service.settlement.NettingEngineService;
import corridorlabs.settlement.state.IntentRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Permissionless settlement entry points. Any caller may settle, but never below an intent's minOut.
 */
@RestController
@RequestMapping("${endpoint.settlement:/settlement}")
@RequiredArgsConstructor
public class SettlementController {

    private final NettingEngineService nettingEngine;
    private final IntentLedgerService ledger;

    @PostMapping("/one")
    public ResponseEntity<IntentView> settleOne(@RequestBody @Valid SettleOneRequest request) {
        IntentRecord record = nettingEngine.settleOne(request.getIntentId(), request.getProposedOutput());
        return ResponseEntity.ok(IntentView.of(record, ledger.currentTime()));
    }

    @PostMapping("/batch")
    public ResponseEntity<CowStats> settleBatch(@RequestBody SettleBatchRequest request) {
        return ResponseEntity.ok(nettingEngine.settleBatch(request.getIntentIds(), request.getProposedOutputs()));
    }
}
