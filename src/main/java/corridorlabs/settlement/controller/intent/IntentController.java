package corridorlabs.settlement.controller.intent;

import java.util.List;

import corridorlabs.settlement.dto.intent.IntentView;
import corridorlabs.settlement.dto.intent.OwnerIntentsResponse;
import corridorlabs.settlement.service.intent.IntentLedgerService;
import corridorlabs.settlement.util.AddressValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("${endpoint.intents:/intents}")
@RequiredArgsConstructor
public class IntentController {

    static final int DEFAULT_MAX_RESULTS = 100;
    static final int MAX_RESULTS_CAP = 1_000;

    private final IntentLedgerService ledger;

    @GetMapping("/{intentId}")
    public ResponseEntity<IntentView> getIntent(@PathVariable long intentId) {
        return ResponseEntity.ok(IntentView.of(ledger.getRequired(intentId), ledger.currentTime()));
    }

    @GetMapping
    public ResponseEntity<OwnerIntentsResponse> listByOwner(
        @RequestParam String owner,
        @RequestParam(name = "max", defaultValue = "" + DEFAULT_MAX_RESULTS) int maxResults
    ) {
        int bounded = Math.min(Math.max(maxResults, 0), MAX_RESULTS_CAP);
        List<Long> ids = ledger.intentsOf(owner, bounded);
        return ResponseEntity.ok(new OwnerIntentsResponse(AddressValidator.normalize(owner), ids));
    }
}
