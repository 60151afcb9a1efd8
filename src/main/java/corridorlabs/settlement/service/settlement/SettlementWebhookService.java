package corridorlabs.settlement.service.settlement;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import corridorlabs.settlement.dto.settlement.CowStats;
import corridorlabs.settlement.event.BatchSettledEvent;
import corridorlabs.settlement.event.IntentSettledEvent;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Forwards settlement signals to the external settler that moves funds.
 * Events are queued while the engine holds its state lock and delivered on a fixed delay.
 */
@Service
@Slf4j
public class SettlementWebhookService {

    static final int MAX_ATTEMPTS = 3;

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient client = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();
    private final Queue<Delivery> pending = new ConcurrentLinkedQueue<>();
    private final String webhookUrl;
    private final String webhookSecret;

    public SettlementWebhookService(
        @Value("${settlement.webhook.url:}") String webhookUrl,
        @Value("${settlement.webhook.secret:}") String webhookSecret
    ) {
        this.webhookUrl = webhookUrl;
        this.webhookSecret = webhookSecret;
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @EventListener
    public void onIntentSettled(IntentSettledEvent event) {
        if (isEnabled()) {
            pending.add(new Delivery(WebhookPayload.from(event), 0));
        }
    }

    @EventListener
    public void onBatchSettled(BatchSettledEvent event) {
        if (isEnabled()) {
            pending.add(new Delivery(WebhookPayload.from(event), 0));
        }
    }

    @Scheduled(fixedDelayString = "${settlement.webhook.flush-interval-ms:2000}")
    public void flush() {
        int batch = pending.size();
        for (int i = 0; i < batch; i++) {
            Delivery delivery = pending.poll();
            if (delivery == null) {
                return;
            }
            if (!send(delivery.payload())) {
                int attempts = delivery.attempts() + 1;
                if (attempts < MAX_ATTEMPTS) {
                    pending.add(new Delivery(delivery.payload(), attempts));
                } else {
                    log.warn("Dropping {} webhook after {} attempts (intent={}, corridor={})",
                        delivery.payload().type(), attempts, delivery.payload().intentId(),
                        LogSanitizer.sanitize(delivery.payload().corridorId()));
                }
            }
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    boolean send(WebhookPayload payload) {
        try {
            String json = mapper.writeValueAsString(payload);
            Request.Builder builder = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(json, JSON));
            if (webhookSecret != null && !webhookSecret.isBlank()) {
                builder.addHeader("X-Signature", sign(json, webhookSecret));
            }
            try (Response response = client.newCall(builder.build()).execute()) {
                if (!response.isSuccessful()) {
                    log.warn("Settlement webhook {} responded with {}", payload.type(), response.code());
                    return false;
                }
                return true;
            }
        } catch (Exception e) {
            log.warn("Unable to deliver settlement webhook {}: {}", payload.type(), LogSanitizer.sanitize(e.getMessage()));
            return false;
        }
    }

    static String sign(String payload, String secret) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] signature = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder("sha256=");
        for (byte b : signature) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private record Delivery(WebhookPayload payload, int attempts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record WebhookPayload(
        String type,
        Long intentId,
        String owner,
        String corridorId,
        BigInteger magnitude,
        BigInteger proposedOutput,
        CowStats stats
    ) {
        static WebhookPayload from(IntentSettledEvent event) {
            return new WebhookPayload("intent_settled", event.getIntentId(), event.getOwner(),
                event.getCorridorId(), event.getMagnitude(), event.getProposedOutput(), null);
        }

        static WebhookPayload from(BatchSettledEvent event) {
            return new WebhookPayload("batch_settled", null, null, event.getCorridorId(), null, null, event.getStats());
        }
    }
}
