package corridorlabs.settlement.config;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private Admin admin = new Admin();
    private Netting netting = new Netting();
    private Fee fee = new Fee();

    @Data
    public static class Admin {
        /** Addresses allowed to register corridors, set fee params and reset flow. */
        private List<String> addresses = new ArrayList<>();
    }

    @Data
    public static class Netting {
        /** Informational processing cost attributed to each intent settled in a batch. */
        private long perIntentCost = 50_000L;
    }

    @Data
    public static class Fee {
        /** Policy cap for baseFee and maxExtraFee, in venue fee units (10000 = 1%). */
        private int maxFee = 10_000;
    }
}
