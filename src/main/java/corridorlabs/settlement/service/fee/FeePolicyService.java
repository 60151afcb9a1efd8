package corridorlabs.settlement.service.fee;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import corridorlabs.settlement.config.SettlementProperties;
import corridorlabs.settlement.event.FeeParamsUpdatedEvent;
import corridorlabs.settlement.exception.CorridorConfigurationException;
import corridorlabs.settlement.exception.SettlementErrorCode;
import corridorlabs.settlement.service.auth.AdminAuthorizationService;
import corridorlabs.settlement.service.corridor.CorridorRegistryService;
import corridorlabs.settlement.state.FeeParams;
import corridorlabs.settlement.state.SettlementStateRepository;
import corridorlabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Dynamic fee policy. The effective fee is flat at baseFee while |flow| stays within the
 * threshold, rises linearly to baseFee + maxExtraFee at |flow| = 2 * threshold, and stays
 * there beyond that.
 */
@Service
@Slf4j
public class FeePolicyService {

    /** Largest fee the venue can encode (100%). */
    public static final int VENUE_MAX_FEE = 1_000_000;

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private final SettlementStateRepository state;
    private final AdminAuthorizationService adminAuthorization;
    private final ApplicationEventPublisher eventPublisher;
    private final int maxFee;

    public FeePolicyService(
        SettlementStateRepository state,
        AdminAuthorizationService adminAuthorization,
        ApplicationEventPublisher eventPublisher,
        SettlementProperties properties
    ) {
        this.state = state;
        this.adminAuthorization = adminAuthorization;
        this.eventPublisher = eventPublisher;
        this.maxFee = properties.getFee().getMaxFee();
    }

    public FeeParams setParams(String caller, String corridorId, int baseFee, int maxExtraFee, BigInteger threshold) {
        adminAuthorization.requireAdmin(caller, "set fee params");
        CorridorRegistryService.requireCorridorId(corridorId);
        BigInteger netFlowThreshold = threshold == null ? BigInteger.ZERO : threshold;
        if (!withinPolicy(baseFee) || !withinPolicy(maxExtraFee) || netFlowThreshold.signum() < 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("baseFee", baseFee);
            details.put("maxExtraFee", maxExtraFee);
            details.put("maxFee", maxFee);
            details.put("threshold", netFlowThreshold);
            throw new CorridorConfigurationException(SettlementErrorCode.INVALID_FEE_PARAMS,
                "Fee params out of range for corridor " + corridorId, details);
        }

        FeeParams params = new FeeParams(baseFee, maxExtraFee, netFlowThreshold);
        state.runInLock(() -> {
            state.putFeeParams(corridorId, params);
            eventPublisher.publishEvent(new FeeParamsUpdatedEvent(this, corridorId, params));
        });
        log.info("Fee params for corridor {} set to base={} maxExtra={} threshold={}",
            LogSanitizer.sanitize(corridorId), baseFee, maxExtraFee, netFlowThreshold);
        return params;
    }

    public FeeParams getParams(String corridorId) {
        return state.findFeeParams(corridorId).orElse(FeeParams.NONE);
    }

    public FeeQuote effectiveFee(String corridorId) {
        return state.inLock(() -> quote(getParams(corridorId), state.flowOf(corridorId)));
    }

    /**
     * Pure fee function over a parameter set and a signed flow value.
     */
    public static FeeQuote quote(FeeParams params, BigInteger flow) {
        if (params == null || params.baseFee() == 0) {
            return FeeQuote.NO_OVERRIDE;
        }
        long fee = params.baseFee();
        BigInteger absFlow = flow == null ? BigInteger.ZERO : flow.abs();
        BigInteger threshold = params.netFlowThreshold();
        if (params.dynamicEnabled() && absFlow.compareTo(threshold) > 0) {
            // basis points of excess over threshold; exceeds 10000 once |flow| > 2 * threshold
            BigInteger excessRatio = absFlow.subtract(threshold).multiply(BPS_DENOMINATOR).divide(threshold);
            BigInteger maxExtra = BigInteger.valueOf(params.maxExtraFee());
            BigInteger extra = maxExtra.multiply(excessRatio).divide(BPS_DENOMINATOR).min(maxExtra);
            fee += extra.longValueExact();
        }
        if (!isValidVenueFee(fee)) {
            throw new CorridorConfigurationException(SettlementErrorCode.INVALID_FEE_PARAMS,
                "Effective fee " + fee + " exceeds venue bound", Map.of("fee", fee));
        }
        return FeeQuote.override((int) fee);
    }

    public static boolean isValidVenueFee(long fee) {
        return fee >= 0 && fee <= VENUE_MAX_FEE;
    }

    private boolean withinPolicy(int fee) {
        return fee >= 0 && fee <= maxFee && isValidVenueFee(fee);
    }
}
