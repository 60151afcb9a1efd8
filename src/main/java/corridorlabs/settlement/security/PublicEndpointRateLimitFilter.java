package corridorlabs.settlement.security;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import corridorlabs.settlement.util.LogSanitizer;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Per-IP token bucket on the settlement and query surfaces, which anyone may call.
 */
@Component
@Order(1)
@Slf4j
public class PublicEndpointRateLimitFilter extends OncePerRequestFilter {

    private static final int MAX_BUCKETS = 50_000;

    @Value("${rate.limit.enabled:true}")
    private boolean rateLimitEnabled;

    @Value("${rate.limit.settlement.requests.per.minute:60}")
    private int settlementRequestsPerMinute;

    @Value("${rate.limit.settlement.requests.burst:20}")
    private int settlementRequestsBurst;

    @Value("${endpoint.settlement:/settlement}")
    private String settlementPath;

    @Value("${endpoint.intents:/intents}")
    private String intentsPath;

    @Value("${endpoint.corridors:/corridors}")
    private String corridorsPath;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        return !rateLimitEnabled || path == null
            || !(path.startsWith(settlementPath) || path.startsWith(intentsPath) || path.startsWith(corridorsPath));
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String clientIp = clientIp(request);
        if (buckets.size() > MAX_BUCKETS) {
            log.info("Clearing {} rate limit buckets", buckets.size());
            buckets.clear();
        }
        Bucket bucket = buckets.computeIfAbsent(clientIp, k -> newBucket());
        if (!bucket.tryConsume(1)) {
            log.warn("Rate limit exceeded on {} for {}", LogSanitizer.sanitize(request.getRequestURI()), maskIp(clientIp));
            response.setStatus(429);
            response.setContentType("application/json");
            response.setHeader("Retry-After", "60");
            response.getWriter().write("{\"error\":\"Too many requests. Please try again later.\"}");
            return;
        }
        filterChain.doFilter(request, response);
    }

    private Bucket newBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(settlementRequestsBurst)
                .refillGreedy(settlementRequestsPerMinute, Duration.ofMinutes(1))
                .build())
            .build();
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private static String maskIp(String ip) {
        if (ip == null) {
            return "unknown";
        }
        int lastDot = ip.lastIndexOf('.');
        return lastDot > 0 ? ip.substring(0, lastDot) + ".***" : ip;
    }
}
