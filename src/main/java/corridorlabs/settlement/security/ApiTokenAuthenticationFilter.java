package corridorlabs.settlement.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import corridorlabs.settlement.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates the two privileged REST surfaces.
 * <ul>
 *   <li>Admin paths need the admin token; the principal is the address in the caller header,
 *       which the engine then checks against its administrator list.</li>
 *   <li>Hook paths need the host token and get ROLE_HOST.</li>
 * </ul>
 * A blank token leaves the matching surface unauthenticated, so SecurityConfig denies it.
 */
@Component
@Slf4j
public class ApiTokenAuthenticationFilter extends OncePerRequestFilter {

    @Value("${security.admin-token:}")
    private String adminToken;

    @Value("${security.admin-token-header:X-Admin-Token}")
    private String adminTokenHeader;

    @Value("${security.caller-header:X-Caller-Address}")
    private String callerHeader;

    @Value("${security.host-token:}")
    private String hostToken;

    @Value("${security.host-token-header:X-Host-Token}")
    private String hostTokenHeader;

    @Value("${endpoint.admin:/admin}")
    private String adminPath;

    @Value("${endpoint.hooks:/hooks}")
    private String hooksPath;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !(path.startsWith(adminPath) || path.startsWith(hooksPath));
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String path = request.getRequestURI();
        if (path.startsWith(adminPath)) {
            String provided = request.getHeader(adminTokenHeader);
            if (provided != null && !provided.isBlank() && hasText(adminToken)) {
                if (!matches(adminToken, provided)) {
                    log.warn("Invalid admin token on {}", LogSanitizer.sanitize(path));
                    response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized");
                    return;
                }
                String caller = request.getHeader(callerHeader);
                authenticate(hasText(caller) ? caller.trim() : "admin", "ROLE_ADMIN");
            }
        } else {
            String provided = request.getHeader(hostTokenHeader);
            if (provided != null && !provided.isBlank() && hasText(hostToken)) {
                if (!matches(hostToken, provided)) {
                    log.warn("Invalid host token on {}", LogSanitizer.sanitize(path));
                    response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized");
                    return;
                }
                authenticate("host", "ROLE_HOST");
            }
        }
        filterChain.doFilter(request, response);
    }

    private static void authenticate(String principal, String role) {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, null, List.of(new SimpleGrantedAuthority(role)))
            );
        }
    }

    private static boolean matches(String expected, String provided) {
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            provided.trim().getBytes(StandardCharsets.UTF_8)
        );
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
