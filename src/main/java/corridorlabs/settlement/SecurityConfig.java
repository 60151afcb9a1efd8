package corridorlabs.settlement;

import java.util.Arrays;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import corridorlabs.settlement.security.ApiTokenAuthenticationFilter;

@Configuration
public class SecurityConfig {

    @Value("${allowed-origins:http://localhost:3000}")
    private String[] allowedOrigins;

    @Value("${endpoint.admin:/admin}")
    private String adminEndpoint;

    @Value("${endpoint.hooks:/hooks}")
    private String hooksEndpoint;

    @Value("${endpoint.settlement:/settlement}")
    private String settlementEndpoint;

    @Value("${endpoint.intents:/intents}")
    private String intentsEndpoint;

    @Value("${endpoint.corridors:/corridors}")
    private String corridorsEndpoint;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, ApiTokenAuthenticationFilter apiTokenFilter) throws Exception {
        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .csrf(csrf -> csrf
                .ignoringRequestMatchers(
                    adminEndpoint + "/**",
                    hooksEndpoint + "/**",
                    settlementEndpoint + "/**",
                    intentsEndpoint + "/**",
                    corridorsEndpoint + "/**"
                )
            )
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(apiTokenFilter, AuthorizationFilter.class)
            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/actuator/health/**", "/actuator/info", "/error").permitAll()
                .requestMatchers(adminEndpoint + "/**").hasRole("ADMIN")
                .requestMatchers(hooksEndpoint + "/**").hasRole("HOST")
                // operator and query surfaces are open; batches are checked against minOut
                .requestMatchers(settlementEndpoint + "/**").permitAll()
                .requestMatchers(intentsEndpoint, intentsEndpoint + "/**").permitAll()
                .requestMatchers(corridorsEndpoint + "/**").permitAll()
                .anyRequest().denyAll()
            );

        return http.build();
    }

    /**
     * Keeps the token filter inside the security chain only, not in the servlet chain as well.
     */
    @Bean
    public FilterRegistrationBean<ApiTokenAuthenticationFilter> apiTokenFilterRegistration(ApiTokenAuthenticationFilter filter) {
        FilterRegistrationBean<ApiTokenAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration publicConfiguration = new CorsConfiguration();
        publicConfiguration.setAllowedOrigins(Arrays.asList(allowedOrigins));
        publicConfiguration.setAllowedMethods(Arrays.asList("GET", "POST"));
        publicConfiguration.addAllowedHeader("*");

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(settlementEndpoint + "/**", publicConfiguration);
        source.registerCorsConfiguration(intentsEndpoint + "/**", publicConfiguration);
        source.registerCorsConfiguration(corridorsEndpoint + "/**", publicConfiguration);
        return source;
    }
}
