package com.example.vrf.config;

import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.security.filter.RateLimitFilter;
import com.example.vrf.web.rest.ApiConstants.Header;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Stateless security configuration for the randomness gateway.
 * <p>
 * Three filter chains. PUBLIC CHAIN (@Order(1)): health, stats, attestation and
 * verification, actuator and API docs. GATED CHAIN (@Order(2)): randomness
 * routes; access is decided per request by the AccessGateService, the chain only
 * hosts the rate limiter. DEFAULT CHAIN (@Order(3)): explicit deny-all.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final RateLimitFilter rateLimitFilter;
  private final ApplicationProperties properties;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/v1/health/**",
                         "/v1/health",
                         "/v1/stats",
                         "/v1/attestation",
                         "/v1/verify",
                         "/actuator/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .addFilterBefore(rateLimitFilter, AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain gatedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/v1/randomness",
                         "/v1/random/**")
        .addFilterBefore(rateLimitFilter, AnonymousAuthenticationFilter.class)
        // Payment, API key and allow-list checks happen in the AccessGateService
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Filter chain #3: Deny everything else
   */
  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * The rate limiter runs inside the security chains only, not as a servlet filter.
   */
  @Bean
  public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration() {
    FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(rateLimitFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public CorsConfigurationSource corsConfigurationSource() {
    CorsConfiguration configuration = new CorsConfiguration();
    if (properties.runtime().production()) {
      List<String> patterns = new ArrayList<>();
      for (String origin : properties.cors().allowedOrigins()) {
        patterns.add(origin);
        // sub-domains of each configured origin
        int schemeEnd = origin.indexOf("://");
        if (schemeEnd > 0) {
          patterns.add(origin.substring(0, schemeEnd + 3) + "*." + origin.substring(schemeEnd + 3));
        }
      }
      configuration.setAllowedOriginPatterns(patterns);
    } else {
      configuration.setAllowedOriginPatterns(List.of("*"));
    }
    configuration.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
    configuration.setAllowedHeaders(List.of("Content-Type", "X-API-Key", "PAYMENT-SIGNATURE",
                                            "X-Payment"));
    configuration.setExposedHeaders(List.of(Header.PAYMENT_REQUIRED, Header.RATE_LIMIT_LIMIT,
                                            Header.RATE_LIMIT_REMAINING, Header.RATE_LIMIT_RESET,
                                            Header.RETRY_AFTER));
    configuration.setMaxAge(Duration.ofHours(1));

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/v1/**", configuration);
    return source;
  }

  /**
   * Common security settings applied to all chains
   */
  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Stateless JSON API, no cookies to protect
        .csrf(AbstractHttpConfigurer::disable)
        .cors(cors -> {
        })
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .headers(headers -> headers
                     // Prevents page from being shown in iframe
                     .frameOptions(FrameOptionsConfig::deny)

                     // Prevents browser from guessing content type
                     .contentTypeOptions(contentType -> {
                     })

                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )
                     .permissionsPolicyHeader(permissions -> permissions
                                                  .policy("camera=(), microphone="
                                                              + "(), geolocation=()")
                                             )

                     // Forces HTTPS for 1 year
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )

                     .contentSecurityPolicy(csp -> csp
                                                .policyDirectives(
                                                    "default-src 'self'; " +
                                                        "img-src 'self' data: https:; " +
                                                        "frame-ancestors 'none'; " +
                                                        "base-uri 'self'"
                                                                 )
                                           )

                     // Randomness responses must never be cached
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control",
                                          "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma",
                                          "no-cache");
                       response.setHeader("Expires",
                                          "0");
                     })
                );
  }
}
