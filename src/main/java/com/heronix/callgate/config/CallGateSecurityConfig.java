package com.heronix.callgate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

import lombok.extern.slf4j.Slf4j;

/**
 * Security configuration for Heronix CallGate.
 *
 * Ledger lookups are public. Router administration requires an authenticated operator
 * with role PROTOCOL_ADMIN (HTTP Basic).
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
@Slf4j
public class CallGateSecurityConfig {

    public static final String PROTOCOL_ADMIN_ROLE = "PROTOCOL_ADMIN";

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public InMemoryUserDetailsManager operatorUserDetailsService(CallGateProperties properties) {
        CallGateProperties.ConsoleConfig console = properties.getConsole();
        InMemoryUserDetailsManager manager = new InMemoryUserDetailsManager();

        if (console.getOperatorPasswordHash() == null || console.getOperatorPasswordHash().isBlank()) {
            log.warn("SECURITY: No operator password hash configured - router administration is unreachable");
            return manager;
        }

        manager.createUser(User.withUsername(console.getOperatorUsername())
                .password(console.getOperatorPasswordHash())
                .roles(PROTOCOL_ADMIN_ROLE)
                .build());
        return manager;
    }

    /**
     * Default/development security configuration. Administrator endpoints are still
     * guarded by method security.
     */
    @Bean
    @Profile("!prod")
    @Order(Ordered.LOWEST_PRECEDENCE)
    public SecurityFilterChain devSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(Customizer.withDefaults())
            .authorizeHttpRequests(auth -> auth
                // Allow H2 console in dev
                .requestMatchers("/h2-console/**").permitAll()
                .requestMatchers("/swagger-ui/**", "/api-docs/**", "/swagger-ui.html").permitAll()
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers("/api/v1/router/admin/**").hasRole(PROTOCOL_ADMIN_ROLE)
                .anyRequest().permitAll()
            )
            .headers(headers -> headers
                .frameOptions(frame -> frame.disable()) // For H2 console
            );

        return http.build();
    }

    /**
     * Production security configuration - strict.
     */
    @Bean
    @Profile("prod")
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public SecurityFilterChain prodSecurityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(Customizer.withDefaults())
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health").permitAll()
                .requestMatchers("/api/v1/gatekeeper/**").permitAll()
                .requestMatchers("/api/v1/router/admin/**").hasRole(PROTOCOL_ADMIN_ROLE)
                .anyRequest().denyAll()
            )
            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none';"))
                .frameOptions(frame -> frame.deny())
            );

        return http.build();
    }
}
