package org.whiteelephant.security;

import jakarta.servlet.DispatcherType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.*;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.web.cors.*;

import java.util.Arrays;
import java.util.List;

@Configuration
@EnableMethodSecurity
public class SecurityConfig {

    private final GatewayUserFilter gatewayUserFilter;

    public SecurityConfig(GatewayUserFilter gatewayUserFilter) {
        this.gatewayUserFilter = gatewayUserFilter;
    }

    // Liste d’origines autorisées (env/properties)
    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOriginsProp;

    @Value("${app.security.user-header:X-User-Id}")
    private String userHeader;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        // redispatch interne (SSE async, page d'erreur) : déjà filtré à l'entrée
                        .dispatcherTypeMatchers(DispatcherType.ASYNC, DispatcherType.ERROR).permitAll()

                        // Préflight
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()

                        // Sonde de santé
                        .requestMatchers(HttpMethod.GET, "/health").permitAll()

                        // Flux SSE public, comme les spectateurs
                        .requestMatchers(HttpMethod.GET, "/api/games/*/stream").permitAll()

                        // Actions de jeu : authentifiées, niveau PLAY vérifié par @PreAuthorize
                        .requestMatchers("/api/play/**").authenticated()

                        // Tout le reste
                        .anyRequest().authenticated()
                );

        http.addFilterBefore(gatewayUserFilter, AnonymousAuthenticationFilter.class);
        return http.build();
    }

    // le filtre ne doit tourner que dans la chaîne Spring Security
    @Bean
    public FilterRegistrationBean<GatewayUserFilter> gatewayUserFilterRegistration(GatewayUserFilter filter) {
        FilterRegistrationBean<GatewayUserFilter> reg = new FilterRegistrationBean<>(filter);
        reg.setEnabled(false);
        return reg;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        List<String> origins = Arrays.stream(allowedOriginsProp.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();

        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOrigins(origins);
        config.setAllowCredentials(true);
        config.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        config.setAllowedHeaders(List.of(userHeader, "Content-Type", "Accept", "Origin", "Last-Event-ID"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }
}
