package com.atrium.auth.security;

import com.atrium.auth.config.AllowedOrigins;
import com.atrium.auth.config.AtriumAuthProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Stateless HTTP security for the auth service.
 *
 * - /me requires a valid user access token
 * - /admin/** requires the static admin API token
 * - everything else (login, callback, backup-login, refresh, logout, health)
 *   is public and authenticates through its own request body
 */
@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   CredentialCodec credentialCodec,
                                                   AtriumAuthProperties properties,
                                                   AllowedOrigins allowedOrigins,
                                                   ApiErrorWriter errorWriter) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .cors(cors -> cors.configurationSource(corsConfigurationSource(allowedOrigins)))
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .requestCache(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/admin/**").hasRole(AdminApiTokenFilter.ADMIN_ROLE)
                        .requestMatchers("/me").authenticated()
                        .anyRequest().permitAll())
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((request, response, e) ->
                                errorWriter.write(request, response, HttpStatus.UNAUTHORIZED, "Invalid or expired token"))
                        .accessDeniedHandler((request, response, e) ->
                                errorWriter.write(request, response, HttpStatus.FORBIDDEN, "Access denied")))
                .addFilterBefore(new AdminApiTokenFilter(properties.getAdmin().getApiToken(), errorWriter),
                        UsernamePasswordAuthenticationFilter.class)
                .addFilterBefore(new BearerTokenAuthenticationFilter(credentialCodec),
                        UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    private CorsConfigurationSource corsConfigurationSource(AllowedOrigins allowedOrigins) {
        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOrigins(allowedOrigins.asList());
        cors.setAllowedMethods(List.of("GET", "POST", "PATCH", "DELETE", "OPTIONS"));
        cors.setAllowedHeaders(List.of("*"));
        cors.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", cors);
        return source;
    }
}
