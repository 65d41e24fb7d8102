package com.example.identity.config;

import com.example.identity.service.TokenService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;

@Configuration
@EnableConfigurationProperties({IdentityInternalApiProperties.class, IdentityTokenProperties.class})
public class IdentitySecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      IdentityInternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(TokenService tokenService) {
    return new BearerTokenAuthenticationFilter(tokenService);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      InternalApiAuthenticationFilter internalApiAuthenticationFilter,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(
            exceptions ->
                exceptions.authenticationEntryPoint(
                    new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, InternalApiAuthenticationFilter.EXTERNAL_LOGIN_PATH)
                    .hasRole("INTERNAL")
                    .requestMatchers(
                        HttpMethod.POST,
                        "/auth/register",
                        "/auth/login",
                        "/auth/refresh",
                        "/auth/verify-email",
                        "/auth/password-reset",
                        "/auth/password-reset:confirm")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/auth/email-exists", "/auth/username-exists")
                    .permitAll()
                    .requestMatchers("/admin/**")
                    .hasRole("ADMIN")
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
