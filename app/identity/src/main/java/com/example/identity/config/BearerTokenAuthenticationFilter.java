/*
 * どこで: app/identity/src/main/java/com/example/identity/config/BearerTokenAuthenticationFilter.java
 * 何を: Authorization: Bearer のアクセストークンを検証し、認証情報を確立する
 * なぜ: /me と /admin の本人・権限判定を署名済みクレームだけで完結させるため
 */
package com.example.identity.config;

import com.example.identity.model.AccountRole;
import com.example.identity.service.IdentityException;
import com.example.identity.service.TokenClaims;
import com.example.identity.service.TokenService;
import com.example.identity.service.TokenType;
import com.google.common.annotations.VisibleForTesting;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final TokenService tokenService;

  public BearerTokenAuthenticationFilter(TokenService tokenService) {
    this.tokenService = tokenService;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      try {
        final TokenClaims claims =
            tokenService.verifySigned(
                header.substring(BEARER_PREFIX.length()).trim(), TokenType.ACCESS);
        SecurityContextHolder.getContext()
            .setAuthentication(
                new UsernamePasswordAuthenticationToken(
                    claims.subject(), "N/A", buildAuthorities(claims.role())));
      } catch (IdentityException ex) {
        // 未認証のまま進め、認可側で 401 とする
        logger.debug(
            "bearer token rejected path={} kind={}", request.getRequestURI(), ex.kind());
      }
    }
    filterChain.doFilter(request, response);
  }

  @VisibleForTesting
  static List<SimpleGrantedAuthority> buildAuthorities(AccountRole role) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
    if (role == AccountRole.MODERATOR || role == AccountRole.ADMIN) {
      authorities.add(new SimpleGrantedAuthority("ROLE_" + role.name()));
    }
    return authorities;
  }
}
