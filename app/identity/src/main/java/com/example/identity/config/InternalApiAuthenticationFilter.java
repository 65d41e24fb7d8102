package com.example.identity.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/** 外部 IdP ログインはゲートウェイからの内部トークン付き呼び出しだけを受け付ける。 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  static final String EXTERNAL_LOGIN_PATH = "/auth/external-login";

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";

  private final IdentityInternalApiProperties properties;

  public InternalApiAuthenticationFilter(IdentityInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !("POST".equals(request.getMethod())
        && EXTERNAL_LOGIN_PATH.equals(request.getRequestURI()));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isValidInternalToken(request.getHeader(properties.headerName()))) {
      SecurityContextHolder.getContext()
          .setAuthentication(
              new UsernamePasswordAuthenticationToken(
                  "gateway-internal", "N/A", List.of(new SimpleGrantedAuthority(INTERNAL_ROLE))));
      logger.debug("internal authentication established for path={}", request.getRequestURI());
    } else {
      logger.debug(
          "internal authentication not established for protected path={}",
          request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    if (actualToken == null || properties.token().isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }
}
