package com.example.identity.config;

import com.google.common.net.InetAddresses;
import jakarta.servlet.http.HttpServletRequest;

/**
 * 最前段のプロキシが付与した X-Forwarded-For の先頭を優先する。IP リテラルとして解釈できない値は
 * 接続元アドレスへフォールバックする。
 */
public final class ClientAddressResolver {

  /** accounts.last_login_address の列幅。IPv6 のテキスト表現の最大長。 */
  public static final int MAX_ADDRESS_LENGTH = 45;

  private ClientAddressResolver() {}

  public static String resolve(HttpServletRequest request) {
    final String forwarded = firstForwarded(request.getHeader("X-Forwarded-For"));
    if (isAddressLiteral(forwarded)) {
      return forwarded;
    }
    return request.getRemoteAddr();
  }

  public static boolean isAddressLiteral(String value) {
    return value != null
        && !value.isEmpty()
        && value.length() <= MAX_ADDRESS_LENGTH
        && InetAddresses.isInetAddress(value);
  }

  private static String firstForwarded(String xForwardedFor) {
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return null;
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
