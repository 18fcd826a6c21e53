package com.ospicorp.geosimple.config;

import jakarta.servlet.http.HttpServletRequest;

final class Requests {
  private Requests() {
  }

  static String uriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
