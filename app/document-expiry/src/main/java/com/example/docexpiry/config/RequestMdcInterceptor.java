/*
 * どこで: Document expiry Web 層
 * 何を: リクエスト単位の運用キー(request_id/method/path/client_ip/trigger_source)を MDC に積む
 * なぜ: cron と手動実行のどちらから起動したサイクルかをログで追えるようにするため
 */
package com.example.docexpiry.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String TRIGGER_SOURCE_HEADER = "X-Trigger-Source";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final String DEFAULT_TRIGGER_SOURCE = "manual";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(
        keys,
        "request_id",
        firstNonBlank(request.getHeader("X-Request-Id"), UUID.randomUUID().toString()));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", resolveClientIp(request));
    put(
        keys,
        "trigger_source",
        firstNonBlank(request.getHeader(TRIGGER_SOURCE_HEADER), DEFAULT_TRIGGER_SOURCE));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys) {
      rawKeys.stream()
          .filter(String.class::isInstance)
          .map(String.class::cast)
          .forEach(MDC::remove);
    }
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    // 先頭がクライアント、以降はプロキシ
    return forwarded.split(",", 2)[0].trim();
  }

  private static String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
