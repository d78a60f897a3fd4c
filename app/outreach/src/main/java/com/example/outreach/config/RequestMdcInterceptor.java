/*
 * Where: Outreach web layer
 * What: binds request, owner and path-resource keys into the MDC for the request's lifetime
 * Why: job and email log lines from controllers and services can be joined to one API call
 */
package com.example.outreach.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  public static final String HEADER_USER_ID = "X-User-Id";
  public static final String HEADER_REQUEST_ID = "X-Request-Id";
  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  // Path variables copied into the MDC under their log key.
  private static final Map<String, String> PATH_KEYS =
      Map.of("jobId", "job_id", "emailId", "email_id", "templateId", "template_id");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = resolveRequestId(request);
    response.setHeader(HEADER_REQUEST_ID, requestId);

    final Map<String, String> values = new LinkedHashMap<>();
    values.put("request_id", requestId);
    values.put("http_method", request.getMethod());
    values.put("http_path", request.getRequestURI());
    values.put("client_ip", resolveClientIp(request));
    values.put("owner_id", request.getHeader(HEADER_USER_ID));
    pathVariables(request)
        .forEach(
            (name, value) -> {
              final String key = PATH_KEYS.get(name);
              if (key != null) {
                values.put(key, value);
              }
            });

    final List<String> keys = new ArrayList<>();
    values.forEach(
        (key, value) -> {
          if (value != null && !value.isBlank()) {
            MDC.put(key, value);
            keys.add(key);
          }
        });
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private static Map<String, String> pathVariables(HttpServletRequest request) {
    final Object attribute =
        request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (!(attribute instanceof Map<?, ?> raw)) {
      return Map.of();
    }
    final Map<String, String> variables = new LinkedHashMap<>();
    raw.forEach((name, value) -> variables.put(String.valueOf(name), String.valueOf(value)));
    return variables;
  }

  private static String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(HEADER_REQUEST_ID);
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  private static String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }
}
