package com.alari.companion.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Writes the service's JSON error shape for 401 / 403 produced by the security filter chain,
 * telling apart missing, expired and malformed bearer tokens.
 */
@Component
public class JsonAuthErrorHandlers implements AuthenticationEntryPoint, AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonAuthErrorHandlers.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException) throws IOException {
        AuthException.Reason reason = classify(authException);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        writeJson(response, 401, reason.name(), describe(reason), request, authException);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException) throws IOException {
        writeJson(response, 403, "FORBIDDEN", "Access denied", request, accessDeniedException);
    }

    static AuthException.Reason classify(AuthenticationException ex) {
        if (!(ex instanceof OAuth2AuthenticationException oauthEx) || oauthEx.getError() == null) {
            return AuthException.Reason.MISSING_TOKEN;
        }
        String description = oauthEx.getError().getDescription();
        if (description != null && description.toLowerCase(Locale.ROOT).contains("expired")) {
            return AuthException.Reason.EXPIRED_TOKEN;
        }
        return AuthException.Reason.MALFORMED_TOKEN;
    }

    private static String describe(AuthException.Reason reason) {
        return switch (reason) {
            case EXPIRED_TOKEN -> "Token has expired";
            case MALFORMED_TOKEN -> "Token is invalid";
            default -> "Not authenticated";
        };
    }

    private void writeJson(HttpServletResponse response, int status, String code, String message,
                           HttpServletRequest request, Exception ex) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");

        String traceId = RequestContextHolder.currentTraceId();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("path", request.getRequestURI());
        details.put("timestamp", Instant.now().toString());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        body.put("details", details);
        body.put("trace_id", traceId);

        log.warn("Auth failure status={} code={} path={} traceId={} msg={}", status, code, request.getRequestURI(), traceId, ex.getMessage());
        mapper.writeValue(response.getOutputStream(), body);
    }
}
