package com.jreinhal.knowledge.filter;

import com.jreinhal.knowledge.config.ApiKeyProperties;
import com.jreinhal.knowledge.model.AccessRole;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.security.CallerContext;
import com.jreinhal.knowledge.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Identifies the caller of {@code /api/**} requests from the API key and the forwarded chat
 * user headers, and binds the result to {@link CallerContext} for the request.
 */
@Component
@Order(value = 1)
public class ApiKeyFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);
    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String SLACK_USER_HEADER = "X-Slack-User-Id";
    public static final String USER_EMAIL_HEADER = "X-User-Email";
    public static final String USER_GROUPS_HEADER = "X-User-Groups";
    public static final String IDENTITY_ATTRIBUTE = "knowledge.callerIdentity";

    private final ApiKeyProperties properties;

    public ApiKeyFilter(ApiKeyProperties properties) {
        this.properties = properties;
        if (properties.getApiKeys().isEmpty()) {
            log.warn("No API keys configured; all callers are accepted with role='write'");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/") || path.startsWith("/api/health");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws IOException, ServletException {
        String callerId = null;
        AccessRole role = AccessRole.WRITE;
        if (!this.properties.getApiKeys().isEmpty()) {
            String key = request.getHeader(API_KEY_HEADER);
            ApiKeyProperties.Caller caller = key == null ? null : this.properties.getApiKeys().get(key);
            if (caller == null) {
                log.warn("Rejected request to {} with missing or unknown API key", LogSanitizer.sanitize(request.getRequestURI()));
                response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                response.getWriter().write("{\"error\":\"Invalid API key\"}");
                return;
            }
            callerId = caller.getCallerId();
            role = AccessRole.parse(caller.getRole());
        }
        CallerIdentity identity = new CallerIdentity(callerId, trimToNull(request.getHeader(SLACK_USER_HEADER)), role,
                trimToNull(request.getHeader(USER_EMAIL_HEADER)), parseGroups(request.getHeader(USER_GROUPS_HEADER)));
        request.setAttribute(IDENTITY_ATTRIBUTE, identity);
        CallerContext.bind(identity);
        try {
            chain.doFilter(request, response);
        }
        finally {
            CallerContext.clear();
        }
    }

    static List<String> parseGroups(String header) {
        if (header == null || header.isBlank()) {
            return List.of();
        }
        return Arrays.stream(header.split(",")).map(String::trim).filter(g -> !g.isEmpty()).toList();
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
