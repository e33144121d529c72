package com.mindcanvus.infrastructure.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mindcanvus.adapter.in.web.ErrorResponse;
import com.mindcanvus.application.port.out.TokenService;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Resolves the bearer token into an {@link Actor} for the request. Public routes accept
 * anonymous callers but still honour a valid token, so authors can see their own drafts.
 */
@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Set<String> PUBLIC_PATHS = Set.of(
        "/api/auth/register",
        "/api/auth/login",
        "/api/health",
        "/actuator",
        "/api-docs",
        "/v3/api-docs",
        "/docs.html",
        "/swagger-ui"
    );

    private static final Set<String> PUBLIC_READ_PREFIXES = Set.of(
        "/api/posts",
        "/api/comments",
        "/api/users"
    );

    private static final String USER_SUGGESTIONS_PATH = "/api/users/suggestions";

    private final TokenService tokenService;
    private final ObjectMapper objectMapper;

    public AuthFilter(TokenService tokenService, ObjectMapper objectMapper) {
        this.tokenService = tokenService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String token = extractBearerToken(request);
        Optional<Actor> actor = token != null ? tokenService.verify(token) : Optional.empty();

        if (actor.isEmpty() && !isPublic(request.getMethod(), path)) {
            String message = token == null ? "No token provided" : "Invalid or expired token";
            log.warn("Rejected request to {}: {}", path, message);
            RequestContext.clear();
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding("UTF-8");
            objectMapper.writeValue(response.getWriter(), new ErrorResponse("UNAUTHORIZED", message, requestId));
            return;
        }

        RequestContext.set(actor.orElse(Actor.ANONYMOUS), requestId);
        log.debug("Request context set: requestId={}, authenticated={}, path={}", requestId, actor.isPresent(), path);

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    static boolean isPublic(String method, String path) {
        if (PUBLIC_PATHS.stream().anyMatch(path::startsWith)) {
            return true;
        }
        if (!"GET".equalsIgnoreCase(method) || path.startsWith(USER_SUGGESTIONS_PATH)) {
            return false;
        }
        return PUBLIC_READ_PREFIXES.stream().anyMatch(prefix -> path.equals(prefix) || path.startsWith(prefix + "/"));
    }

    private String extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader(AUTHORIZATION_HEADER);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
