package com.dev.prostaff.security;

import com.dev.prostaff.tenant.TenantScope;
import com.dev.prostaff.web.ApiExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String LOGIN_PATH = "/api/v1/auth/login";
    public static final String REFRESH_PATH = "/api/v1/auth/refresh";

    // credentials for these come in the body; a stale bearer must not block them
    private static final List<RequestMatcher> PUBLIC_ENDPOINTS = List.of(
            new AntPathRequestMatcher(LOGIN_PATH, HttpMethod.POST.name()),
            new AntPathRequestMatcher(REFRESH_PATH, HttpMethod.POST.name())
    );

    private final ConnectionAuthenticator connectionAuthenticator;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(ConnectionAuthenticator connectionAuthenticator, ObjectMapper objectMapper) {
        this.connectionAuthenticator = connectionAuthenticator;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return PUBLIC_ENDPOINTS.stream().anyMatch(matcher -> matcher.matches(request));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        AuthenticationResult result = connectionAuthenticator.authenticate(token.get());
        if (!result.isAuthenticated()) {
            writeUnauthorized(response, result.failure());
            return;
        }

        Identity identity = result.identity();
        SecurityContextHolder.getContext().setAuthentication(new IdentityAuthentication(identity, token.get()));
        try (TenantScope scope = TenantScope.open(identity)) {
            request.setAttribute(TenantScope.REQUEST_ATTRIBUTE, scope);
            filterChain.doFilter(request, response);
        } finally {
            request.removeAttribute(TenantScope.REQUEST_ATTRIBUTE);
            SecurityContextHolder.clearContext();
        }
    }

    private void writeUnauthorized(HttpServletResponse response, AuthFailure failure) throws IOException {
        HttpStatus status = HttpStatus.UNAUTHORIZED;
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(),
                ApiExceptionHandler.errorBody(status, failure.name(), "Authentication failed"));
    }
}
