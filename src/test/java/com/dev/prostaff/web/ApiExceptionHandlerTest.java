package com.dev.prostaff.web;

import com.dev.prostaff.security.TokenRevokedException;
import com.dev.prostaff.tenant.TenantMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.security.authentication.BadCredentialsException;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApiExceptionHandler")
class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    @DisplayName("maps domain exceptions to their status")
    void domainExceptions() {
        assertStatus(handler.handleRuntime(new ResourceNotFoundException("Message not found")), HttpStatus.NOT_FOUND, "NOT_FOUND");
        assertStatus(handler.handleRuntime(new ForbiddenOperationException("nope")), HttpStatus.FORBIDDEN, "FORBIDDEN");
        assertStatus(handler.handleRuntime(new BadRequestException("bad")), HttpStatus.BAD_REQUEST, "BAD_REQUEST");
    }

    @Test
    @DisplayName("session failures answer 401 with their code")
    void sessionFailure() {
        ResponseEntity<Map<String, Object>> response = handler.handleSession(new TokenRevokedException("Token has been revoked"));

        assertStatus(response, HttpStatus.UNAUTHORIZED, "TOKEN_REVOKED");
        assertThat(response.getBody()).containsEntry("message", "Token has been revoked");
    }

    @Test
    @DisplayName("bad credentials never reveal which part was wrong")
    void badCredentials() {
        ResponseEntity<Map<String, Object>> response = handler.handleBadCredentials(new BadCredentialsException("x"));

        assertStatus(response, HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        assertThat(response.getBody()).containsEntry("message", "Invalid email or password");
    }

    @Test
    @DisplayName("cross-tenant access answers 403 without details")
    void tenantMismatch() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleTenantMismatch(new TenantMismatchException(UUID.randomUUID(), UUID.randomUUID()));

        assertStatus(response, HttpStatus.FORBIDDEN, "FORBIDDEN");
        assertThat(response.getBody()).containsEntry("message", "Access denied");
    }

    @Test
    @DisplayName("error bodies carry timestamp, status and reason")
    void bodyShape() {
        Map<String, Object> body = ApiExceptionHandler.errorBody(HttpStatus.NOT_FOUND, "NOT_FOUND", null);

        assertThat(body).containsKeys("timestamp", "status", "error", "code", "message");
        assertThat(body).containsEntry("status", 404).containsEntry("message", "Not Found");
    }

    @Test
    @DisplayName("an unreadable request body answers 400 in the common error shape")
    void unreadableBody() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "Required request body is missing", new MockHttpInputMessage(new byte[0]));

        ResponseEntity<Map<String, Object>> response = handler.handleBadParameter(ex);

        assertStatus(response, HttpStatus.BAD_REQUEST, "INVALID_PARAMETER");
        assertThat(response.getBody()).containsKeys("timestamp", "status", "error", "code", "message");
    }

    private static void assertStatus(ResponseEntity<Map<String, Object>> response, HttpStatus status, String code) {
        assertThat(response.getStatusCode()).isEqualTo(status);
        assertThat(response.getBody()).containsEntry("code", code);
    }
}
