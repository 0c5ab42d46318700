package com.example.factcheck.common.exception;

import com.example.factcheck.exception.ApiException;
import com.example.factcheck.permissions.exception.PermissionsException;
import com.example.factcheck.permissions.model.ActionKind;
import com.example.factcheck.permissions.model.PermissionDecision;
import com.example.factcheck.permissions.model.PermissionDecision.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should map every quota denial to forbidden with its reason")
    void shouldMapDenialsToForbidden() {
        for (Outcome outcome : new Outcome[]{Outcome.UNKNOWN_ACTION, Outcome.INSUFFICIENT_REPUTATION, Outcome.LIMIT_REACHED}) {
            PermissionsException ex = new PermissionsException(
                    PermissionDecision.denied(outcome, 1L, ActionKind.VOTE_UP));

            ResponseEntity<Map<String, Object>> response = handler.handlePermissions(ex);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(response.getBody())
                    .containsEntry("error", "forbidden")
                    .containsEntry("message", outcome.reason());
        }
    }

    @Test
    @DisplayName("should map downstream failures to service unavailable")
    void shouldMapApiExceptions() {
        ResponseEntity<Map<String, Object>> response = handler.handleApiException(
                new ApiException("UserService", HttpStatus.BAD_GATEWAY, "User service error"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("error", "service_unavailable");
    }

    @Test
    @DisplayName("should not leak internal messages")
    void shouldNotLeakInternalMessages() {
        ResponseEntity<Map<String, Object>> response = handler.handleGeneral(
                new IllegalStateException("connection string user=admin"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("message", "An unexpected error occurred");
    }
}
