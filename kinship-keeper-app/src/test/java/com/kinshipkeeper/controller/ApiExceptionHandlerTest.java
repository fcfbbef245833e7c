package com.kinshipkeeper.controller;

import com.kinshipkeeper.model.Rejection;
import com.kinshipkeeper.service.RejectionException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void ownershipViolationIsForbidden() {
        ResponseEntity<Map<String, Object>> response = handler.handleRejection(
            new RejectionException(Rejection.OWNERSHIP_VIOLATION, "not yours"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody()).containsEntry("error", "OwnershipViolation");
    }

    @Test
    void everyOtherRejectionIsBadRequest() {
        for (Rejection rejection : Rejection.values()) {
            if (rejection != Rejection.OWNERSHIP_VIOLATION) {
                assertThat(ApiExceptionHandler.statusFor(rejection)).isEqualTo(HttpStatus.BAD_REQUEST);
            }
        }
    }

    @Test
    void commitTimeSerializationFailureIsConflictNotServerError() {
        ResponseEntity<Map<String, Object>> response = handler.handleConcurrentWrite(
            new CannotAcquireLockException("could not serialize access"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).containsEntry("error", "ConcurrentWrite");
    }
}
