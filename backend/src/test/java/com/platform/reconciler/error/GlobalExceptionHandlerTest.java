package com.platform.reconciler.error;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    @ParameterizedTest
    @CsvSource({
        "LAYER_NOT_FOUND, NOT_FOUND",
        "UPDATE_IN_PROGRESS, CONFLICT",
        "INVALID_FIELD_VALUE, BAD_REQUEST",
        "CIRCULAR_DEPENDENCY, UNPROCESSABLE_ENTITY",
        "RUNTIME_UNAVAILABLE, SERVICE_UNAVAILABLE",
        "COMMAND_TIMEOUT, GATEWAY_TIMEOUT",
        "CONTAINER_OPERATION_FAILED, BAD_GATEWAY",
        "ROLLBACK_FAILED, INTERNAL_SERVER_ERROR"
    })
    void mapsErrorCodesToHttpStatus(ErrorCode code, HttpStatus expected) {
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(code)).isEqualTo(expected);
    }

    @Test
    void rollbackFailureKeepsTheOriginalError() {
        LiveUpdateException original = new LiveUpdateException("Failed to apply change: Install packages: git");
        RollbackFailedException e = new RollbackFailedException("snapshot-1", new StateSyncException("disk full"), original);

        assertThat(e.isFatal()).isTrue();
        assertThat(e.getSuppressed()).containsExactly(original);
        assertThat(e.getMessage()).contains("snapshot-1").contains("disk full");
    }
}
