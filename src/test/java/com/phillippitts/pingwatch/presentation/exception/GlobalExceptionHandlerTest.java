package com.phillippitts.pingwatch.presentation.exception;

import com.phillippitts.pingwatch.exception.ExportException;
import com.phillippitts.pingwatch.exception.NoValidTargetsException;
import com.phillippitts.pingwatch.exception.TraceAlreadyRunningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesNoValidTargetsReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleNoValidTargets(new NoValidTargetsException(2));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("NoValidTargetsException");
        assertThat(response.getBody().details()).contains("2 submitted");
    }

    @Test
    void verifiesIllegalArgumentReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("intervalMs must be positive"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).isEqualTo("intervalMs must be positive");
    }

    @Test
    void verifiesTraceAlreadyRunningReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleTraceRunning(new TraceAlreadyRunningException(UUID.randomUUID()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().errorCode()).isEqualTo("TraceAlreadyRunningException");
    }

    @Test
    void verifiesIllegalStateReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalState(new IllegalStateException("Cannot reset while monitoring is running"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().details()).contains("while monitoring is running");
    }

    @Test
    void verifiesExportFailureDoesNotExposeFilePath() {
        ExportException ex = new ExportException("Failed to save monitoring results",
                Path.of("/secret/internal/path/report.csv"), new AccessDeniedException("/secret/internal/path"));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleExport(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal/path");
        assertThat(response.getBody().details()).isEqualTo("I/O error: AccessDeniedException");
    }

    @Test
    void verifiesUnexpectedDoesNotExposeMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new RuntimeException("Internal error with stack trace"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("RuntimeException");
        assertThat(response.getBody().toString()).doesNotContain("stack trace");
    }

    @Test
    void verifiesErrorResponseHasValidStructure() {
        String body = handler.handleBadRequest(new IllegalArgumentException("x")).getBody().toString();

        assertThat(body).contains("errorCode=");
        assertThat(body).contains("message=");
        assertThat(body).contains("details=");
        assertThat(body).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
