package com.example.pairing.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.pairing.model.SubmissionCounts;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleInvalidRequestReturns400() {
    final var response = handler.handleInvalidRequest(new InvalidPairingRequestException("bad"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.PAIRING_BAD_REQUEST, "bad"));
  }

  @Test
  void handleValidationReturns400() {
    final var response = handler.handleValidation((MethodArgumentNotValidException) null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.PAIRING_VALIDATION_ERROR);
  }

  @Test
  void handleNotReadyReturns409WithCounts() {
    final var response = handler.handleNotReady(new PairingNotReadyException(new SubmissionCounts(2, 5)));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().submitted()).isEqualTo(2);
    assertThat(response.getBody().total()).isEqualTo(5);
  }

  @Test
  void handleSessionNotFoundReturns404() {
    final var response = handler.handleSessionNotFound(new SessionNotFoundException("s1"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.PAIRING_SESSION_NOT_FOUND);
  }

  @Test
  void handleInvalidCredentialsReturns401() {
    final var response = handler.handleInvalidCredentials(new InvalidCredentialsException());

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.PAIRING_INVALID_CREDENTIALS);
  }

  @Test
  void handleRuntimeReturns500() {
    final var response = handler.handleRuntime(new RuntimeException("oops"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo(ApiErrorCode.PAIRING_INTERNAL_ERROR);
  }
}
