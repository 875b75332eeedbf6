package com.example.pairing.api;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidPairingRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidPairingRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_BAD_REQUEST, ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        Optional.ofNullable(ex)
            .flatMap(
                e ->
                    e.getBindingResult().getFieldErrors().stream()
                        .map(DefaultMessageSourceResolvable::getDefaultMessage)
                        .filter(value -> value != null && !value.isBlank())
                        .findFirst())
            .orElse("request validation failed");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_VALIDATION_ERROR, message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    final String message =
        rawMessage.contains("Required request body is missing")
            ? "request body is required"
            : "request body is invalid";
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_VALIDATION_ERROR, message));
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_SESSION_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(ParticipantNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleParticipantNotFound(
      ParticipantNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_PARTICIPANT_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(PairingNotReadyException.class)
  public ResponseEntity<PairingNotReadyErrorResponse> handleNotReady(PairingNotReadyException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            new PairingNotReadyErrorResponse(
                ApiErrorCode.PAIRING_NOT_READY,
                ex.getMessage(),
                ex.counts().submitted(),
                ex.counts().total()));
  }

  @ExceptionHandler(DuplicateParticipantException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateParticipant(
      DuplicateParticipantException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_DUPLICATE_PARTICIPANT, ex.getMessage()));
  }

  @ExceptionHandler(InvalidCredentialsException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidCredentials(
      InvalidCredentialsException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_INVALID_CREDENTIALS, ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled pairing api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.PAIRING_INTERNAL_ERROR, ex.getMessage()));
  }
}
