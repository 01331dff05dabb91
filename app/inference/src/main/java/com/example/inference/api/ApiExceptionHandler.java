/*
 * どこで: Inference API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: クライアント起因 (4xx) とサーバ起因 (5xx) のエラー応答を {code, message} に統一するため
 */
package com.example.inference.api;

import com.example.inference.artifact.ArtifactLoadException;
import com.example.inference.service.FeatureAlignmentException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidInferenceRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidInferenceRequestException ex) {
    return badRequest(ApiErrorCode.VALIDATION_ERROR, ex.getMessage());
  }

  @ExceptionHandler(FeatureAlignmentException.class)
  public ResponseEntity<ApiErrorResponse> handleAlignment(FeatureAlignmentException ex) {
    return badRequest(ex.failure().errorCode(), ex.getMessage());
  }

  @ExceptionHandler(ArtifactUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleArtifactUnavailable(
      ArtifactUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(ApiErrorCode.ARTIFACT_UNAVAILABLE, ex.getMessage()));
  }

  @ExceptionHandler(ArtifactLoadException.class)
  public ResponseEntity<ApiErrorResponse> handleArtifactLoad(ArtifactLoadException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.ARTIFACT_LOAD_FAILED, ex.getMessage()));
  }

  @ExceptionHandler(OutcomeConflictException.class)
  public ResponseEntity<ApiErrorResponse> handleOutcomeConflict(OutcomeConflictException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.OUTCOME_CONFLICT, ex.getMessage()));
  }

  @ExceptionHandler(DriftEvaluationInProgressException.class)
  public ResponseEntity<ApiErrorResponse> handleDriftEvaluationRunning(
      DriftEvaluationInProgressException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(ApiErrorCode.DRIFT_EVALUATION_RUNNING, ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(ApiErrorCode.VALIDATION_ERROR, message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(ApiErrorCode.VALIDATION_ERROR, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest(ApiErrorCode.VALIDATION_ERROR, "request body is required");
    }
    return badRequest(ApiErrorCode.VALIDATION_ERROR, "request body is invalid");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex) {
    // 405/404 など Spring MVC 自身の例外はその状態コードを保つ
    if (ex instanceof ErrorResponse errorResponse) {
      final HttpStatusCode status = errorResponse.getStatusCode();
      final ApiErrorCode code;
      if (status.value() == HttpStatus.NOT_FOUND.value()) {
        code = ApiErrorCode.NOT_FOUND;
      } else if (status.is4xxClientError()) {
        code = ApiErrorCode.VALIDATION_ERROR;
      } else {
        code = ApiErrorCode.INTERNAL_ERROR;
      }
      return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
    }
    logger.error("unexpected error while handling request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(ApiErrorCode code, String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
