/*
 * どこで: Tariff API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 未検出/入力不正/DB 障害を区別したエラー応答に統一するため
 */
package com.insurancecost.tariff.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(TariffNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTariffNotFound(TariffNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.TARIFF_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(InvalidTariffRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTariffRequest(
      InvalidTariffRequestException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド名順に並べ、全件をまとめて返す
    final List<String> errors =
        ex.getBindingResult().getFieldErrors().stream()
            .sorted(
                Comparator.comparing(FieldError::getField)
                    .thenComparing(error -> String.valueOf(error.getDefaultMessage())))
            .map(FieldError::getDefaultMessage)
            .filter(this::hasText)
            .toList();
    return validationFailure(errors, "request body is invalid");
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final List<String> errors =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .sorted()
            .toList();
    return validationFailure(errors, "request is invalid");
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleHandlerMethodValidation(
      HandlerMethodValidationException ex) {
    final List<String> errors =
        ex.getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .filter(this::hasText)
            .sorted()
            .toList();
    return validationFailure(errors, "request is invalid");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return validationFailure(List.of(ex.getName() + " is invalid"), "request is invalid");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出せず、用途に合う短文へ正規化する。
    final String message = resolveUnreadableBodyMessage(ex);
    return validationFailure(List.of(message), message);
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    logger.error("tariff store operation failed", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(ApiErrorCode.STORE_UNAVAILABLE, "tariff store is unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected failure while handling request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> validationFailure(List<String> errors, String fallback) {
    if (errors.isEmpty()) {
      return badRequest(fallback);
    }
    logger.warn(
        "{} validation {} in the recent request:\n  {}",
        errors.size(),
        errors.size() == 1 ? "error" : "errors",
        String.join("\n  ", errors));
    return badRequest(String.join("; ", errors));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private String resolveUnreadableBodyMessage(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return "request body is required";
    }
    return "request body is invalid";
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
