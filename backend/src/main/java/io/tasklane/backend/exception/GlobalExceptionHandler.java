package io.tasklane.backend.exception;

import io.tasklane.backend.api.ApiResponse;
import io.tasklane.backend.api.ErrorCode;
import io.tasklane.backend.security.CallerContextNotBoundException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Converts every failure raised below the controllers into the {@link ApiResponse} envelope.
 * Messages are taken only from this application's own exceptions; framework and infrastructure
 * failures get the generic message of their {@link ErrorCode}.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<ApiResponse<Void>> handleForbidden(
      ForbiddenException ex, HttpServletRequest request) {
    log.warn(
        "security.access_denied: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getReason());
    return envelope(ErrorCode.NOT_FOUND, ex.getBody().getDetail());
  }

  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<ApiResponse<Void>> handleStoreFailure(
      Exception ex, HttpServletRequest request) {
    log.error(
        "Store operation failed: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    return envelope(ErrorCode.STORE_UNAVAILABLE, ErrorCode.STORE_UNAVAILABLE.defaultMessage());
  }

  @ExceptionHandler(CallerContextNotBoundException.class)
  public ResponseEntity<ApiResponse<Void>> handleCallerContextNotBound(
      CallerContextNotBoundException ex) {
    log.error("Caller context invariant violation: {}", ex.getMessage());
    return envelope(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.defaultMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    log.error(
        "Unhandled exception: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    return envelope(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.defaultMessage());
  }

  @Override
  protected ResponseEntity<Object> handleTypeMismatch(
      TypeMismatchException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request) {
    // A path segment that is not a valid id can never name a resource the caller owns
    if (ex instanceof MethodArgumentTypeMismatchException mismatch
        && mismatch.getParameter().hasParameterAnnotation(PathVariable.class)) {
      return handleExceptionInternal(
          ex,
          ApiResponse.fail(ErrorCode.NOT_FOUND, ErrorCode.NOT_FOUND.defaultMessage()),
          headers,
          HttpStatus.NOT_FOUND,
          request);
    }
    String parameter = ex.getPropertyName() != null ? ex.getPropertyName() : "parameter";
    return handleExceptionInternal(
        ex,
        ApiResponse.fail(ErrorCode.VALIDATION_ERROR, "Invalid value for " + parameter),
        headers,
        status,
        request);
  }

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .sorted()
            .collect(Collectors.joining("; "));
    if (message.isEmpty()) {
      message = ErrorCode.VALIDATION_ERROR.defaultMessage();
    }
    return handleExceptionInternal(
        ex, ApiResponse.fail(ErrorCode.VALIDATION_ERROR, message), headers, status, request);
  }

  @Override
  protected ResponseEntity<Object> handleExceptionInternal(
      Exception ex,
      Object body,
      HttpHeaders headers,
      HttpStatusCode statusCode,
      WebRequest request) {
    if (body instanceof ApiResponse<?>) {
      return new ResponseEntity<>(body, headers, statusCode);
    }

    ErrorCode code = ErrorCode.forStatus(statusCode.value());
    String message = code.defaultMessage();
    if (ex instanceof ErrorResponse errorResponse) {
      ProblemDetail problem = errorResponse.getBody();
      if (problem.getProperties() != null
          && problem.getProperties().get("code") instanceof String ownCode) {
        code = ErrorCode.valueOf(ownCode);
        message = problem.getDetail();
      }
    }

    if (statusCode.is5xxServerError()) {
      log.error("Request failed with status {}", statusCode.value(), ex);
    } else {
      log.debug(
          "Request rejected: status={}, code={}, reason={}",
          statusCode.value(),
          code,
          ex.getMessage());
    }
    return new ResponseEntity<>(ApiResponse.fail(code, message), headers, statusCode);
  }

  private static ResponseEntity<ApiResponse<Void>> envelope(ErrorCode code, String message) {
    return ResponseEntity.status(code.status()).body(ApiResponse.fail(code, message));
  }
}
