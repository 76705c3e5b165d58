package io.tasklane.backend.api;

/**
 * Uniform response envelope. Exactly one of {@code data} and {@code error} is populated, so every
 * outcome (success or failure) is parsed the same way by clients.
 */
public record ApiResponse<T>(boolean success, T data, ErrorDetail error) {

  public record ErrorDetail(String code, String message) {}

  public static <T> ApiResponse<T> ok(T data) {
    return new ApiResponse<>(true, data, null);
  }

  public static ApiResponse<Void> fail(ErrorCode code, String message) {
    return new ApiResponse<>(false, null, new ErrorDetail(code.name(), message));
  }
}
