package com.codeheadsystems.keyward.model;

import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import java.util.Optional;

/**
 * Outcome of a facade operation. Exactly one of {@code value} or {@code errorKind} is meaningful,
 * selected by {@code success}.
 *
 * @param success   whether the operation completed
 * @param value     the result when successful, may be null for void operations
 * @param errorKind the failure category when unsuccessful
 * @param error     human-readable failure message when unsuccessful
 * @param <T>       the result type
 */
public record OperationResult<T>(boolean success, T value, ErrorKind errorKind, String error) {

  public static <T> OperationResult<T> ok(final T value) {
    return new OperationResult<>(true, value, null, null);
  }

  public static <T> OperationResult<T> failure(final ErrorKind kind, final String error) {
    return new OperationResult<>(false, null, kind, error);
  }

  public static <T> OperationResult<T> failure(final KeywardException e) {
    return failure(e.kind(), e.getMessage());
  }

  public Optional<T> asOptional() {
    return success ? Optional.ofNullable(value) : Optional.empty();
  }

  /**
   * Returns the value or rethrows the failure as a {@link KeywardException}.
   */
  public T orElseThrow() {
    if (!success) {
      throw new KeywardException(errorKind, error);
    }
    return value;
  }
}
