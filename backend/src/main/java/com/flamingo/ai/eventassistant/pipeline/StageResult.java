package com.flamingo.ai.eventassistant.pipeline;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one pipeline stage: either a value or a {@link RetrievalError}. Callers pick the
 * degraded value explicitly with {@link #orElse(Object)}.
 *
 * @param <T> value type
 */
public final class StageResult<T> {

  private final T value;
  private final RetrievalError error;

  private StageResult(T value, RetrievalError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> StageResult<T> success(T value) {
    return new StageResult<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> StageResult<T> failure(RetrievalError error) {
    return new StageResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  public boolean isFailure() {
    return error != null;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if this is a failure
   */
  public T value() {
    if (error != null) {
      throw new IllegalStateException("No value: " + error);
    }
    return value;
  }

  public RetrievalError error() {
    return error;
  }

  public T orElse(T degraded) {
    return error == null ? value : degraded;
  }

  public <R> StageResult<R> map(Function<? super T, ? extends R> mapper) {
    if (error != null) {
      return failure(error);
    }
    return success(mapper.apply(value));
  }

  @Override
  public String toString() {
    return error == null ? "StageResult[success=" + value + "]" : "StageResult[" + error + "]";
  }
}
