package dev.dylanburati.chainmap;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value produced by a fallible operation, or the {@link Status} that
 * explains why there is none. A successful result never holds {@code null}.
 */
public final class Result<T> {
  private final T value;
  private final Status status;

  private Result(T value, Status status) {
    this.value = value;
    this.status = status;
  }

  public static <T> Result<T> ok(T value) {
    return new Result<>(Objects.requireNonNull(value), Status.OK);
  }

  public static <T> Result<T> failure(Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("expected a failure status");
    }
    return new Result<>(null, status);
  }

  public boolean isOk() {
    return this.status.isOk();
  }

  public Status status() {
    return this.status;
  }

  /** Returns the value, or throws {@link AllocationException} with this result's status. */
  public T get() {
    if (!this.isOk()) {
      throw new AllocationException(this.status);
    }
    return this.value;
  }

  public T orElse(T other) {
    return this.isOk() ? this.value : other;
  }

  public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
    Objects.requireNonNull(mapper);
    if (!this.isOk()) {
      return failure(this.status);
    }
    return ok(mapper.apply(this.value));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Result<?>)) {
      return false;
    }
    Result<?> other = (Result<?>) o;
    return this.status == other.status && Objects.equals(this.value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(this.value, this.status);
  }

  @Override
  public String toString() {
    return this.isOk() ? "Ok(" + this.value + ")" : "Failure(" + this.status.description() + ")";
  }
}
