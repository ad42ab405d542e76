package dev.dylanburati.chainmap;

/**
 * Thrown where a failed {@link Result} or {@link Status} has to be unwrapped,
 * e.g. by the {@link java.util.Map} view of a {@link ChainedHashMap}.
 */
public class AllocationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Status status;

  public AllocationException(Status status) {
    super(status.description());
    if (status.isOk()) {
      throw new IllegalArgumentException("expected a failure status");
    }
    this.status = status;
  }

  public Status status() {
    return this.status;
  }
}
