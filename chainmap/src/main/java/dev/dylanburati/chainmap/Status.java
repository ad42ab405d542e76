package dev.dylanburati.chainmap;

/**
 * Outcome of a fallible container operation. Absence of a value is not a
 * status; lookups report it with an empty {@link java.util.Optional}.
 */
public enum Status {
  OK("OK"),
  OUT_OF_MEMORY("Out of memory"),
  BAD_ARGUMENT("Bad argument");

  private final String description;

  Status(String description) {
    this.description = description;
  }

  public boolean isOk() {
    return this == OK;
  }

  public String description() {
    return this.description;
  }
}
