package dev.aahmedlab.oneshot;

/**
 * Published result held by a {@link SharedState}: exactly one of a value, an application error, or
 * a broken-promise marker. This class is package-private and not part of the public API.
 *
 * @param <T> the value type
 * @param <E> the application error type
 */
final class Outcome<T, E extends Exception> {

  enum Kind {
    VALUE,
    ERROR,
    BROKEN
  }

  private final Kind kind;
  private final T value;
  private final E error;
  private final BrokenPromiseException broken;

  private Outcome(Kind kind, T value, E error, BrokenPromiseException broken) {
    this.kind = kind;
    this.value = value;
    this.error = error;
    this.broken = broken;
  }

  static <T, E extends Exception> Outcome<T, E> value(T value) {
    return new Outcome<>(Kind.VALUE, value, null, null);
  }

  static <T, E extends Exception> Outcome<T, E> error(E error) {
    if (error == null) throw new NullPointerException("error");
    return new Outcome<>(Kind.ERROR, null, error, null);
  }

  static <T, E extends Exception> Outcome<T, E> broken(BrokenPromiseException broken) {
    if (broken == null) throw new NullPointerException("broken");
    return new Outcome<>(Kind.BROKEN, null, null, broken);
  }

  Kind kind() {
    return kind;
  }

  SlotState slotState() {
    return kind == Kind.VALUE ? SlotState.HAS_VALUE : SlotState.HAS_ERROR;
  }

  /**
   * Returns the value, or throws the stored error exactly as it was published.
   *
   * @throws E the application error published by the producer
   * @throws BrokenPromiseException if the producer was discarded without publishing
   */
  T unwrap() throws E {
    switch (kind) {
      case VALUE -> {
        return value;
      }
      case ERROR -> throw error;
      case BROKEN -> throw broken;
      default -> throw new AssertionError("Unhandled outcome kind: " + kind);
    }
  }

  @Override
  public String toString() {
    return switch (kind) {
      case VALUE -> "Outcome[value=" + value + "]";
      case ERROR -> "Outcome[error=" + error + "]";
      case BROKEN -> "Outcome[broken]";
    };
  }
}
