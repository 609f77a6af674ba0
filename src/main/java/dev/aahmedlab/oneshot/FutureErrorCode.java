package dev.aahmedlab.oneshot;

/**
 * Protocol violations reported by promises and futures.
 *
 * @since 1.0.0
 */
public enum FutureErrorCode {
  /**
   * A value or exception was already published to the shared state.
   *
   * @since 1.0.0
   */
  PROMISE_ALREADY_SATISFIED("promise already satisfied"),

  /**
   * The promise already handed out its future.
   *
   * @since 1.0.0
   */
  FUTURE_ALREADY_RETRIEVED("future already retrieved"),

  /**
   * The promise was discarded before it published a result.
   *
   * @since 1.0.0
   */
  BROKEN_PROMISE("broken promise"),

  /**
   * The future has no result to hand out: it was already consumed or the future was closed.
   *
   * @since 1.0.0
   */
  NO_STATE("no state");

  private final String description;

  FutureErrorCode(String description) {
    this.description = description;
  }

  /**
   * Returns a short human readable description of this code.
   *
   * @return the description
   * @since 1.0.0
   */
  public String description() {
    return description;
  }
}
