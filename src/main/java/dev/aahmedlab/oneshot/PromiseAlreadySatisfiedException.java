package dev.aahmedlab.oneshot;

/**
 * Thrown when a promise is asked to publish a second result.
 *
 * @since 1.0.0
 */
public final class PromiseAlreadySatisfiedException extends FutureStateException {
  private static final long serialVersionUID = 1L;

  public PromiseAlreadySatisfiedException() {
    super(FutureErrorCode.PROMISE_ALREADY_SATISFIED);
  }
}
