package dev.aahmedlab.oneshot;

/**
 * Thrown by {@link Promise#getFuture()} once the future has already been handed out.
 *
 * @since 1.0.0
 */
public final class FutureAlreadyRetrievedException extends FutureStateException {
  private static final long serialVersionUID = 1L;

  public FutureAlreadyRetrievedException() {
    super(FutureErrorCode.FUTURE_ALREADY_RETRIEVED);
  }
}
