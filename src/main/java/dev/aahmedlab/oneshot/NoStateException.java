package dev.aahmedlab.oneshot;

/**
 * Thrown when a future has no result left to hand out, either because {@link Future#get()} already
 * consumed it or because the future was closed.
 *
 * @since 1.0.0
 */
public final class NoStateException extends FutureStateException {
  private static final long serialVersionUID = 1L;

  public NoStateException() {
    super(FutureErrorCode.NO_STATE);
  }

  public NoStateException(String message) {
    super(FutureErrorCode.NO_STATE, message);
  }
}
