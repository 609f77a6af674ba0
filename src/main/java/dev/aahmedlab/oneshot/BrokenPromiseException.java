package dev.aahmedlab.oneshot;

/**
 * Terminal error seen by a future whose promise was closed or abandoned without publishing a
 * result.
 *
 * @since 1.0.0
 */
public final class BrokenPromiseException extends FutureStateException {
  private static final long serialVersionUID = 1L;

  public BrokenPromiseException() {
    super(FutureErrorCode.BROKEN_PROMISE);
  }

  public BrokenPromiseException(String message) {
    super(FutureErrorCode.BROKEN_PROMISE, message);
  }
}
