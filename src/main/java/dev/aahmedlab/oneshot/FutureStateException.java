package dev.aahmedlab.oneshot;

/**
 * Base class for misuse of the promise/future protocol.
 *
 * <p>These exceptions are raised synchronously at the call that violated the protocol. They are
 * never retried and never raised on an unrelated thread. Application errors published through
 * {@link Promise#setException(Exception)} are not wrapped in this type; they reach {@link
 * Future#get()} unchanged.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public abstract class FutureStateException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final FutureErrorCode code;

  FutureStateException(FutureErrorCode code) {
    this(code, code.description());
  }

  FutureStateException(FutureErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  /**
   * Returns the error code identifying which rule was broken.
   *
   * @return the error code
   * @since 1.0.0
   */
  public FutureErrorCode code() {
    return code;
  }
}
