package dev.aahmedlab.oneshot;

/**
 * Static factories for promises and already-completed futures.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class Promises {

  private Promises() {}

  /**
   * Creates a new promise with an empty shared state.
   *
   * @param <T> the value type
   * @param <E> the application error type
   * @return a new promise
   * @since 1.0.0
   */
  public static <T, E extends Exception> Promise<T, E> make() {
    return new Promise<>();
  }

  /**
   * Returns a future that is already ready with the given value.
   *
   * @param value the value, may be null
   * @param <T> the value type
   * @param <E> the application error type
   * @return a ready future
   * @since 1.0.0
   */
  public static <T, E extends Exception> Future<T, E> completed(T value) {
    try (Promise<T, E> promise = new Promise<>()) {
      Future<T, E> future = promise.getFuture();
      promise.setValue(value);
      return future;
    }
  }

  /**
   * Returns a future whose {@link Future#get()} throws the given error.
   *
   * @param exception the error to publish
   * @param <T> the value type
   * @param <E> the application error type
   * @return a ready future
   * @throws NullPointerException if exception is null
   * @since 1.0.0
   */
  public static <T, E extends Exception> Future<T, E> failed(E exception) {
    if (exception == null) throw new NullPointerException("exception");
    try (Promise<T, E> promise = new Promise<>()) {
      Future<T, E> future = promise.getFuture();
      promise.setException(exception);
      return future;
    }
  }
}
