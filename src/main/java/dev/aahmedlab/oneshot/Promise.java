package dev.aahmedlab.oneshot;

import java.lang.ref.Cleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The write side of a one-shot result channel.
 *
 * <p>A promise publishes exactly one result, either a value through {@link #setValue(Object)} or an
 * application error through {@link #setException(Exception)}, to the single {@link Future} obtained
 * from {@link #getFuture()}. Any number of threads may race to publish; exactly one wins and the
 * others get a {@link PromiseAlreadySatisfiedException}.
 *
 * <p>A promise that is closed, or that becomes unreachable, without having published anything
 * breaks: its future then fails with {@link BrokenPromiseException} instead of blocking forever.
 * Use try-with-resources to make that deterministic:
 *
 * <pre>{@code
 * try (Promise<String, IOException> promise = new Promise<>()) {
 *   Future<String, IOException> future = promise.getFuture();
 *   startWork(promise);
 *   ...
 * }
 * }</pre>
 *
 * @param <T> the value type
 * @param <E> the type of application error that may be published instead of a value
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class Promise<T, E extends Exception> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(Promise.class);
  private static final Cleaner CLEANER = Cleaner.create();

  private final SharedState<T, E> state;
  private final Abandonment abandonment;
  private final Cleaner.Cleanable cleanable;
  private volatile boolean closed;

  /**
   * Creates a promise with a fresh, empty shared state.
   *
   * @since 1.0.0
   */
  public Promise() {
    this.state = new SharedState<>();
    this.state.attach();
    this.abandonment = new Abandonment(state);
    this.cleanable = CLEANER.register(this, abandonment);
  }

  /**
   * Returns the future bound to this promise. Only one future is ever handed out.
   *
   * @return the future that observes this promise's result
   * @throws FutureAlreadyRetrievedException if the future was already retrieved
   * @throws NoStateException if this promise has been closed
   * @since 1.0.0
   */
  public Future<T, E> getFuture() {
    if (closed) {
      throw new NoStateException("promise has been closed");
    }
    state.markFutureTaken();
    return new Future<>(state);
  }

  /**
   * Publishes a value and wakes the waiting consumer. {@code null} is a valid value.
   *
   * @param value the value to publish
   * @throws PromiseAlreadySatisfiedException if a result was already published or the promise was
   *     closed
   * @since 1.0.0
   */
  public void setValue(T value) {
    state.publish(Outcome.value(value));
  }

  /**
   * Publishes an application error. The consumer's {@link Future#get()} throws this exact instance.
   *
   * @param exception the error to publish
   * @throws NullPointerException if exception is null
   * @throws PromiseAlreadySatisfiedException if a result was already published or the promise was
   *     closed
   * @since 1.0.0
   */
  public void setException(E exception) {
    if (exception == null) throw new NullPointerException("exception");
    state.publish(Outcome.error(exception));
  }

  /**
   * Publishes a value unless a result is already present.
   *
   * @param value the value to publish
   * @return true if this call published the value
   * @since 1.0.0
   */
  public boolean trySetValue(T value) {
    return state.tryPublish(Outcome.value(value));
  }

  /**
   * Publishes an application error unless a result is already present.
   *
   * @param exception the error to publish
   * @return true if this call published the error
   * @throws NullPointerException if exception is null
   * @since 1.0.0
   */
  public boolean trySetException(E exception) {
    if (exception == null) throw new NullPointerException("exception");
    return state.tryPublish(Outcome.error(exception));
  }

  /**
   * Returns true if a result has been published, including a broken-promise result recorded by
   * {@link #close()}.
   *
   * @return true if this promise can no longer publish
   * @since 1.0.0
   */
  public boolean isSatisfied() {
    return state.isReady();
  }

  /**
   * Releases this promise. If nothing was published, the future observes a {@link
   * BrokenPromiseException}. Calling this method more than once has no further effect.
   *
   * @since 1.0.0
   */
  @Override
  public void close() {
    closed = true;
    abandonment.explicit = true;
    cleanable.clean();
  }

  SharedState<T, E> sharedState() {
    return state;
  }

  /** Runs once, on {@link #close()} or after the promise became unreachable. */
  private static final class Abandonment implements Runnable {
    private final SharedState<?, ?> state;
    private volatile boolean explicit;

    Abandonment(SharedState<?, ?> state) {
      this.state = state;
    }

    @Override
    public void run() {
      boolean broke = state.markBroken();
      if (broke && !explicit) {
        logger.warn("Promise became unreachable without publishing a result; marked broken");
      } else if (broke) {
        logger.debug("Promise closed without publishing a result; marked broken");
      }
      state.release();
    }
  }
}
