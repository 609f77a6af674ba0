package dev.aahmedlab.oneshot;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The read side of a one-shot result channel, obtained from {@link Promise#getFuture()}.
 *
 * <p>{@link #get()} blocks until the promise publishes and then moves the result out; it succeeds
 * once. {@link #await()}, {@link #waitFor(Duration)} and {@link #isReady()} observe readiness
 * without consuming anything and may be called any number of times.
 *
 * <p>Closing a future only detaches it from the shared state. The producer is neither cancelled nor
 * woken.
 *
 * @param <T> the value type
 * @param <E> the type of application error the promise may publish
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class Future<T, E extends Exception> implements AutoCloseable {
  private final AtomicReference<SharedState<T, E>> stateRef;

  Future(SharedState<T, E> state) {
    state.attach();
    this.stateRef = new AtomicReference<>(state);
  }

  /**
   * Waits for the result and takes it.
   *
   * @return the published value
   * @throws E the exact error instance published with {@link Promise#setException(Exception)}
   * @throws BrokenPromiseException if the promise was closed or abandoned without publishing
   * @throws NoStateException if the result was already taken or this future was closed
   * @throws InterruptedException if the current thread was interrupted while waiting
   * @since 1.0.0
   */
  public T get() throws E, InterruptedException {
    SharedState<T, E> state = attached();
    state.blockUntilReady();
    return state.takeResult().unwrap();
  }

  /**
   * Waits at most the given time for the result and takes it. On timeout nothing is consumed and a
   * later call may still succeed.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return the published value
   * @throws E the exact error instance published with {@link Promise#setException(Exception)}
   * @throws BrokenPromiseException if the promise was closed or abandoned without publishing
   * @throws NoStateException if the result was already taken or this future was closed
   * @throws InterruptedException if the current thread was interrupted while waiting
   * @throws TimeoutException if nothing was published in time
   * @since 1.0.0
   */
  public T get(long timeout, TimeUnit unit) throws E, InterruptedException, TimeoutException {
    SharedState<T, E> state = attached();
    if (state.waitUntilReadyFor(timeout, unit) == WaitStatus.TIMEOUT) {
      throw new TimeoutException("no result after " + timeout + " " + unit);
    }
    return state.takeResult().unwrap();
  }

  /**
   * Blocks until a result is published. Does not consume it.
   *
   * @throws NoStateException if this future was closed
   * @throws InterruptedException if the current thread was interrupted while waiting
   * @since 1.0.0
   */
  public void await() throws InterruptedException {
    attached().blockUntilReady();
  }

  /**
   * Blocks until a result is published or the timeout elapses. Does not consume the result. A zero
   * or negative timeout polls.
   *
   * @param timeout the maximum time to wait
   * @return {@link WaitStatus#READY} if a result is available, {@link WaitStatus#TIMEOUT} otherwise
   * @throws NullPointerException if timeout is null
   * @throws NoStateException if this future was closed
   * @throws InterruptedException if the current thread was interrupted while waiting
   * @since 1.0.0
   */
  public WaitStatus waitFor(Duration timeout) throws InterruptedException {
    if (timeout == null) throw new NullPointerException("timeout");
    return waitFor(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
  }

  /**
   * Blocks until a result is published or the timeout elapses. Does not consume the result.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return {@link WaitStatus#READY} if a result is available, {@link WaitStatus#TIMEOUT} otherwise
   * @throws NullPointerException if unit is null
   * @throws NoStateException if this future was closed
   * @throws InterruptedException if the current thread was interrupted while waiting
   * @since 1.0.0
   */
  public WaitStatus waitFor(long timeout, TimeUnit unit) throws InterruptedException {
    return attached().waitUntilReadyFor(timeout, unit);
  }

  /**
   * Returns true if a result has been published. Never blocks. Stays true after {@link #get()} has
   * taken the result; returns false once this future is closed.
   *
   * @return true if a result has been published
   * @since 1.0.0
   */
  public boolean isReady() {
    SharedState<T, E> state = stateRef.get();
    return state != null && state.isReady();
  }

  /**
   * Returns true while this future still has a result to hand out, that is, it is open and {@link
   * #get()} has not taken the result yet.
   *
   * @return true if a call to {@link #get()} may still succeed
   * @since 1.0.0
   */
  public boolean isValid() {
    SharedState<T, E> state = stateRef.get();
    return state != null && state.snapshot() != SlotState.CONSUMED;
  }

  /**
   * Detaches this future from its shared state. Later consumer calls fail with {@link
   * NoStateException}. Calling this method more than once has no further effect.
   *
   * @since 1.0.0
   */
  @Override
  public void close() {
    SharedState<T, E> state = stateRef.getAndSet(null);
    if (state != null) {
      state.release();
    }
  }

  private SharedState<T, E> attached() {
    SharedState<T, E> state = stateRef.get();
    if (state == null) {
      throw new NoStateException("future has been closed");
    }
    return state;
  }
}
