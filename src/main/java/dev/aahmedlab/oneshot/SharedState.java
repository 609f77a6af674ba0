package dev.aahmedlab.oneshot;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The cell shared by one {@link Promise} and its {@link Future}. This class is package-private and
 * not part of the public API.
 *
 * <p>All reads and writes of the slot, its state and the future-taken flag happen under {@link
 * #lock}. The {@code ready} flag is a volatile mirror of "slot is no longer empty" so that {@link
 * #isReady()} can poll without locking. A result is written and waiters are signalled inside the
 * same critical section, so any thread returning from a wait sees the complete payload.
 *
 * @param <T> the value type
 * @param <E> the application error type
 */
final class SharedState<T, E extends Exception> {
  private static final Logger logger = LoggerFactory.getLogger(SharedState.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition published = lock.newCondition();
  private final AtomicInteger holders = new AtomicInteger();

  private Outcome<T, E> slot;
  private SlotState state = SlotState.EMPTY;
  private boolean futureTaken;
  private volatile boolean ready;

  /**
   * Publishes {@code outcome} if nothing has been published yet and wakes every waiter.
   *
   * @return true if this call published, false if a result was already there
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  boolean tryPublish(Outcome<T, E> outcome) {
    if (outcome == null) throw new NullPointerException("outcome");
    lock.lock();
    try {
      if (state != SlotState.EMPTY) {
        return false;
      }
      slot = outcome;
      state = outcome.slotState();
      ready = true;
      published.signalAll();
    } finally {
      lock.unlock();
    }
    logger.debug("Published {}", outcome);
    return true;
  }

  /**
   * Publishes {@code outcome}.
   *
   * @throws PromiseAlreadySatisfiedException if a result was already published
   */
  void publish(Outcome<T, E> outcome) {
    if (!tryPublish(outcome)) {
      throw new PromiseAlreadySatisfiedException();
    }
  }

  /**
   * Records a broken promise unless a result was already published.
   *
   * @return true if the state was empty and is now broken
   */
  boolean markBroken() {
    return tryPublish(Outcome.broken(new BrokenPromiseException()));
  }

  /** Blocks until a result has been published. Does not consume it. */
  void blockUntilReady() throws InterruptedException {
    if (ready) {
      return;
    }
    lock.lockInterruptibly();
    try {
      while (state == SlotState.EMPTY) {
        published.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until a result has been published or the timeout elapses. A timeout of zero or less
   * polls. Does not consume the result.
   */
  WaitStatus waitUntilReadyFor(long timeout, TimeUnit unit) throws InterruptedException {
    if (unit == null) throw new NullPointerException("unit");
    if (ready) {
      return WaitStatus.READY;
    }
    long remainingNanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (state == SlotState.EMPTY) {
        if (remainingNanos <= 0) {
          return WaitStatus.TIMEOUT;
        }
        remainingNanos = published.awaitNanos(remainingNanos);
      }
      return WaitStatus.READY;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Moves the published result out of the slot.
   *
   * @throws NoStateException if nothing was published yet or the result was already taken
   */
  Outcome<T, E> takeResult() {
    Outcome<T, E> taken;
    lock.lock();
    try {
      if (state == SlotState.EMPTY) {
        throw new NoStateException("no result has been published");
      }
      if (state == SlotState.CONSUMED) {
        throw new NoStateException("result already retrieved");
      }
      if (slot == null) {
        throw new NoStateException("shared state has been released");
      }
      taken = slot;
      slot = null;
      state = SlotState.CONSUMED;
    } finally {
      lock.unlock();
    }
    logger.debug("Consumed {}", taken);
    return taken;
  }

  /**
   * Flags that the single future for this state has been handed out.
   *
   * @throws FutureAlreadyRetrievedException if it was handed out before
   */
  void markFutureTaken() {
    lock.lock();
    try {
      if (futureTaken) {
        throw new FutureAlreadyRetrievedException();
      }
      futureTaken = true;
    } finally {
      lock.unlock();
    }
  }

  boolean isReady() {
    return ready;
  }

  SlotState snapshot() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  // Holder accounting: one count per attached Promise or Future.

  void attach() {
    holders.incrementAndGet();
  }

  void release() {
    int remaining = holders.decrementAndGet();
    if (remaining < 0) {
      throw new AssertionError("Shared state released more often than attached");
    }
    if (remaining == 0) {
      SlotState finalState;
      lock.lock();
      try {
        slot = null;
        finalState = state;
      } finally {
        lock.unlock();
      }
      logger.debug("Last holder released shared state in state {}", finalState);
    }
  }

  int holderCount() {
    return holders.get();
  }

  /** Returns true once the last holder has released the state and any payload has been dropped. */
  boolean isReleased() {
    lock.lock();
    try {
      return holders.get() == 0 && slot == null;
    } finally {
      lock.unlock();
    }
  }
}
