package dev.aahmedlab.oneshot;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Callable} bound to a {@link Promise}: running it publishes the callable's result, or
 * the exception it threw, to the task's future.
 *
 * <p>The task does not schedule itself. Hand it to a thread or an executor of your choice:
 *
 * <pre>{@code
 * PackagedTask<Integer> task = new PackagedTask<>(() -> compute());
 * Future<Integer, Exception> future = task.getFuture();
 * new Thread(task).start();
 * int result = future.get();
 * }</pre>
 *
 * @param <T> the result type of the callable
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class PackagedTask<T> implements Runnable, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(PackagedTask.class);

  private final Callable<T> task;
  private final Promise<T, Exception> promise = new Promise<>();
  private final AtomicBoolean started = new AtomicBoolean();

  /**
   * Creates a task for the given callable.
   *
   * @param task the work to run
   * @throws NullPointerException if task is null
   * @since 1.0.0
   */
  public PackagedTask(Callable<T> task) {
    if (task == null) throw new NullPointerException("task");
    this.task = task;
  }

  /**
   * Returns the future that receives this task's result.
   *
   * @return the future bound to this task
   * @throws FutureAlreadyRetrievedException if the future was already retrieved
   * @since 1.0.0
   */
  public Future<T, Exception> getFuture() {
    return promise.getFuture();
  }

  /**
   * Runs the callable in the calling thread and publishes its outcome.
   *
   * @throws PromiseAlreadySatisfiedException if the task already ran or was closed
   * @since 1.0.0
   */
  @Override
  public void run() {
    if (!started.compareAndSet(false, true)) {
      throw new PromiseAlreadySatisfiedException();
    }

    T result;
    try {
      result = task.call();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      promise.setException(e);
      return;
    } catch (Exception e) {
      promise.setException(e);
      return;
    } catch (Error e) {
      logger.error("Error occurred while running packaged task", e);
      promise.close();
      throw e;
    }
    promise.setValue(result);
  }

  /**
   * Returns true once the task has run or has been closed.
   *
   * @return true if the task can no longer run
   * @since 1.0.0
   */
  public boolean isDone() {
    return promise.isSatisfied();
  }

  /**
   * Releases the task's promise. If the task never ran, its future fails with {@link
   * BrokenPromiseException}.
   *
   * @since 1.0.0
   */
  @Override
  public void close() {
    started.set(true);
    promise.close();
  }
}
