package dev.aahmedlab.oneshot;

import static org.junit.jupiter.api.Assertions.*;

import dev.aahmedlab.oneshot.PromiseTestSupport.CustomException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("slow")
class ConcurrencyTest {

  private ExecutorService threads;

  @BeforeEach
  void setUp() {
    threads = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    threads.shutdownNow();
    assertTrue(threads.awaitTermination(5, TimeUnit.SECONDS), "test threads did not terminate");
  }

  @Test
  void exactlyOneOfManyRacingSettersWins() throws Exception {
    int racers = 16;

    for (int round = 0; round < 50; round++) {
      Promise<Integer, CustomException> promise = PromiseTestSupport.newPromise();
      Future<Integer, CustomException> future = promise.getFuture();
      CountDownLatch start = new CountDownLatch(1);
      CountDownLatch finished = new CountDownLatch(racers);
      AtomicInteger winners = new AtomicInteger();
      AtomicInteger losers = new AtomicInteger();
      AtomicInteger winningValue = new AtomicInteger(-1);

      for (int i = 0; i < racers; i++) {
        int value = i;
        threads.submit(
            () -> {
              try {
                start.await();
                promise.setValue(value);
                winners.incrementAndGet();
                winningValue.set(value);
              } catch (PromiseAlreadySatisfiedException expected) {
                losers.incrementAndGet();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              } finally {
                finished.countDown();
              }
            });
      }

      start.countDown();
      PromiseTestSupport.awaitLatch(finished);

      assertEquals(1, winners.get(), "round " + round);
      assertEquals(racers - 1, losers.get(), "round " + round);
      assertEquals(winningValue.get(), future.get(1, TimeUnit.SECONDS));
    }
  }

  @Test
  void valueAndExceptionRaceHasSingleOutcome() throws Exception {
    for (int round = 0; round < 100; round++) {
      Promise<Integer, CustomException> promise = PromiseTestSupport.newPromise();
      Future<Integer, CustomException> future = promise.getFuture();
      CountDownLatch start = new CountDownLatch(1);
      AtomicInteger successes = new AtomicInteger();

      java.util.concurrent.Future<?> setter =
          threads.submit(
              () -> {
                start.await();
                if (promise.trySetValue(1)) successes.incrementAndGet();
                return null;
              });
      java.util.concurrent.Future<?> failer =
          threads.submit(
              () -> {
                start.await();
                if (promise.trySetException(new CustomException("lost?"))) {
                  successes.incrementAndGet();
                }
                return null;
              });
      java.util.concurrent.Future<?> closer =
          threads.submit(
              () -> {
                start.await();
                promise.close();
                return null;
              });

      start.countDown();
      setter.get(2, TimeUnit.SECONDS);
      failer.get(2, TimeUnit.SECONDS);
      closer.get(2, TimeUnit.SECONDS);

      assertTrue(successes.get() <= 1, "more than one publisher won in round " + round);
      SlotState state = promise.sharedState().snapshot();
      assertTrue(state == SlotState.HAS_VALUE || state == SlotState.HAS_ERROR);
      try {
        assertEquals(1, future.get());
        assertEquals(1, successes.get());
      } catch (CustomException | BrokenPromiseException e) {
        assertEquals(e instanceof CustomException ? 1 : 0, successes.get());
      }
    }
  }

  @Test
  void allWaitersWakeOnPublish() throws Exception {
    Promise<Integer, CustomException> promise = PromiseTestSupport.newPromise();
    Future<Integer, CustomException> future = promise.getFuture();
    int waiters = 8;
    CountDownLatch started = new CountDownLatch(waiters);
    CountDownLatch woke = new CountDownLatch(waiters);

    for (int i = 0; i < waiters; i++) {
      threads.submit(
          () -> {
            started.countDown();
            try {
              future.await();
              woke.countDown();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          });
    }

    PromiseTestSupport.awaitLatch(started);
    assertFalse(woke.await(50, TimeUnit.MILLISECONDS), "waiters returned before publish");

    promise.setValue(3);

    assertTrue(woke.await(2, TimeUnit.SECONDS), "not every waiter woke up");
    assertEquals(3, future.get());
  }

  @Test
  void consumerSeesFullyConstructedPayload() throws Exception {
    int rounds = 2000;
    AtomicReference<Throwable> firstError = new AtomicReference<>();

    for (int round = 0; round < rounds; round++) {
      Promise<List<Integer>, CustomException> promise = Promises.make();
      Future<List<Integer>, CustomException> future = promise.getFuture();
      int size = round % 64;

      threads.submit(
          () -> {
            List<Integer> payload = new ArrayList<>();
            for (int i = 0; i < size; i++) {
              payload.add(i);
            }
            promise.setValue(payload);
          });

      List<Integer> received = future.get(2, TimeUnit.SECONDS);
      if (received.size() != size) {
        firstError.compareAndSet(
            null, new AssertionError("round " + round + " saw " + received.size() + " items"));
      }
    }

    assertNull(firstError.get());
  }

  @Test
  void onlyOneOfRacingGetsTakesTheResult() throws Exception {
    for (int round = 0; round < 50; round++) {
      Promise<Integer, CustomException> promise = PromiseTestSupport.newPromise();
      Future<Integer, CustomException> future = promise.getFuture();
      int readers = 4;
      CountDownLatch finished = new CountDownLatch(readers);
      AtomicInteger taken = new AtomicInteger();
      AtomicInteger noState = new AtomicInteger();

      for (int i = 0; i < readers; i++) {
        threads.submit(
            () -> {
              try {
                future.get();
                taken.incrementAndGet();
              } catch (NoStateException e) {
                noState.incrementAndGet();
              } catch (CustomException | InterruptedException e) {
                throw new AssertionError(e);
              } finally {
                finished.countDown();
              }
            });
      }

      promise.setValue(round);
      PromiseTestSupport.awaitLatch(finished);

      assertEquals(1, taken.get(), "round " + round);
      assertEquals(readers - 1, noState.get(), "round " + round);
    }
  }
}
