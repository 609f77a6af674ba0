package examples;

import dev.aahmedlab.oneshot.BrokenPromiseException;
import dev.aahmedlab.oneshot.Future;
import dev.aahmedlab.oneshot.Promise;
import dev.aahmedlab.oneshot.Promises;
import dev.aahmedlab.oneshot.WaitStatus;
import java.io.IOException;
import java.time.Duration;

/**
 * Example demonstrating basic usage of Promise and Future.
 * This is not part of the API - just a demonstration.
 */
public class BasicUsageExample {
    public static void main(String[] args) throws Exception {
        // Hand a value from a worker thread to the main thread
        Promise<Integer, IOException> promise = Promises.make();
        Future<Integer, IOException> future = promise.getFuture();

        new Thread(() -> {
            try {
                Thread.sleep(10);
                promise.setValue(42);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                promise.close(); // consumer sees a broken promise instead of hanging
            }
        }, "producer").start();

        if (future.waitFor(Duration.ofMillis(1)) == WaitStatus.TIMEOUT) {
            System.out.println("Not ready yet, blocking...");
        }
        System.out.println("Result: " + future.get());

        // A producer that gives up without publishing
        Future<String, IOException> abandoned;
        try (Promise<String, IOException> producer = Promises.make()) {
            abandoned = producer.getFuture();
        }
        try {
            abandoned.get();
        } catch (BrokenPromiseException e) {
            System.err.println("Producer went away: " + e.getMessage());
        }
    }
}
