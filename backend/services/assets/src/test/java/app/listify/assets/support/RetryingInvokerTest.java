package app.listify.assets.support;

import app.listify.assets.error.TransientServiceException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryingInvokerTest {

    @Test
    void succeedsOnThirdAttempt() {
        List<Duration> sleeps = new ArrayList<>();
        RetryingInvoker invoker = new RetryingInvoker(3, 100, 1000, 0, sleeps::add);
        AtomicInteger calls = new AtomicInteger();

        String result = invoker.invoke("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("busy");
            }
            return "model";
        });

        assertEquals("model", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void propagatesLastFailureAfterMaxAttempts() {
        RetryingInvoker invoker = new RetryingInvoker(3, 0, 0, 0, duration -> { });
        AtomicInteger calls = new AtomicInteger();

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> invoker.invoke("test", () -> {
            throw new IllegalStateException("failure " + calls.incrementAndGet());
        }));

        assertEquals(3, calls.get());
        assertEquals("failure 3", ex.getMessage());
        assertEquals(2, ex.getSuppressed().length);
    }

    @Test
    void wrapsCheckedFailures() {
        RetryingInvoker invoker = new RetryingInvoker(2, 0, 0, 0, duration -> { });
        IOException cause = new IOException("connection reset");

        TransientServiceException ex = assertThrows(TransientServiceException.class, () -> invoker.invoke("Upload", () -> {
            throw cause;
        }));

        assertSame(cause, ex.getCause());
        assertEquals("Upload failed after 2 attempts", ex.getMessage());
    }

    @Test
    void backoffDoublesAndIsCapped() {
        RetryingInvoker invoker = new RetryingInvoker(5, 2000, 10000, 0, duration -> { });

        assertEquals(2000, invoker.computeBackoff(1));
        assertEquals(4000, invoker.computeBackoff(2));
        assertEquals(8000, invoker.computeBackoff(3));
        assertEquals(10000, invoker.computeBackoff(4));
    }

    @Test
    void jitterNeverExceedsCap() {
        RetryingInvoker invoker = new RetryingInvoker(3, 2000, 3000, 0.5, duration -> { });

        for (int i = 0; i < 50; i++) {
            long backoff = invoker.computeBackoff(1);
            assertTrue(backoff >= 2000 && backoff <= 3000, "backoff " + backoff);
        }
    }
}
