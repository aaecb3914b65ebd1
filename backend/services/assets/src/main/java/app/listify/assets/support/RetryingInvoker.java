package app.listify.assets.support;

import app.listify.assets.error.TransientServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with exponential backoff. Every exception is retried; after the last
 * attempt the final failure propagates with the earlier ones attached as suppressed.
 */
@Component
public class RetryingInvoker {

    private static final Logger log = LoggerFactory.getLogger(RetryingInvoker.class);

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final double jitterRatio;
    private final Sleeper sleeper;

    @Autowired
    public RetryingInvoker(@Value("${app.assets.generation.retry.max-attempts:3}") int maxAttempts,
                           @Value("${app.assets.generation.retry.backoff-ms:2000}") long baseBackoffMs,
                           @Value("${app.assets.generation.retry.max-backoff-ms:10000}") long maxBackoffMs,
                           @Value("${app.assets.generation.retry.jitter-ratio:0.1}") double jitterRatio) {
        this(maxAttempts, baseBackoffMs, maxBackoffMs, jitterRatio, duration -> Thread.sleep(duration.toMillis()));
    }

    public RetryingInvoker(int maxAttempts,
                           long baseBackoffMs,
                           long maxBackoffMs,
                           double jitterRatio,
                           Sleeper sleeper) {
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.baseBackoffMs = Math.max(baseBackoffMs, 0);
        this.maxBackoffMs = Math.max(maxBackoffMs, this.baseBackoffMs);
        this.jitterRatio = Math.max(jitterRatio, 0);
        this.sleeper = sleeper;
    }

    public <T> T invoke(String operation, Attempt<T> attempt) {
        List<Exception> failures = new ArrayList<>();
        for (int attemptNumber = 1; ; attemptNumber++) {
            try {
                return attempt.call();
            } catch (Exception ex) {
                failures.add(ex);
                if (ex instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw exhausted(operation, failures);
                }
                if (attemptNumber >= maxAttempts) {
                    log.warn("{} failed after {} attempts error={}", operation, attemptNumber, ErrorMessages.summarize(ex));
                    throw exhausted(operation, failures);
                }
                Duration delay = Duration.ofMillis(computeBackoff(attemptNumber));
                log.info("{} attempt {}/{} failed, retrying in {}ms error={}",
                        operation, attemptNumber, maxAttempts, delay.toMillis(), ErrorMessages.summarize(ex));
                pause(operation, delay, failures);
            }
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    long computeBackoff(int attempts) {
        long multiplier = 1L << Math.min(Math.max(attempts - 1, 0), 30);
        long backoff = baseBackoffMs * multiplier;
        if (backoff < 0 || backoff > maxBackoffMs) {
            backoff = maxBackoffMs;
        }
        if (jitterRatio > 0 && backoff > 0) {
            long jitter = (long) (ThreadLocalRandom.current().nextDouble() * backoff * jitterRatio);
            backoff = Math.min(backoff + jitter, maxBackoffMs);
        }
        return backoff;
    }

    private void pause(String operation, Duration delay, List<Exception> failures) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            IllegalStateException interrupted = new IllegalStateException(operation + " retry interrupted", ex);
            failures.forEach(interrupted::addSuppressed);
            throw interrupted;
        }
    }

    private RuntimeException exhausted(String operation, List<Exception> failures) {
        Exception last = failures.get(failures.size() - 1);
        RuntimeException propagated = last instanceof RuntimeException runtime
                ? runtime
                : new TransientServiceException(operation + " failed after " + failures.size() + " attempts", last);
        for (int i = 0; i < failures.size() - 1; i++) {
            if (failures.get(i) != propagated) {
                propagated.addSuppressed(failures.get(i));
            }
        }
        return propagated;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
