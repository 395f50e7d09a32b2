package ch.so.arp.faq.bot;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;

/**
 * Runs provider calls on the provider executor under a resilience4j
 * {@link TimeLimiter}. A call that exceeds the timeout, or whose caller is
 * interrupted while waiting, is cancelled so that it does not keep running in
 * the background.
 */
class ProviderTimeLimiter {

    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;

    ProviderTimeLimiter(String name, ExecutorService executor, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build();
        this.timeLimiter = TimeLimiter.of(name, config);
    }

    Duration timeout() {
        return timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    }

    /**
     * Invoke the call and wait for its result.
     *
     * @param call        the provider call
     * @param description short description used in failure messages
     * @param failure     creates the exception thrown for a failed call
     */
    <T> T call(Supplier<T> call, String description,
            BiFunction<String, Throwable, ? extends RuntimeException> failure) {
        AtomicReference<Future<T>> submitted = new AtomicReference<>();
        // a submitted Future interrupts the worker on cancel, a CompletableFuture would not
        Callable<T> timed = TimeLimiter.decorateFutureSupplier(timeLimiter, () -> {
            Callable<T> task = call::get;
            Future<T> future = executor.submit(task);
            submitted.set(future);
            return future;
        });
        try {
            return timed.call();
        } catch (TimeoutException ex) {
            throw failure.apply(description + " timed out after " + timeout().toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            Future<T> future = submitted.get();
            if (future != null) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw failure.apply(description + " was interrupted", ex);
        } catch (EmbeddingUnavailableException | CompletionUnavailableException ex) {
            throw ex;
        } catch (Exception ex) {
            throw failure.apply(description + " failed: " + ex.getMessage(), ex);
        }
    }
}
