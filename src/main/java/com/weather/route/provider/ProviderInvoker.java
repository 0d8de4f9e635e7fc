package com.weather.route.provider;

import com.weather.route.core.error.ProviderUnavailableException;
import com.weather.route.metrics.MetricsService;
import com.weather.route.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs collaborator calls with an explicit timeout. Timeouts and failures surface as
 * {@link ProviderUnavailableException}; no retry is attempted here.
 */
public class ProviderInvoker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProviderInvoker.class);

    private final Duration timeout;
    private final MetricsService metricsService;
    private final ExecutorService executor;

    public ProviderInvoker(Duration timeout) {
        this(timeout, new NoOpMetricsService());
    }

    public ProviderInvoker(Duration timeout, MetricsService metricsService) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeout = timeout;
        this.metricsService = metricsService;
        this.executor = Executors.newCachedThreadPool(new ProviderThreadFactory());
    }

    /**
     * Calls {@code call} on a provider thread and waits at most the configured timeout.
     *
     * @param provider provider name used in logs and metrics
     * @throws ProviderUnavailableException on timeout, failure or interruption
     */
    public <T> T invoke(String provider, Supplier<T> call) {
        long started = System.nanoTime();
        Future<T> future = executor.submit(call::get);
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                metricsService.recordProviderCall(provider, "failure", elapsedSince(started));
                throw new ProviderUnavailableException(provider + " provider returned no result");
            }
            metricsService.recordProviderCall(provider, "success", elapsedSince(started));
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            metricsService.recordProviderCall(provider, "timeout", elapsedSince(started));
            log.warn("{} provider timed out after {}", provider, timeout);
            throw new ProviderUnavailableException(provider + " provider timed out after " + timeout, e);
        } catch (ExecutionException e) {
            metricsService.recordProviderCall(provider, "failure", elapsedSince(started));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} provider failed: {}", provider, cause.getMessage());
            if (cause instanceof ProviderUnavailableException unavailable) {
                throw unavailable;
            }
            throw new ProviderUnavailableException(provider + " provider failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while calling " + provider + " provider", e);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static final class ProviderThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
