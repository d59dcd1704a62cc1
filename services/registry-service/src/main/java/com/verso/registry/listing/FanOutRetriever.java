package com.verso.registry.listing;

import com.verso.registry.common.RequestContext;
import com.verso.registry.common.RequestContextHolder;
import com.verso.registry.config.RegistryProperties;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Loads entity bodies for a page of IDs concurrently.
 *
 * <p>Each ID is fetched on its own task and lands in the slot matching its position, so output order
 * is input order whatever the completion order. A fetch that finds nothing or fails leaves its slot
 * empty; the batch itself only fails when the request deadline passes or the calling thread is
 * interrupted, and then every outstanding fetch is cancelled.
 */
@Component
public class FanOutRetriever {
    private static final Logger logger = LoggerFactory.getLogger(FanOutRetriever.class);

    private final ExecutorService executor;
    private final long timeoutMs;

    @Autowired
    public FanOutRetriever(@Qualifier("fanOutExecutor") ExecutorService executor, RegistryProperties properties) {
        this(executor, properties.getListing().getFanOutTimeoutMs());
    }

    public FanOutRetriever(ExecutorService executor, long timeoutMs) {
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    public <T> FanOutResult<T> fetchAll(List<String> ids, Function<String, Optional<T>> loader) {
        if (ids.isEmpty()) {
            return FanOutResult.empty();
        }
        List<Callable<Optional<T>>> tasks = new ArrayList<>(ids.size());
        for (String id : ids) {
            tasks.add(() -> load(id, loader));
        }

        List<Future<Optional<T>>> futures;
        try {
            futures = executor.invokeAll(tasks, remainingMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FanOutTimeoutException("request cancelled while fetching " + ids.size() + " entities");
        }

        List<Optional<T>> slots = new ArrayList<>(ids.size());
        for (Future<Optional<T>> future : futures) {
            if (future.isCancelled()) {
                cancelAll(futures);
                Metrics.counter("registry.fanout.timeouts.total").increment();
                throw new FanOutTimeoutException("timed out fetching " + ids.size() + " entities");
            }
            slots.add(resolved(future));
        }
        FanOutResult<T> result = new FanOutResult<>(slots);
        if (result.missingCount() > 0) {
            logger.debug("fan_out requested={} missing={}", result.size(), result.missingCount());
            Metrics.counter("registry.fanout.missing.total").increment(result.missingCount());
        }
        return result;
    }

    private <T> Optional<T> load(String id, Function<String, Optional<T>> loader) {
        try {
            Optional<T> loaded = loader.apply(id);
            return loaded == null ? Optional.empty() : loaded;
        } catch (RuntimeException ex) {
            logger.warn("fan_out_fetch_failed id={} error={}", id, ex.toString());
            return Optional.empty();
        }
    }

    private <T> Optional<T> resolved(Future<Optional<T>> future) {
        try {
            return future.get();
        } catch (ExecutionException | CancellationException ex) {
            logger.warn("fan_out_task_failed error={}", ex.toString());
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FanOutTimeoutException("request cancelled while collecting fetched entities");
        }
    }

    private long remainingMs() {
        RequestContext context = RequestContextHolder.get();
        if (context == null) {
            return timeoutMs;
        }
        return Math.max(1L, timeoutMs - context.elapsedMs());
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
