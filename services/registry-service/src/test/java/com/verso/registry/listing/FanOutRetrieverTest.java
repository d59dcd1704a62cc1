package com.verso.registry.listing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class FanOutRetrieverTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void keepsRequestOrderRegardlessOfCompletionOrder() {
        FanOutRetriever retriever = new FanOutRetriever(executor, 5_000L);
        Map<String, Long> delays = Map.of("A", 150L, "B", 0L, "C", 60L);

        FanOutResult<String> result = retriever.fetchAll(List.of("A", "B", "C"), id -> {
            sleep(delays.get(id));
            return Optional.of(id.toLowerCase());
        });

        assertThat(result.present()).containsExactly("a", "b", "c");
    }

    @Test
    void missingAndFailingItemsBecomeEmptySlots() {
        FanOutRetriever retriever = new FanOutRetriever(executor, 5_000L);

        FanOutResult<String> result = retriever.fetchAll(List.of("A", "B", "C", "D"), id -> switch (id) {
            case "B" -> Optional.empty();
            case "C" -> throw new IllegalStateException("store hiccup");
            default -> Optional.of(id);
        });

        assertThat(result.size()).isEqualTo(4);
        assertThat(result.getSlots()).containsExactly(Optional.of("A"), Optional.empty(), Optional.empty(), Optional.of("D"));
        assertThat(result.present()).containsExactly("A", "D");
        assertThat(result.missingCount()).isEqualTo(2);
    }

    @Test
    void emptyRequestNeverTouchesTheExecutor() {
        FanOutRetriever retriever = new FanOutRetriever(executor, 5_000L);

        assertThat(retriever.fetchAll(List.of(), id -> Optional.of(id)).size()).isZero();
    }

    @Test
    void deadlineCancelsOutstandingFetchesAndFailsTheBatch() throws InterruptedException {
        FanOutRetriever retriever = new FanOutRetriever(executor, 100L);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();

        assertThatThrownBy(() -> retriever.fetchAll(List.of("fast", "slow"), id -> {
            if (id.equals("slow")) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                }
            }
            return Optional.of(id);
        }))
            .isInstanceOf(FanOutTimeoutException.class)
            .hasMessageContaining("timed out");

        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted).isTrue();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
