package com.vidnyan.doclint.application.service;

import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.IntFunction;

/**
 * Bounded pull-model pool.
 *
 * <p>At most {@code limit} workers share one atomic cursor; each claims the next index with a
 * single {@code getAndIncrement} and stops once the cursor passes the end. Every index is therefore
 * claimed exactly once, whatever the worker count, and its result lands in the slot of the same
 * index regardless of completion order.
 */
@RequiredArgsConstructor
public class WorkerPool {

    private final Executor executor;

    /**
     * Run {@code work} for every index in {@code [0, size)} and block until all are done.
     * @return results in index order
     */
    public <T> List<T> drain(int size, int limit, IntFunction<T> work) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1 but was " + limit);
        }
        if (size == 0) {
            return List.of();
        }

        AtomicInteger cursor = new AtomicInteger();
        AtomicReferenceArray<T> slots = new AtomicReferenceArray<>(size);

        int workers = Math.min(limit, size);
        CompletableFuture<?>[] running = new CompletableFuture<?>[workers];
        for (int w = 0; w < workers; w++) {
            running[w] = CompletableFuture.runAsync(() -> {
                int index;
                while ((index = cursor.getAndIncrement()) < size) {
                    slots.set(index, work.apply(index));
                }
            }, executor);
        }

        try {
            CompletableFuture.allOf(running).join();
        } catch (CompletionException e) {
            throw rethrow(e.getCause() != null ? e.getCause() : e);
        }

        List<T> results = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            results.add(slots.get(i));
        }
        return results;
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("worker failed", cause);
    }
}
