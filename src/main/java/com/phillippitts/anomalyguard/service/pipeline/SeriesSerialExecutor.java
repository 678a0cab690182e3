package com.phillippitts.anomalyguard.service.pipeline;

import com.phillippitts.anomalyguard.domain.SeriesKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks on a shared executor, serialized per series.
 *
 * <p>Tasks of one series run one at a time in submission order; tasks of different series run
 * in parallel up to the delegate's capacity. Each submission swaps itself in as the tail of the
 * series' chain and starts once the previous tail completed, successfully or not.
 */
public class SeriesSerialExecutor {

    private final Executor delegate;
    private final ConcurrentMap<SeriesKey, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public SeriesSerialExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * @param seriesKey series the task belongs to
     * @param task      work to run
     * @return completes when the task finished; exceptionally if it threw
     */
    public CompletableFuture<Void> submit(SeriesKey seriesKey, Runnable task) {
        Objects.requireNonNull(task, "task");
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(seriesKey, gate);
        CompletableFuture<Void> base = previous == null ? CompletableFuture.completedFuture(null) : previous;
        base.whenComplete((ignored, previousError) -> start(gate, task));
        gate.whenComplete((ignored, error) -> tails.remove(seriesKey, gate));
        return gate;
    }

    /**
     * @return number of series with queued or running tasks
     */
    public int activeSeries() {
        return tails.size();
    }

    private void start(CompletableFuture<Void> gate, Runnable task) {
        try {
            delegate.execute(() -> {
                try {
                    task.run();
                    gate.complete(null);
                } catch (Throwable t) {
                    gate.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            gate.completeExceptionally(e);
        }
    }
}
