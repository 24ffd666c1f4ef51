package fun.fengwk.readex.core.concurrent;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Maps a pure function over independent nodes with a fixed worker pool.
 * Output order always equals input order.
 *
 * <p>The function must not mutate shared document state.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ParallelNodeMapper {

    private final ParallelProperties parallelProperties;
    private final ExecutorService workers;
    private final AtomicInteger workerIdGen = new AtomicInteger(1);

    public ParallelNodeMapper(ParallelProperties parallelProperties) {
        this.parallelProperties = parallelProperties;
        this.workers = Executors.newFixedThreadPool(normalizeParallelism(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("readex-node-worker-" + workerIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T, R> List<R> map(List<T> nodes, Function<? super T, ? extends R> processor) {
        if (nodes == null || nodes.isEmpty()) {
            return List.of();
        }
        int size = nodes.size();
        int parallelism = normalizeParallelism();
        if (!parallelProperties.isEnabled() || parallelism <= 1 || size <= parallelProperties.getSequentialThreshold()) {
            return mapSequentially(nodes, processor);
        }
        Object[] results = new Object[size];
        List<CompletableFuture<Void>> futures = size < parallelProperties.getQueueThreshold()
            ? submitBatches(nodes, processor, results, Math.min(parallelism, size))
            : submitQueueWorkers(nodes, processor, results, parallelism);
        await(futures);
        return toList(results);
    }

    <T, R> List<R> mapSequentially(List<T> nodes, Function<? super T, ? extends R> processor) {
        List<R> results = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            results.add(processor.apply(node));
        }
        return results;
    }

    private <T, R> List<CompletableFuture<Void>> submitBatches(
        List<T> nodes, Function<? super T, ? extends R> processor, Object[] results, int batchCount) {
        int size = nodes.size();
        int batchSize = (size + batchCount - 1) / batchCount;
        List<CompletableFuture<Void>> futures = new ArrayList<>(batchCount);
        for (int from = 0; from < size; from += batchSize) {
            int start = from;
            int end = Math.min(size, from + batchSize);
            futures.add(CompletableFuture.runAsync(() -> {
                for (int i = start; i < end; i++) {
                    results[i] = processor.apply(nodes.get(i));
                }
            }, workers));
        }
        return futures;
    }

    private <T, R> List<CompletableFuture<Void>> submitQueueWorkers(
        List<T> nodes, Function<? super T, ? extends R> processor, Object[] results, int workerCount) {
        BlockingQueue<Integer> queue = new LinkedBlockingQueue<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            queue.add(i);
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(workerCount);
        for (int w = 0; w < workerCount; w++) {
            futures.add(CompletableFuture.runAsync(() -> {
                Integer index;
                while ((index = queue.poll()) != null) {
                    results[index] = processor.apply(nodes.get(index));
                }
            }, workers));
        }
        return futures;
    }

    private void await(List<CompletableFuture<Void>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("node processing interrupted");
            throw new IllegalStateException("node processing interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("node processing failed, error={}", cause.getMessage());
            throw new IllegalStateException("node processing failed: " + cause.getMessage(), cause);
        }
    }

    @SuppressWarnings("unchecked")
    private <R> List<R> toList(Object[] results) {
        return (List<R>) Arrays.asList(results);
    }

    private int normalizeParallelism() {
        return Math.max(1, parallelProperties.getMaxParallelism());
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

}
