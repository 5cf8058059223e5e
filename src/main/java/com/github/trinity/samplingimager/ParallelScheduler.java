package com.github.trinity.samplingimager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Spreads the per-point evaluations of a search grid over a fixed pool of workers
 * and merges the results in grid order.
 *
 * <p>
 * The grid indices are split into one chunk per worker (contiguous ranges or
 * round-robin). Each chunk runs as an independent task on a dedicated
 * {@link ForkJoinPool}. Results are keyed by grid index, so completion order never
 * affects the output. The first failing chunk stops the other tasks and the run
 * ends with a {@link WorkerFailureException}; a partial field is never returned.
 * </p>
 *
 * @author Sean Phillips
 */
public class ParallelScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(ParallelScheduler.class);

    public enum ChunkStrategy {
        CONTIGUOUS,
        ROUND_ROBIN
    }

    private final ChunkStrategy strategy;
    private final ResultAssembler assembler;

    public ParallelScheduler() {
        this(ChunkStrategy.CONTIGUOUS);
    }

    public ParallelScheduler(ChunkStrategy strategy) {
        this(strategy, new ResultAssembler());
    }

    public ParallelScheduler(ChunkStrategy strategy, ResultAssembler assembler) {
        this.strategy = strategy;
        this.assembler = assembler;
    }

    public static int defaultWorkerCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    public ChunkStrategy getStrategy() {
        return strategy;
    }

    /**
     * Evaluates every grid point.
     *
     * @param grid        the search grid; its size fixes the field length and order
     * @param workerCount number of workers, at least 1 (capped at the grid size)
     * @param evaluator   per-point evaluation, called concurrently
     * @return the assembled field and diagnostics
     * @throws WorkerFailureException    if any evaluation throws
     * @throws ImagingCancelledException if the calling thread is interrupted while waiting
     */
    public AssembledField run(SearchGrid grid, int workerCount, GridEvaluator evaluator) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be >= 1, got " + workerCount);
        }
        int n = grid.size();
        int workers = Math.min(workerCount, n);
        List<int[]> chunks = partition(n, workers, strategy);
        LOG.info("Dispatching {} grid points to {} workers ({} chunks)", n, workers, strategy);

        AtomicBoolean stop = new AtomicBoolean(false);
        ForkJoinPool pool = new ForkJoinPool(workers);
        ExecutorCompletionService<List<PointEvaluation>> completion = new ExecutorCompletionService<>(pool);
        Map<Future<List<PointEvaluation>>, int[]> chunkOf = new HashMap<>();
        List<PointEvaluation> results = new ArrayList<>(n);
        try {
            for (int[] chunk : chunks) {
                chunkOf.put(completion.submit(new ChunkTask(chunk, evaluator, stop)), chunk);
            }
            for (int done = 0; done < chunks.size(); done++) {
                Future<List<PointEvaluation>> finished = completion.take();
                try {
                    results.addAll(finished.get());
                } catch (ExecutionException e) {
                    stop.set(true);
                    cancelAll(chunkOf.keySet());
                    throw workerFailure(chunkOf.get(finished), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            stop.set(true);
            cancelAll(chunkOf.keySet());
            Thread.currentThread().interrupt();
            LOG.warn("Imaging run cancelled with {} of {} points evaluated", results.size(), n);
            throw new ImagingCancelledException("Imaging run cancelled", e);
        } finally {
            pool.shutdownNow();
        }
        return assembler.assemble(n, results);
    }

    /**
     * Splits {@code [0, n)} into {@code workers} non-empty chunks.
     */
    static List<int[]> partition(int n, int workers, ChunkStrategy strategy) {
        List<int[]> chunks = new ArrayList<>(workers);
        if (strategy == ChunkStrategy.ROUND_ROBIN) {
            for (int w = 0; w < workers; w++) {
                int[] chunk = new int[(n - w + workers - 1) / workers];
                for (int i = 0, idx = w; idx < n; i++, idx += workers) {
                    chunk[i] = idx;
                }
                chunks.add(chunk);
            }
            return chunks;
        }
        int base = n / workers;
        int extra = n % workers;
        int start = 0;
        for (int w = 0; w < workers; w++) {
            int size = base + (w < extra ? 1 : 0);
            int[] chunk = new int[size];
            for (int i = 0; i < size; i++) {
                chunk[i] = start + i;
            }
            chunks.add(chunk);
            start += size;
        }
        return chunks;
    }

    private static void cancelAll(Iterable<Future<List<PointEvaluation>>> futures) {
        for (Future<List<PointEvaluation>> future : futures) {
            future.cancel(true);
        }
    }

    private static WorkerFailureException workerFailure(int[] chunk, Throwable failure) {
        int failedIndex = -1;
        Throwable cause = failure;
        if (failure instanceof PointFailure) {
            failedIndex = ((PointFailure) failure).index;
            cause = failure.getCause();
        }
        int first = Integer.MAX_VALUE;
        int last = Integer.MIN_VALUE;
        for (int idx : chunk) {
            first = Math.min(first, idx);
            last = Math.max(last, idx);
        }
        LOG.warn("Worker for grid indices [{}, {}] failed at index {}: {}", first, last, failedIndex,
            cause.toString());
        return new WorkerFailureException(first, last, failedIndex, cause);
    }

    private static final class ChunkTask implements Callable<List<PointEvaluation>> {
        private final int[] indices;
        private final GridEvaluator evaluator;
        private final AtomicBoolean stop;

        ChunkTask(int[] indices, GridEvaluator evaluator, AtomicBoolean stop) {
            this.indices = indices;
            this.evaluator = evaluator;
            this.stop = stop;
        }

        @Override
        public List<PointEvaluation> call() {
            List<PointEvaluation> out = new ArrayList<>(indices.length);
            for (int idx : indices) {
                if (stop.get() || Thread.currentThread().isInterrupted()) {
                    // the run is already failing or cancelled; these results are discarded
                    return out;
                }
                try {
                    out.add(evaluator.evaluate(idx));
                } catch (RuntimeException e) {
                    throw new PointFailure(idx, e);
                }
            }
            return out;
        }
    }

    // carries the grid index of a failed evaluation out of the worker
    private static final class PointFailure extends RuntimeException {
        private final int index;

        PointFailure(int index, Throwable cause) {
            super("Evaluation failed at grid index " + index, cause);
            this.index = index;
        }
    }
}
