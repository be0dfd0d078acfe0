package org.nowstart.crossover.backtest.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import org.nowstart.crossover.backtest.model.BacktestResult;
import org.nowstart.crossover.backtest.model.CrossoverParams;
import org.nowstart.crossover.backtest.model.GridSearchRow;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.nowstart.crossover.backtest.model.WindowGrid;
import org.nowstart.crossover.data.exception.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WindowGridSearchService {

    private static final Logger log = LoggerFactory.getLogger(WindowGridSearchService.class);

    private final BacktestEngineFactory engineFactory;

    public List<GridSearchRow> search(
            PriceSeries series,
            WindowGrid grid,
            double costRate,
            int topK,
            int parallelism,
            int progressLogSeconds
    ) {
        if (topK <= 0) {
            throw new InvalidParameterException("top-k must be > 0, got: " + topK);
        }
        if (parallelism <= 0 || progressLogSeconds <= 0) {
            throw new InvalidParameterException("grid parallelism and progress interval must be > 0");
        }
        List<int[]> pairs = grid.pairs(series.size());
        if (pairs.isEmpty()) {
            throw new InvalidParameterException("grid has no short < long window pair that fits " + series.size() + " rows");
        }

        List<CrossoverParams> candidates = pairs.stream()
                .map(pair -> new CrossoverParams(pair[0], pair[1], costRate))
                .toList();
        Comparator<GridSearchRow> better = rankingComparator();
        TopCandidates top = new TopCandidates(topK, better);
        GridProgress progress = new GridProgress(candidates.size(), TimeUnit.SECONDS.toNanos(progressLogSeconds));
        log.info("[Grid][Start] series={} combinations={} topK={} parallelism={}",
                series.size(), candidates.size(), topK, parallelism);

        evaluateAll(candidates, parallelism, params -> {
            // One engine per candidate; engines are never shared across pool threads.
            BacktestResult result = engineFactory.create(series).run(params);
            top.offer(new GridSearchRow(params, result.metrics(), result.positionChanges()));
            progress.completed();
        });

        progress.finished();
        return top.ranked();
    }

    private void evaluateAll(List<CrossoverParams> candidates, int parallelism, Consumer<CrossoverParams> task) {
        if (parallelism == 1) {
            candidates.forEach(task);
            return;
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            pool.submit(() -> candidates.parallelStream().forEach(task)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Grid search interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Grid search failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    Comparator<GridSearchRow> rankingComparator() {
        return Comparator
                .comparingDouble((GridSearchRow row) -> rankValue(row.metrics().sharpeRatio())).reversed()
                .thenComparing(Comparator.comparingDouble((GridSearchRow row) -> rankValue(row.metrics().totalReturn())).reversed())
                .thenComparingInt(row -> row.params().shortWindow())
                .thenComparingInt(row -> row.params().longWindow());
    }

    private static double rankValue(double value) {
        return Double.isFinite(value) ? value : Double.NEGATIVE_INFINITY;
    }

    /**
     * Best {@code limit} rows seen so far, kept sorted best-first.
     */
    static final class TopCandidates {

        private final int limit;
        private final Comparator<GridSearchRow> order;
        private final List<GridSearchRow> rows = new ArrayList<>();

        TopCandidates(int limit, Comparator<GridSearchRow> order) {
            this.limit = limit;
            this.order = order;
        }

        synchronized void offer(GridSearchRow row) {
            int position = Collections.binarySearch(rows, row, order);
            int insertAt = position >= 0 ? position : -position - 1;
            if (insertAt >= limit) {
                return;
            }
            rows.add(insertAt, row);
            if (rows.size() > limit) {
                rows.remove(rows.size() - 1);
            }
        }

        synchronized List<GridSearchRow> ranked() {
            return List.copyOf(rows);
        }
    }

    private static final class GridProgress {

        private final int total;
        private final long intervalNanos;
        private final long startedAtNanos = System.nanoTime();
        private final AtomicInteger done = new AtomicInteger();
        private final AtomicLong nextLogAtNanos;

        private GridProgress(int total, long intervalNanos) {
            this.total = total;
            this.intervalNanos = intervalNanos;
            this.nextLogAtNanos = new AtomicLong(startedAtNanos + intervalNanos);
        }

        void completed() {
            int count = done.incrementAndGet();
            long now = System.nanoTime();
            long due = nextLogAtNanos.get();
            if (now < due || !nextLogAtNanos.compareAndSet(due, now + intervalNanos)) {
                return;
            }
            log.info("[Grid][Progress] done={}/{} ({}%) rate={}/s",
                    count,
                    total,
                    String.format(Locale.US, "%.2f", count * 100.0 / total),
                    Math.round(count / elapsedSeconds(now)));
        }

        void finished() {
            double elapsed = elapsedSeconds(System.nanoTime());
            log.info("[Grid][Done] done={}/{} elapsedSec={} rate={}/s",
                    done.get(),
                    total,
                    String.format(Locale.US, "%.2f", elapsed),
                    Math.round(done.get() / elapsed));
        }

        private double elapsedSeconds(long now) {
            return Math.max(1e-9, (now - startedAtNanos) / 1_000_000_000.0);
        }
    }
}
