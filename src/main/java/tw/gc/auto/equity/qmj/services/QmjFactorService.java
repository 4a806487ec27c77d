package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.model.PeriodFactorReturn;
import tw.gc.auto.equity.qmj.model.PeriodOutcome;
import tw.gc.auto.equity.qmj.model.QmjRunResult;
import tw.gc.auto.equity.qmj.panel.PanelSource;
import tw.gc.auto.equity.qmj.panel.PanelStore;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * QmjFactorService
 *
 * <p>Builds the Quality Minus Junk factor return series from the full panel:
 * <pre>
 * panel ─► growth deltas ─► partition by period ─► PeriodPipeline (per period, in parallel)
 *                                                        │
 *                      sorted factor return series ◄─────┘
 * </pre>
 *
 * <p>Only the growth deltas read across periods. Everything after the partition
 * step works on one period at a time, so each period becomes one worker task.
 * The worker pool lives for a single run and is shut down before the run
 * returns. Results are re-sorted by period because tasks finish in any order,
 * and the output is identical for any worker count.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QmjFactorService {

    private final QmjProperties properties;
    private final PanelSource panelSource;
    private final FactorReturnSink factorReturnSink;
    private final GrowthDeltaCalculator growthDeltaCalculator;
    private final PeriodPipeline periodPipeline;
    private final FactorReturnAggregator factorReturnAggregator;

    private final AtomicReference<QmjRunResult> latestRun = new AtomicReference<>();

    @Scheduled(cron = "${qmj.refresh-cron:0 30 19 * * MON-FRI}", zone = "Asia/Taipei")
    public void refreshScheduled() {
        if (!properties.isRefreshEnabled()) {
            log.debug("Scheduled QMJ refresh disabled");
            return;
        }
        try {
            refresh();
        } catch (Exception e) {
            log.error("❌ Scheduled QMJ refresh failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Loads the panel, recomputes the whole series and publishes it.
     * Nothing is published if any step fails.
     */
    public QmjRunResult refresh() {
        properties.validate();
        PanelStore panel = panelSource.loadPanel();
        QmjRunResult result = computeFactorReturns(panel);
        factorReturnSink.publish(result);
        latestRun.set(result);
        return result;
    }

    /**
     * Runs every stage over the given panel without publishing.
     *
     * @throws tw.gc.auto.equity.qmj.config.QmjConfigurationException before any period runs, if the configuration is invalid
     * @throws IllegalStateException if a period fails; no partial result is returned
     */
    public QmjRunResult computeFactorReturns(PanelStore panel) {
        properties.validate();
        long startTime = System.currentTimeMillis();

        PanelStore enriched = growthDeltaCalculator.withDeltas(panel, properties.configuredMetrics());
        List<Period> periods = enriched.periods();
        log.info("🚀 Starting QMJ run: {} records, {} entities, {} periods",
            enriched.size(), enriched.entityCount(), periods.size());

        int workers = Math.min(properties.getWorkerThreads(), Math.max(1, periods.size()));
        List<PeriodOutcome> outcomes = workers <= 1
            ? runSequential(enriched, periods)
            : runParallel(enriched, periods, workers);
        outcomes.sort(Comparator.comparing(PeriodOutcome::period));

        List<PeriodFactorReturn> series = factorReturnAggregator.merge(outcomes.stream()
            .filter(o -> !o.isSkipped())
            .map(PeriodOutcome::factorReturn)
            .toList());
        List<Period> skipped = outcomes.stream()
            .filter(PeriodOutcome::isSkipped)
            .map(PeriodOutcome::period)
            .toList();

        long durationMs = System.currentTimeMillis() - startTime;
        log.info("✅ QMJ run complete: {} periods computed, {} skipped, {} ms (workers={})",
            series.size(), skipped.size(), durationMs, workers);
        if (!skipped.isEmpty()) {
            log.warn("⚠️ Periods without output: {}", skipped);
        }

        return new QmjRunResult(series, outcomes, skipped, LocalDateTime.now(), durationMs);
    }

    public Optional<QmjRunResult> getLatestRun() {
        return Optional.ofNullable(latestRun.get());
    }

    private List<PeriodOutcome> runSequential(PanelStore panel, List<Period> periods) {
        List<PeriodOutcome> outcomes = new ArrayList<>(periods.size());
        for (Period period : periods) {
            try {
                outcomes.add(periodPipeline.run(period, panel.recordsFor(period)));
            } catch (RuntimeException e) {
                throw new IllegalStateException("QMJ pipeline failed for period " + period, e);
            }
        }
        return outcomes;
    }

    private List<PeriodOutcome> runParallel(PanelStore panel, List<Period> periods, int workers) {
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            Map<Period, Future<PeriodOutcome>> futures = new LinkedHashMap<>();
            for (Period period : periods) {
                futures.put(period, executor.submit(() -> periodPipeline.run(period, panel.recordsFor(period))));
            }

            List<PeriodOutcome> outcomes = new ArrayList<>(periods.size());
            for (Map.Entry<Period, Future<PeriodOutcome>> entry : futures.entrySet()) {
                try {
                    outcomes.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    throw new IllegalStateException("QMJ pipeline failed for period " + entry.getKey(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("QMJ run interrupted at period " + entry.getKey(), e);
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "qmj-period-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
