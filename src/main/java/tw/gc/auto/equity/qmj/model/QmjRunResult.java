package tw.gc.auto.equity.qmj.model;

import tw.gc.auto.equity.qmj.enums.Bucket;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Output of a full-panel run.
 *
 * @param factorReturns factor return series, one entry per computed period, sorted by period
 * @param outcomes every period's outcome (computed and skipped), sorted by period
 * @param skippedPeriods periods absent from the factor return series
 * @param completedAt completion time
 * @param durationMs wall time of the run
 */
public record QmjRunResult(
    List<PeriodFactorReturn> factorReturns,
    List<PeriodOutcome> outcomes,
    List<Period> skippedPeriods,
    LocalDateTime completedAt,
    long durationMs
) {
    public QmjRunResult {
        factorReturns = List.copyOf(factorReturns);
        outcomes = List.copyOf(outcomes);
        skippedPeriods = List.copyOf(skippedPeriods);
    }

    public Optional<PeriodOutcome> outcomeFor(Period period) {
        return outcomes.stream().filter(o -> o.period().equals(period)).findFirst();
    }

    /**
     * Bucket of an entity in a period; empty when the entity was not ranked there.
     */
    public Optional<Bucket> bucketOf(String entityId, Period period) {
        return outcomeFor(period)
            .flatMap(o -> o.assignments().stream()
                .filter(a -> a.entityId().equals(entityId))
                .findFirst())
            .map(PortfolioAssignment::bucket);
    }
}
