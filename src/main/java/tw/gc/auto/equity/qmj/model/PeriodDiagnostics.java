package tw.gc.auto.equity.qmj.model;

import java.util.List;

/**
 * Per-period bookkeeping of a pipeline run.
 *
 * @param period panel period
 * @param entityCount records present in the period
 * @param rankedCount entities with a Quality score (N of the period)
 * @param excludedCount entities left out of the ranking
 * @param qualityCount size of the Quality bucket
 * @param junkCount size of the Junk bucket
 * @param degenerateMetrics metrics with zero cross-sectional variance
 */
public record PeriodDiagnostics(
    Period period,
    int entityCount,
    int rankedCount,
    int excludedCount,
    int qualityCount,
    int junkCount,
    List<String> degenerateMetrics
) {
    public PeriodDiagnostics {
        degenerateMetrics = List.copyOf(degenerateMetrics);
    }
}
