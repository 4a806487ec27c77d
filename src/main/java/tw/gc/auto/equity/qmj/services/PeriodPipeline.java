package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.enums.Bucket;
import tw.gc.auto.equity.qmj.model.CompositeScore;
import tw.gc.auto.equity.qmj.model.DimensionScore;
import tw.gc.auto.equity.qmj.model.MetricRecord;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.model.PeriodDiagnostics;
import tw.gc.auto.equity.qmj.model.PeriodFactorReturn;
import tw.gc.auto.equity.qmj.model.PeriodOutcome;
import tw.gc.auto.equity.qmj.model.PortfolioAssignment;
import tw.gc.auto.equity.qmj.model.RankedEntity;
import tw.gc.auto.equity.qmj.services.CrossSectionalNormalizer.NormalizationResult;

import java.util.List;
import java.util.Map;

/**
 * Runs normalize, aggregate, score, rank, assign and return aggregation for
 * one period, strictly in that order. Holds no state between calls, so
 * different periods can run on different threads.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PeriodPipeline {

    private final QmjProperties properties;
    private final CrossSectionalNormalizer normalizer;
    private final SubFactorAggregator subFactorAggregator;
    private final CompositeScorer compositeScorer;
    private final QualityRanker ranker;
    private final PortfolioAssigner assigner;
    private final ReturnCalculator returnCalculator;
    private final FactorReturnAggregator factorReturnAggregator;

    /**
     * @param records the period's records, each already carrying its delta metrics
     */
    public PeriodOutcome run(Period period, List<MetricRecord> records) {
        if (records.isEmpty()) {
            log.warn("⚠️ Skipping {}: no entities", period);
            return PeriodOutcome.skipped(new PeriodDiagnostics(period, 0, 0, 0, 0, 0, List.of()), "no entities");
        }

        NormalizationResult normalized = normalizer.normalize(period, records, properties.configuredMetrics());
        List<DimensionScore> dimensionScores = subFactorAggregator.aggregate(normalized.records());
        List<CompositeScore> compositeScores = compositeScorer.score(dimensionScores);
        List<RankedEntity> ranked = ranker.rank(compositeScores);

        int excluded = records.size() - ranked.size();
        if (ranked.isEmpty()) {
            log.warn("⚠️ Skipping {}: none of {} entities has a Quality score", period, records.size());
            PeriodDiagnostics diagnostics = new PeriodDiagnostics(
                period, records.size(), 0, excluded, 0, 0, normalized.degenerateMetrics());
            return PeriodOutcome.skipped(diagnostics, "no entity with a Quality score");
        }

        List<PortfolioAssignment> assignments = assigner.assign(ranked);
        Map<String, Double> returns = returnCalculator.computeAll(records);
        PeriodFactorReturn factorReturn = factorReturnAggregator.aggregate(period, assignments, returns);

        PeriodDiagnostics diagnostics = new PeriodDiagnostics(
            period,
            records.size(),
            ranked.size(),
            excluded,
            count(assignments, Bucket.QUALITY),
            count(assignments, Bucket.JUNK),
            normalized.degenerateMetrics());

        log.debug("{}: ranked={} excluded={} quality={} junk={} qmj={}",
            period, ranked.size(), excluded, diagnostics.qualityCount(), diagnostics.junkCount(),
            factorReturn.qmj());
        return PeriodOutcome.computed(factorReturn, ranked, assignments, diagnostics);
    }

    private static int count(List<PortfolioAssignment> assignments, Bucket bucket) {
        return (int) assignments.stream().filter(a -> a.bucket() == bucket).count();
    }
}
