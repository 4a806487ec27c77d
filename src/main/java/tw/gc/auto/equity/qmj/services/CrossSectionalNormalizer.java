package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.enums.MissingValuePolicy;
import tw.gc.auto.equity.qmj.model.MetricRecord;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.model.StandardizedRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Standardizes raw metrics within a single period.
 *
 * <p>For each metric, the population mean and population standard deviation
 * are taken over the entities with a present value (two passes: mean first,
 * then squared deviations from it). z = (x - mean) / std.
 *
 * <p>When the standard deviation is zero every present value maps to z = 0 and
 * a warning is logged once for that (period, metric).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CrossSectionalNormalizer {

    private final QmjProperties properties;

    public NormalizationResult normalize(Period period, List<MetricRecord> records, Collection<String> metrics) {
        List<MetricRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(MetricRecord::entityId));

        Map<String, Map<String, Double>> zByEntity = new HashMap<>();
        for (MetricRecord record : ordered) {
            zByEntity.put(record.entityId(), new HashMap<>());
        }

        List<String> degenerate = new ArrayList<>();
        for (String metric : metrics) {
            if (!standardizeMetric(period, metric, ordered, zByEntity)) {
                degenerate.add(metric);
            }
        }

        boolean zeroFill = properties.getMissingValuePolicy() == MissingValuePolicy.ZERO_FILL;
        List<StandardizedRecord> standardized = new ArrayList<>(ordered.size());
        for (MetricRecord record : ordered) {
            Map<String, Double> z = zByEntity.get(record.entityId());
            if (zeroFill) {
                for (String metric : metrics) {
                    z.putIfAbsent(metric, 0.0);
                }
            }
            standardized.add(new StandardizedRecord(record.entityId(), period, z));
        }
        return new NormalizationResult(standardized, degenerate);
    }

    /**
     * @return {@code false} if the metric had zero variance in this period
     */
    private boolean standardizeMetric(Period period, String metric, List<MetricRecord> ordered,
                                      Map<String, Map<String, Double>> zByEntity) {
        int count = 0;
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (MetricRecord record : ordered) {
            Double value = record.metric(metric);
            if (value != null) {
                sum += value;
                min = Math.min(min, value);
                max = Math.max(max, value);
                count++;
            }
        }
        if (count == 0) {
            return true;
        }

        // Identical values: the rounded mean can differ from them by an ulp
        double std = min == max ? 0.0 : populationStd(metric, ordered, sum / count, count);

        if (std == 0.0) {
            log.warn("⚠️ Zero cross-sectional variance for {} in {} ({} entities), z-scores set to 0",
                metric, period, count);
            for (MetricRecord record : ordered) {
                if (record.hasMetric(metric)) {
                    zByEntity.get(record.entityId()).put(metric, 0.0);
                }
            }
            return false;
        }

        double mean = sum / count;
        for (MetricRecord record : ordered) {
            Double value = record.metric(metric);
            if (value != null) {
                zByEntity.get(record.entityId()).put(metric, (value - mean) / std);
            }
        }
        return true;
    }

    private static double populationStd(String metric, List<MetricRecord> ordered, double mean, int count) {
        double squaredDeviations = 0.0;
        for (MetricRecord record : ordered) {
            Double value = record.metric(metric);
            if (value != null) {
                double deviation = value - mean;
                squaredDeviations += deviation * deviation;
            }
        }
        return Math.sqrt(squaredDeviations / count);
    }

    /**
     * @param records one standardized record per input record, sorted by entity id
     * @param degenerateMetrics metrics whose cross-sectional variance was zero
     */
    public record NormalizationResult(List<StandardizedRecord> records, List<String> degenerateMetrics) {
        public NormalizationResult {
            records = List.copyOf(records);
            degenerateMetrics = List.copyOf(degenerateMetrics);
        }
    }
}
