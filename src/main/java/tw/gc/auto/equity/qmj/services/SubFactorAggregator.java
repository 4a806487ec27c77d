package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.enums.Dimension;
import tw.gc.auto.equity.qmj.model.DimensionScore;
import tw.gc.auto.equity.qmj.model.StandardizedRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines standardized metrics into the four dimension scores.
 *
 * <p>A dimension score is the arithmetic mean of its configured component
 * z-scores that are present; with no present component it is missing.
 */
@Component
@RequiredArgsConstructor
public class SubFactorAggregator {

    private final QmjProperties properties;

    public List<DimensionScore> aggregate(List<StandardizedRecord> records) {
        Map<Dimension, List<String>> components = properties.getDimensionMetricMap();
        List<DimensionScore> scores = new ArrayList<>(records.size());
        for (StandardizedRecord record : records) {
            Map<Dimension, Double> byDimension = new EnumMap<>(Dimension.class);
            for (Dimension dimension : Dimension.values()) {
                Double score = meanOfPresent(record, components.getOrDefault(dimension, List.of()));
                if (score != null) {
                    byDimension.put(dimension, score);
                }
            }
            scores.add(DimensionScore.of(record.entityId(), record.period(), byDimension));
        }
        return scores;
    }

    private static Double meanOfPresent(StandardizedRecord record, List<String> metrics) {
        double sum = 0.0;
        int present = 0;
        for (String metric : metrics) {
            Double z = record.z(metric);
            if (z != null) {
                sum += z;
                present++;
            }
        }
        return present == 0 ? null : sum / present;
    }
}
