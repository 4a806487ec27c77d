package tw.gc.auto.equity.qmj.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cross-sectional z-scores of one entity in one period. Metrics with a missing
 * z-score are absent from the map.
 */
public record StandardizedRecord(String entityId, Period period, Map<String, Double> z) {

    public StandardizedRecord {
        z = Collections.unmodifiableMap(new TreeMap<>(z));
    }

    /**
     * @return the z-score of the metric, or {@code null} if missing
     */
    public Double z(String metric) {
        return z.get(metric);
    }
}
