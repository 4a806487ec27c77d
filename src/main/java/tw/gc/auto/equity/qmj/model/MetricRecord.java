package tw.gc.auto.equity.qmj.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One immutable panel observation: the raw fundamental metrics and prices of
 * an entity in a period.
 *
 * <p>Missing metrics are simply absent from {@code rawMetrics}. NaN and infinite
 * values are rejected rather than coerced to a numeric default.
 *
 * @param entityId entity identifier (ticker, permno, ...)
 * @param period panel period
 * @param rawMetrics metric name to raw value, present values only
 * @param price closing price of the period, or {@code null} if missing
 * @param prevPrice closing price of the previous period, or {@code null} if missing
 */
public record MetricRecord(
    String entityId,
    Period period,
    Map<String, Double> rawMetrics,
    Double price,
    Double prevPrice
) {
    public MetricRecord {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (period == null) {
            throw new IllegalArgumentException("period cannot be null");
        }
        requireFinite("price", price, entityId, period);
        requireFinite("prev_price", prevPrice, entityId, period);

        TreeMap<String, Double> present = new TreeMap<>();
        if (rawMetrics != null) {
            for (Map.Entry<String, Double> entry : rawMetrics.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                requireFinite(entry.getKey(), entry.getValue(), entityId, period);
                present.put(entry.getKey(), entry.getValue());
            }
        }
        rawMetrics = Collections.unmodifiableMap(present);
    }

    /**
     * @return the raw value of the metric, or {@code null} if missing
     */
    public Double metric(String name) {
        return rawMetrics.get(name);
    }

    public boolean hasMetric(String name) {
        return rawMetrics.containsKey(name);
    }

    /**
     * Returns a copy of this record with additional derived metrics. Existing
     * metrics with the same name are replaced.
     */
    public MetricRecord withMetrics(Map<String, Double> extra) {
        Map<String, Double> merged = new TreeMap<>(rawMetrics);
        merged.putAll(extra);
        return new MetricRecord(entityId, period, merged, price, prevPrice);
    }

    private static void requireFinite(String field, Double value, String entityId, Period period) {
        if (value != null && (value.isNaN() || value.isInfinite())) {
            throw new IllegalArgumentException(String.format(
                "Non-finite value for %s of %s in %s: %s", field, entityId, period, value));
        }
    }
}
