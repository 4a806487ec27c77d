package tw.gc.auto.equity.qmj.services;

import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.model.MetricRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-entity period return.
 *
 * <p>Return = price - prev_price, an absolute price change rather than a
 * percentage. Callers that need a relative return divide by prev_price
 * themselves.
 */
@Component
public class ReturnCalculator {

    /**
     * @return the absolute price change, or {@code null} when either price is missing
     */
    public Double compute(MetricRecord record) {
        if (record.price() == null || record.prevPrice() == null) {
            return null;
        }
        return record.price() - record.prevPrice();
    }

    /**
     * @return entity id to return, for records with both prices present
     */
    public Map<String, Double> computeAll(List<MetricRecord> records) {
        Map<String, Double> returns = new HashMap<>();
        for (MetricRecord record : records) {
            Double value = compute(record);
            if (value != null) {
                returns.put(record.entityId(), value);
            }
        }
        return returns;
    }
}
