package tw.gc.auto.equity.qmj.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.model.MetricRecord;
import tw.gc.auto.equity.qmj.panel.PanelSchema;
import tw.gc.auto.equity.qmj.panel.PanelStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives period-over-period change metrics ({@code delta_<metric>}) from each
 * entity's own history.
 *
 * <p>delta(t) = metric(t) - metric(previous record of the entity). The first
 * record of an entity, or a pair where either value is missing, yields a
 * missing delta. This is the only stage that reads across periods, and it runs
 * before the panel is partitioned.
 */
@Component
@Slf4j
public class GrowthDeltaCalculator {

    /**
     * Returns a new store whose records carry the requested delta metrics in
     * addition to their raw metrics. Names without the {@code delta_} prefix
     * are ignored.
     */
    public PanelStore withDeltas(PanelStore panel, Collection<String> metrics) {
        List<String> deltas = metrics.stream()
            .filter(m -> PanelSchema.deltaBase(m).isPresent())
            .distinct()
            .toList();
        if (deltas.isEmpty()) {
            return panel;
        }

        List<MetricRecord> augmented = new ArrayList<>(panel.size());
        int firstObservations = 0;
        for (MetricRecord record : panel.allRecords()) {
            Optional<MetricRecord> previous = panel.previousOf(record);
            if (previous.isEmpty()) {
                firstObservations++;
                augmented.add(record);
                continue;
            }
            Map<String, Double> changes = new HashMap<>();
            for (String delta : deltas) {
                String base = PanelSchema.deltaBase(delta).orElseThrow();
                Double current = record.metric(base);
                Double prior = previous.get().metric(base);
                if (current != null && prior != null) {
                    changes.put(delta, current - prior);
                }
            }
            augmented.add(changes.isEmpty() ? record : record.withMetrics(changes));
        }

        log.debug("Computed {} delta metrics for {} records ({} without prior period)",
            deltas.size(), augmented.size(), firstObservations);
        return PanelStore.of(augmented);
    }
}
