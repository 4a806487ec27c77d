package tw.gc.auto.equity.qmj.panel;

import tw.gc.auto.equity.qmj.model.MetricRecord;
import tw.gc.auto.equity.qmj.model.Period;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, in-memory panel of {@link MetricRecord}s.
 *
 * <p>Two views are kept over the same records:
 * <ul>
 *   <li>by period, each period's records sorted by entity id</li>
 *   <li>by entity, a period-ordered history addressed by index, used for
 *       prior-period lookups</li>
 * </ul>
 */
public final class PanelStore {

    private final TreeMap<Period, List<MetricRecord>> byPeriod;
    private final Map<String, List<MetricRecord>> historyByEntity;
    private final Map<EntityPeriod, Integer> historyIndex;
    private final int size;

    private PanelStore(TreeMap<Period, List<MetricRecord>> byPeriod,
                       Map<String, List<MetricRecord>> historyByEntity,
                       Map<EntityPeriod, Integer> historyIndex,
                       int size) {
        this.byPeriod = byPeriod;
        this.historyByEntity = historyByEntity;
        this.historyIndex = historyIndex;
        this.size = size;
    }

    /**
     * Builds a store from the given records.
     *
     * @throws IllegalArgumentException if an entity appears twice in the same period
     */
    public static PanelStore of(Collection<MetricRecord> records) {
        TreeMap<Period, List<MetricRecord>> byPeriod = new TreeMap<>();
        Map<String, List<MetricRecord>> byEntity = new HashMap<>();
        Map<EntityPeriod, Integer> seen = new HashMap<>();

        for (MetricRecord record : records) {
            EntityPeriod key = new EntityPeriod(record.entityId(), record.period());
            if (seen.putIfAbsent(key, 0) != null) {
                throw new IllegalArgumentException(String.format(
                    "Duplicate panel record for %s in %s", record.entityId(), record.period()));
            }
            byPeriod.computeIfAbsent(record.period(), p -> new ArrayList<>()).add(record);
            byEntity.computeIfAbsent(record.entityId(), e -> new ArrayList<>()).add(record);
        }

        TreeMap<Period, List<MetricRecord>> frozenPeriods = new TreeMap<>();
        for (Map.Entry<Period, List<MetricRecord>> entry : byPeriod.entrySet()) {
            List<MetricRecord> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparing(MetricRecord::entityId));
            frozenPeriods.put(entry.getKey(), Collections.unmodifiableList(sorted));
        }

        Map<String, List<MetricRecord>> frozenHistory = new HashMap<>();
        Map<EntityPeriod, Integer> index = new HashMap<>();
        for (Map.Entry<String, List<MetricRecord>> entry : byEntity.entrySet()) {
            List<MetricRecord> history = new ArrayList<>(entry.getValue());
            history.sort(Comparator.comparing(MetricRecord::period));
            for (int i = 0; i < history.size(); i++) {
                index.put(new EntityPeriod(entry.getKey(), history.get(i).period()), i);
            }
            frozenHistory.put(entry.getKey(), Collections.unmodifiableList(history));
        }

        return new PanelStore(frozenPeriods, frozenHistory, index, seen.size());
    }

    /**
     * @return all periods in ascending order
     */
    public List<Period> periods() {
        return List.copyOf(byPeriod.keySet());
    }

    /**
     * @return the period's records sorted by entity id, empty if the period is unknown
     */
    public List<MetricRecord> recordsFor(Period period) {
        return byPeriod.getOrDefault(period, List.of());
    }

    /**
     * @return the entity's records in period order
     */
    public List<MetricRecord> historyOf(String entityId) {
        return historyByEntity.getOrDefault(entityId, List.of());
    }

    /**
     * Record of the same entity immediately preceding {@code record} in the
     * entity's history.
     */
    public Optional<MetricRecord> previousOf(MetricRecord record) {
        Integer position = historyIndex.get(new EntityPeriod(record.entityId(), record.period()));
        if (position == null || position == 0) {
            return Optional.empty();
        }
        return Optional.of(historyByEntity.get(record.entityId()).get(position - 1));
    }

    public List<MetricRecord> allRecords() {
        List<MetricRecord> all = new ArrayList<>(size);
        byPeriod.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return size;
    }

    public int entityCount() {
        return historyByEntity.size();
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private record EntityPeriod(String entityId, Period period) {
    }
}
