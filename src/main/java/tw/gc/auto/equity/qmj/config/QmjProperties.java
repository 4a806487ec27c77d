package tw.gc.auto.equity.qmj.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.enums.CompositePolicy;
import tw.gc.auto.equity.qmj.enums.Dimension;
import tw.gc.auto.equity.qmj.enums.MissingValuePolicy;
import tw.gc.auto.equity.qmj.enums.TieBreakKey;
import tw.gc.auto.equity.qmj.panel.PanelSchema;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Component
@ConfigurationProperties(prefix = "qmj")
public class QmjProperties {

    /**
     * Component metrics of each quality dimension. Growth is defined over the
     * period-over-period changes of the profitability metrics.
     */
    private Map<Dimension, List<String>> dimensionMetricMap = defaultDimensionMetricMap();

    private MissingValuePolicy missingValuePolicy = MissingValuePolicy.EXCLUDE;

    private CompositePolicy compositePolicy = CompositePolicy.LENIENT;

    private double topDecileFraction = 0.1;

    private double bottomDecileFraction = 0.1;

    private TieBreakKey tieBreakKey = TieBreakKey.ENTITY_ID_ASC;

    /**
     * Period partitions computed concurrently. 1 runs every period in the caller thread.
     */
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    /** Source table of the input panel */
    private String panelTable = "qmj_panel";

    private boolean refreshEnabled = true;

    public static Map<Dimension, List<String>> defaultDimensionMetricMap() {
        Map<Dimension, List<String>> map = new EnumMap<>(Dimension.class);
        map.put(Dimension.PROFITABILITY, new ArrayList<>(List.of("gpoa", "roe", "roa", "cfoa", "gmar", "acc")));
        map.put(Dimension.GROWTH, new ArrayList<>(List.of(
            "delta_gpoa", "delta_roe", "delta_roa", "delta_cfoa", "delta_gmar")));
        map.put(Dimension.SAFETY, new ArrayList<>(List.of("bab", "lev", "o", "z", "evol")));
        map.put(Dimension.PAYOUT, new ArrayList<>(List.of("eiss", "diss", "npop")));
        return map;
    }

    /**
     * Every metric referenced by the dimension map, in dimension order.
     */
    public Set<String> configuredMetrics() {
        Set<String> metrics = new LinkedHashSet<>();
        for (Dimension dimension : Dimension.values()) {
            metrics.addAll(dimensionMetricMap.getOrDefault(dimension, List.of()));
        }
        return metrics;
    }

    /**
     * @throws QmjConfigurationException if the configuration cannot drive a run
     */
    public void validate() {
        if (dimensionMetricMap == null) {
            throw new QmjConfigurationException("qmj.dimension-metric-map must be set");
        }
        for (Dimension dimension : Dimension.values()) {
            List<String> metrics = dimensionMetricMap.get(dimension);
            if (metrics == null || metrics.isEmpty()) {
                throw new QmjConfigurationException("No metrics configured for dimension " + dimension);
            }
            for (String metric : metrics) {
                if (metric == null || !PanelSchema.isKnownMetric(metric)) {
                    throw new QmjConfigurationException(
                        "Unknown metric '" + metric + "' configured for dimension " + dimension);
                }
            }
        }
        requireFraction("top-decile-fraction", topDecileFraction);
        requireFraction("bottom-decile-fraction", bottomDecileFraction);
        if (missingValuePolicy == null || compositePolicy == null || tieBreakKey == null) {
            throw new QmjConfigurationException(
                "missing-value-policy, composite-policy and tie-break-key must be set");
        }
        if (workerThreads < 1) {
            throw new QmjConfigurationException("qmj.worker-threads must be >= 1, got: " + workerThreads);
        }
    }

    private static void requireFraction(String name, double value) {
        if (!(value > 0.0 && value <= 0.5)) {
            throw new QmjConfigurationException("qmj." + name + " must be in (0, 0.5], got: " + value);
        }
    }
}
