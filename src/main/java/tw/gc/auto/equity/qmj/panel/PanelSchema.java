package tw.gc.auto.equity.qmj.panel;

import tw.gc.auto.equity.qmj.config.QmjConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Column layout of the input panel.
 */
public final class PanelSchema {

    public static final String ENTITY_ID = "entity_id";
    public static final String PERIOD = "period";
    public static final String PRICE = "price";
    public static final String PREV_PRICE = "prev_price";

    /** Raw fundamental metric columns */
    public static final List<String> METRIC_COLUMNS = List.of(
        "gpoa", "roe", "roa", "cfoa", "gmar", "acc",
        "bab", "lev", "o", "z", "evol",
        "eiss", "diss", "npop"
    );

    /** Prefix of derived period-over-period change metrics, e.g. {@code delta_roe} */
    public static final String DELTA_PREFIX = "delta_";

    private static final List<String> REQUIRED_COLUMNS;

    static {
        List<String> required = new ArrayList<>(List.of(ENTITY_ID, PERIOD, PRICE, PREV_PRICE));
        required.addAll(METRIC_COLUMNS);
        REQUIRED_COLUMNS = List.copyOf(required);
    }

    private PanelSchema() {
    }

    public static List<String> requiredColumns() {
        return REQUIRED_COLUMNS;
    }

    /**
     * Verifies that every required column is present (case-insensitive).
     *
     * @throws QmjConfigurationException listing the missing columns
     */
    public static void validateColumns(Collection<String> columns) {
        Set<String> available = columns.stream()
            .map(c -> c.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        List<String> missing = REQUIRED_COLUMNS.stream()
            .filter(c -> !available.contains(c))
            .toList();
        if (!missing.isEmpty()) {
            throw new QmjConfigurationException("Input panel is missing required columns: " + missing);
        }
    }

    /**
     * @return the raw metric a {@code delta_} metric is derived from
     */
    public static Optional<String> deltaBase(String metric) {
        if (metric.startsWith(DELTA_PREFIX)) {
            return Optional.of(metric.substring(DELTA_PREFIX.length()));
        }
        return Optional.empty();
    }

    /**
     * A metric is known if it is a raw column or the change of a raw column.
     */
    public static boolean isKnownMetric(String metric) {
        return METRIC_COLUMNS.contains(metric)
            || deltaBase(metric).map(METRIC_COLUMNS::contains).orElse(false);
    }
}
