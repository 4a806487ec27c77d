package tw.gc.auto.equity.qmj.panel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.equity.qmj.config.QmjConfigurationException;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.model.MetricRecord;
import tw.gc.auto.equity.qmj.model.Period;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the panel table through {@link JdbcTemplate}.
 *
 * <p>The column check runs on the result set metadata before any row is
 * mapped. Values must already be numeric; strings or other types in numeric
 * columns are rejected instead of being parsed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcPanelSource implements PanelSource {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final JdbcTemplate jdbcTemplate;
    private final QmjProperties properties;

    @Override
    @Transactional(readOnly = true)
    public PanelStore loadPanel() {
        String table = properties.getPanelTable();
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new QmjConfigurationException("Invalid qmj.panel-table: " + table);
        }

        ResultSetExtractor<List<MetricRecord>> extractor = this::extract;
        List<MetricRecord> records = jdbcTemplate.query("SELECT * FROM " + table, extractor);
        PanelStore store = PanelStore.of(records == null ? List.of() : records);
        log.info("📥 Loaded panel from {}: {} records, {} entities, {} periods",
            table, store.size(), store.entityCount(), store.periods().size());
        return store;
    }

    List<MetricRecord> extract(ResultSet rs) throws SQLException {
        Map<String, Integer> columns = columnIndex(rs.getMetaData());
        PanelSchema.validateColumns(columns.keySet());

        List<MetricRecord> records = new ArrayList<>();
        while (rs.next()) {
            records.add(mapRow(rs, columns));
        }
        return records;
    }

    private MetricRecord mapRow(ResultSet rs, Map<String, Integer> columns) throws SQLException {
        String entityId = rs.getString(columns.get(PanelSchema.ENTITY_ID));
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Panel row without entity_id at row " + rs.getRow());
        }
        Object rawPeriod = rs.getObject(columns.get(PanelSchema.PERIOD));
        if (rawPeriod == null) {
            throw new IllegalArgumentException("Panel row without period for " + entityId);
        }
        Period period = Period.parse(rawPeriod.toString());

        Map<String, Double> metrics = new HashMap<>();
        for (String metric : PanelSchema.METRIC_COLUMNS) {
            Double value = numeric(rs, columns.get(metric), metric, entityId, period);
            if (value != null) {
                metrics.put(metric, value);
            }
        }
        Double price = numeric(rs, columns.get(PanelSchema.PRICE), PanelSchema.PRICE, entityId, period);
        Double prevPrice = numeric(rs, columns.get(PanelSchema.PREV_PRICE), PanelSchema.PREV_PRICE, entityId, period);
        return new MetricRecord(entityId.trim(), period, metrics, price, prevPrice);
    }

    private static Double numeric(ResultSet rs, int column, String name, String entityId, Period period)
            throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException(String.format(
            "Non-numeric value for %s of %s in %s: '%s'", name, entityId, period, value));
    }

    private static Map<String, Integer> columnIndex(ResultSetMetaData metaData) throws SQLException {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            columns.putIfAbsent(metaData.getColumnLabel(i).trim().toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }
}
