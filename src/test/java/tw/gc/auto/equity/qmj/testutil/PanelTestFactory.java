package tw.gc.auto.equity.qmj.testutil;

import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.model.MetricRecord;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.panel.PanelSchema;
import tw.gc.auto.equity.qmj.services.CompositeScorer;
import tw.gc.auto.equity.qmj.services.CrossSectionalNormalizer;
import tw.gc.auto.equity.qmj.services.FactorReturnAggregator;
import tw.gc.auto.equity.qmj.services.PeriodPipeline;
import tw.gc.auto.equity.qmj.services.PortfolioAssigner;
import tw.gc.auto.equity.qmj.services.QualityRanker;
import tw.gc.auto.equity.qmj.services.ReturnCalculator;
import tw.gc.auto.equity.qmj.services.SubFactorAggregator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Test factory for panel records and fully wired pipeline components.
 */
public class PanelTestFactory {

    /**
     * Default properties with a single worker thread.
     */
    public static QmjProperties properties() {
        QmjProperties properties = new QmjProperties();
        properties.setWorkerThreads(1);
        return properties;
    }

    public static PeriodPipeline pipeline(QmjProperties properties) {
        return new PeriodPipeline(
            properties,
            new CrossSectionalNormalizer(properties),
            new SubFactorAggregator(properties),
            new CompositeScorer(properties),
            new QualityRanker(properties),
            new PortfolioAssigner(properties),
            new ReturnCalculator(),
            new FactorReturnAggregator()
        );
    }

    public static MetricRecord record(String entityId, Period period, Map<String, Double> metrics,
                                      Double price, Double prevPrice) {
        return new MetricRecord(entityId, period, metrics, price, prevPrice);
    }

    /**
     * Record where every raw metric equals {@code level}.
     */
    public static MetricRecord uniformRecord(String entityId, Period period, double level,
                                             Double price, Double prevPrice) {
        Map<String, Double> metrics = new HashMap<>();
        for (String metric : PanelSchema.METRIC_COLUMNS) {
            metrics.put(metric, level);
        }
        return new MetricRecord(entityId, period, metrics, price, prevPrice);
    }

    /**
     * A period of {@code size} entities E01..En whose metric levels strictly
     * decrease with the entity number, so E01 has the best Quality score.
     */
    public static List<MetricRecord> rankedPeriod(Period period, int size) {
        List<MetricRecord> records = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            double level = size - i + 1;
            records.add(uniformRecord(entityId(i), period, level, 100.0 + level, 100.0));
        }
        return records;
    }

    /**
     * Random panel with gaps: some metrics and some prices are missing.
     */
    public static List<MetricRecord> randomPanel(long seed, int entities, List<Period> periods) {
        Random random = new Random(seed);
        List<MetricRecord> records = new ArrayList<>();
        for (Period period : periods) {
            for (int i = 1; i <= entities; i++) {
                if (random.nextDouble() < 0.1) {
                    continue;
                }
                Map<String, Double> metrics = new HashMap<>();
                for (String metric : PanelSchema.METRIC_COLUMNS) {
                    if (random.nextDouble() < 0.9) {
                        metrics.put(metric, random.nextGaussian());
                    }
                }
                double prevPrice = 50.0 + random.nextDouble() * 50.0;
                Double price = random.nextDouble() < 0.95 ? prevPrice + random.nextGaussian() * 5.0 : null;
                records.add(new MetricRecord(entityId(i), period, metrics, price, prevPrice));
            }
        }
        return records;
    }

    public static String entityId(int i) {
        return String.format("E%02d", i);
    }
}
