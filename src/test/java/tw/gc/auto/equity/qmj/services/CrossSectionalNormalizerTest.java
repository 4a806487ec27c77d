package tw.gc.auto.equity.qmj.services;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.enums.MissingValuePolicy;
import tw.gc.auto.equity.qmj.model.MetricRecord;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.model.StandardizedRecord;
import tw.gc.auto.equity.qmj.services.CrossSectionalNormalizer.NormalizationResult;
import tw.gc.auto.equity.qmj.testutil.PanelTestFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static tw.gc.auto.equity.qmj.testutil.PanelTestFactory.record;

class CrossSectionalNormalizerTest {

    private static final Period P = Period.of(2020);

    private QmjProperties properties;
    private CrossSectionalNormalizer normalizer;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        properties = PanelTestFactory.properties();
        normalizer = new CrossSectionalNormalizer(properties);

        Logger logger = (Logger) LoggerFactory.getLogger(CrossSectionalNormalizer.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(CrossSectionalNormalizer.class)).detachAppender(logAppender);
    }

    @Test
    void normalize_shouldProduceZeroMeanUnitPopulationStd() {
        Random random = new Random(42);
        List<MetricRecord> records = new ArrayList<>();
        for (int i = 0; i < 57; i++) {
            records.add(record("E" + i, P, Map.of("roe", random.nextGaussian() * 3 + 7,
                "lev", random.nextDouble() * 100), 1.0, 1.0));
        }

        NormalizationResult result = normalizer.normalize(P, records, List.of("roe", "lev"));

        for (String metric : List.of("roe", "lev")) {
            double[] z = result.records().stream().mapToDouble(r -> r.z(metric)).toArray();
            double mean = Arrays.stream(z).average().orElseThrow();
            double variance = Arrays.stream(z).map(v -> (v - mean) * (v - mean)).sum() / z.length;
            assertThat(mean).isCloseTo(0.0, offset(1e-12));
            assertThat(Math.sqrt(variance)).isCloseTo(1.0, offset(1e-12));
        }
        assertThat(result.degenerateMetrics()).isEmpty();
        assertThat(logAppender.list).noneMatch(e -> e.getLevel() == Level.WARN);
    }

    @Test
    void normalize_shouldMatchHandComputedZScores() {
        List<MetricRecord> records = List.of(
            record("A", P, Map.of("roe", 1.0), 1.0, 1.0),
            record("B", P, Map.of("roe", 2.0), 1.0, 1.0),
            record("C", P, Map.of("roe", 3.0), 1.0, 1.0)
        );

        NormalizationResult result = normalizer.normalize(P, records, List.of("roe"));

        double std = Math.sqrt(2.0 / 3.0);
        assertThat(result.records()).extracting(r -> r.z("roe"))
            .containsExactly(-1.0 / std, 0.0, 1.0 / std);
    }

    @Test
    void constantMetric_shouldGiveZeroZScoresAndBeReportedDegenerate() {
        List<MetricRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(record("E" + i, P, Map.of("roe", 5.0, "roa", (double) i), 1.0, 1.0));
        }

        NormalizationResult result = normalizer.normalize(P, records, List.of("roe", "roa"));

        assertThat(result.records()).allSatisfy(r -> assertThat(r.z("roe")).isEqualTo(0.0));
        assertThat(result.records()).allSatisfy(r -> assertThat(r.z("roa")).isFinite());
        assertThat(result.degenerateMetrics()).containsExactly("roe");
        assertThat(logAppender.list)
            .filteredOn(e -> e.getLevel() == Level.WARN)
            .extracting(ILoggingEvent::getFormattedMessage)
            .singleElement()
            .satisfies(message -> assertThat(message).contains("roe").contains("2020"));
    }

    @Test
    void constantMetricNotExactInBinary_shouldStillBeDegenerate() {
        List<MetricRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(record("E" + i, P, Map.of("roe", 0.1, "gmar", 0.7), 1.0, 1.0));
        }

        NormalizationResult result = normalizer.normalize(P, records, List.of("roe", "gmar"));

        assertThat(result.records()).allSatisfy(r -> {
            assertThat(r.z("roe")).isEqualTo(0.0);
            assertThat(r.z("gmar")).isEqualTo(0.0);
        });
        assertThat(result.degenerateMetrics()).containsExactly("roe", "gmar");
        assertThat(logAppender.list).filteredOn(e -> e.getLevel() == Level.WARN).hasSize(2);
    }

    @Test
    void missingValues_shouldStayMissingAndBeLeftOutOfStatistics() {
        Map<String, Double> none = new HashMap<>();
        List<MetricRecord> records = List.of(
            record("A", P, Map.of("roe", 1.0), 1.0, 1.0),
            record("B", P, none, 1.0, 1.0),
            record("C", P, Map.of("roe", 3.0), 1.0, 1.0)
        );

        NormalizationResult result = normalizer.normalize(P, records, List.of("roe", "roa"));

        assertThat(result.records()).extracting(r -> r.z("roe")).containsExactly(-1.0, null, 1.0);
        assertThat(result.records()).allSatisfy(r -> assertThat(r.z("roa")).isNull());
    }

    @Test
    void zeroFillPolicy_shouldReplaceMissingWithZero() {
        properties.setMissingValuePolicy(MissingValuePolicy.ZERO_FILL);
        List<MetricRecord> records = List.of(
            record("A", P, Map.of("roe", 1.0), 1.0, 1.0),
            record("B", P, Map.of(), 1.0, 1.0),
            record("C", P, Map.of("roe", 3.0), 1.0, 1.0)
        );

        NormalizationResult result = normalizer.normalize(P, records, List.of("roe"));

        assertThat(result.records()).extracting(r -> r.z("roe")).containsExactly(-1.0, 0.0, 1.0);
    }

    @Test
    void singlePresentValue_shouldBeDegenerate() {
        List<MetricRecord> records = List.of(
            record("A", P, Map.of("roe", 4.0), 1.0, 1.0),
            record("B", P, Map.of(), 1.0, 1.0)
        );

        NormalizationResult result = normalizer.normalize(P, records, List.of("roe"));

        assertThat(result.records()).extracting(r -> r.z("roe")).containsExactly(0.0, null);
        assertThat(result.degenerateMetrics()).containsExactly("roe");
        assertThat(logAppender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.WARN);
    }

    @Test
    void normalize_shouldNotDependOnInputOrder() {
        List<MetricRecord> records = PanelTestFactory.randomPanel(7L, 40, List.of(P));
        List<MetricRecord> shuffled = new ArrayList<>(records);
        Collections.shuffle(shuffled, new Random(3));

        List<StandardizedRecord> first = normalizer.normalize(P, records, List.of("roe", "bab")).records();
        List<StandardizedRecord> second = normalizer.normalize(P, shuffled, List.of("roe", "bab")).records();

        assertThat(second).isEqualTo(first);
    }
}
