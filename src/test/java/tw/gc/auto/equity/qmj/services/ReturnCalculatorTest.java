package tw.gc.auto.equity.qmj.services;

import org.junit.jupiter.api.Test;
import tw.gc.auto.equity.qmj.model.Period;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static tw.gc.auto.equity.qmj.testutil.PanelTestFactory.record;

class ReturnCalculatorTest {

    private static final Period P = Period.of(2020);

    private final ReturnCalculator calculator = new ReturnCalculator();

    @Test
    void compute_shouldReturnAbsolutePriceChange() {
        assertThat(calculator.compute(record("AAA", P, Map.of(), 110.0, 100.0))).isEqualTo(10.0);
        assertThat(calculator.compute(record("AAA", P, Map.of(), 1.5, 2.0))).isEqualTo(-0.5);
    }

    @Test
    void compute_shouldBeMissingWithoutBothPrices() {
        assertThat(calculator.compute(record("AAA", P, Map.of(), null, 100.0))).isNull();
        assertThat(calculator.compute(record("AAA", P, Map.of(), 100.0, null))).isNull();
    }

    @Test
    void computeAll_shouldSkipMissingReturns() {
        Map<String, Double> returns = calculator.computeAll(List.of(
            record("AAA", P, Map.of(), 12.0, 10.0),
            record("BBB", P, Map.of(), null, 10.0)));

        assertThat(returns).containsOnly(Map.entry("AAA", 2.0));
    }
}
