package tw.gc.auto.equity.qmj.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodFactorReturnTest {

    @Test
    void of_shouldComputeSpreadExactly() {
        PeriodFactorReturn fr = PeriodFactorReturn.of(Period.of(2020), 0.8, 0.3);

        assertThat(fr.qmj()).isEqualTo(0.5);
    }

    @Test
    void of_shouldLeaveSpreadMissingWhenEitherLegIsMissing() {
        assertThat(PeriodFactorReturn.of(Period.of(2020), null, 0.3).qmj()).isNull();
        assertThat(PeriodFactorReturn.of(Period.of(2020), 0.8, null).qmj()).isNull();
    }
}
