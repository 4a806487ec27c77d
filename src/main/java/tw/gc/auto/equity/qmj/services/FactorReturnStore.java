package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.auto.equity.qmj.entities.FactorReturn;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.model.PeriodFactorReturn;
import tw.gc.auto.equity.qmj.model.QmjRunResult;
import tw.gc.auto.equity.qmj.repositories.FactorReturnRepository;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Persists the factor return series to {@code qmj_factor_returns}.
 *
 * <p>Each publish deletes the previous series and writes the new one in a
 * single transaction, so readers never see a mix of two runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FactorReturnStore implements FactorReturnSink {

    private final FactorReturnRepository factorReturnRepository;

    @Override
    @Transactional
    public void publish(QmjRunResult result) {
        OffsetDateTime computedAt = result.completedAt().atZone(ZoneId.systemDefault()).toOffsetDateTime();
        List<FactorReturn> rows = result.outcomes().stream()
            .filter(o -> !o.isSkipped())
            .map(o -> FactorReturn.from(o, computedAt))
            .toList();

        factorReturnRepository.deleteAllInBatch();
        factorReturnRepository.saveAll(rows);
        log.info("💾 Stored {} factor return rows", rows.size());
    }

    @Transactional(readOnly = true)
    public List<PeriodFactorReturn> loadSeries() {
        return factorReturnRepository.findAllOrderByPeriod().stream()
            .map(FactorReturn::toPeriodFactorReturn)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<PeriodFactorReturn> find(Period period) {
        return factorReturnRepository.findByPeriodLabel(period.toString())
            .map(FactorReturn::toPeriodFactorReturn);
    }
}
