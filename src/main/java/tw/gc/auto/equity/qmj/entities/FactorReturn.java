package tw.gc.auto.equity.qmj.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.model.PeriodFactorReturn;
import tw.gc.auto.equity.qmj.model.PeriodOutcome;

import java.time.OffsetDateTime;

/**
 * FactorReturn Entity - one row of the QMJ factor return series.
 *
 * <p>The table is rebuilt from scratch on every pipeline run; rows are never
 * updated in place.
 *
 * @see tw.gc.auto.equity.qmj.services.FactorReturnStore
 */
@Entity
@Table(name = "qmj_factor_returns",
    uniqueConstraints = @UniqueConstraint(name = "uk_qmj_factor_returns_period", columnNames = "period_label"),
    indexes = @Index(name = "idx_qmj_factor_returns_year_month", columnList = "period_year, period_month"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactorReturn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "period_year", nullable = false)
    private Integer periodYear;

    /**
     * Month of the period, null for annual periods
     */
    @Column(name = "period_month")
    private Integer periodMonth;

    /**
     * Period in text form ("2021" or "2021-06")
     */
    @Column(name = "period_label", length = 7, nullable = false)
    private String periodLabel;

    /**
     * Mean return of the Quality bucket, null when undefined
     */
    @Column(name = "quality_return")
    private Double qualityReturn;

    /**
     * Mean return of the Junk bucket, null when undefined
     */
    @Column(name = "junk_return")
    private Double junkReturn;

    /**
     * Quality minus Junk spread, null when either leg is undefined
     */
    @Column(name = "qmj")
    private Double qmj;

    @Column(name = "ranked_count", nullable = false)
    private Integer rankedCount;

    @Column(name = "quality_count", nullable = false)
    private Integer qualityCount;

    @Column(name = "junk_count", nullable = false)
    private Integer junkCount;

    @Column(name = "computed_at", nullable = false)
    private OffsetDateTime computedAt;

    public static FactorReturn from(PeriodOutcome outcome, OffsetDateTime computedAt) {
        if (outcome.isSkipped()) {
            throw new IllegalArgumentException("Skipped period has no factor return: " + outcome.period());
        }
        PeriodFactorReturn fr = outcome.factorReturn();
        return FactorReturn.builder()
            .periodYear(fr.period().year())
            .periodMonth(fr.period().month())
            .periodLabel(fr.period().toString())
            .qualityReturn(fr.qualityReturn())
            .junkReturn(fr.junkReturn())
            .qmj(fr.qmj())
            .rankedCount(outcome.diagnostics().rankedCount())
            .qualityCount(outcome.diagnostics().qualityCount())
            .junkCount(outcome.diagnostics().junkCount())
            .computedAt(computedAt)
            .build();
    }

    public PeriodFactorReturn toPeriodFactorReturn() {
        return new PeriodFactorReturn(new Period(periodYear, periodMonth), qualityReturn, junkReturn, qmj);
    }
}
