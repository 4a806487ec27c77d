package tw.gc.auto.equity.qmj.model;

import java.util.List;

/**
 * Result of running every stage for one period. A period is either fully
 * computed or skipped; there is no partial state.
 */
public record PeriodOutcome(
    Period period,
    PeriodFactorReturn factorReturn,
    List<RankedEntity> rankings,
    List<PortfolioAssignment> assignments,
    PeriodDiagnostics diagnostics,
    String skipReason
) {
    public PeriodOutcome {
        rankings = List.copyOf(rankings);
        assignments = List.copyOf(assignments);
    }

    public static PeriodOutcome computed(PeriodFactorReturn factorReturn,
                                         List<RankedEntity> rankings,
                                         List<PortfolioAssignment> assignments,
                                         PeriodDiagnostics diagnostics) {
        return new PeriodOutcome(factorReturn.period(), factorReturn, rankings, assignments, diagnostics, null);
    }

    public static PeriodOutcome skipped(PeriodDiagnostics diagnostics, String reason) {
        return new PeriodOutcome(diagnostics.period(), null, List.of(), List.of(), diagnostics, reason);
    }

    public boolean isSkipped() {
        return factorReturn == null;
    }
}
