package tw.gc.auto.equity.qmj.services;

import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.enums.Bucket;
import tw.gc.auto.equity.qmj.model.Period;
import tw.gc.auto.equity.qmj.model.PeriodFactorReturn;
import tw.gc.auto.equity.qmj.model.PortfolioAssignment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Averages returns per bucket and forms the Quality minus Junk spread.
 *
 * <p>An empty bucket (or one where no member has a return) has an undefined
 * mean and is reported as missing rather than 0.
 */
@Component
public class FactorReturnAggregator {

    /**
     * @param assignments the period's bucket labels, in rank order
     * @param returns entity id to return; entities without an entry are skipped
     */
    public PeriodFactorReturn aggregate(Period period, List<PortfolioAssignment> assignments,
                                        Map<String, Double> returns) {
        Double qualityReturn = bucketMean(Bucket.QUALITY, assignments, returns);
        Double junkReturn = bucketMean(Bucket.JUNK, assignments, returns);
        return PeriodFactorReturn.of(period, qualityReturn, junkReturn);
    }

    /**
     * Concatenates per-period results and orders them by period.
     */
    public List<PeriodFactorReturn> merge(Collection<PeriodFactorReturn> periodReturns) {
        List<PeriodFactorReturn> merged = new ArrayList<>(periodReturns);
        merged.sort(Comparator.comparing(PeriodFactorReturn::period));
        return merged;
    }

    private static Double bucketMean(Bucket bucket, List<PortfolioAssignment> assignments,
                                     Map<String, Double> returns) {
        double sum = 0.0;
        int count = 0;
        for (PortfolioAssignment assignment : assignments) {
            if (assignment.bucket() != bucket) {
                continue;
            }
            Double value = returns.get(assignment.entityId());
            if (value != null) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }
}
