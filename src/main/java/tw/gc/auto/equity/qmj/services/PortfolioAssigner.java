package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.enums.Bucket;
import tw.gc.auto.equity.qmj.model.PortfolioAssignment;
import tw.gc.auto.equity.qmj.model.RankedEntity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps ranks to portfolio buckets using the ranked count N of the same period.
 *
 * <ul>
 *   <li>QUALITY: rank &lt;= ceil(top * N)</li>
 *   <li>JUNK: rank &gt; floor((1 - bottom) * N)</li>
 *   <li>NEUTRAL: everything else</li>
 * </ul>
 *
 * Cut-offs are computed in decimal arithmetic so that e.g. 0.1 * 30 is exactly 3.
 * When the two legs overlap (a single ranked entity) QUALITY wins.
 */
@Component
@RequiredArgsConstructor
public class PortfolioAssigner {

    private final QmjProperties properties;

    public List<PortfolioAssignment> assign(List<RankedEntity> ranked) {
        int n = ranked.size();
        int qualityCutoff = qualityCutoff(n);
        int junkCutoff = junkCutoff(n);

        List<PortfolioAssignment> assignments = new ArrayList<>(n);
        for (RankedEntity entity : ranked) {
            Bucket bucket;
            if (entity.rank() <= qualityCutoff) {
                bucket = Bucket.QUALITY;
            } else if (entity.rank() > junkCutoff) {
                bucket = Bucket.JUNK;
            } else {
                bucket = Bucket.NEUTRAL;
            }
            assignments.add(new PortfolioAssignment(entity.entityId(), entity.period(), bucket));
        }
        return assignments;
    }

    /**
     * @return highest rank in the Quality bucket for a period of {@code n} ranked entities
     */
    public int qualityCutoff(int n) {
        return BigDecimal.valueOf(properties.getTopDecileFraction())
            .multiply(BigDecimal.valueOf(n))
            .setScale(0, RoundingMode.CEILING)
            .intValueExact();
    }

    /**
     * @return ranks strictly above this value fall into the Junk bucket
     */
    public int junkCutoff(int n) {
        return BigDecimal.ONE.subtract(BigDecimal.valueOf(properties.getBottomDecileFraction()))
            .multiply(BigDecimal.valueOf(n))
            .setScale(0, RoundingMode.FLOOR)
            .intValueExact();
    }
}
