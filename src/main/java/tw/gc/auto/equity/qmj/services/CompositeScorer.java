package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.enums.CompositePolicy;
import tw.gc.auto.equity.qmj.enums.Dimension;
import tw.gc.auto.equity.qmj.model.CompositeScore;
import tw.gc.auto.equity.qmj.model.DimensionScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Quality = mean of the dimension scores.
 *
 * <p>LENIENT averages the present dimensions; STRICT requires all four. An
 * entity without any usable dimension gets a missing score, never 0.
 */
@Component
@RequiredArgsConstructor
public class CompositeScorer {

    private final QmjProperties properties;

    public List<CompositeScore> score(List<DimensionScore> dimensionScores) {
        boolean strict = properties.getCompositePolicy() == CompositePolicy.STRICT;
        List<CompositeScore> scores = new ArrayList<>(dimensionScores.size());
        for (DimensionScore ds : dimensionScores) {
            scores.add(new CompositeScore(ds.entityId(), ds.period(), quality(ds, strict)));
        }
        return scores;
    }

    private static Double quality(DimensionScore ds, boolean strict) {
        double sum = 0.0;
        int present = 0;
        for (Dimension dimension : Dimension.values()) {
            Double value = ds.get(dimension);
            if (value == null) {
                if (strict) {
                    return null;
                }
                continue;
            }
            sum += value;
            present++;
        }
        return present == 0 ? null : sum / present;
    }
}
