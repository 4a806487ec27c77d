package tw.gc.auto.equity.qmj.services;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.auto.equity.qmj.config.QmjProperties;
import tw.gc.auto.equity.qmj.model.CompositeScore;
import tw.gc.auto.equity.qmj.model.RankedEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders a period's entities by Quality, best first.
 *
 * <p>Primary key is Quality descending, ties go to the configured entity id
 * order. Ranks are 1..N with no gaps; entities with a missing Quality are not
 * ranked.
 */
@Component
@RequiredArgsConstructor
public class QualityRanker {

    private final QmjProperties properties;

    public List<RankedEntity> rank(List<CompositeScore> scores) {
        Comparator<CompositeScore> order = Comparator
            .comparingDouble((CompositeScore s) -> s.quality())
            .reversed()
            .thenComparing(CompositeScore::entityId, properties.getTieBreakKey().entityOrder());

        List<CompositeScore> eligible = new ArrayList<>();
        for (CompositeScore score : scores) {
            if (score.isPresent()) {
                eligible.add(score);
            }
        }
        eligible.sort(order);

        List<RankedEntity> ranked = new ArrayList<>(eligible.size());
        for (int i = 0; i < eligible.size(); i++) {
            CompositeScore score = eligible.get(i);
            ranked.add(new RankedEntity(score.entityId(), score.period(), score.quality(), i + 1));
        }
        return ranked;
    }
}
