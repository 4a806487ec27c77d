package tw.gc.auto.equity.qmj.model;

import tw.gc.auto.equity.qmj.enums.Dimension;

import java.util.Map;

/**
 * Sub-factor scores of one entity in one period. A {@code null} score means
 * the dimension had no present component.
 */
public record DimensionScore(
    String entityId,
    Period period,
    Double profitability,
    Double growth,
    Double safety,
    Double payout
) {

    public static DimensionScore of(String entityId, Period period, Map<Dimension, Double> scores) {
        return new DimensionScore(
            entityId,
            period,
            scores.get(Dimension.PROFITABILITY),
            scores.get(Dimension.GROWTH),
            scores.get(Dimension.SAFETY),
            scores.get(Dimension.PAYOUT)
        );
    }

    public Double get(Dimension dimension) {
        return switch (dimension) {
            case PROFITABILITY -> profitability;
            case GROWTH -> growth;
            case SAFETY -> safety;
            case PAYOUT -> payout;
        };
    }
}
