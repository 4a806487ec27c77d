package tw.gc.auto.equity.qmj.model;

/**
 * An entity's position in its period's Quality ranking. Rank 1 is best.
 */
public record RankedEntity(String entityId, Period period, double quality, int rank) {
}
