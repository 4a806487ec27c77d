package tw.gc.auto.equity.qmj.model;

/**
 * Composite Quality score; {@code quality} is {@code null} when the entity
 * cannot be scored and must be left out of the ranking.
 */
public record CompositeScore(String entityId, Period period, Double quality) {

    public boolean isPresent() {
        return quality != null;
    }
}
