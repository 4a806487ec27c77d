package tw.gc.auto.equity.qmj.enums;

/**
 * The four quality dimensions that make up the composite Quality score.
 */
public enum Dimension {
    PROFITABILITY("Profitability"),
    GROWTH("Growth"),
    SAFETY("Safety"),
    PAYOUT("Payout");

    private final String displayName;

    Dimension(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
