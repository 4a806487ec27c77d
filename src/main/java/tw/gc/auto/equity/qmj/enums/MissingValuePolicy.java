package tw.gc.auto.equity.qmj.enums;

/**
 * How a missing raw metric is reflected in the standardized panel.
 */
public enum MissingValuePolicy {
    /**
     * Entity keeps a missing z-score for that metric.
     */
    EXCLUDE,

    /**
     * Entity receives z = 0 (the cross-sectional mean) for that metric.
     * Population statistics are still computed over present values only.
     */
    ZERO_FILL
}
