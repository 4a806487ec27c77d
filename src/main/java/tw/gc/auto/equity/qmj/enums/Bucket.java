package tw.gc.auto.equity.qmj.enums;

/**
 * Portfolio bucket assigned to a ranked entity within its period.
 * Entities excluded from ranking never receive a bucket.
 */
public enum Bucket {
    /** Top decile by Quality score (long leg) */
    QUALITY,

    /** Bottom decile by Quality score (short leg) */
    JUNK,

    /** Everything in between */
    NEUTRAL
}
