package tw.gc.auto.equity.qmj.enums;

/**
 * Combination rule for the composite Quality score.
 */
public enum CompositePolicy {
    /** Mean of the dimension scores that are present */
    LENIENT,

    /** Every dimension must be present, otherwise the composite is missing */
    STRICT
}
