package tw.gc.auto.equity.qmj.model;

/**
 * Factor return of one period. Any leg may be {@code null} when its bucket had
 * no return to average; the spread is then {@code null} as well.
 *
 * @param period panel period
 * @param qualityReturn mean return of the Quality bucket
 * @param junkReturn mean return of the Junk bucket
 * @param qmj {@code qualityReturn - junkReturn}
 */
public record PeriodFactorReturn(Period period, Double qualityReturn, Double junkReturn, Double qmj) {

    public static PeriodFactorReturn of(Period period, Double qualityReturn, Double junkReturn) {
        Double spread = qualityReturn != null && junkReturn != null ? qualityReturn - junkReturn : null;
        return new PeriodFactorReturn(period, qualityReturn, junkReturn, spread);
    }
}
