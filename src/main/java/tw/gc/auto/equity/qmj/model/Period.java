package tw.gc.auto.equity.qmj.model;

import java.util.Comparator;

/**
 * A panel period: a fiscal year, optionally narrowed to a month.
 *
 * <p>Periods order by year, then month. A year-only period sorts before any
 * monthly period of the same year.
 *
 * @param year calendar year
 * @param month month of year (1-12), or {@code null} for an annual period
 */
public record Period(int year, Integer month) implements Comparable<Period> {

    private static final Comparator<Period> ORDER = Comparator
        .comparingInt(Period::year)
        .thenComparing(Period::month, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Period {
        if (year < 1 || year > 9999) {
            throw new IllegalArgumentException("year out of range: " + year);
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month out of range: " + month);
        }
    }

    public static Period of(int year) {
        return new Period(year, null);
    }

    public static Period of(int year, int month) {
        return new Period(year, month);
    }

    /**
     * Parses {@code yyyy} or {@code yyyy-MM}.
     *
     * @throws IllegalArgumentException if the text is not a valid period
     */
    public static Period parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("period cannot be null or blank");
        }
        String trimmed = text.trim();
        try {
            int dash = trimmed.indexOf('-');
            if (dash < 0) {
                return of(Integer.parseInt(trimmed));
            }
            return of(Integer.parseInt(trimmed.substring(0, dash)), Integer.parseInt(trimmed.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed period: '" + text + "'", e);
        }
    }

    public boolean isMonthly() {
        return month != null;
    }

    @Override
    public int compareTo(Period other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return month == null ? String.format("%04d", year) : String.format("%04d-%02d", year, month);
    }
}
