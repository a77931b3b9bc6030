package org.opentimeline.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A date whose month and day may be unknown.
 *
 * <p>The year is always set. A day requires a month. Unknown components are never
 * zero-filled: when two dates are compared, a missing component sorts before any
 * present one, so {@code 1914 < 1914-06 < 1914-06-28}.
 */
public record PartialDate(int year, Integer month, Integer day) implements Comparable<PartialDate> {

    public static final int MIN_YEAR = -50000;
    public static final int MAX_YEAR = 10000;

    private static final Pattern TEXT_FORM = Pattern.compile("^(-?\\d{1,5})(?:-(\\d{1,2})(?:-(\\d{1,2}))?)?$");
    private static final String[] MONTH_ABBREVIATIONS = {
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };

    /** How much of the date is known. */
    public enum Precision { YEAR, MONTH, DAY }

    public PartialDate {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("Year " + year + " is outside " + MIN_YEAR + ".." + MAX_YEAR);
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("Month " + month + " is not allowed");
        }
        if (day != null && (day < 1 || day > 31)) {
            throw new IllegalArgumentException("Day " + day + " is not allowed");
        }
        if (day != null && month == null) {
            throw new IllegalArgumentException("A day cannot be set without a month");
        }
    }

    public static PartialDate ofYear(int year) {
        return new PartialDate(year, null, null);
    }

    public static PartialDate ofMonth(int year, int month) {
        return new PartialDate(year, month, null);
    }

    public static PartialDate of(int year, int month, int day) {
        return new PartialDate(year, month, day);
    }

    /**
     * Parses {@code YYYY}, {@code YYYY-MM} or {@code YYYY-MM-DD}; years may be negative.
     */
    public static PartialDate parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Date text is required");
        }
        Matcher m = TEXT_FORM.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a partial date: '" + text + "'");
        }
        int year = Integer.parseInt(m.group(1));
        Integer month = m.group(2) != null ? Integer.valueOf(m.group(2)) : null;
        Integer day = m.group(3) != null ? Integer.valueOf(m.group(3)) : null;
        return new PartialDate(year, month, day);
    }

    public Precision precision() {
        if (day != null) return Precision.DAY;
        if (month != null) return Precision.MONTH;
        return Precision.YEAR;
    }

    @Override
    public int compareTo(PartialDate other) {
        int c = Integer.compare(year, other.year);
        if (c != 0) return c;
        c = compareMissingFirst(month, other.month);
        if (c != 0) return c;
        return compareMissingFirst(day, other.day);
    }

    /**
     * Compares only the components both dates have. {@code 1914} and {@code 1914-06-28}
     * compare equal here, while {@link #compareTo} orders them.
     */
    public int compareAtSharedPrecision(PartialDate other) {
        int c = Integer.compare(year, other.year);
        if (c != 0 || month == null || other.month == null) return c;
        c = Integer.compare(month, other.month);
        if (c != 0 || day == null || other.day == null) return c;
        return Integer.compare(day, other.day);
    }

    /** e.g. {@code 28 Jun 1914}, {@code Jun 1914} or {@code 1914}. */
    public String toLongFormat() {
        StringBuilder sb = new StringBuilder();
        if (day != null) sb.append(day).append(' ');
        if (month != null) sb.append(MONTH_ABBREVIATIONS[month - 1]).append(' ');
        return sb.append(year).toString();
    }

    /** e.g. {@code 28 / 6 / 1914}, with {@code -} for unknown components. */
    public String toShortFormat() {
        return (day != null ? day.toString() : "-") + " / "
                + (month != null ? month.toString() : "-") + " / "
                + year;
    }

    /** The inverse of {@link #parse(String)}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(Integer.toString(year));
        if (month != null) sb.append(String.format("-%02d", month));
        if (day != null) sb.append(String.format("-%02d", day));
        return sb.toString();
    }

    private static int compareMissingFirst(Integer a, Integer b) {
        if (a == null) return b == null ? 0 : -1;
        if (b == null) return 1;
        return Integer.compare(a, b);
    }
}
