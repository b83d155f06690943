package dev.catananti.passwordlab.util;

import java.util.Locale;

/**
 * Renders a duration in seconds using the largest unit that keeps the value at or above one.
 */
public final class CrackTimeFormatter {

    public static final double SECONDS_PER_MINUTE = 60;
    public static final double SECONDS_PER_HOUR = 3_600;
    public static final double SECONDS_PER_DAY = 86_400;
    public static final double SECONDS_PER_YEAR = 31_536_000;
    public static final double SECONDS_PER_CENTURY = SECONDS_PER_YEAR * 100;

    /** Beyond this many centuries the value stops being meaningful. */
    private static final double SATURATION_CENTURIES = 1_000_000;

    private static final double HALF_CENT = 0.005;

    public static final String INSTANT = "Instant";
    public static final String SATURATED = "Over a million centuries";

    private CrackTimeFormatter() {
    }

    public static String format(double seconds) {
        if (Double.isNaN(seconds) || seconds < 1) {
            return INSTANT;
        }
        if (roundsBelow(seconds, SECONDS_PER_MINUTE, 1)) {
            return render(seconds, "seconds");
        }
        if (roundsBelow(seconds, SECONDS_PER_HOUR, SECONDS_PER_MINUTE)) {
            return render(seconds / SECONDS_PER_MINUTE, "minutes");
        }
        if (roundsBelow(seconds, SECONDS_PER_DAY, SECONDS_PER_HOUR)) {
            return render(seconds / SECONDS_PER_HOUR, "hours");
        }
        if (roundsBelow(seconds, SECONDS_PER_YEAR, SECONDS_PER_DAY)) {
            return render(seconds / SECONDS_PER_DAY, "days");
        }
        if (roundsBelow(seconds, SECONDS_PER_CENTURY, SECONDS_PER_YEAR)) {
            return render(seconds / SECONDS_PER_YEAR, "years");
        }
        double centuries = seconds / SECONDS_PER_CENTURY;
        if (!roundsBelow(centuries, SATURATION_CENTURIES, 1) || Double.isInfinite(centuries)) {
            return SATURATED;
        }
        return render(centuries, "centuries");
    }

    /**
     * True when {@code seconds}, shown in {@code unit} with two decimals, stays below {@code limit}.
     * A value that would round up to the limit belongs to the next unit.
     */
    private static boolean roundsBelow(double seconds, double limit, double unit) {
        return seconds < limit - HALF_CENT * unit;
    }

    private static String render(double value, String unit) {
        return String.format(Locale.ROOT, "%.2f %s", value, unit);
    }
}
