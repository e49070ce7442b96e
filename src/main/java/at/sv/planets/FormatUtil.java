package at.sv.planets;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class FormatUtil {

    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter ZONE_FORMATTER = DateTimeFormatter.ofPattern("zzz", Locale.ENGLISH);

    private FormatUtil() {
    }

    public static String formatDegrees(double degrees) {
        double roundedTwoDecimals = Math.round(degrees * 100.0) / 100.0;
        if (Math.abs(roundedTwoDecimals - Math.rint(roundedTwoDecimals)) < 0.0001) {
            return (int) Math.rint(roundedTwoDecimals) + "°";
        }
        return String.format(Locale.ROOT, "%.2f°", roundedTwoDecimals);
    }

    /**
     * Formats the given instant in the display zone, followed by the zone's short name, e.g. "2025-03-01 21:30 IST".
     */
    public static String formatDateTime(Instant instant, ZoneId zone) {
        return DATE_TIME_FORMATTER.format(instant.atZone(zone)) + " " + ZONE_FORMATTER.format(instant.atZone(zone));
    }

    public static String formatTime(Instant instant, ZoneId zone) {
        return TIME_FORMATTER.format(instant.atZone(zone));
    }
}
