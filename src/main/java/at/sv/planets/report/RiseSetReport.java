package at.sv.planets.report;

import at.sv.planets.FormatUtil;
import at.sv.planets.riseset.RiseSet;
import at.sv.planets.riseset.VisibilityEvent;

import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

/**
 * Plain text table with the next rise and set of every body.
 */
public final class RiseSetReport {

    static final String UNKNOWN = "—";
    private static final String ROW_FORMAT = "%-8s %-22s %-22s%n";

    private final ZoneId zone;

    public RiseSetReport(ZoneId zone) {
        this.zone = zone;
    }

    public String render(List<RiseSet> table) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, ROW_FORMAT, "Body", "Rise", "Set"));
        for (RiseSet riseSet : table) {
            sb.append(String.format(Locale.ROOT, ROW_FORMAT, riseSet.body(), describe(riseSet.rise()),
                    describe(riseSet.set())));
        }
        return sb.toString();
    }

    String describe(VisibilityEvent event) {
        return switch (event.status()) {
            case FOUND -> FormatUtil.formatDateTime(event.instant(), zone);
            case NEVER_RISES -> "never rises";
            case NEVER_SETS -> "never sets";
            case INDETERMINATE -> UNKNOWN;
        };
    }
}
