package at.sv.planets.report;

import at.sv.planets.LightingRegime;
import at.sv.planets.snapshot.EphemerisDiagnostic;
import at.sv.planets.snapshot.SkySnapshot;
import at.sv.planets.snapshot.VisibleBody;

import java.time.ZoneId;
import java.util.Locale;

import static at.sv.planets.FormatUtil.formatDateTime;
import static at.sv.planets.FormatUtil.formatDegrees;

/**
 * Plain text rendering of a {@link SkySnapshot}, with times shown in the given display zone.
 */
public final class SnapshotReport {

    private static final String ROW_FORMAT = "%-8s %9s %9s %9s %9s%n";

    private final ZoneId zone;

    public SnapshotReport(ZoneId zone) {
        this.zone = zone;
    }

    public String render(SkySnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        String time = formatDateTime(snapshot.instant(), zone);
        sb.append(describeLighting(snapshot.lightingRegime())).append('\n');
        if (snapshot.isEmpty()) {
            sb.append("No planets or Sun visible above the horizon at ").append(time).append(".\n");
        } else {
            sb.append("Planets & Sun at ").append(time).append('\n');
            sb.append(String.format(Locale.ROOT, ROW_FORMAT, "Body", "Altitude", "Azimuth", "Theta", "Radius"));
            for (VisibleBody body : snapshot.visibleBodies()) {
                sb.append(String.format(Locale.ROOT, ROW_FORMAT, body.body(), formatDegrees(body.altitude()),
                        formatDegrees(body.azimuth()), formatDegrees(body.projectedTheta()),
                        formatDegrees(body.projectedRadius())));
            }
        }
        for (EphemerisDiagnostic diagnostic : snapshot.diagnostics()) {
            sb.append("Unavailable: ").append(diagnostic).append('\n');
        }
        return sb.toString();
    }

    private static String describeLighting(LightingRegime regime) {
        if (regime == null) {
            return "Lighting: unknown";
        }
        return "Lighting: " + regime.name().toLowerCase(Locale.ROOT);
    }
}
