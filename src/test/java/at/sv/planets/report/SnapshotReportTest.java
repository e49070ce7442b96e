package at.sv.planets.report;

import at.sv.planets.Body;
import at.sv.planets.LightingRegime;
import at.sv.planets.snapshot.EphemerisDiagnostic;
import at.sv.planets.snapshot.SkySnapshot;
import at.sv.planets.snapshot.VisibleBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotReportTest {

    private static final Instant NOW = Instant.parse("2025-03-01T16:00:00Z");

    private SnapshotReport report;

    @BeforeEach
    void setUp() {
        report = new SnapshotReport(ZoneId.of("Asia/Kolkata"));
    }

    @Test
    void render_nothingVisible_emptyMessage() {
        SkySnapshot snapshot = new SkySnapshot(NOW, LightingRegime.NIGHT, List.of(), List.of());

        String text = report.render(snapshot);

        assertThat(text).isEqualTo("Lighting: night\n" +
                                   "No planets or Sun visible above the horizon at 2025-03-01 21:30 IST.\n");
    }

    @Test
    void render_visibleBodies_oneRowEachInGivenOrder() {
        SkySnapshot snapshot = new SkySnapshot(NOW, LightingRegime.TWILIGHT, List.of(
                new VisibleBody(Body.VENUS, 12.3456, 250.0, 250.0, 77.6544),
                new VisibleBody(Body.JUPITER, 45.0, 90.5, 90.5, 45.0)), List.of());

        List<String> lines = report.render(snapshot).lines().toList();

        assertThat(lines).hasSize(5);
        assertThat(lines.get(0)).isEqualTo("Lighting: twilight");
        assertThat(lines.get(1)).isEqualTo("Planets & Sun at 2025-03-01 21:30 IST");
        assertThat(lines.get(2)).startsWith("Body").contains("Altitude", "Azimuth", "Theta", "Radius");
        assertThat(lines.get(3)).startsWith("Venus").contains("12.35°", "250°", "77.65°");
        assertThat(lines.get(4)).startsWith("Jupiter").contains("45°", "90.50°");
    }

    @Test
    void render_unknownLightingAndDiagnostics_listed() {
        SkySnapshot snapshot = new SkySnapshot(NOW, null, List.of(),
                List.of(new EphemerisDiagnostic(Body.SUN, "out of range")));

        String text = report.render(snapshot);

        assertThat(text).startsWith("Lighting: unknown\n")
                        .contains("No planets or Sun visible")
                        .endsWith("Unavailable: Sun: out of range\n");
    }
}
