package at.sv.planets.snapshot;

import at.sv.planets.LightingRegime;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * What is above the horizon at one instant. The visible bodies keep the catalog order. An empty list is a normal
 * result meaning nothing is up.
 *
 * @param lightingRegime null, if the Sun's own position could not be computed
 * @param diagnostics    one entry for every body that was left out because its ephemeris failed
 */
public record SkySnapshot(Instant instant, @Nullable LightingRegime lightingRegime, List<VisibleBody> visibleBodies,
                          List<EphemerisDiagnostic> diagnostics) {

    public SkySnapshot {
        visibleBodies = List.copyOf(visibleBodies);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isEmpty() {
        return visibleBodies.isEmpty();
    }

    public boolean isDegraded() {
        return !diagnostics.isEmpty();
    }
}
