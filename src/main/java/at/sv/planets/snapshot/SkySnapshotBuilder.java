package at.sv.planets.snapshot;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.LightingRegime;
import at.sv.planets.LightingRegimeClassifier;
import at.sv.planets.Observer;
import at.sv.planets.ephemeris.EphemerisException;
import at.sv.planets.ephemeris.EphemerisProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link SkySnapshot} for an instant and observer: one ephemeris query per catalog body, bodies at or
 * below the horizon filtered out, the remaining ones projected in catalog order. The Sun's sample also decides the
 * lighting regime.
 */
@Slf4j
public final class SkySnapshotBuilder {

    private final EphemerisProvider ephemerisProvider;
    private final List<Body> catalog;

    public SkySnapshotBuilder(EphemerisProvider ephemerisProvider) {
        this(ephemerisProvider, Body.CATALOG);
    }

    public SkySnapshotBuilder(EphemerisProvider ephemerisProvider, List<Body> catalog) {
        this.ephemerisProvider = ephemerisProvider;
        this.catalog = List.copyOf(catalog);
    }

    public SkySnapshot build(Instant instant, Observer observer) {
        List<VisibleBody> visibleBodies = new ArrayList<>();
        List<EphemerisDiagnostic> diagnostics = new ArrayList<>();
        LightingRegime lightingRegime = null;
        for (Body body : catalog) {
            HorizonSample sample;
            try {
                sample = ephemerisProvider.position(body, instant, observer);
            } catch (EphemerisException e) {
                log.warn("No position for {} at {}: '{}'. Leaving it out.", body, instant, e.getLocalizedMessage());
                diagnostics.add(new EphemerisDiagnostic(body, e.getLocalizedMessage()));
                continue;
            }
            if (body.isSun()) {
                lightingRegime = LightingRegimeClassifier.classify(sample.altitude());
            }
            if (sample.isAboveHorizon()) {
                visibleBodies.add(VisibleBody.of(body, sample));
            }
        }
        SkySnapshot snapshot = new SkySnapshot(instant, lightingRegime, visibleBodies, diagnostics);
        log.debug("Snapshot for {} at {}: {}", observer, instant, snapshot);
        return snapshot;
    }
}
