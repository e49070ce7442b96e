package at.sv.planets;

import java.time.Instant;

/**
 * A single evaluation of an ephemeris: where a body stands in the local sky at the given instant.
 *
 * @param altitude degrees above the horizon, negative below
 * @param azimuth  compass bearing in degrees, 0 = north, clockwise
 */
public record HorizonSample(Instant instant, double altitude, double azimuth) {

    public boolean isAboveHorizon() {
        return altitude > 0;
    }
}
