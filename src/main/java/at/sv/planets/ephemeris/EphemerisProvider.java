package at.sv.planets.ephemeris;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.Observer;

import java.time.Instant;

/**
 * Computes where a body stands in the local sky of an observer. Implementations must be deterministic for fixed
 * inputs and free of side effects.
 */
public interface EphemerisProvider {

    /**
     * @return the topocentric altitude and azimuth of the body, in degrees
     * @throws EphemerisException if no position can be computed for the given body and instant
     */
    HorizonSample position(Body body, Instant instant, Observer observer);
}
