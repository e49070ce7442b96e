package at.sv.planets.ephemeris;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.Observer;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Low precision planetary positions from mean Keplerian elements. Accurate to a fraction of a degree between
 * 1800 and 2050, which is plenty for deciding whether a planet is above the horizon. Light time, nutation,
 * precession and parallax are ignored.
 * <p>
 * Positions are also returned up to {@link #VALIDITY_MARGIN} outside these years, so that a rise/set scan
 * starting on the last day of 2050 can still finish. Longer scan horizons reaching further out end up
 * {@code INDETERMINATE}.
 */
public final class PlanetPositionProvider implements EphemerisProvider {

    static final int FIRST_VALID_YEAR = 1800;
    static final int LAST_VALID_YEAR = 2050;
    static final Duration VALIDITY_MARGIN = Duration.ofDays(7);

    private static final Instant EARLIEST = OffsetDateTime.of(FIRST_VALID_YEAR, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)
                                                          .toInstant().minus(VALIDITY_MARGIN);
    private static final Instant LATEST = OffsetDateTime.of(LAST_VALID_YEAR + 1, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)
                                                        .toInstant().plus(VALIDITY_MARGIN);

    @Override
    public HorizonSample position(Body body, Instant instant, Observer observer) {
        OrbitalElements elements = OrbitalElements.of(body)
                                                  .orElseThrow(() -> new EphemerisException(
                                                          "Unsupported body for planetary ephemeris: " + body));
        assertValidTime(instant);

        double t = AstroMath.julianCenturiesSinceJ2000(instant);
        double[] planet = elements.heliocentricPosition(t);
        double[] earth = OrbitalElements.EARTH_MOON_BARYCENTER.heliocentricPosition(t);
        double[] equatorial = OrbitalElements.toEquatorial(planet[0] - earth[0], planet[1] - earth[1],
                planet[2] - earth[2]);
        double[] horizontal = AstroMath.toHorizontal(equatorial[0], equatorial[1], observer.latitude(),
                AstroMath.localSiderealTime(instant, observer.longitude()));
        return new HorizonSample(instant, horizontal[0], horizontal[1]);
    }

    private static void assertValidTime(Instant instant) {
        if (instant.isBefore(EARLIEST) || !instant.isBefore(LATEST)) {
            throw new EphemerisException("Planetary elements are only valid between " + FIRST_VALID_YEAR + " and "
                                         + LAST_VALID_YEAR + ": " + instant);
        }
    }
}
