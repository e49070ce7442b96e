package at.sv.planets.ephemeris;

import java.time.Instant;

import static java.lang.Math.asin;
import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.tan;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

/**
 * Time scales and the conversion from equatorial to horizontal coordinates.
 *
 * @see <a href="https://en.wikipedia.org/wiki/Horizontal_coordinate_system">Horizontal coordinate system</a>
 */
final class AstroMath {

    static final double J2000 = 2451545.0;
    static final double DAYS_PER_CENTURY = 36525.0;
    /**
     * Mean obliquity of the ecliptic at J2000, in degrees.
     */
    static final double OBLIQUITY_J2000 = 23.43928;

    private static final double JULIAN_DAY_UNIX_EPOCH = 2440587.5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private AstroMath() {
    }

    static double julianDay(Instant instant) {
        return instant.toEpochMilli() / MILLIS_PER_DAY + JULIAN_DAY_UNIX_EPOCH;
    }

    static double julianCenturiesSinceJ2000(Instant instant) {
        return (julianDay(instant) - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * @return the local mean sidereal time in degrees [0, 360)
     */
    static double localSiderealTime(Instant instant, double longitude) {
        double gmst = 280.46061837 + 360.98564736629 * (julianDay(instant) - J2000);
        return normalizeDegrees(gmst + longitude);
    }

    /**
     * Converts right ascension and declination to altitude and azimuth for the given observer.
     *
     * @return [altitude, azimuth] in degrees, azimuth north based and clockwise
     */
    static double[] toHorizontal(double rightAscension, double declination, double latitude,
                                 double localSiderealTime) {
        double hourAngle = toRadians(localSiderealTime - rightAscension);
        double phi = toRadians(latitude);
        double dec = toRadians(declination);

        double sinAltitude = sin(phi) * sin(dec) + cos(phi) * cos(dec) * cos(hourAngle);
        double altitude = asin(Math.max(-1.0, Math.min(1.0, sinAltitude)));
        // measured from south towards west
        double azimuth = atan2(sin(hourAngle), cos(hourAngle) * sin(phi) - tan(dec) * cos(phi));
        return new double[]{toDegrees(altitude), normalizeDegrees(toDegrees(azimuth) + 180.0)};
    }

    static double normalizeDegrees(double degrees) {
        double normalized = degrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        return normalized >= 360.0 ? 0.0 : normalized;
    }
}
