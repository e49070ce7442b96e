package at.sv.planets.ephemeris;

import at.sv.planets.Body;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

import static java.lang.Math.atan2;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.sqrt;
import static java.lang.Math.toRadians;

/**
 * Keplerian elements and their rates per Julian century, relative to the mean ecliptic and equinox of J2000.
 * Values from E.M. Standish, <a href="https://ssd.jpl.nasa.gov/planets/approx_pos.html">Keplerian Elements for
 * Approximate Positions of the Major Planets</a>, table 1, valid from 1800 to 2050.
 */
@RequiredArgsConstructor
enum OrbitalElements {
    //          a [au]       e             I [deg]       L [deg]          long.peri [deg]  long.node [deg]
    MERCURY(Body.MERCURY,
            0.38709927, 0.20563593, 7.00497902, 252.25032350, 77.45779628, 48.33076593,
            0.00000037, 0.00001906, -0.00594749, 149472.67411175, 0.16047689, -0.12534081),
    VENUS(Body.VENUS,
            0.72333566, 0.00677672, 3.39467605, 181.97909950, 131.60246718, 76.67984255,
            0.00000390, -0.00004107, -0.00078890, 58517.81538729, 0.00268329, -0.27769418),
    EARTH_MOON_BARYCENTER(null,
            1.00000261, 0.01671123, -0.00001531, 100.46457166, 102.93768193, 0.0,
            0.00000562, -0.00004392, -0.01294668, 35999.37244981, 0.32327364, 0.0),
    MARS(Body.MARS,
            1.52371034, 0.09339410, 1.84969142, -4.55343205, -23.94362959, 49.55953891,
            0.00001847, 0.00007882, -0.00813131, 19140.30268499, 0.44441088, -0.29257343),
    JUPITER(Body.JUPITER,
            5.20288700, 0.04838624, 1.30439695, 34.39644051, 14.72847983, 100.47390909,
            -0.00011607, -0.00013253, -0.00183714, 3034.74612775, 0.21252668, 0.20469106),
    SATURN(Body.SATURN,
            9.53667594, 0.05386179, 2.48599187, 49.95424423, 92.59887831, 113.66242448,
            -0.00125060, -0.00050991, 0.00193609, 1222.49362201, -0.41897216, -0.28867794),
    URANUS(Body.URANUS,
            19.18916464, 0.04725744, 0.77263783, 313.23810451, 170.95427630, 74.01692503,
            -0.00196176, -0.00004397, -0.00242939, 428.48202785, 0.40805281, 0.04240589),
    NEPTUNE(Body.NEPTUNE,
            30.06992276, 0.00859048, 1.77004347, -55.12002969, 44.96476227, 131.78422574,
            0.00026291, 0.00005105, 0.00035372, 218.45945325, -0.32241464, -0.01262724);

    private static final int MAX_KEPLER_ITERATIONS = 30;
    private static final double KEPLER_TOLERANCE = 1e-12;

    private final Body body;
    private final double semiMajorAxis;
    private final double eccentricity;
    private final double inclination;
    private final double meanLongitude;
    private final double longitudeOfPerihelion;
    private final double longitudeOfAscendingNode;
    private final double semiMajorAxisRate;
    private final double eccentricityRate;
    private final double inclinationRate;
    private final double meanLongitudeRate;
    private final double longitudeOfPerihelionRate;
    private final double longitudeOfAscendingNodeRate;

    static Optional<OrbitalElements> of(Body body) {
        return Arrays.stream(values())
                     .filter(elements -> elements.body == body)
                     .findFirst();
    }

    /**
     * @param t Julian centuries since J2000
     * @return heliocentric ecliptic coordinates [x, y, z] in au
     */
    double[] heliocentricPosition(double t) {
        double a = semiMajorAxis + semiMajorAxisRate * t;
        double e = eccentricity + eccentricityRate * t;
        double i = toRadians(inclination + inclinationRate * t);
        double l = meanLongitude + meanLongitudeRate * t;
        double varpi = longitudeOfPerihelion + longitudeOfPerihelionRate * t;
        double node = longitudeOfAscendingNode + longitudeOfAscendingNodeRate * t;

        double omega = toRadians(varpi - node); // argument of perihelion
        double bigOmega = toRadians(node);
        double meanAnomaly = toRadians(normalizeAnomaly(l - varpi));
        double eccentricAnomaly = solveKepler(meanAnomaly, e);

        double xOrbit = a * (cos(eccentricAnomaly) - e);
        double yOrbit = a * sqrt(1 - e * e) * sin(eccentricAnomaly);

        double cosOmega = cos(omega);
        double sinOmega = sin(omega);
        double cosNode = cos(bigOmega);
        double sinNode = sin(bigOmega);
        double cosI = cos(i);
        double sinI = sin(i);

        double x = (cosOmega * cosNode - sinOmega * sinNode * cosI) * xOrbit
                   + (-sinOmega * cosNode - cosOmega * sinNode * cosI) * yOrbit;
        double y = (cosOmega * sinNode + sinOmega * cosNode * cosI) * xOrbit
                   + (-sinOmega * sinNode + cosOmega * cosNode * cosI) * yOrbit;
        double z = sinOmega * sinI * xOrbit + cosOmega * sinI * yOrbit;
        return new double[]{x, y, z};
    }

    private static double normalizeAnomaly(double degrees) {
        double normalized = AstroMath.normalizeDegrees(degrees);
        return normalized > 180.0 ? normalized - 360.0 : normalized;
    }

    /**
     * Solves Kepler's equation {@code M = E - e sin(E)} with Newton's method.
     */
    private static double solveKepler(double meanAnomaly, double e) {
        double eccentricAnomaly = meanAnomaly + e * sin(meanAnomaly);
        for (int i = 0; i < MAX_KEPLER_ITERATIONS; i++) {
            double delta = (eccentricAnomaly - e * sin(eccentricAnomaly) - meanAnomaly)
                           / (1 - e * cos(eccentricAnomaly));
            eccentricAnomaly -= delta;
            if (Math.abs(delta) < KEPLER_TOLERANCE) {
                break;
            }
        }
        return eccentricAnomaly;
    }

    /**
     * @return [right ascension, declination] in degrees for the given geocentric ecliptic vector
     */
    static double[] toEquatorial(double x, double y, double z) {
        double epsilon = toRadians(AstroMath.OBLIQUITY_J2000);
        double yEquatorial = y * cos(epsilon) - z * sin(epsilon);
        double zEquatorial = y * sin(epsilon) + z * cos(epsilon);
        double rightAscension = AstroMath.normalizeDegrees(Math.toDegrees(atan2(yEquatorial, x)));
        double declination = Math.toDegrees(atan2(zEquatorial, sqrt(x * x + yEquatorial * yEquatorial)));
        return new double[]{rightAscension, declination};
    }
}
