package at.sv.planets;

/**
 * Projects horizontal coordinates onto a polar sky plot: north at the top, angles growing clockwise, the zenith in
 * the center and the horizon on the circle of radius 90.
 */
public final class PolarProjection {

    public static final double HORIZON_RADIUS = 90.0;

    private PolarProjection() {
    }

    /**
     * @return the azimuth as compass bearing in [0, 360)
     */
    public static double theta(double azimuth) {
        double theta = azimuth % 360.0;
        if (theta < 0) {
            theta += 360.0;
        }
        if (theta >= 360.0) { // -1e-20 % 360 + 360 rounds up to 360
            theta = 0.0;
        }
        return theta;
    }

    public static double radius(double altitude) {
        return HORIZON_RADIUS - altitude;
    }

    public static double altitude(double radius) {
        return HORIZON_RADIUS - radius;
    }
}
