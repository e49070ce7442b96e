package at.sv.planets;

/**
 * Maps the solar altitude to a {@link LightingRegime}. The thresholds are chosen for a plausible looking sky and
 * ignore atmospheric refraction. Both boundaries belong to {@link LightingRegime#TWILIGHT}.
 */
public final class LightingRegimeClassifier {

    public static final double NIGHT_BELOW_ALTITUDE = -6.0;
    public static final double DAY_ABOVE_ALTITUDE = 0.0;

    private LightingRegimeClassifier() {
    }

    public static LightingRegime classify(double solarAltitude) {
        if (solarAltitude < NIGHT_BELOW_ALTITUDE) {
            return LightingRegime.NIGHT;
        }
        if (solarAltitude > DAY_ABOVE_ALTITUDE) {
            return LightingRegime.DAY;
        }
        return LightingRegime.TWILIGHT;
    }
}
