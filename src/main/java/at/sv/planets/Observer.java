package at.sv.planets;

/**
 * A location on earth. Latitude and longitude in degrees, elevation in meters above sea level.
 */
public record Observer(double latitude, double longitude, double elevation) {

    public Observer {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new InvalidObserverException("Latitude must be between -90 and 90 degrees: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new InvalidObserverException("Longitude must be between -180 and 180 degrees: " + longitude);
        }
        if (!Double.isFinite(elevation)) {
            throw new InvalidObserverException("Elevation must be a finite number: " + elevation);
        }
    }

    public static Observer of(double latitude, double longitude) {
        return new Observer(latitude, longitude, 0.0);
    }

    @Override
    public String toString() {
        return "[" + FormatUtil.formatDegrees(latitude) + "," + FormatUtil.formatDegrees(longitude) + ']';
    }
}
