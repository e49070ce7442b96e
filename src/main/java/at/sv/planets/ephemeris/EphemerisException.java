package at.sv.planets.ephemeris;

/**
 * Exception to signal that an ephemeris could not produce a position for a requested body and instant. Callers
 * recover per body: the body is left out of a snapshot or its rise and set are reported as indeterminate.
 */
public class EphemerisException extends RuntimeException {
    public EphemerisException(String message) {
        super(message);
    }

    public EphemerisException(String message, Throwable cause) {
        super(message, cause);
    }
}
