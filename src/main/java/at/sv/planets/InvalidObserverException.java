package at.sv.planets;

/**
 * Signals malformed observer coordinates. Raised before any computation starts.
 */
public final class InvalidObserverException extends IllegalArgumentException {
    public InvalidObserverException(String message) {
        super(message);
    }
}
