package at.sv.planets.snapshot;

import at.sv.planets.Body;

/**
 * Records why a body is missing from a snapshot.
 */
public record EphemerisDiagnostic(Body body, String message) {
    @Override
    public String toString() {
        return body + ": " + message;
    }
}
