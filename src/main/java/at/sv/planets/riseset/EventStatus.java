package at.sv.planets.riseset;

public enum EventStatus {
    /**
     * The crossing was found and the event carries its instant.
     */
    FOUND,
    /**
     * The body stays at or below the horizon for the rest of the scanned period.
     */
    NEVER_RISES,
    /**
     * The body stays above the horizon for the rest of the scanned period.
     */
    NEVER_SETS,
    /**
     * The ephemeris failed while scanning, so nothing can be said.
     */
    INDETERMINATE
}
