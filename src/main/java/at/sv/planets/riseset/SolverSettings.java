package at.sv.planets.riseset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Tuning of the {@link HorizonCrossingSolver}. A coarser scan step or a larger tolerance costs precision but needs
 * fewer ephemeris evaluations.
 */
@Data
@AllArgsConstructor
@Builder
public final class SolverSettings {

    public static final SolverSettings DEFAULT = SolverSettings.builder().build();

    /**
     * Distance between two samples of the bracketing scan.
     */
    @Builder.Default
    private final Duration scanStep = Duration.ofMinutes(10);
    /**
     * The refinement stops as soon as the bracket is at most this wide.
     */
    @Builder.Default
    private final Duration tolerance = Duration.ofSeconds(60);
    /**
     * How far after the reference instant to look for crossings.
     */
    @Builder.Default
    private final Duration scanHorizon = Duration.ofHours(30);
    /**
     * Hard ceiling for the bisection steps spent on a single event.
     */
    @Builder.Default
    private final int maxIterations = 32;

    /**
     * @throws IllegalArgumentException if any of the values is unusable
     */
    public SolverSettings validate() {
        assertPositive(scanStep, "scan step");
        assertPositive(tolerance, "tolerance");
        assertPositive(scanHorizon, "scan horizon");
        if (scanHorizon.compareTo(scanStep) < 0) {
            throw new IllegalArgumentException("Scan horizon " + scanHorizon + " must not be shorter than the scan step "
                                               + scanStep);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Max iterations must be > 0: " + maxIterations);
        }
        return this;
    }

    private static void assertPositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("The " + name + " must be > 0: " + duration);
        }
    }
}
