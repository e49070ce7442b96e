package at.sv.planets.riseset;

import at.sv.planets.Body;
import at.sv.planets.Observer;
import at.sv.planets.ephemeris.EphemerisException;
import at.sv.planets.ephemeris.EphemerisProvider;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Finds the next rise and set of a body after a reference instant.
 * <p>
 * The altitude is sampled every {@link SolverSettings#getScanStep() scan step} until both a rise (altitude going
 * from at or below zero to above zero) and a set (the other way round) are bracketed, or the
 * {@link SolverSettings#getScanHorizon() scan horizon} is exhausted. Each bracket is then narrowed by bisection
 * until it is at most {@link SolverSettings#getTolerance() tolerance} wide or the
 * {@link SolverSettings#getMaxIterations() iteration cap} is reached. Bisection needs no derivative and is robust
 * against noise in the ephemeris.
 * <p>
 * A body without any crossing during the whole scan is reported as never rising or never setting. A failing
 * ephemeris makes both events of that body {@link EventStatus#INDETERMINATE}.
 */
@Slf4j
public final class HorizonCrossingSolver {

    private final EphemerisProvider ephemerisProvider;
    private final SolverSettings settings;

    public HorizonCrossingSolver(EphemerisProvider ephemerisProvider) {
        this(ephemerisProvider, SolverSettings.DEFAULT);
    }

    public HorizonCrossingSolver(EphemerisProvider ephemerisProvider, SolverSettings settings) {
        this.ephemerisProvider = ephemerisProvider;
        this.settings = settings.validate();
    }

    public RiseSet solve(Body body, Observer observer, Instant reference) {
        MDC.put("context", body.getDisplayName());
        try {
            RiseSet riseSet = new Scan(body, observer, reference).run();
            log.debug("Next rise: {}, next set: {}", riseSet.rise(), riseSet.set());
            return riseSet;
        } catch (EphemerisException e) {
            log.warn("Rise and set indeterminate: '{}'", e.getLocalizedMessage());
            return RiseSet.indeterminate(body);
        } finally {
            MDC.remove("context");
        }
    }

    public VisibilityEvent nextRise(Body body, Observer observer, Instant reference) {
        return solve(body, observer, reference).rise();
    }

    public VisibilityEvent nextSet(Body body, Observer observer, Instant reference) {
        return solve(body, observer, reference).set();
    }

    private record Bracket(Instant start, Instant end, boolean upAtStart) {
    }

    private final class Scan {
        private final Body body;
        private final Observer observer;
        private final Instant reference;
        private int evaluations;

        private Scan(Body body, Observer observer, Instant reference) {
            this.body = body;
            this.observer = observer;
            this.reference = reference;
        }

        RiseSet run() {
            Instant end = reference.plus(settings.getScanHorizon());
            Instant time = reference;
            boolean previousUp = isUp(time);
            boolean sawUp = previousUp;
            boolean sawDown = !previousUp;
            Bracket riseBracket = null;
            Bracket setBracket = null;
            while ((riseBracket == null || setBracket == null) && time.isBefore(end)) {
                Instant next = min(time.plus(settings.getScanStep()), end);
                boolean up = isUp(next);
                if (!previousUp && up && riseBracket == null) {
                    riseBracket = new Bracket(time, next, false);
                }
                if (previousUp && !up && setBracket == null) {
                    setBracket = new Bracket(time, next, true);
                }
                sawUp |= up;
                sawDown |= !up;
                previousUp = up;
                time = next;
            }
            VisibilityEvent rise = riseBracket != null
                    ? VisibilityEvent.found(body, EventKind.RISE, refine(riseBracket))
                    : VisibilityEvent.withoutInstant(body, EventKind.RISE,
                    sawDown ? EventStatus.NEVER_RISES : EventStatus.NEVER_SETS);
            VisibilityEvent set = setBracket != null
                    ? VisibilityEvent.found(body, EventKind.SET, refine(setBracket))
                    : VisibilityEvent.withoutInstant(body, EventKind.SET,
                    sawUp ? EventStatus.NEVER_SETS : EventStatus.NEVER_RISES);
            log.trace("Used {} ephemeris evaluations", evaluations);
            return new RiseSet(rise, set);
        }

        private Instant refine(Bracket bracket) {
            Instant low = bracket.start();
            Instant high = bracket.end();
            int iterations = 0;
            while (Duration.between(low, high).compareTo(settings.getTolerance()) > 0
                   && iterations < settings.getMaxIterations()) {
                Instant middle = midpoint(low, high);
                if (isUp(middle) == bracket.upAtStart()) {
                    low = middle;
                } else {
                    high = middle;
                }
                iterations++;
            }
            Instant estimate = midpoint(low, high).truncatedTo(ChronoUnit.SECONDS);
            return estimate.isAfter(reference) ? estimate : high;
        }

        private boolean isUp(Instant instant) {
            evaluations++;
            return ephemerisProvider.position(body, instant, observer).isAboveHorizon();
        }
    }

    private static Instant midpoint(Instant low, Instant high) {
        return low.plus(Duration.between(low, high).dividedBy(2));
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
