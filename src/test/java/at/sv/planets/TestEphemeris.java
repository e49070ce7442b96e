package at.sv.planets;

import at.sv.planets.ephemeris.EphemerisException;
import at.sv.planets.ephemeris.EphemerisProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ephemeris with hand made altitudes. Bodies without a configured position fail with an {@link EphemerisException}.
 */
public final class TestEphemeris implements EphemerisProvider {

    private final Map<Body, AltitudeFunction> functions = new EnumMap<>(Body.class);
    private final AtomicInteger evaluations = new AtomicInteger();

    @FunctionalInterface
    public interface AltitudeFunction {
        HorizonSample sample(Instant instant);
    }

    public TestEphemeris fixed(Body body, double altitude, double azimuth) {
        functions.put(body, instant -> new HorizonSample(instant, altitude, azimuth));
        return this;
    }

    /**
     * A body following a sine curve with a 24h period, rising at the given hour after the reference instant and
     * setting twelve hours later.
     */
    public TestEphemeris sinusoid(Body body, Instant reference, double riseHour, double amplitude) {
        functions.put(body, instant -> {
            double hours = Duration.between(reference, instant).toMillis() / 3_600_000.0;
            double altitude = amplitude * Math.sin(2 * Math.PI * (hours - riseHour) / 24.0);
            return new HorizonSample(instant, altitude, 90.0);
        });
        return this;
    }

    public TestEphemeris function(Body body, AltitudeFunction function) {
        functions.put(body, function);
        return this;
    }

    public int getEvaluations() {
        return evaluations.get();
    }

    @Override
    public HorizonSample position(Body body, Instant instant, Observer observer) {
        evaluations.incrementAndGet();
        AltitudeFunction function = functions.get(body);
        if (function == null) {
            throw new EphemerisException("No position for " + body);
        }
        return function.sample(instant);
    }
}
