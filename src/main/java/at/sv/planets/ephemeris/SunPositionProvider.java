package at.sv.planets.ephemeris;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.Observer;
import org.shredzone.commons.suncalc.SunPosition;

import java.time.Instant;
import java.util.function.Function;

/**
 * Solar positions from commons-suncalc. Uses the geometric altitude without refraction, so that the Sun is
 * treated exactly like the planets. Any failure inside suncalc is reported as an {@link EphemerisException}.
 */
public final class SunPositionProvider implements EphemerisProvider {

    private final Function<Observer, SunPosition.Parameters> parametersFactory;

    public SunPositionProvider() {
        this(SunPositionProvider::getParametersFor);
    }

    SunPositionProvider(Function<Observer, SunPosition.Parameters> parametersFactory) {
        this.parametersFactory = parametersFactory;
    }

    @Override
    public HorizonSample position(Body body, Instant instant, Observer observer) {
        if (!body.isSun()) {
            throw new EphemerisException("Unsupported body for solar ephemeris: " + body);
        }
        SunPosition position;
        try {
            position = parametersFactory.apply(observer).on(instant).execute();
        } catch (RuntimeException e) {
            throw new EphemerisException("Failed to compute the Sun's position at " + instant + ": "
                                         + e.getLocalizedMessage(), e);
        }
        return new HorizonSample(instant, position.getTrueAltitude(), AstroMath.normalizeDegrees(position.getAzimuth()));
    }

    private static SunPosition.Parameters getParametersFor(Observer observer) {
        return SunPosition.compute()
                          .at(observer.latitude(), observer.longitude())
                          .elevation(observer.elevation());
    }
}
