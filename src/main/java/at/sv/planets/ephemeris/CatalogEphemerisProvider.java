package at.sv.planets.ephemeris;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.Observer;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

/**
 * Routes the Sun to the solar ephemeris and every planet to the planetary one.
 */
@RequiredArgsConstructor
public final class CatalogEphemerisProvider implements EphemerisProvider {

    private final EphemerisProvider sunProvider;
    private final EphemerisProvider planetProvider;

    public CatalogEphemerisProvider() {
        this(new SunPositionProvider(), new PlanetPositionProvider());
    }

    @Override
    public HorizonSample position(Body body, Instant instant, Observer observer) {
        if (body.isSun()) {
            return sunProvider.position(body, instant, observer);
        }
        return planetProvider.position(body, instant, observer);
    }
}
