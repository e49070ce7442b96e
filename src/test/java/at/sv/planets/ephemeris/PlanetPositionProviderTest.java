package at.sv.planets.ephemeris;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.Observer;
import at.sv.planets.riseset.EventStatus;
import at.sv.planets.riseset.HorizonCrossingSolver;
import at.sv.planets.riseset.RiseSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.toRadians;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanetPositionProviderTest {

    private Observer observer;
    private PlanetPositionProvider provider;
    private SunPositionProvider sunProvider;

    @BeforeEach
    void setUp() {
        observer = Observer.of(13.00844, 74.79777);
        provider = new PlanetPositionProvider();
        sunProvider = new SunPositionProvider();
    }

    /**
     * Angular distance between two positions in the local sky, in degrees.
     */
    private static double separation(HorizonSample a, HorizonSample b) {
        double cosDistance = sin(toRadians(a.altitude())) * sin(toRadians(b.altitude()))
                             + cos(toRadians(a.altitude())) * cos(toRadians(b.altitude()))
                               * cos(toRadians(a.azimuth() - b.azimuth()));
        return Math.toDegrees(Math.acos(Math.max(-1, Math.min(1, cosDistance))));
    }

    private void assertMaxElongation(Body body, double maxElongation) {
        Instant instant = Instant.parse("2020-01-01T00:00:00Z");
        Instant end = Instant.parse("2030-01-01T00:00:00Z");
        double largest = 0;
        while (instant.isBefore(end)) {
            double elongation = separation(provider.position(body, instant, observer),
                    sunProvider.position(Body.SUN, instant, observer));
            largest = Math.max(largest, elongation);
            instant = instant.plus(Duration.ofDays(3));
        }
        assertThat(largest).as("largest elongation of %s", body).isLessThan(maxElongation).isGreaterThan(maxElongation - 5);
    }

    @Test
    void position_staysWithinValueRanges() {
        Instant instant = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < 200; i++) {
            for (Body body : Body.CATALOG) {
                if (body.isSun()) {
                    continue;
                }
                HorizonSample sample = provider.position(body, instant, observer);
                assertThat(sample.instant()).isEqualTo(instant);
                assertThat(sample.altitude()).isBetween(-90.0, 90.0);
                assertThat(sample.azimuth()).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
            }
            instant = instant.plus(Duration.ofHours(37));
        }
    }

    @Test
    void position_venus_neverFartherFromTheSunThanItsGreatestElongation() {
        assertMaxElongation(Body.VENUS, 49.5);
    }

    @Test
    void position_mercury_neverFartherFromTheSunThanItsGreatestElongation() {
        assertMaxElongation(Body.MERCURY, 29.5);
    }

    @Test
    void position_greatConjunction2020_jupiterAndSaturnCloseTogether() {
        Instant instant = Instant.parse("2020-12-21T18:00:00Z");

        double distance = separation(provider.position(Body.JUPITER, instant, observer),
                provider.position(Body.SATURN, instant, observer));

        assertThat(distance).isLessThan(0.5);
    }

    @Test
    void position_deterministic() {
        Instant instant = Instant.parse("2025-03-01T16:00:00Z");

        assertThat(provider.position(Body.MARS, instant, observer))
                .isEqualTo(provider.position(Body.MARS, instant, observer));
    }

    @Test
    void position_outsideValidYears_exception() {
        assertThatThrownBy(() -> provider.position(Body.MARS, Instant.parse("1799-12-24T23:59:59Z"), observer))
                .isInstanceOf(EphemerisException.class)
                .hasMessageContaining("1800");
        assertThatThrownBy(() -> provider.position(Body.MARS, Instant.parse("2051-01-08T00:00:00Z"), observer))
                .isInstanceOf(EphemerisException.class);
    }

    @Test
    void position_shortlyAfterValidYears_stillComputed() {
        assertThat(provider.position(Body.MARS, Instant.parse("2051-01-01T00:00:00Z"), observer).altitude())
                .isBetween(-90.0, 90.0);
        assertThat(provider.position(Body.MARS, Instant.parse("1799-12-31T23:59:59Z"), observer).altitude())
                .isBetween(-90.0, 90.0);
    }

    @Test
    void solve_lastDayOfValidYears_scanCanFinish() {
        HorizonCrossingSolver solver = new HorizonCrossingSolver(provider);

        for (Body body : Body.CATALOG) {
            if (body.isSun()) {
                continue;
            }
            RiseSet riseSet = solver.solve(body, observer, Instant.parse("2050-12-31T12:00:00Z"));
            assertThat(riseSet.rise().status()).as("rise of %s", body).isNotEqualTo(EventStatus.INDETERMINATE);
            assertThat(riseSet.set().status()).as("set of %s", body).isNotEqualTo(EventStatus.INDETERMINATE);
        }
    }

    @Test
    void position_sun_notSupported() {
        assertThatThrownBy(() -> provider.position(Body.SUN, Instant.parse("2025-03-01T16:00:00Z"), observer))
                .isInstanceOf(EphemerisException.class)
                .hasMessageContaining("Sun");
    }
}
