package at.sv.planets.ephemeris;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.Observer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogEphemerisProviderTest {

    private static final Instant NOW = Instant.parse("2025-03-01T16:00:00Z");

    @Mock
    private EphemerisProvider sunProvider;
    @Mock
    private EphemerisProvider planetProvider;
    private CatalogEphemerisProvider provider;
    private Observer observer;

    @BeforeEach
    void setUp() {
        provider = new CatalogEphemerisProvider(sunProvider, planetProvider);
        observer = Observer.of(13.00844, 74.79777);
    }

    @Test
    void position_sun_usesSolarEphemeris() {
        HorizonSample sample = new HorizonSample(NOW, 20.0, 240.0);
        when(sunProvider.position(Body.SUN, NOW, observer)).thenReturn(sample);

        assertThat(provider.position(Body.SUN, NOW, observer)).isSameAs(sample);
        verifyNoInteractions(planetProvider);
    }

    @Test
    void position_planet_usesPlanetaryEphemeris() {
        HorizonSample sample = new HorizonSample(NOW, -5.0, 10.0);
        when(planetProvider.position(Body.SATURN, NOW, observer)).thenReturn(sample);

        assertThat(provider.position(Body.SATURN, NOW, observer)).isSameAs(sample);
        verify(planetProvider).position(Body.SATURN, NOW, observer);
        verifyNoInteractions(sunProvider);
    }

    @Test
    void position_failure_propagated() {
        when(planetProvider.position(Body.MARS, NOW, observer)).thenThrow(new EphemerisException("down"));

        assertThatThrownBy(() -> provider.position(Body.MARS, NOW, observer))
                .isInstanceOf(EphemerisException.class)
                .hasMessage("down");
    }

    @Test
    void defaultProvider_coversWholeCatalog() {
        CatalogEphemerisProvider real = new CatalogEphemerisProvider();

        for (Body body : Body.CATALOG) {
            assertThat(real.position(body, NOW, observer).altitude()).isBetween(-90.0, 90.0);
        }
    }
}
