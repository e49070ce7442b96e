package at.sv.planets;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * The tracked bodies together with their render attributes. The Sun is drawn at twice the size of a planet.
 */
@Getter
@RequiredArgsConstructor
public enum Body {
    SUN("Sun", "yellow", 2.0),
    MERCURY("Mercury", "blue", 1.0),
    VENUS("Venus", "orange", 1.0),
    MARS("Mars", "red", 1.0),
    JUPITER("Jupiter", "green", 1.0),
    SATURN("Saturn", "purple", 1.0),
    URANUS("Uranus", "cyan", 1.0),
    NEPTUNE("Neptune", "darkblue", 1.0);

    /**
     * The default catalog order: planets from the inside out, Sun last. Snapshots and rise/set tables keep this
     * order and never re-sort by altitude.
     */
    public static final List<Body> CATALOG = List.of(MERCURY, VENUS, MARS, JUPITER, SATURN, URANUS, NEPTUNE, SUN);

    private final String displayName;
    private final String displayColor;
    private final double renderSizeMultiplier;

    public boolean isSun() {
        return this == SUN;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
