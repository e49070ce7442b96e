package at.sv.planets;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The ambient lighting, derived from the solar altitude by {@link LightingRegimeClassifier}. Each regime carries
 * the attributes used to render a sky plot for it.
 */
@Getter
@RequiredArgsConstructor
public enum LightingRegime {
    NIGHT("#0a0a23", 1.0, "white"),
    TWILIGHT("#2c7491", 0.6, "green"),
    DAY("#e5e6ae", 0.3, "green");

    private final String backgroundColor;
    private final double markerAlpha;
    private final String titleColor;
}
