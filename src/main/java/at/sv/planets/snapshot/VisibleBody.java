package at.sv.planets.snapshot;

import at.sv.planets.Body;
import at.sv.planets.HorizonSample;
import at.sv.planets.PolarProjection;

/**
 * A body above the horizon with its position projected onto the polar sky plot.
 *
 * @param projectedTheta  compass bearing in degrees, 0 = north, clockwise
 * @param projectedRadius 0 at the zenith, 90 at the horizon
 */
public record VisibleBody(Body body, double altitude, double azimuth, double projectedTheta, double projectedRadius) {

    static VisibleBody of(Body body, HorizonSample sample) {
        double theta = PolarProjection.theta(sample.azimuth());
        return new VisibleBody(body, sample.altitude(), theta, theta, PolarProjection.radius(sample.altitude()));
    }
}
