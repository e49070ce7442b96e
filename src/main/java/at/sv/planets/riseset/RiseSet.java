package at.sv.planets.riseset;

import at.sv.planets.Body;

public record RiseSet(VisibilityEvent rise, VisibilityEvent set) {

    public static RiseSet indeterminate(Body body) {
        return new RiseSet(VisibilityEvent.withoutInstant(body, EventKind.RISE, EventStatus.INDETERMINATE),
                VisibilityEvent.withoutInstant(body, EventKind.SET, EventStatus.INDETERMINATE));
    }

    public Body body() {
        return rise.body();
    }
}
