package at.sv.planets.riseset;

import at.sv.planets.Body;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * The next rise or set of a body.
 *
 * @param instant only present if the status is {@link EventStatus#FOUND}
 */
public record VisibilityEvent(Body body, EventKind kind, @Nullable Instant instant, EventStatus status) {

    public VisibilityEvent {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        if ((status == EventStatus.FOUND) != (instant != null)) {
            throw new IllegalArgumentException("Instant must be given exactly for found events: " + status + ", " + instant);
        }
    }

    public static VisibilityEvent found(Body body, EventKind kind, Instant instant) {
        return new VisibilityEvent(body, kind, instant, EventStatus.FOUND);
    }

    public static VisibilityEvent withoutInstant(Body body, EventKind kind, EventStatus status) {
        return new VisibilityEvent(body, kind, null, status);
    }

    public boolean isFound() {
        return status == EventStatus.FOUND;
    }
}
