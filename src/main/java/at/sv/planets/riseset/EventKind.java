package at.sv.planets.riseset;

public enum EventKind {
    RISE,
    SET
}
