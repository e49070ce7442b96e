package at.sv.planets;

import at.sv.planets.ephemeris.CatalogEphemerisProvider;
import at.sv.planets.ephemeris.EphemerisProvider;
import at.sv.planets.report.JsonReportWriter;
import at.sv.planets.report.RiseSetReport;
import at.sv.planets.report.SnapshotReport;
import at.sv.planets.riseset.HorizonCrossingSolver;
import at.sv.planets.riseset.RiseSet;
import at.sv.planets.riseset.RiseSetTableBuilder;
import at.sv.planets.riseset.SolverSettings;
import at.sv.planets.snapshot.SkySnapshot;
import at.sv.planets.snapshot.SkySnapshotBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

@Command(name = "PlanetTracker", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Shows which planets and the Sun are above the horizon and when they rise and set.")
public final class PlanetTracker implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(PlanetTracker.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat",
            defaultValue = "${env:LAT:-13.00844}",
            description = "The latitude of your location in degrees [-90..90]. Default: ${DEFAULT-VALUE}")
    double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG:-74.79777}",
            description = "The longitude of your location in degrees [-180..180]. Default: ${DEFAULT-VALUE}")
    double longitude;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of your location.")
    double elevation;
    @Option(names = "--time", paramLabel = "<instant>",
            defaultValue = "${env:TIME}",
            description = "The instant to look at, in ISO-8601 format, e.g. 2025-03-01T16:00:00Z. Default: now.")
    String time;
    @Option(names = "--zone", paramLabel = "<zone>",
            defaultValue = "${env:DISPLAY_ZONE:-Asia/Kolkata}",
            description = "The time zone used to display times. Default: ${DEFAULT-VALUE}")
    String zone;
    @Option(names = "--rise-set",
            description = "Also compute the next rise and set of every body.")
    boolean riseSet;
    @Option(names = "--json",
            description = "Print the result as JSON instead of plain text.")
    boolean json;
    @Option(names = "--scan-step", paramLabel = "<minutes>",
            defaultValue = "${env:SCAN_STEP:-10}",
            description = "The step in minutes between two altitude samples when looking for rise and set. " +
                          "Default: ${DEFAULT-VALUE} minutes.")
    int scanStepInMinutes;
    @Option(names = "--tolerance", paramLabel = "<seconds>",
            defaultValue = "${env:TOLERANCE:-60}",
            description = "The precision of rise and set times in seconds. Default: ${DEFAULT-VALUE} seconds.")
    int toleranceInSeconds;
    @Option(names = "--scan-horizon", paramLabel = "<hours>",
            defaultValue = "${env:SCAN_HORIZON:-30}",
            description = "How many hours ahead to look for rise and set. Default: ${DEFAULT-VALUE} hours.")
    int scanHorizonInHours;
    @Option(names = "--max-iterations", paramLabel = "<iterations>",
            defaultValue = "${env:MAX_ITERATIONS:-32}",
            description = "The maximum number of bisection steps per rise or set. Default: ${DEFAULT-VALUE}")
    int maxIterations;
    @Option(names = "--threads", paramLabel = "<threads>",
            defaultValue = "${env:THREADS:-1}",
            description = "The number of threads used to compute rise and set times. Default: ${DEFAULT-VALUE}")
    int threads;

    private final EphemerisProvider ephemerisProvider;
    private final Supplier<Instant> currentTime;

    public PlanetTracker() {
        this(new CatalogEphemerisProvider(), Instant::now);
    }

    PlanetTracker(EphemerisProvider ephemerisProvider, Supplier<Instant> currentTime) {
        this.ephemerisProvider = ephemerisProvider;
        this.currentTime = currentTime;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new PlanetTracker()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        Observer observer;
        Instant instant;
        ZoneId displayZone;
        SolverSettings settings;
        MDC.put("context", "init");
        try {
            assertConfigurationParameters();
            observer = createObserver();
            instant = parseTime();
            displayZone = parseZone();
            settings = createSolverSettings();
        } finally {
            MDC.remove("context");
        }

        LOG.debug("Looking at the sky of {} at {}", observer, instant);
        SkySnapshot snapshot = new SkySnapshotBuilder(ephemerisProvider).build(instant, observer);
        List<RiseSet> riseSets = null;
        if (riseSet) {
            riseSets = computeRiseSets(observer, instant, settings);
        }
        print(snapshot, riseSets, displayZone);
    }

    private List<RiseSet> computeRiseSets(Observer observer, Instant instant, SolverSettings settings) {
        HorizonCrossingSolver solver = new HorizonCrossingSolver(ephemerisProvider, settings);
        if (threads <= 1) {
            return new RiseSetTableBuilder(solver).build(observer, instant);
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            return new RiseSetTableBuilder(solver, Body.CATALOG, executor).build(observer, instant);
        } finally {
            executor.shutdown();
        }
    }

    private void print(SkySnapshot snapshot, List<RiseSet> riseSets, ZoneId displayZone) {
        PrintWriter out = getOut();
        if (json) {
            out.println(new JsonReportWriter().write(snapshot, riseSets));
        } else {
            out.print(new SnapshotReport(displayZone).render(snapshot));
            if (riseSets != null) {
                out.println();
                out.print(new RiseSetReport(displayZone).render(riseSets));
            }
        }
        out.flush();
    }

    private PrintWriter getOut() {
        if (spec != null) {
            return spec.commandLine().getOut();
        }
        return new PrintWriter(System.out, true);
    }

    private Observer createObserver() {
        try {
            return new Observer(latitude, longitude, elevation);
        } catch (InvalidObserverException e) {
            fail(e.getMessage());
            return null;
        }
    }

    private Instant parseTime() {
        if (time == null || time.isBlank()) {
            return currentTime.get();
        }
        try {
            return Instant.parse(time);
        } catch (DateTimeParseException e) {
            fail("--time must be an ISO-8601 instant like 2025-03-01T16:00:00Z: '" + time + "'");
            return null;
        }
    }

    private ZoneId parseZone() {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            fail("--zone is not a valid time zone: '" + zone + "'");
            return null;
        }
    }

    private SolverSettings createSolverSettings() {
        return SolverSettings.builder()
                             .scanStep(Duration.ofMinutes(scanStepInMinutes))
                             .tolerance(Duration.ofSeconds(toleranceInSeconds))
                             .scanHorizon(Duration.ofHours(scanHorizonInHours))
                             .maxIterations(maxIterations)
                             .build()
                             .validate();
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertSolverConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void assertSolverConfigurations() {
        if (scanStepInMinutes <= 0) {
            fail("--scan-step must be > 0");
        }
        if (toleranceInSeconds <= 0) {
            fail("--tolerance must be > 0");
        }
        if (scanHorizonInHours <= 0) {
            fail("--scan-horizon must be > 0");
        }
        if (Duration.ofHours(scanHorizonInHours).compareTo(Duration.ofMinutes(scanStepInMinutes)) < 0) {
            fail("--scan-horizon must not be shorter than --scan-step");
        }
        if (maxIterations <= 0) {
            fail("--max-iterations must be > 0");
        }
        if (threads <= 0) {
            fail("--threads must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
