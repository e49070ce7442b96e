package at.sv.planets.riseset;

import at.sv.planets.Body;
import at.sv.planets.Observer;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Solves rise and set for every catalog body. Bodies are independent of each other, so with an executor they are
 * solved concurrently. The result always keeps the catalog order.
 */
public final class RiseSetTableBuilder {

    private final HorizonCrossingSolver solver;
    private final List<Body> catalog;
    @Nullable
    private final ExecutorService executor;

    public RiseSetTableBuilder(HorizonCrossingSolver solver) {
        this(solver, Body.CATALOG, null);
    }

    public RiseSetTableBuilder(HorizonCrossingSolver solver, List<Body> catalog, @Nullable ExecutorService executor) {
        this.solver = solver;
        this.catalog = List.copyOf(catalog);
        this.executor = executor;
    }

    public List<RiseSet> build(Observer observer, Instant reference) {
        if (executor == null) {
            return catalog.stream()
                          .map(body -> solver.solve(body, observer, reference))
                          .toList();
        }
        List<CompletableFuture<RiseSet>> futures =
                catalog.stream()
                       .map(body -> CompletableFuture.supplyAsync(() -> solver.solve(body, observer, reference), executor))
                       .toList();
        return futures.stream()
                      .map(RiseSetTableBuilder::join)
                      .toList();
    }

    private static RiseSet join(CompletableFuture<RiseSet> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
