package no.boreas.pipeline;

import no.boreas.db.IngestLogRepo;
import no.boreas.errors.ValidationException;
import no.boreas.metrics.UpstreamCallMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.sql.SQLException;
import java.util.*;

/**
 * Runs pipelines in their fixed order and collects a {@link RunReport}.
 *
 * <p>
 * A failing pipeline is logged and recorded, and the next one still runs. Each
 * run is bracketed by an {@code _ingest_runs} row.
 * </p>
 */
public final class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final LinkedHashMap<String, Pipeline> pipelines = new LinkedHashMap<>();
    private final IngestLogRepo logRepo;
    private final UpstreamCallMetrics metrics;

    /**
     * @param pipelines pipelines in execution order
     */
    public PipelineOrchestrator(List<Pipeline> pipelines, IngestLogRepo logRepo, UpstreamCallMetrics metrics) {
        for (Pipeline p : pipelines) {
            if (this.pipelines.putIfAbsent(p.name(), p) != null)
                throw new IllegalArgumentException("duplicate pipeline " + p.name());
        }
        this.logRepo = logRepo;
        this.metrics = metrics;
    }

    public List<String> pipelineNames() {
        return List.copyOf(pipelines.keySet());
    }

    public RunReport runAll() {
        return execute(pipelines.values());
    }

    /**
     * Runs the named pipelines, still in the fixed order.
     */
    public RunReport run(Collection<String> names) throws ValidationException {
        Set<String> wanted = new HashSet<>(names);
        for (String n : wanted) {
            if (!pipelines.containsKey(n))
                throw new ValidationException("unknown pipeline '" + n + "', expected one of " + pipelines.keySet());
        }
        List<Pipeline> selected = new ArrayList<>();
        for (Pipeline p : pipelines.values()) {
            if (wanted.contains(p.name()))
                selected.add(p);
        }
        return execute(selected);
    }

    private RunReport execute(Collection<Pipeline> selected) {
        List<PipelineOutcome> outcomes = new ArrayList<>();
        for (Pipeline p : selected) {
            outcomes.add(runOne(p));
        }
        RunReport report = new RunReport(outcomes);

        metrics.snapshot().forEach((service, s) -> log.info("Upstream {}: {}", service, s));
        if (report.succeeded()) {
            log.info("Run complete: pipelines={} rows={}", outcomes.size(), report.rowsLoaded());
        } else {
            log.error("Run finished with failures: {}",
                    report.failures().stream().map(PipelineOutcome::name).toList());
        }
        return report;
    }

    private PipelineOutcome runOne(Pipeline p) {
        MDC.put("pipeline", p.name());
        long t0 = System.currentTimeMillis();
        String runId = null;
        try {
            runId = logRepo.startRun(p.name());
            MDC.put("runId", runId);
            log.info("Starting pipeline {}", p.name());

            long rows = p.run(runId);
            long ms = System.currentTimeMillis() - t0;
            finish(runId, true, "rows=" + rows);
            log.info("Pipeline {} succeeded: rows={} in {}ms", p.name(), rows, ms);
            return new PipelineOutcome(p.name(), runId, rows, ms, null);
        } catch (Exception e) {
            if (e instanceof InterruptedException)
                Thread.currentThread().interrupt();
            long ms = System.currentTimeMillis() - t0;
            log.error("Pipeline {} failed after {}ms: {}", p.name(), ms, e.getMessage(), e);
            if (runId != null)
                finish(runId, false, e.getMessage());
            return new PipelineOutcome(p.name(), runId, 0L, ms, e);
        } finally {
            MDC.remove("runId");
            MDC.remove("pipeline");
        }
    }

    private void finish(String runId, boolean success, String notes) {
        try {
            logRepo.finishRun(runId, success, notes);
        } catch (SQLException e) {
            log.warn("Failed to close run {}: {}", runId, e.getMessage());
        }
    }
}
