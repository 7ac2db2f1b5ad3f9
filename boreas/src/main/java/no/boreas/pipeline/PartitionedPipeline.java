package no.boreas.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import no.boreas.db.IngestLogRepo;
import no.boreas.errors.ApiFormatException;
import no.boreas.errors.NetworkException;
import no.boreas.errors.PartitionFailuresException;
import no.boreas.partition.GeoPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Base for pipelines that fan out over geospatial partitions.
 *
 * <p>
 * Subclasses supply the partitions and a task factory; this class registers the
 * tasks by name, runs them through the {@link PartitionRunner} and turns partial
 * failure into a {@link PartitionFailuresException} once every task has finished.
 * </p>
 */
public abstract class PartitionedPipeline implements Pipeline {
    private static final Logger log = LoggerFactory.getLogger(PartitionedPipeline.class);

    private final PartitionRunner runner;
    private final IngestLogRepo logRepo;

    protected PartitionedPipeline(PartitionRunner runner, IngestLogRepo logRepo) {
        this.runner = runner;
        this.logRepo = logRepo;
    }

    protected abstract List<GeoPartition> partitions();

    /**
     * Builds the task for one partition. The partition is passed in explicitly so
     * each task is bound to exactly the partition it was created for.
     */
    protected abstract PartitionTask taskFor(GeoPartition partition);

    /**
     * Tasks keyed by task name, in partition order.
     */
    public LinkedHashMap<String, PartitionTask> tasks() {
        LinkedHashMap<String, PartitionTask> tasks = new LinkedHashMap<>();
        for (GeoPartition p : partitions()) {
            PartitionTask t = taskFor(p);
            if (tasks.putIfAbsent(t.name(), t) != null)
                throw new IllegalStateException("duplicate partition task " + t.name());
        }
        return tasks;
    }

    @Override
    public long run(String runId) throws Exception {
        LinkedHashMap<String, PartitionTask> tasks = tasks();
        List<PartitionOutcome> outcomes = runner.runAll(name(), runId, tasks);

        long rows = 0;
        List<String> failed = new ArrayList<>();
        Exception firstCause = null;
        for (PartitionOutcome o : outcomes) {
            rows += o.rowsLoaded();
            if (!o.success()) {
                failed.add(o.partitionId());
                if (firstCause == null)
                    firstCause = o.error();
            }
        }
        log.info("{} finished: partitions={} failed={} rows={}", name(), outcomes.size(), failed.size(), rows);
        if (!failed.isEmpty())
            throw new PartitionFailuresException(name(), failed, firstCause);
        return rows;
    }

    /**
     * Upstream call whose outcome is recorded in the run's event log.
     */
    @FunctionalInterface
    protected interface UpstreamCall {
        JsonNode get() throws NetworkException, ApiFormatException;
    }

    /**
     * Performs {@code call} and logs one {@code _ingest_events} row for it.
     */
    protected JsonNode fetchLogged(String runId, String source, String endpoint, UpstreamCall call)
            throws NetworkException, ApiFormatException {
        long t0 = System.currentTimeMillis();
        try {
            JsonNode body = call.get();
            event(runId, source, endpoint, 200, System.currentTimeMillis() - t0, null);
            return body;
        } catch (NetworkException e) {
            event(runId, source, endpoint, e.httpStatus(), System.currentTimeMillis() - t0, e.getMessage());
            throw e;
        } catch (ApiFormatException e) {
            event(runId, source, endpoint, 200, System.currentTimeMillis() - t0, e.getMessage());
            throw e;
        }
    }

    private void event(String runId, String source, String endpoint, Integer status, long ms, String error) {
        try {
            logRepo.logEvent(runId, source, endpoint, status, ms, error);
        } catch (SQLException e) {
            // event rows never decide the outcome of a load
            log.warn("Failed to record ingest event for {}: {}", endpoint, e.getMessage());
        }
    }
}
