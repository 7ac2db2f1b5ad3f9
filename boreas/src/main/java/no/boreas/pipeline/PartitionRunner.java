package no.boreas.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the partition tasks of one pipeline, sequentially or on a fixed pool.
 *
 * <p>
 * A task's failure is caught, logged and returned as its outcome; it never cancels
 * sibling tasks. Each task runs its own windows in order, so no two windows of one
 * partition interleave.
 * </p>
 */
public final class PartitionRunner {
    private static final Logger log = LoggerFactory.getLogger(PartitionRunner.class);

    private final int parallelism;

    public PartitionRunner(int parallelism) {
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Runs every task and returns outcomes in registry order.
     */
    public List<PartitionOutcome> runAll(String pipeline, String runId, Map<String, PartitionTask> tasks)
            throws InterruptedException {
        List<PartitionOutcome> out = new ArrayList<>(tasks.size());
        if (parallelism == 1 || tasks.size() <= 1) {
            for (PartitionTask t : tasks.values()) {
                out.add(safe(pipeline, runId, t));
            }
            return out;
        }

        AtomicInteger n = new AtomicInteger();
        ExecutorService exec = Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()),
                r -> new Thread(r, "ingest-" + pipeline + "-" + n.incrementAndGet()));
        try {
            List<Future<PartitionOutcome>> futures = new ArrayList<>(tasks.size());
            for (PartitionTask t : tasks.values()) {
                futures.add(exec.submit(() -> safe(pipeline, runId, t)));
            }
            for (Future<PartitionOutcome> f : futures) {
                try {
                    out.add(f.get());
                } catch (ExecutionException e) {
                    // safe() catches everything; only an Error can land here
                    throw new IllegalStateException("partition task crashed", e.getCause());
                }
            }
        } finally {
            shutdown(exec, pipeline);
        }
        return out;
    }

    private PartitionOutcome safe(String pipeline, String runId, PartitionTask task) {
        MDC.put("pipeline", pipeline);
        MDC.put("runId", runId);
        MDC.put("partition", task.partition().id());
        try {
            long rows = task.work().run(runId);
            return new PartitionOutcome(task.name(), task.partition().id(), rows, null);
        } catch (Exception e) {
            if (e instanceof InterruptedException)
                Thread.currentThread().interrupt();
            log.warn("Partition task {} failed: {}", task.name(), e.getMessage(), e);
            return new PartitionOutcome(task.name(), task.partition().id(), 0L, e);
        } finally {
            MDC.remove("partition");
            MDC.remove("runId");
            MDC.remove("pipeline");
        }
    }

    private void shutdown(ExecutorService es, String name) throws InterruptedException {
        es.shutdown();
        if (!es.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Partition pool for {} did not terminate cleanly", name);
            es.shutdownNow();
        }
    }
}
