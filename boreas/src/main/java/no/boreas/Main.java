/*
* Command line entry point for the Boreas ingestion engine.
*
* Loads configuration, opens the warehouse pool, makes sure the bookkeeping tables
* exist and runs the pipelines once (all of them, or the ones named on the command
* line). The exit code reports the outcome: 0 on success, 1 when a pipeline failed,
* 2 when the configuration is invalid.
*/

package no.boreas;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import no.boreas.config.AppConfig;
import no.boreas.db.Database;
import no.boreas.db.WarehouseSchema;
import no.boreas.errors.ValidationException;
import no.boreas.metrics.UpstreamCallMetrics;
import no.boreas.partition.PartitionRegistry;
import no.boreas.pipeline.PipelineOrchestrator;
import no.boreas.pipeline.PipelineOutcome;
import no.boreas.pipeline.Pipelines;
import no.boreas.pipeline.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        log.info("Starting ingestion run");
        AppConfig cfg;
        try {
            cfg = AppConfig.load();
        } catch (ValidationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG;
        }
        return run(cfg, Clock.system(cfg.clockZoneId()), args);
    }

    /**
     * Runs the selected pipelines against {@code cfg} and returns the exit code.
     */
    static int run(AppConfig cfg, Clock clock, String[] pipelineNames) {
        ObjectMapper om = new ObjectMapper();
        UpstreamCallMetrics metrics = new UpstreamCallMetrics();

        try (HikariDataSource ds = Database.createIngestDataSource(cfg)) {
            WarehouseSchema.ensure(ds);
            PipelineOrchestrator orchestrator = Pipelines.standard(cfg, ds, new PartitionRegistry(), om, metrics,
                    clock);

            log.info("Pipelines: {}", pipelineNames.length == 0
                    ? orchestrator.pipelineNames()
                    : Arrays.asList(pipelineNames));
            RunReport report = pipelineNames.length == 0
                    ? orchestrator.runAll()
                    : orchestrator.run(Arrays.asList(pipelineNames));
            if (report.succeeded())
                return EXIT_OK;

            for (PipelineOutcome f : report.failures()) {
                System.err.println("Pipeline " + f.name() + " failed: " + f.error());
            }
            return EXIT_FAILED;
        } catch (ValidationException e) {
            log.error("Invalid pipeline selection: {}", e.getMessage());
            System.err.println(e.getMessage());
            return EXIT_CONFIG;
        } catch (Exception e) {
            log.error("Ingestion run aborted", e);
            System.err.println("Ingestion run aborted: " + e);
            return EXIT_FAILED;
        }
    }
}
