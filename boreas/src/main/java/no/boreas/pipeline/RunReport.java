package no.boreas.pipeline;

import java.util.List;

/**
 * Outcomes of every pipeline in one orchestrator run, in execution order.
 */
public record RunReport(List<PipelineOutcome> outcomes) {
    public RunReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean succeeded() {
        return outcomes.stream().allMatch(PipelineOutcome::success);
    }

    public List<PipelineOutcome> failures() {
        return outcomes.stream().filter(o -> !o.success()).toList();
    }

    public long rowsLoaded() {
        return outcomes.stream().mapToLong(PipelineOutcome::rowsLoaded).sum();
    }
}
