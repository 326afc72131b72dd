package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.LoadMode;
import com.tapas.qb.etl.domain.WarehouseHealth;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Getter
public class PipelineRunReport {

    private final UUID runId = UUID.randomUUID();
    private final LoadMode mode;
    private final Instant startedAt;
    private final List<StageResult> stageResults = new ArrayList<>();
    private final List<PipelineState> transitions = new ArrayList<>();
    private PipelineState state = PipelineState.IDLE;
    private PipelineStage failedStage;
    private WarehouseHealth health;

    public PipelineRunReport(LoadMode mode, Instant startedAt) {
        this.mode = mode;
        this.startedAt = startedAt;
        this.transitions.add(PipelineState.IDLE);
    }

    void transitionTo(PipelineState next) {
        if (state == PipelineState.FAILED || state == PipelineState.CLOSED) {
            throw new IllegalStateException("Run " + runId + " already ended in state " + state);
        }
        state = next;
        transitions.add(next);
    }

    void record(StageResult result) {
        stageResults.add(result);
    }

    void recordHealth(WarehouseHealth health) {
        this.health = health;
    }

    void fail(PipelineStage stage) {
        failedStage = stage;
        transitionTo(PipelineState.FAILED);
    }

    public List<StageResult> getStageResults() {
        return Collections.unmodifiableList(stageResults);
    }

    public List<PipelineState> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public Optional<StageResult> result(PipelineStage stage) {
        return stageResults.stream().filter(r -> r.stage() == stage).findFirst();
    }

    public int totalLoaded() {
        return stageResults.stream().mapToInt(StageResult::loaded).sum();
    }

    public int totalSkipped() {
        return stageResults.stream().mapToInt(StageResult::skipped).sum();
    }
}
