package com.hrflow.onboarding.engine;

import com.hrflow.onboarding.model.ExceptionRecord;
import com.hrflow.onboarding.model.Stage;
import com.hrflow.onboarding.model.StepRecord;
import com.hrflow.onboarding.model.StepStatus;
import com.hrflow.onboarding.model.WorkflowInstance;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives workflow-level metrics from a workflow's steps and exceptions.
 *
 * Pure: nothing in this class mutates its inputs, so it is safe to call on
 * every read. The only time source is the injected clock.
 */
@Component
public class ProgressCalculator {

    private final Clock clock;

    public ProgressCalculator(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Snapshot
    // ------------------------------------------------------------------

    public ProgressSnapshot snapshot(WorkflowInstance workflow) {
        List<StepRecord> steps = workflow.getSteps();
        Map<StepStatus, Integer> counts = countByStatus(steps);
        Instant now = clock.instant();

        int percentage = progressPercentage(steps);
        long elapsed   = daysElapsed(workflow.getStartedAt(), now);

        return new ProgressSnapshot(
                workflow.getId(),
                workflow.getStatus(),
                workflow.getCurrentStage(),
                steps.size(),
                counts.get(StepStatus.COMPLETED),
                counts.get(StepStatus.SKIPPED),
                counts.get(StepStatus.IN_PROGRESS),
                counts.get(StepStatus.PENDING),
                counts.get(StepStatus.BLOCKED),
                counts.get(StepStatus.FAILED),
                percentage,
                elapsed,
                workflow.getExpectedDays(),
                isOnTrack(elapsed, workflow.getExpectedDays(), percentage),
                openExceptions(workflow.getExceptions()),
                overdueSteps(steps, now)
        );
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    /** round(100 * done / total), where done = completed + skipped. 0 for an empty workflow. */
    public int progressPercentage(List<StepRecord> steps) {
        if (steps.isEmpty()) return 0;
        long done = steps.stream().filter(s -> s.getStatus().isDone()).count();
        return (int) Math.round(100.0 * done / steps.size());
    }

    public Map<StepStatus, Integer> countByStatus(List<StepRecord> steps) {
        Map<StepStatus, Integer> counts = new EnumMap<>(StepStatus.class);
        for (StepStatus status : StepStatus.values()) counts.put(status, 0);
        for (StepRecord step : steps) counts.merge(step.getStatus(), 1, Integer::sum);
        return counts;
    }

    public int openExceptions(List<ExceptionRecord> exceptions) {
        return (int) exceptions.stream().filter(ExceptionRecord::isOpen).count();
    }

    /** Steps past their due date that are not yet completed or skipped. */
    public List<UUID> overdueSteps(List<StepRecord> steps, Instant now) {
        return steps.stream()
                .filter(s -> s.getDueDate() != null && s.getDueDate().isBefore(now))
                .filter(s -> !s.getStatus().isDone())
                .map(StepRecord::getId)
                .toList();
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    /** True iff every step of the given stage is completed or skipped. Vacuously true for an empty stage. */
    public boolean stageComplete(List<StepRecord> steps, Stage stage) {
        return steps.stream()
                .filter(s -> s.getStage() == stage)
                .allMatch(s -> s.getStatus().isDone());
    }

    /**
     * The stage the workflow should move to, if any.
     *
     * Non-empty only when the current stage is complete and a later stage holds
     * at least one step; stages without steps are jumped over. Callers apply
     * this repeatedly until it returns empty, so several stages can be passed
     * in one command when later steps were already skipped.
     */
    public Optional<Stage> nextStage(WorkflowInstance workflow) {
        List<StepRecord> steps = workflow.getSteps();
        Stage current = workflow.getCurrentStage();
        if (!stageComplete(steps, current)) {
            return Optional.empty();
        }
        return steps.stream()
                .map(StepRecord::getStage)
                .filter(stage -> stage.isAfter(current))
                .min(Stage::compareTo);
    }

    /** Every step is completed or skipped. A workflow without steps is never finished. */
    public boolean isFinished(WorkflowInstance workflow) {
        List<StepRecord> steps = workflow.getSteps();
        return !steps.isEmpty()
                && steps.stream().allMatch(s -> s.getStatus().isDone());
    }

    /** The first stage that holds any step; PRE_BOARDING when there are none. */
    public Stage initialStage(List<StepRecord> steps) {
        return steps.stream()
                .map(StepRecord::getStage)
                .min(Stage::compareTo)
                .orElse(Stage.PRE_BOARDING);
    }

    /**
     * Steps bucketed by stage, in stage order, preserving step order inside a
     * bucket. Every stage has an entry, possibly empty.
     */
    public Map<Stage, List<StepRecord>> groupByStage(List<StepRecord> steps) {
        Map<Stage, List<StepRecord>> grouped = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) grouped.put(stage, new ArrayList<>());
        for (StepRecord step : steps) grouped.get(step.getStage()).add(step);
        grouped.replaceAll((stage, list) -> Collections.unmodifiableList(list));
        return Collections.unmodifiableMap(grouped);
    }

    // ------------------------------------------------------------------
    // Schedule
    // ------------------------------------------------------------------

    /** Whole days since the workflow started; never negative. */
    public long daysElapsed(Instant startedAt, Instant now) {
        return Math.max(0, Duration.between(startedAt, now).toDays());
    }

    /** Linear pace target: the percentage a workflow "should" have reached by now, capped at 100. */
    public int expectedProgress(long daysElapsed, int expectedDays) {
        if (expectedDays <= 0) return 100;
        return (int) Math.min(100, Math.round(100.0 * daysElapsed / expectedDays));
    }

    /**
     * On track when still inside the expected duration, or when progress keeps
     * up with the linear pace. A workflow past its deadline but fully complete
     * is therefore still on track.
     */
    public boolean isOnTrack(long daysElapsed, int expectedDays, int progressPercentage) {
        return daysElapsed <= expectedDays
                || progressPercentage >= expectedProgress(daysElapsed, expectedDays);
    }
}
