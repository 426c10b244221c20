package com.sensorplatform.analysis.batch;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorplatform.analysis.model.AnalysisOutcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable progress of one batch job, shared between the worker loop in
 * {@link BatchAnalysisService} (writer) and the HTTP layer (reader).
 *
 * <p>Progress fields are written from the single worker thread, so volatile
 * visibility is enough. The per-sensor result map is read concurrently and is
 * synchronised. Cancellation is a flag the worker checks between sensors.
 */
public class BatchJobState {

    public enum Status { RUNNING, COMPLETE, CANCELLED, ERROR }

    private final String        jobId;
    private final int           total;
    private final Instant       startedAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final Map<String, AnalysisOutcome> results =
        Collections.synchronizedMap(new LinkedHashMap<>());

    private volatile Status  status = Status.RUNNING;
    private volatile int     completed;
    private volatile String  currentSensorId;
    private volatile String  errorMessage;
    private volatile Instant finishedAt;

    public BatchJobState(String jobId, int total, Instant startedAt) {
        this.jobId     = jobId;
        this.total     = total;
        this.startedAt = startedAt;
    }

    // ── mutators (worker thread) ───────────────────────────────────────────

    /** Marks {@code sensorId} as in progress; it counts towards progress once recorded. */
    public void advance(String sensorId) {
        this.currentSensorId = sensorId;
    }

    public void record(String sensorId, AnalysisOutcome outcome) {
        results.put(sensorId, outcome);
        this.completed = completed + 1;
    }

    public void complete(Instant at) {
        this.finishedAt = at;
        this.status     = Status.COMPLETE;
    }

    public void cancelled(Instant at) {
        this.finishedAt = at;
        this.status     = Status.CANCELLED;
    }

    public void error(String message, Instant at) {
        this.errorMessage = message;
        this.finishedAt   = at;
        this.status       = Status.ERROR;
    }

    /** Asks the worker to stop before the next sensor. Returns false if already finished. */
    public boolean requestCancel() {
        if (isFinished()) return false;
        cancelRequested.set(true);
        return true;
    }

    // ── accessors ──────────────────────────────────────────────────────────

    @JsonProperty("job_id")
    public String getJobId()            { return jobId; }

    @JsonProperty("status")
    public Status getStatus()           { return status; }

    /** Sensors finished so far, successful or not. */
    @JsonProperty("current")
    public int getCurrent()             { return completed; }

    @JsonProperty("total")
    public int getTotal()               { return total; }

    @JsonProperty("sensor_id")
    public String getCurrentSensorId()  { return currentSensorId; }

    @JsonProperty("error")
    public String getErrorMessage()     { return errorMessage; }

    @JsonProperty("started_at")
    public Instant getStartedAt()       { return startedAt; }

    @JsonProperty("finished_at")
    public Instant getFinishedAt()      { return finishedAt; }

    @JsonIgnore
    public boolean isCancelRequested()  { return cancelRequested.get(); }

    @JsonIgnore
    public boolean isFinished()         { return status != Status.RUNNING; }

    /** Share of sensors finished so far, 0–100. */
    @JsonProperty("progress")
    public int getProgress() {
        return total > 0 ? (int) ((double) completed / total * 100.0) : 100;
    }

    /** Snapshot copy, in processing order. */
    @JsonProperty("results")
    public Map<String, AnalysisOutcome> getResults() {
        synchronized (results) {
            return new LinkedHashMap<>(results);
        }
    }
}
