package com.example.talentengine.talent;

/**
 * Outcome of applying one modifier: applied, skipped by its gate predicate, or failed
 * with an {@link EngineError}.
 */
public class ApplyResult {
    public enum Status { APPLIED, GATED, FAILED }

    private static final ApplyResult APPLIED = new ApplyResult(Status.APPLIED, null, null);
    private static final ApplyResult GATED = new ApplyResult(Status.GATED, null, null);

    private final Status status;
    private final EngineError error;
    private final String message;

    private ApplyResult(Status status, EngineError error, String message) {
        this.status = status;
        this.error = error;
        this.message = message;
    }

    public static ApplyResult applied() { return APPLIED; }

    public static ApplyResult gated() { return GATED; }

    public static ApplyResult failure(EngineError error, String message) {
        return new ApplyResult(Status.FAILED, error, message);
    }

    public Status getStatus() { return status; }
    public boolean isApplied() { return status == Status.APPLIED; }
    public boolean isGated() { return status == Status.GATED; }
    public boolean isFailure() { return status == Status.FAILED; }
    public EngineError getError() { return error; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return isFailure() ? "FAILED(" + error + ": " + message + ")" : status.name();
    }
}
