package org.iceforge.pgpulse.plan;

/** Failure while gathering optional plan statistics. Logged and discarded by the executor. */
public class PlanAnalysisException extends RuntimeException {
    public PlanAnalysisException(String message, Throwable cause) { super(message, cause); }
    public PlanAnalysisException(String message) { super(message); }
}
