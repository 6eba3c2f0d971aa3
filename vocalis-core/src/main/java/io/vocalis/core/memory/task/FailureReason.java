package io.vocalis.core.memory.task;

public enum FailureReason {
    /** The service reported the job as failed, or rejected a status request outright. */
    SERVICE_FAILURE,
    /** Attempt or wall-clock budget exhausted while the job was still pending. */
    TIMEOUT,
    /** The job completed but its categories could not be retrieved. */
    RETRIEVAL_FAILURE,
    /** The owning session closed before the job resolved. */
    CLOSED
}
