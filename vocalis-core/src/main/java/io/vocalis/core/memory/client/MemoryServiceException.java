package io.vocalis.core.memory.client;

/** The memory service answered, but not with a usable success response. */
public final class MemoryServiceException extends MemoryClientException {
    private final int statusCode;

    public MemoryServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public MemoryServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the response, or 0 when the failure was not tied to one. */
    public int statusCode() {
        return statusCode;
    }

    @Override
    public boolean retryable() {
        return statusCode == 429 || statusCode >= 500;
    }
}
