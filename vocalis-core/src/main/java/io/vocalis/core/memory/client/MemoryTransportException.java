package io.vocalis.core.memory.client;

/** The memory service could not be reached. */
public final class MemoryTransportException extends MemoryClientException {

    public MemoryTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
