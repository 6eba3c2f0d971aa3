package io.vocalis.core.memory.client;

import java.io.IOException;

public class MemoryClientException extends IOException {

    public MemoryClientException(String message) {
        super(message);
    }

    public MemoryClientException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether repeating the same call later may succeed. */
    public boolean retryable() {
        return false;
    }
}
