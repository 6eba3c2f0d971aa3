package io.vocalis.core.observability;

import java.io.IOException;
import java.util.List;

/** Durable log of pipeline events. Implementations replace the whole log on every save. */
public interface MemoryEventStore {
    /** @return the stored events, oldest first; empty when nothing has been recorded yet */
    List<MemoryEvent> load() throws IOException;

    void save(List<MemoryEvent> events) throws IOException;
}
