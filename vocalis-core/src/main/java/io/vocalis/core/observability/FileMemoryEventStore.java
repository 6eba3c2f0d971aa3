package io.vocalis.core.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileMemoryEventStore implements MemoryEventStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileMemoryEventStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileMemoryEventStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized List<MemoryEvent> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            return mapper.readValue(Files.readString(path), new TypeReference<List<MemoryEvent>>() {
            });
        } catch (IOException e) {
            LOG.warn("Event log {} is unreadable, starting a fresh one: {}", path, e.getMessage());
            return List.of();
        }
    }

    @Override
    public synchronized void save(List<MemoryEvent> events) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(events);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
