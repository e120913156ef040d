package org.calista.formalizer.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Append-only JSONL log of run events. */
public final class EventStore {
    private static final Logger log = LogManager.getLogger(EventStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public void append(RunEvent e) throws IOException {
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    /** Failures are logged and dropped. */
    public void appendQuietly(RunEvent e) {
        try {
            append(e);
        } catch (IOException ex) {
            log.warn("event {} for run {} not recorded: {}", e.type, e.runId, ex.toString());
        }
    }

    public List<RunEvent> readAll() throws IOException {
        if (!io.exists(file)) return List.of();
        List<RunEvent> out = new ArrayList<>();
        for (String line : io.readJsonl(file)) {
            out.add(mapper.readValue(line, RunEvent.class));
        }
        return out;
    }
}
