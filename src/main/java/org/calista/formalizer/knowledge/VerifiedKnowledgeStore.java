package org.calista.formalizer.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * VerifiedKnowledgeStore — persists the verified knowledge base between runs.
 *
 * <p>JSONL, one {@link VerifiedEntry} per line, first line {"_schema":"verified-kb-jsonl-v1"}.
 * Broken rows are logged and skipped; they never fail the whole load.</p>
 */
public final class VerifiedKnowledgeStore {
    private static final Logger log = LogManager.getLogger(VerifiedKnowledgeStore.class);

    static final String SCHEMA_LINE = "{\"_schema\":\"verified-kb-jsonl-v1\"}";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public VerifiedKnowledgeStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void save(VerifiedKnowledgeBase kb) throws IOException {
        List<VerifiedEntry> entries = kb.snapshotSorted();

        FileIO.WriterHandle h = io.openWriter(file);
        try {
            h.writer.write(SCHEMA_LINE);
            h.writer.newLine();
            for (VerifiedEntry e : entries) {
                h.writer.write(mapper.writeValueAsString(e));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            if (e instanceof IOException) throw (IOException) e;
            throw new IOException("Failed to save verified knowledge: " + file, e);
        }
        log.debug("verified kb saved: {} entries -> {}", entries.size(), file);
    }

    /**
     * Upserts every readable row into {@code kb}. A missing file loads nothing.
     *
     * @return rows loaded
     */
    public int load(VerifiedKnowledgeBase kb) throws IOException {
        if (!io.exists(file)) return 0;

        int loaded = 0;
        int lineNo = 0;
        try (Stream<String> lines = io.jsonlStream(file)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                lineNo++;
                if (line.contains("\"_schema\"")) continue;
                try {
                    VerifiedEntry e = mapper.readValue(line, VerifiedEntry.class);
                    if (e == null) continue;
                    kb.upsert(e);
                    loaded++;
                } catch (IOException | IllegalArgumentException rowErr) {
                    log.warn("verified kb: skip broken row {} in {}: {}", lineNo, file, rowErr.getMessage());
                }
            }
        }
        log.info("verified kb loaded: {} entries from {}", loaded, file);
        return loaded;
    }
}
