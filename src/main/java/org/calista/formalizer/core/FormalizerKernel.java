package org.calista.formalizer.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.formalizer.events.EventStore;
import org.calista.formalizer.io.FileIO;
import org.calista.formalizer.knowledge.InMemoryVerifiedKnowledgeBase;
import org.calista.formalizer.knowledge.VerifiedKnowledgeBase;
import org.calista.formalizer.knowledge.VerifiedKnowledgeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * FormalizerKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, bind I/O to baseDir, create stores
 *   2) loadKnowledge()   -> read the verified knowledge base (explicit)
 *   3) use               -> compose pipelines over it
 */
public final class FormalizerKernel {

    private static final Logger log = LoggerFactory.getLogger(FormalizerKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final FormalizerConfig cfg;

    private final VerifiedKnowledgeBase knowledge;
    private final VerifiedKnowledgeStore knowledgeStore;
    private final EventStore events;

    private volatile boolean knowledgeLoaded = false;

    private FormalizerKernel(FileIO io, ObjectMapper mapper, FormalizerConfig cfg, VerifiedKnowledgeBase knowledge,
                             VerifiedKnowledgeStore knowledgeStore, EventStore events) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.knowledge = Objects.requireNonNull(knowledge, "knowledge");
        this.knowledgeStore = Objects.requireNonNull(knowledgeStore, "knowledgeStore");
        this.events = Objects.requireNonNull(events, "events");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        /** Directory relative config paths and baseDir are resolved against. */
        private Path root = Path.of(".");
        private ObjectMapper mapper;
        private VerifiedKnowledgeBase knowledge;

        public Builder root(Path root) {
            this.root = Objects.requireNonNull(root, "root");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder knowledge(VerifiedKnowledgeBase kb) {
            this.knowledge = Objects.requireNonNull(kb, "knowledge");
            return this;
        }

        public FormalizerKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");
            ObjectMapper om = mapper != null ? mapper : defaultMapper();

            FileIO external = new FileIO(root);
            Path cfgPath = configFile.isAbsolute() ? configFile : external.baseDir().resolve(configFile);
            FormalizerConfig cfg = FormalizerConfig.loadOrCreate(external, cfgPath, om);

            FileIO io = new FileIO(external.resolveExternal(cfg.baseDir));

            VerifiedKnowledgeBase kb = knowledge != null ? knowledge : new InMemoryVerifiedKnowledgeBase();
            VerifiedKnowledgeStore store = new VerifiedKnowledgeStore(io, om, io.resolve(cfg.knowledge.file));
            EventStore events = new EventStore(io, om, io.resolve(cfg.events.logFile));

            FormalizerKernel k = new FormalizerKernel(io, om, cfg, kb, store, events);
            log.info("FormalizerKernel created: config={}, baseDir={}", cfgPath, io.baseDir());
            return k;
        }

        public static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Knowledge (explicit)
    // ---------------------------------------------------------------------

    /** Loads the verified knowledge base once; later calls are no-ops. */
    public synchronized int loadKnowledge() throws IOException {
        if (knowledgeLoaded) return 0;
        int n = cfg.knowledge.enabled ? knowledgeStore.load(knowledge) : 0;
        knowledgeLoaded = true;
        log.info("verified knowledge: {} entries (enabled={})", knowledge.size(), cfg.knowledge.enabled);
        return n;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public FormalizerConfig config() { return cfg; }
    public VerifiedKnowledgeBase knowledge() { return knowledge; }
    public VerifiedKnowledgeStore knowledgeStore() { return knowledgeStore; }
    public EventStore eventStore() { return events; }
}
