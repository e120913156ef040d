package org.calista.formalizer.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.formalizer.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FormalizerConfig — plain POJO config:
 * - defaults in the field initializers
 * - loadOrCreate() writes the defaults when the file is missing
 * - validate() clamps and normalizes every knob
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FormalizerConfig {

    private static final Logger log = LoggerFactory.getLogger(FormalizerConfig.class);

    public static final String API_KEY_ENV = "FORMALIZER_LLM_API_KEY";

    public String baseDir = "data";
    public Planner planner = new Planner();
    public Grounding grounding = new Grounding();
    public Synthesis synthesis = new Synthesis();
    public Collaborators collaborators = new Collaborators();
    public Artifact artifact = new Artifact();
    public Alignment alignment = new Alignment();
    public Knowledge knowledge = new Knowledge();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Planner {
        public int maxDepth = 4;
        public int maxNodes = 64;
        /** Skip grounding for the root and always decompose it. */
        public boolean forceRootDecomposition = false;
        public double temperature = 0.1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Grounding {
        /** A candidate grounds the concept only at distance <= this. */
        public double acceptDistance = 0.35;
        public int searchLimit = 20;
        /** Also query with LaTeX '$' removed when that differs. */
        public boolean stripLatexQuery = true;
        public boolean reasonerEnabled = false;
        public int reasonerCandidates = 5;
        public double reasonerTemperature = 0.1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Synthesis {
        public int maxAttempts = 16;
        /** Parallel attempt workers per node; they share maxAttempts. */
        public int workers = 1;
        /** Wall-clock budget per node, 0 = none. */
        public long nodeBudgetMs = 0;
        /** Read the root's first candidate back and drop it early when it states something else. */
        public boolean rootSemanticGate = true;
        public int maxDiagnosticChars = 4000;
        public double temperature = 0.1;
        public List<String> baseImports = List.of("import Mathlib");
        public String threadNamePrefix = "synth-worker-";
        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Collaborators {
        /** Extra tries after a collaborator failure. */
        public int retries = 1;
        public long retryDelayMs = 2000;
        public Search search = new Search();
        public Llm llm = new Llm();
        public Compiler compiler = new Compiler();
        /** Directory with prompt overrides (name.txt); blank = bundled prompts only. */
        public String promptsDir = "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Search {
        /** "web" (LeanSearch API) or "local" (a LeanSearch script run per query). */
        public String mode = "web";
        public String endpoint = "https://leansearch.net/search";
        public long timeoutMs = 30_000;
        /** Local mode: command line, the query is appended as the last argument. */
        public List<String> localCommand = List.of("python3", "search.py");
        public String localWorkingDir = "LeanSearch";
        /** Local mode: ask the web API when the local search cannot run. */
        public boolean fallbackToWeb = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Llm {
        public String baseUrl = "https://api.openai.com/v1";
        /** Overridden by the FORMALIZER_LLM_API_KEY environment variable when set. */
        public String apiKey = "";
        public String model = "gpt-4o";
        public long timeoutMs = 120_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Compiler {
        /** Lake project with Mathlib; scratch files go to its src/ directory. */
        public String sandboxDir = "lean_sandbox";
        public String lake = "lake";
        public String lean = "lean";
        public long timeoutMs = 120_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Artifact {
        /** Comment line for library-grounded concepts. */
        public boolean annotateGrounded = true;
        public String outputDir = "batch_results";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Alignment {
        public boolean enabled = true;
        public double temperature = 0.1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Knowledge {
        public boolean enabled = true;
        public String file = "verified_kb.jsonl";
        /** Save synthesized non-root nodes of aligned runs. */
        public boolean saveVerified = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public String logFile = "events.jsonl";
    }

    // -------------------- Load / Create --------------------

    /** Loads the config; a missing or blank file is (re)created with defaults. */
    public static FormalizerConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            FormalizerConfig created = new FormalizerConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            FormalizerConfig created = new FormalizerConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        FormalizerConfig cfg = mapper.readValue(json, FormalizerConfig.class);
        if (cfg == null) cfg = new FormalizerConfig();
        cfg.validate();
        return cfg;
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, FormalizerConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    /** Environment variable first, then {@code collaborators.llm.apiKey}. */
    public String resolveApiKey() {
        String env = System.getenv(API_KEY_ENV);
        if (env != null && !env.isBlank()) return env.trim();
        return collaborators.llm.apiKey == null ? "" : collaborators.llm.apiKey.trim();
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (planner == null) planner = new Planner();
        if (planner.maxDepth < 0) planner.maxDepth = 0;
        if (planner.maxNodes < 1) planner.maxNodes = 1;
        planner.temperature = clampTemperature(planner.temperature, 0.1);

        if (grounding == null) grounding = new Grounding();
        if (!Double.isFinite(grounding.acceptDistance) || grounding.acceptDistance < 0.0) grounding.acceptDistance = 0.35;
        if (grounding.searchLimit < 1) grounding.searchLimit = 1;
        if (grounding.reasonerCandidates < 1) grounding.reasonerCandidates = 1;
        grounding.reasonerTemperature = clampTemperature(grounding.reasonerTemperature, 0.1);

        if (synthesis == null) synthesis = new Synthesis();
        if (synthesis.maxAttempts < 1) synthesis.maxAttempts = 1;
        if (synthesis.workers < 1) synthesis.workers = 1;
        if (synthesis.workers > synthesis.maxAttempts) synthesis.workers = synthesis.maxAttempts;
        if (synthesis.nodeBudgetMs < 0) synthesis.nodeBudgetMs = 0;
        if (synthesis.maxDiagnosticChars < 200) synthesis.maxDiagnosticChars = 200;
        synthesis.temperature = clampTemperature(synthesis.temperature, 0.1);
        synthesis.baseImports = normalizeImports(synthesis.baseImports);
        if (synthesis.threadNamePrefix == null || synthesis.threadNamePrefix.isBlank())
            synthesis.threadNamePrefix = "synth-worker-";
        if (synthesis.shutdownTimeoutMs < 250) synthesis.shutdownTimeoutMs = 250;

        if (collaborators == null) collaborators = new Collaborators();
        if (collaborators.retries < 0) collaborators.retries = 0;
        if (collaborators.retryDelayMs < 0) collaborators.retryDelayMs = 0;
        if (collaborators.promptsDir == null) collaborators.promptsDir = "";

        if (collaborators.search == null) collaborators.search = new Search();
        if (collaborators.search.endpoint == null || collaborators.search.endpoint.isBlank())
            collaborators.search.endpoint = "https://leansearch.net/search";
        if (collaborators.search.timeoutMs < 1000) collaborators.search.timeoutMs = 1000;
        String mode = collaborators.search.mode == null ? "" : collaborators.search.mode.trim().toLowerCase(Locale.ROOT);
        if (!mode.equals("web") && !mode.equals("local")) {
            log.warn("Unknown collaborators.search.mode '{}', using web", collaborators.search.mode);
            mode = "web";
        }
        collaborators.search.mode = mode;
        if (collaborators.search.localCommand == null) collaborators.search.localCommand = List.of();
        collaborators.search.localCommand = collaborators.search.localCommand.stream()
                .filter(Objects::nonNull).map(String::trim).filter(x -> !x.isEmpty()).collect(Collectors.toList());
        if (mode.equals("local") && collaborators.search.localCommand.isEmpty()) {
            log.warn("collaborators.search.localCommand is empty, using web search");
            collaborators.search.mode = "web";
        }
        if (collaborators.search.localWorkingDir == null || collaborators.search.localWorkingDir.isBlank())
            collaborators.search.localWorkingDir = ".";

        if (collaborators.llm == null) collaborators.llm = new Llm();
        if (collaborators.llm.baseUrl == null || collaborators.llm.baseUrl.isBlank())
            collaborators.llm.baseUrl = "https://api.openai.com/v1";
        if (collaborators.llm.apiKey == null) collaborators.llm.apiKey = "";
        if (collaborators.llm.model == null || collaborators.llm.model.isBlank()) collaborators.llm.model = "gpt-4o";
        if (collaborators.llm.timeoutMs < 1000) collaborators.llm.timeoutMs = 1000;

        if (collaborators.compiler == null) collaborators.compiler = new Compiler();
        if (collaborators.compiler.sandboxDir == null || collaborators.compiler.sandboxDir.isBlank())
            collaborators.compiler.sandboxDir = "lean_sandbox";
        if (collaborators.compiler.lake == null || collaborators.compiler.lake.isBlank()) collaborators.compiler.lake = "lake";
        if (collaborators.compiler.lean == null || collaborators.compiler.lean.isBlank()) collaborators.compiler.lean = "lean";
        if (collaborators.compiler.timeoutMs < 1000) collaborators.compiler.timeoutMs = 1000;

        if (artifact == null) artifact = new Artifact();
        if (artifact.outputDir == null || artifact.outputDir.isBlank()) artifact.outputDir = "batch_results";

        if (alignment == null) alignment = new Alignment();
        alignment.temperature = clampTemperature(alignment.temperature, 0.1);

        if (knowledge == null) knowledge = new Knowledge();
        if (knowledge.file == null || knowledge.file.isBlank()) knowledge.file = "verified_kb.jsonl";

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";
    }

    private static double clampTemperature(double t, double fallback) {
        if (!Double.isFinite(t) || t < 0.0) return fallback;
        return Math.min(t, 2.0);
    }

    private static List<String> normalizeImports(List<String> imports) {
        if (imports == null) return List.of();
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String s : imports) {
            if (s == null || s.isBlank()) continue;
            String t = s.trim().replaceAll("\\s+", " ");
            out.add(t.startsWith("import ") ? t : "import " + t);
        }
        return new ArrayList<>(out);
    }
}
