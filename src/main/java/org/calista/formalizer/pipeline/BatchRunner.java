package org.calista.formalizer.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * BatchRunner — a JSONL problem set through one pipeline.
 *
 * <p>Input rows: {@code {"index": .., "question": "..", "category": ".."}}. Per problem:
 * {@code problem_<index>.lean} and {@code problem_<index>_report.json}; one line per
 * problem in {@code summary.jsonl}. A problem that throws is recorded as {@code error}
 * and the batch goes on.</p>
 */
public final class BatchRunner {

    private static final Logger log = LogManager.getLogger(BatchRunner.class);

    public static final String SUMMARY_FILE = "summary.jsonl";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final FormalizationPipeline pipeline;

    public BatchRunner(FileIO io, ObjectMapper mapper, FormalizationPipeline pipeline) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }

    /** Running totals of a batch. */
    public static final class Summary {
        public int total;
        public int compiled;
        public int semantic;
        public int errors;

        public double compileRate() {
            return total == 0 ? 0.0 : 100.0 * compiled / total;
        }

        public double semanticRate() {
            return total == 0 ? 0.0 : 100.0 * semantic / total;
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "compiled %d/%d (%.1f%%), semantic %d/%d (%.1f%%), errors %d",
                    compiled, total, compileRate(), semantic, total, semanticRate(), errors);
        }
    }

    /**
     * @param limit rows to run, {@code <= 0} for all
     */
    public Summary run(Path input, Path outputDir, int limit) throws IOException {
        List<String> rows = io.readJsonl(input);
        if (limit > 0 && rows.size() > limit) rows = rows.subList(0, limit);
        io.ensureParentDir(outputDir.resolve(SUMMARY_FILE));
        Path summaryFile = outputDir.resolve(SUMMARY_FILE);
        io.writeString(summaryFile, "");

        log.info("[batch] {} problems from {} -> {}", rows.size(), input, outputDir);
        Summary s = new Summary();
        for (int i = 0; i < rows.size(); i++) {
            ObjectNode row = runOne(rows.get(i), i + 1, outputDir);
            s.total++;
            if (row.path("compilationPassed").asBoolean(false)) s.compiled++;
            if (row.path("semanticPassed").asBoolean(false)) s.semantic++;
            if ("error".equals(row.path("status").asText())) s.errors++;
            io.appendJsonl(summaryFile, mapper.writeValueAsString(row));
            log.info("[batch] {}/{}: {}", i + 1, rows.size(), s);
        }
        log.info("[batch] done: {} -> {}", s, outputDir);
        return s;
    }

    private ObjectNode runOne(String line, int rowNumber, Path outputDir) throws IOException {
        ObjectNode row = mapper.createObjectNode();
        JsonNode entry;
        try {
            entry = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[batch] row {} is not JSON: {}", rowNumber, e.getOriginalMessage());
            return error(row, Integer.toString(rowNumber), "unparsable input row: " + e.getOriginalMessage());
        }

        String index = entry.hasNonNull("index") ? entry.get("index").asText() : Integer.toString(rowNumber);
        String question = entry.path("question").asText("");
        row.put("index", index);
        row.put("question", question);
        row.put("category", entry.path("category").asText("Unknown"));
        if (question.isBlank()) return error(row, index, "empty question");

        log.info("[batch] problem {} ({}): {}", index, row.get("category").asText(), oneLine(question));
        try {
            FormalizationResult r = pipeline.formalize(question);
            row.put("runId", r.runId);
            row.put("status", r.status().wire());
            row.put("compilationPassed", r.compilationPassed);
            row.put("semanticPassed", r.semanticPassed());
            row.put("consistencyLevel", r.alignment == null ? "N/A" : r.alignment.consistencyLevel);
            row.putNull("error");

            String safe = safeName(index);
            io.writeString(outputDir.resolve("problem_" + safe + ".lean"), r.artifact.text);
            ObjectNode report = r.report(mapper);
            report.put("index", index);
            report.put("category", row.get("category").asText());
            io.writeString(outputDir.resolve("problem_" + safe + "_report.json"),
                    mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report) + System.lineSeparator());
            return row;
        } catch (RuntimeException e) {
            log.error("[batch] problem {} aborted: {}", index, e.toString());
            log.debug("[batch] problem {} stack", index, e);
            return error(row, index, e.toString());
        }
    }

    private static ObjectNode error(ObjectNode row, String index, String message) {
        row.put("index", index);
        row.put("status", "error");
        row.put("compilationPassed", false);
        row.put("semanticPassed", false);
        row.put("consistencyLevel", "N/A");
        row.put("error", message);
        return row;
    }

    static String safeName(String index) {
        String s = index.replaceAll("[^A-Za-z0-9._-]", "_");
        return s.isEmpty() ? "unknown" : s;
    }

    private static String oneLine(String s) {
        String x = s.replaceAll("\\s+", " ").trim();
        return x.length() > 80 ? x.substring(0, 77) + "..." : x;
    }
}
