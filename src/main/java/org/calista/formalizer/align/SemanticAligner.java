package org.calista.formalizer.align;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.core.CollaboratorException;
import org.calista.formalizer.core.FormalizerConfig;
import org.calista.formalizer.core.Retries;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.llm.LanguageModel;
import org.calista.formalizer.llm.ModelOutputs;
import org.calista.formalizer.llm.PromptLibrary;
import org.calista.formalizer.schedule.BuildPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * SemanticAligner — Stage 3. Reads the synthesized code back into natural language, node
 * by node in build order (each with the readings of its dependencies as context), merges
 * the readings and asks the model to compare them with the original statement.
 */
public final class SemanticAligner {

    private static final Logger log = LogManager.getLogger(SemanticAligner.class);

    private final LanguageModel model;
    private final PromptLibrary prompts;
    private final ObjectMapper mapper;
    private final FormalizerConfig.Alignment cfg;
    private final Retries retries;

    public SemanticAligner(LanguageModel model, PromptLibrary prompts, ObjectMapper mapper,
                           FormalizerConfig.Alignment cfg, Retries retries) {
        this.model = Objects.requireNonNull(model, "model");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.retries = Objects.requireNonNull(retries, "retries");
    }

    public AlignmentReport align(String statement, ConceptGraph graph, BuildPlan plan) {
        AlignmentReport report;
        try {
            report = check(statement, graph, plan);
        } catch (CollaboratorException e) {
            log.warn("[stage3] alignment aborted: {}", e.getMessage());
            report = AlignmentReport.failed(e.getMessage());
        }
        log.info("[stage3] {}", report);
        return report;
    }

    /**
     * Reads one candidate for the whole statement back and checks it, without the merge step.
     * {@code error} is set when the verdict is unreadable or a collaborator is down.
     */
    public AlignmentReport precheck(String statement, String code) {
        AlignmentReport report = new AlignmentReport();
        try {
            String reading = retries.call("precheck-back-translation", () -> model.complete(
                    prompts.conversation(PromptLibrary.BACK_TRANSLATION, Map.of(
                            "concept", statement,
                            "nl_context", "(omitted for the pre-check)",
                            "code", code)),
                    cfg.temperature)).trim();
            report.segments.put(statement, reading);
            report.mergedBackTranslation = reading;

            String verdict = retries.call("precheck-semantic-check", () -> model.complete(
                    prompts.conversation(PromptLibrary.SEMANTIC_CHECK, Map.of(
                            "original", statement,
                            "back_translated", reading)),
                    cfg.temperature));
            if (!readVerdict(verdict, report)) report.error = "unreadable verdict";
        } catch (CollaboratorException e) {
            report.error = e.getMessage();
        }
        log.debug("[precheck] {}", report);
        return report;
    }

    private AlignmentReport check(String statement, ConceptGraph graph, BuildPlan plan) throws CollaboratorException {
        AlignmentReport report = new AlignmentReport();

        for (ConceptNode n : plan.synthesisOrder) {
            if (n.status() != NodeStatus.SYNTHESIZED) continue;

            StringBuilder ctx = new StringBuilder();
            for (String depId : n.dependencies()) {
                ConceptNode dep = graph.node(depId);
                String reading = report.segments.get(dep.description());
                if (reading != null) ctx.append("- ").append(dep.description()).append(": ").append(reading).append('\n');
            }
            String nlContext = ctx.length() == 0 ? "(none)" : ctx.toString().trim();
            String reading = retries.call("back-translation", () -> model.complete(
                    prompts.conversation(PromptLibrary.BACK_TRANSLATION, Map.of(
                            "concept", n.description(),
                            "nl_context", nlContext,
                            "code", n.synthesizedCode())),
                    cfg.temperature)).trim();
            report.segments.put(n.description(), reading);
            log.debug("[stage3] {} reads as: {}", n.id(), ModelOutputs.oneLine(reading, 300));
        }

        if (report.segments.isEmpty()) {
            report.error = "no synthesized code to read back";
            return report;
        }

        StringBuilder segs = new StringBuilder();
        for (Map.Entry<String, String> e : report.segments.entrySet()) {
            if (segs.length() > 0) segs.append("\n\n");
            segs.append("### ").append(e.getKey()).append('\n').append(e.getValue());
        }
        String segments = segs.toString();
        report.mergedBackTranslation = retries.call("merge-back-translations", () -> model.complete(
                prompts.conversation(PromptLibrary.MERGE_BACK_TRANSLATIONS, Map.of("segments", segments)),
                cfg.temperature)).trim();

        String verdict = retries.call("semantic-check", () -> model.complete(
                prompts.conversation(PromptLibrary.SEMANTIC_CHECK, Map.of(
                        "original", statement,
                        "back_translated", report.mergedBackTranslation)),
                cfg.temperature));
        readVerdict(verdict, report);
        return report;
    }

    /**
     * Unreadable verdicts leave the report at level_3 with the problem as a discrepancy.
     *
     * @return false for an unreadable verdict
     */
    boolean readVerdict(String verdict, AlignmentReport report) {
        JsonNode root;
        try {
            root = mapper.readTree(ModelOutputs.extractBlock(verdict));
        } catch (JsonProcessingException e) {
            log.debug("[stage3] verdict is not JSON: {}", e.getOriginalMessage());
            root = null;
        }
        if (root == null || !root.isObject()) {
            report.consistencyLevel = AlignmentReport.LEVEL_3;
            report.discrepancies = List.of("semantic check returned no JSON object");
            return false;
        }

        String level = root.path("consistency_level").asText(AlignmentReport.LEVEL_3).trim().toLowerCase(Locale.ROOT);
        report.consistencyLevel = AlignmentReport.LEVEL_1.equals(level) || AlignmentReport.LEVEL_2.equals(level)
                ? level
                : AlignmentReport.LEVEL_3;
        report.discrepancies = strings(root.get("discrepancies"));
        report.recommendations = strings(root.get("recommendations"));
        return true;
    }

    private static List<String> strings(JsonNode n) {
        List<String> out = new ArrayList<>();
        if (n == null || !n.isArray()) return out;
        for (JsonNode x : n) {
            String s = x.isTextual() ? x.asText() : x.toString();
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }
}
