package org.calista.formalizer.pipeline;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formalizer.align.AlignmentReport;
import org.calista.formalizer.align.SemanticAligner;
import org.calista.formalizer.assemble.Assembler;
import org.calista.formalizer.assemble.FormalArtifact;
import org.calista.formalizer.compiler.CompilationResult;
import org.calista.formalizer.compiler.CompilationUnit;
import org.calista.formalizer.compiler.CompilerClient;
import org.calista.formalizer.core.CollaboratorException;
import org.calista.formalizer.events.EventStore;
import org.calista.formalizer.events.RunEvent;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.knowledge.VerifiedEntry;
import org.calista.formalizer.knowledge.VerifiedKnowledgeBase;
import org.calista.formalizer.knowledge.VerifiedKnowledgeStore;
import org.calista.formalizer.plan.GraphBuilder;
import org.calista.formalizer.schedule.BuildPlan;
import org.calista.formalizer.schedule.BuildScheduler;
import org.calista.formalizer.synth.SynthesisEngine;
import org.calista.formalizer.synth.SynthesisOutcome;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FormalizationPipeline — one statement end to end:
 * Stage 1 (graph) → schedule → Stage 2 (synthesis) → assemble → whole-file check →
 * Stage 3 (alignment, only for a complete file) → knowledge-base update.
 *
 * <p>Always returns a result with an artifact; only graph-invariant violations escape.
 * Owns the synthesis engine (and its worker pool).</p>
 */
public final class FormalizationPipeline implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(FormalizationPipeline.class);

    private final GraphBuilder graphBuilder;
    private final BuildScheduler scheduler;
    private final SynthesisEngine engine;
    private final Assembler assembler;
    private final CompilerClient finalCheck;          // nullable
    private final SemanticAligner aligner;            // nullable
    private final VerifiedKnowledgeBase knowledge;    // nullable
    private final VerifiedKnowledgeStore knowledgeStore; // nullable
    private final EventStore events;                  // nullable

    private final AtomicLong runSeq = new AtomicLong();

    private FormalizationPipeline(Builder b) {
        this.graphBuilder = Objects.requireNonNull(b.graphBuilder, "graphBuilder");
        this.scheduler = b.scheduler != null ? b.scheduler : new BuildScheduler();
        this.engine = Objects.requireNonNull(b.engine, "engine");
        this.assembler = Objects.requireNonNull(b.assembler, "assembler");
        this.finalCheck = b.finalCheck;
        this.aligner = b.aligner;
        this.knowledge = b.knowledge;
        this.knowledgeStore = b.knowledgeStore;
        this.events = b.events;
    }

    public FormalizationResult formalize(String statement) {
        if (statement == null || statement.isBlank()) throw new IllegalArgumentException("statement is blank");
        final long started = System.currentTimeMillis();
        final String runId = "run-" + Long.toString(started, 36) + "-" + runSeq.incrementAndGet();

        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("run", runId)) {
            // Stage 1
            GraphBuilder.Result stage1 = graphBuilder.build(statement.trim());
            ConceptGraph graph = stage1.graph;
            emit(RunEvent.of(RunEvent.STAGE1_DONE, runId, null, statement)
                    .with("nodes", graph.size())
                    .with("statusCounts", graph.statusCounts().toString())
                    .with("expansions", stage1.expansions.toString())
                    .with("groundingErrors", stage1.groundingErrors));

            BuildPlan plan = scheduler.schedule(graph);

            // Stage 2
            List<SynthesisOutcome> outcomes = engine.run(graph, plan);
            for (SynthesisOutcome o : outcomes) {
                String type = o.synthesized() ? RunEvent.NODE_SYNTHESIZED : RunEvent.NODE_FAILED;
                emit(RunEvent.of(type, runId, o.nodeId, o.description)
                        .with("attempts", o.attempts)
                        .with("reason", o.reason.name()));
            }

            FormalArtifact artifact = assembler.assemble(graph, plan);
            boolean compiled = artifact.isComplete() && checkWholeFile(artifact, runId);
            emit(RunEvent.of(RunEvent.ARTIFACT, runId, null, null)
                    .with("synthesized", artifact.synthesized)
                    .with("failed", artifact.failed)
                    .with("grounded", artifact.grounded)
                    .with("compilationPassed", compiled));

            // Stage 3
            AlignmentReport alignment = null;
            int saved = 0;
            if (compiled && aligner != null && plan.size() > 0) {
                alignment = aligner.align(statement.trim(), graph, plan);
                emit(RunEvent.of(RunEvent.ALIGNMENT, runId, null, alignment.consistencyLevel)
                        .with("consistent", alignment.isConsistent())
                        .with("discrepancies", alignment.discrepancies.size()));
                if (alignment.isConsistent()) saved = remember(graph, plan);
            }

            FormalizationResult result = new FormalizationResult(runId, statement.trim(), graph, plan, outcomes,
                    artifact, compiled, alignment, saved, System.currentTimeMillis() - started);
            log.info("[pipeline] {} status={} compiled={} nodes={} elapsedMs={}",
                    runId, result.status().wire(), compiled, graph.size(), result.elapsedMs);
            return result;
        }
    }

    private boolean checkWholeFile(FormalArtifact artifact, String runId) {
        if (finalCheck == null) return true;
        try {
            CompilationResult r = finalCheck.check(new CompilationUnit(List.of(), List.of(), artifact.text), runId + "_final");
            if (!r.success) {
                log.warn("[pipeline] assembled file does not compile: {}",
                        r.diagnostics.isEmpty() ? "(no diagnostics)" : r.diagnostics.get(0).render());
            }
            return r.success;
        } catch (CollaboratorException e) {
            log.warn("[pipeline] whole-file check unavailable, counting as not compiled: {}", e.getMessage());
            return false;
        }
    }

    /** Saves synthesized non-root nodes of an aligned run. */
    private int remember(ConceptGraph graph, BuildPlan plan) {
        if (knowledge == null) return 0;
        int changed = 0;
        for (ConceptNode n : plan.synthesisOrder) {
            if (n == graph.root() || n.status() != NodeStatus.SYNTHESIZED) continue;
            List<String> deps = new ArrayList<>();
            for (String d : n.dependencies()) {
                ConceptNode dep = graph.node(d);
                boolean hasCode = dep.status() == NodeStatus.SYNTHESIZED
                        || (dep.status() == NodeStatus.GROUNDED && !dep.resolvedReference().isLibrary());
                if (hasCode) deps.add(dep.description());
            }
            if (knowledge.upsert(VerifiedEntry.of(n.description(), n.synthesizedCode(), deps))) changed++;
        }
        if (changed > 0 && knowledgeStore != null) {
            try {
                knowledgeStore.save(knowledge);
            } catch (IOException e) {
                log.error("[pipeline] verified knowledge not persisted to {}", knowledgeStore.file(), e);
            }
        }
        log.info("[pipeline] verified knowledge: {} entries updated, {} total", changed, knowledge.size());
        return changed;
    }

    private void emit(RunEvent e) {
        if (events != null) events.appendQuietly(e);
    }

    @Override
    public void close() {
        engine.close();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private GraphBuilder graphBuilder;
        private BuildScheduler scheduler;
        private SynthesisEngine engine;
        private Assembler assembler;
        private CompilerClient finalCheck;
        private SemanticAligner aligner;
        private VerifiedKnowledgeBase knowledge;
        private VerifiedKnowledgeStore knowledgeStore;
        private EventStore events;

        private Builder() {
        }

        public Builder graphBuilder(GraphBuilder v) {
            this.graphBuilder = Objects.requireNonNull(v, "graphBuilder");
            return this;
        }

        public Builder scheduler(BuildScheduler v) {
            this.scheduler = Objects.requireNonNull(v, "scheduler");
            return this;
        }

        public Builder engine(SynthesisEngine v) {
            this.engine = Objects.requireNonNull(v, "engine");
            return this;
        }

        public Builder assembler(Assembler v) {
            this.assembler = Objects.requireNonNull(v, "assembler");
            return this;
        }

        /** Compiles the assembled file once more; without it a complete file counts as compiled. */
        public Builder finalCheck(CompilerClient v) {
            this.finalCheck = v;
            return this;
        }

        public Builder aligner(SemanticAligner v) {
            this.aligner = v; // nullable: no Stage 3
            return this;
        }

        public Builder knowledge(VerifiedKnowledgeBase kb, VerifiedKnowledgeStore store) {
            this.knowledge = kb;
            this.knowledgeStore = store;
            return this;
        }

        public Builder events(EventStore v) {
            this.events = v;
            return this;
        }

        public FormalizationPipeline build() {
            return new FormalizationPipeline(this);
        }
    }
}
