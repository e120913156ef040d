package org.calista.formalizer.synth;

import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.calista.formalizer.align.AlignmentReport;
import org.calista.formalizer.align.SemanticAligner;
import org.calista.formalizer.compiler.CompilationResult;
import org.calista.formalizer.compiler.CompilationUnit;
import org.calista.formalizer.compiler.CompilerClient;
import org.calista.formalizer.core.CollaboratorException;
import org.calista.formalizer.core.FormalizerConfig;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GraphInvariantException;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.knowledge.VerifiedKnowledgeBase;
import org.calista.formalizer.llm.ChatMessage;
import org.calista.formalizer.llm.LanguageModel;
import org.calista.formalizer.llm.ModelOutputs;
import org.calista.formalizer.llm.PromptLibrary;
import org.calista.formalizer.schedule.BuildPlan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * SynthesisEngine — Stage 2. Walks the build plan and drives, per node, the bounded
 * attempt / check / reflect loop.
 *
 * <p>Per node: every attempt (successful, empty or failed on a collaborator) costs one unit
 * of {@code maxAttempts}. The loop stops on the first compiled candidate, when the budget
 * is spent, when collaborator failures exceed {@code retries} in a row, or when the
 * optional wall-clock budget runs out. With {@code workers > 1} the node's budget is
 * shared by parallel workers, each with its own reflection chain; the first compiled
 * candidate wins.</p>
 *
 * <p>With a root gate, a worker's first candidate for the root node is read back and checked
 * against the statement before it is compiled. A clear {@code level_3} verdict ends that
 * worker; an unreadable verdict lets the candidate go on to the compiler.</p>
 *
 * <p>Owns its worker pool (only created for {@code workers > 1}); close it with the run.</p>
 */
public final class SynthesisEngine implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(SynthesisEngine.class);

    static final String EMPTY_REPLY = "the reply contained no Lean code";

    private final LanguageModel model;
    private final CompilerClient compiler;
    private final PromptLibrary prompts;
    private final VerifiedKnowledgeBase knowledge; // nullable
    private final FormalizerConfig.Synthesis cfg;
    private final int collaboratorRetries;
    private final SemanticAligner rootGate; // nullable
    private final LongSupplier clock;

    private final ExecutorService workers; // null for single worker

    public SynthesisEngine(LanguageModel model, CompilerClient compiler, PromptLibrary prompts,
                           VerifiedKnowledgeBase knowledge, FormalizerConfig.Synthesis cfg,
                           int collaboratorRetries) {
        this(model, compiler, prompts, knowledge, cfg, collaboratorRetries, null);
    }

    public SynthesisEngine(LanguageModel model, CompilerClient compiler, PromptLibrary prompts,
                           VerifiedKnowledgeBase knowledge, FormalizerConfig.Synthesis cfg,
                           int collaboratorRetries, SemanticAligner rootGate) {
        this(model, compiler, prompts, knowledge, cfg, collaboratorRetries, rootGate, System::currentTimeMillis);
    }

    SynthesisEngine(LanguageModel model, CompilerClient compiler, PromptLibrary prompts,
                    VerifiedKnowledgeBase knowledge, FormalizerConfig.Synthesis cfg,
                    int collaboratorRetries, SemanticAligner rootGate, LongSupplier clock) {
        this.model = Objects.requireNonNull(model, "model");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.prompts = Objects.requireNonNull(prompts, "prompts");
        this.knowledge = knowledge;
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.collaboratorRetries = Math.max(0, collaboratorRetries);
        this.rootGate = rootGate;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = cfg.workers > 1 ? createPool(cfg) : null;
    }

    // ---------------------------------------------------------------------
    // Stage 2
    // ---------------------------------------------------------------------

    /** Synthesizes every node of the plan in order. A FAILED node does not stop the run. */
    public List<SynthesisOutcome> run(ConceptGraph graph, BuildPlan plan) {
        List<SynthesisOutcome> out = new ArrayList<>(plan.size());
        int i = 0;
        for (ConceptNode node : plan.synthesisOrder) {
            i++;
            log.info("[stage2] {}/{} {} '{}'", i, plan.size(), node.id(), ModelOutputs.oneLine(node.description(), 120));
            SynthesisOutcome o = synthesize(graph, node);
            log.info("[stage2] {}", o);
            out.add(o);
        }
        return out;
    }

    public SynthesisOutcome synthesize(ConceptGraph graph, ConceptNode node) {
        if (node.status() != NodeStatus.TO_SYNTHESIZE) {
            throw new GraphInvariantException("node " + node.id() + " is not TO_SYNTHESIZE: " + node.status());
        }
        for (String dep : node.dependencies()) {
            if (!graph.node(dep).status().isTerminal()) {
                throw new GraphInvariantException("dependency " + dep + " of " + node.id() + " is not terminal");
            }
        }

        long started = clock.getAsLong();
        long deadline = cfg.nodeBudgetMs > 0 ? started + cfg.nodeBudgetMs : Long.MAX_VALUE;
        DependencyScope scope = DependencyScope.of(graph, node, knowledge);
        NodeRun run = new NodeRun(node, scope, deadline, rootGate != null && node == graph.root());

        try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("node", node.id())) {
            if (workers == null) {
                run.work(0);
            } else {
                runParallel(run);
            }
        }

        SynthesisOutcome.Reason reason;
        String code = run.winner.get();
        if (code != null) {
            node.synthesized(code);
            reason = SynthesisOutcome.Reason.COMPILED;
        } else {
            node.failed(run.lastDiagnostics.get());
            int workerCount = workers == null ? 1 : cfg.workers;
            if (run.stopReason.get() != null) reason = run.stopReason.get();
            else if (run.rejectedWorkers.get() == workerCount) reason = SynthesisOutcome.Reason.SEMANTIC_REJECTED;
            else reason = SynthesisOutcome.Reason.ATTEMPTS_EXHAUSTED;
        }
        return new SynthesisOutcome(node.id(), node.description(), node.status(), reason, node.attemptCount(),
                clock.getAsLong() - started);
    }

    private void runParallel(NodeRun run) {
        final Map<String, String> mdc = ThreadContext.getImmutableContext();
        List<CompletableFuture<Void>> futures = new ArrayList<>(cfg.workers);
        for (int w = 0; w < cfg.workers; w++) {
            final int idx = w;
            futures.add(CompletableFuture.runAsync(() -> {
                ThreadContext.putAll(mdc);
                try {
                    run.work(idx);
                } finally {
                    ThreadContext.clearMap();
                }
            }, workers));
        }
        for (int w = 0; w < futures.size(); w++) {
            try {
                futures.get(w).join();
            } catch (RuntimeException e) {
                log.warn("worker {} for {} crashed", w, run.node.id(), e);
                run.recordProblem(List.of("worker crashed: " + e));
            }
        }
    }

    // ---------------------------------------------------------------------
    // One node: shared state of its workers
    // ---------------------------------------------------------------------

    private final class NodeRun {
        final ConceptNode node;
        final DependencyScope scope;
        final long deadline;
        final boolean gated;

        final AtomicReference<String> winner = new AtomicReference<>();
        final AtomicBoolean stop = new AtomicBoolean();
        final AtomicReference<SynthesisOutcome.Reason> stopReason = new AtomicReference<>();
        final AtomicReference<List<String>> lastDiagnostics = new AtomicReference<>(List.of());
        final AtomicInteger rejectedWorkers = new AtomicInteger();

        NodeRun(ConceptNode node, DependencyScope scope, long deadline, boolean gated) {
            this.node = node;
            this.scope = scope;
            this.deadline = deadline;
            this.gated = gated;
        }

        void recordProblem(List<String> diagnostics) {
            lastDiagnostics.set(List.copyOf(diagnostics));
        }

        void halt(SynthesisOutcome.Reason reason) {
            stopReason.compareAndSet(null, reason);
            stop.set(true);
        }

        void work(int worker) {
            SynthesisContext ctx = new SynthesisContext(node, scope);
            int consecutiveCollaboratorFailures = 0;

            while (!stop.get()) {
                if (clock.getAsLong() >= deadline) {
                    log.warn("{} wall-clock budget of {} ms spent", node.id(), cfg.nodeBudgetMs);
                    halt(SynthesisOutcome.Reason.BUDGET_EXHAUSTED);
                    return;
                }
                int attempt = node.tryBeginAttempt(cfg.maxAttempts);
                if (attempt == 0) return;
                ctx.beginAttempt(attempt);

                try (final CloseableThreadContext.Instance ctc = CloseableThreadContext.put("attempt", Integer.toString(attempt))) {
                    Step step = attemptOnce(ctx, worker, gated);
                    consecutiveCollaboratorFailures = 0;
                    if (step == Step.REJECTED) {
                        lastDiagnostics.set(ctx.lastDiagnostics());
                        rejectedWorkers.incrementAndGet();
                        log.warn("{} worker {} stops: the candidate does not state the problem", node.id(), worker);
                        return;
                    }
                    if (step == Step.COMPILED) {
                        if (winner.compareAndSet(null, ctx.lastCandidate())) {
                            log.info("{} compiled on attempt {} (worker {})", node.id(), attempt, worker);
                        }
                        stop.set(true);
                        return;
                    }
                    lastDiagnostics.set(ctx.lastDiagnostics());
                } catch (CollaboratorException e) {
                    consecutiveCollaboratorFailures++;
                    lastDiagnostics.set(List.of("collaborator failure: " + e.getMessage()));
                    log.warn("{} attempt {}: {} ({} in a row)", node.id(), attempt, e.getMessage(), consecutiveCollaboratorFailures);
                    if (consecutiveCollaboratorFailures > collaboratorRetries) {
                        halt(SynthesisOutcome.Reason.COLLABORATOR_FAILURE);
                        return;
                    }
                }
            }
        }
    }

    private enum Step { COMPILED, FAILED, REJECTED }

    /**
     * One generate + check round. The candidate (imports included) and any problem with it
     * are left in {@code ctx}.
     */
    private Step attemptOnce(SynthesisContext ctx, int worker, boolean gated) throws CollaboratorException {
        ConceptNode node = ctx.node;
        String reply = model.complete(messages(ctx), cfg.temperature);
        String code = ModelOutputs.extractBlock(reply);
        ModelOutputs.Candidate candidate = ModelOutputs.splitImports(code);
        if (candidate.isEmpty()) {
            ctx.recordProblem(EMPTY_REPLY);
            log.debug("{} attempt {}: empty candidate", node.id(), ctx.attempt());
            return Step.FAILED;
        }
        if (gated && ctx.workerAttempts() == 1 && !passesRootGate(ctx, code)) return Step.REJECTED;

        List<String> imports = new ArrayList<>(cfg.baseImports);
        imports.addAll(ctx.scope.imports);
        imports.addAll(candidate.imports);
        CompilationUnit unit = new CompilationUnit(imports, ctx.scope.blocks, candidate.body);

        String requestId = node.id() + "_a" + ctx.attempt() + "_w" + worker;
        log.debug("{} attempt {} candidate:\n{}", node.id(), ctx.attempt(), code);
        CompilationResult result = compiler.check(unit, requestId);
        if (result.success) {
            ctx.recordCompiled(code);
            return Step.COMPILED;
        }

        ctx.recordCompileFailure(code, result.diagnostics);
        log.debug("{} attempt {} diagnostics:\n{}", node.id(), ctx.attempt(), String.join("\n", ctx.lastDiagnostics()));
        return Step.FAILED;
    }

    /** False only for a readable verdict that the meaning is wrong. */
    private boolean passesRootGate(SynthesisContext ctx, String code) {
        AlignmentReport r = rootGate.precheck(ctx.node.description(), code);
        if (r.error != null) {
            log.warn("{} root check skipped: {}", ctx.node.id(), r.error);
            return true;
        }
        if (r.isConsistent()) return true;
        ctx.recordProblem("the code does not state the problem: " + String.join("; ", r.discrepancies));
        log.info("{} root check {}: {}", ctx.node.id(), r.consistencyLevel, r.discrepancies);
        return false;
    }

    private List<ChatMessage> messages(SynthesisContext ctx) {
        Map<String, String> v = new HashMap<>();
        v.put("concept", ctx.node.description());
        v.put("shape", ctx.node.plannedShape() == null ? "(free)" : ctx.node.plannedShape());
        v.put("dependency_context", ctx.scope.promptContext());
        v.put("grounded_context", ctx.scope.groundedContext());
        if (!ctx.isReflection()) return prompts.conversation(PromptLibrary.SYNTHESIS, v);

        v.put("attempt", Integer.toString(ctx.attempt() - 1));
        v.put("max_attempts", Integer.toString(cfg.maxAttempts));
        v.put("failed_code", ctx.lastCandidate().isBlank() ? "-- (no code was produced)" : ctx.lastCandidate());
        v.put("diagnostics", ctx.diagnosticsText(cfg.maxDiagnosticChars));
        return prompts.conversation(PromptLibrary.REFLECTION, v);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (workers == null) return;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(cfg.shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
                workers.awaitTermination(Math.max(250, cfg.shutdownTimeoutMs / 2), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static ExecutorService createPool(FormalizerConfig.Synthesis cfg) {
        final AtomicLong tid = new AtomicLong(1);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, cfg.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(cfg.workers, cfg.workers, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), tf);
    }
}
