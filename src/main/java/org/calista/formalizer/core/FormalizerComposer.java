package org.calista.formalizer.core;

import org.calista.formalizer.align.SemanticAligner;
import org.calista.formalizer.assemble.Assembler;
import org.calista.formalizer.compiler.CompilerClient;
import org.calista.formalizer.compiler.LeanCompilerClient;
import org.calista.formalizer.ground.GroundingReasoner;
import org.calista.formalizer.ground.GroundingResolver;
import org.calista.formalizer.knowledge.VerifiedKnowledgeBase;
import org.calista.formalizer.llm.LanguageModel;
import org.calista.formalizer.llm.OpenAiChatModel;
import org.calista.formalizer.llm.PromptLibrary;
import org.calista.formalizer.pipeline.FormalizationPipeline;
import org.calista.formalizer.plan.DecompositionExpander;
import org.calista.formalizer.plan.GraphBuilder;
import org.calista.formalizer.schedule.BuildScheduler;
import org.calista.formalizer.search.FallbackSearchClient;
import org.calista.formalizer.search.LeanSearchClient;
import org.calista.formalizer.search.LocalSearchClient;
import org.calista.formalizer.search.SearchClient;
import org.calista.formalizer.synth.SynthesisEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * FormalizerComposer — wires collaborators and stages from the kernel's config.
 *
 * <p>The three collaborators default to the HTTP/subprocess adapters and can be replaced
 * (tests pass fakes).</p>
 */
public final class FormalizerComposer {

    private static final Logger log = LoggerFactory.getLogger(FormalizerComposer.class);

    private final FormalizerKernel kernel;

    private SearchClient search;
    private LanguageModel model;
    private CompilerClient compiler;
    private PromptLibrary prompts;

    public FormalizerComposer(FormalizerKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
    }

    public FormalizerComposer search(SearchClient v) {
        this.search = Objects.requireNonNull(v, "search");
        return this;
    }

    public FormalizerComposer model(LanguageModel v) {
        this.model = Objects.requireNonNull(v, "model");
        return this;
    }

    public FormalizerComposer compiler(CompilerClient v) {
        this.compiler = Objects.requireNonNull(v, "compiler");
        return this;
    }

    public FormalizerComposer prompts(PromptLibrary v) {
        this.prompts = Objects.requireNonNull(v, "prompts");
        return this;
    }

    /** The caller owns the returned pipeline (close it: it owns the synthesis worker pool). */
    public FormalizationPipeline buildPipeline() {
        FormalizerConfig cfg = kernel.config();
        fillDefaults(cfg);

        Retries retries = new Retries(cfg.collaborators.retries, cfg.collaborators.retryDelayMs);
        VerifiedKnowledgeBase kb = cfg.knowledge.enabled ? kernel.knowledge() : null;

        GroundingReasoner reasoner = cfg.grounding.reasonerEnabled
                ? new GroundingReasoner(model, prompts, cfg.grounding.reasonerTemperature)
                : null;
        GroundingResolver resolver = new GroundingResolver(search, kb, reasoner, cfg.grounding, retries);
        DecompositionExpander expander = new DecompositionExpander(model, prompts, kernel.mapper(), cfg.planner, retries);
        GraphBuilder graphBuilder = new GraphBuilder(resolver, expander, cfg.planner.maxNodes,
                cfg.planner.forceRootDecomposition);

        SemanticAligner rootGate = cfg.synthesis.rootSemanticGate
                ? new SemanticAligner(model, prompts, kernel.mapper(), cfg.alignment, retries)
                : null;
        SynthesisEngine engine = new SynthesisEngine(model, compiler, prompts, kb, cfg.synthesis,
                cfg.collaborators.retries, rootGate);
        Assembler assembler = new Assembler(cfg.synthesis.baseImports, kb, cfg.artifact.annotateGrounded);
        SemanticAligner aligner = cfg.alignment.enabled
                ? new SemanticAligner(model, prompts, kernel.mapper(), cfg.alignment, retries)
                : null;

        log.info("Pipeline composed: search={}, model={}, compiler={}, reasoner={}, rootGate={}, alignment={}, workers={}, maxAttempts={}",
                search.getClass().getSimpleName(), model.getClass().getSimpleName(), compiler.getClass().getSimpleName(),
                reasoner != null, rootGate != null, aligner != null, cfg.synthesis.workers, cfg.synthesis.maxAttempts);

        return FormalizationPipeline.builder()
                .graphBuilder(graphBuilder)
                .scheduler(new BuildScheduler())
                .engine(engine)
                .assembler(assembler)
                .finalCheck(compiler)
                .aligner(aligner)
                .knowledge(kb != null && cfg.knowledge.saveVerified ? kb : null, kernel.knowledgeStore())
                .events(kernel.eventStore())
                .build();
    }

    private void fillDefaults(FormalizerConfig cfg) {
        if (prompts == null) {
            String dir = cfg.collaborators.promptsDir;
            prompts = dir.isBlank() ? new PromptLibrary() : new PromptLibrary(kernel.io().resolveExternal(dir));
        }
        HttpClient http = null;
        if (search == null || model == null) {
            http = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(15))
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
        }
        if (search == null) {
            FormalizerConfig.Search sc = cfg.collaborators.search;
            SearchClient web = new LeanSearchClient(http, kernel.mapper(), URI.create(sc.endpoint),
                    Duration.ofMillis(sc.timeoutMs));
            if ("local".equals(sc.mode)) {
                SearchClient local = new LocalSearchClient(sc.localCommand,
                        kernel.io().resolveExternal(sc.localWorkingDir), kernel.mapper(), Duration.ofMillis(sc.timeoutMs));
                search = sc.fallbackToWeb ? new FallbackSearchClient(local, web) : local;
            } else {
                search = web;
            }
        }
        if (model == null) {
            String key = cfg.resolveApiKey();
            if (key.isEmpty()) {
                log.warn("No language-model API key (config collaborators.llm.apiKey or env {})", FormalizerConfig.API_KEY_ENV);
            }
            model = new OpenAiChatModel(http, kernel.mapper(), cfg.collaborators.llm.baseUrl, key,
                    cfg.collaborators.llm.model, Duration.ofMillis(cfg.collaborators.llm.timeoutMs));
        }
        if (compiler == null) {
            compiler = new LeanCompilerClient(kernel.io().resolveExternal(cfg.collaborators.compiler.sandboxDir),
                    cfg.collaborators.compiler.lake, cfg.collaborators.compiler.lean,
                    Duration.ofMillis(cfg.collaborators.compiler.timeoutMs));
        }
    }
}
