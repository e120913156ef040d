package org.calista.formalizer.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.calista.formalizer.compiler.CompilationResult;
import org.calista.formalizer.core.FormalizerComposer;
import org.calista.formalizer.core.FormalizerKernel;
import org.calista.formalizer.events.RunEvent;
import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.llm.PromptLibrary;
import org.calista.formalizer.search.SearchHit;
import org.calista.formalizer.synth.SynthesisOutcome;
import org.calista.formalizer.testing.FakeCompiler;
import org.calista.formalizer.testing.FakeSearch;
import org.calista.formalizer.testing.ScriptedModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FormalizationPipelineTest {

  static final String STATEMENT = "The sum of two even integers is even.";
  static final String EVEN_CODE = "def isEven (n : ℤ) : Prop := ∃ k, n = 2 * k";
  static final String ROOT_CODE =
      "theorem even_add (a b : ℤ) (ha : isEven a) (hb : isEven b) : isEven (a + b) := sorry";

  static FormalizerKernel kernel(Path root) throws Exception {
    FormalizerKernel k = FormalizerKernel.builder().root(root).build(Path.of("formalizer.json"));
    k.config().collaborators.retryDelayMs = 0;
    k.config().synthesis.rootSemanticGate = false;
    k.loadKnowledge();
    return k;
  }

  /** Plans "even integer" under the root, writes code for both, and agrees on the meaning. */
  static ScriptedModel mathematician(String verdictLevel) {
    return new ScriptedModel((kind, user) -> {
      String concept = ScriptedModel.conceptOf(user);
      switch (kind) {
        case PromptLibrary.EXPANSION:
          return concept.equals(STATEMENT) ? "{\"subconcepts\": [\"even integer\"]}" : "{\"subconcepts\": []}";
        case PromptLibrary.SYNTHESIS:
        case PromptLibrary.REFLECTION:
          return "```lean\n" + (concept.equals("even integer") ? EVEN_CODE : ROOT_CODE) + "\n```";
        case PromptLibrary.BACK_TRANSLATION:
          return "reading of " + concept;
        case PromptLibrary.MERGE_BACK_TRANSLATIONS:
          return "If a and b are even integers then a + b is even.";
        case PromptLibrary.SEMANTIC_CHECK:
          return "{\"consistency_level\": \"" + verdictLevel + "\", \"discrepancies\": []}";
        default:
          return "NO_MATCH";
      }
    });
  }

  @Test
  public void testEndToEndSuccessSavesVerifiedKnowledge(@TempDir Path root) throws Exception {
    FormalizerKernel k = kernel(root);
    FakeCompiler compiler = FakeCompiler.lenient();

    FormalizationResult r;
    try (FormalizationPipeline p = new FormalizerComposer(k)
        .search(new FakeSearch()).model(mathematician("level_1")).compiler(compiler).buildPipeline()) {
      r = p.formalize(STATEMENT);
    }

    assertThat(r.status()).isEqualTo(FormalizationResult.Status.SUCCESS);
    assertThat(r.compilationPassed).isTrue();
    assertThat(r.semanticPassed()).isTrue();
    assertThat(r.graph.size()).isEqualTo(2);
    assertThat(r.outcomes).allSatisfy(o -> assertThat(o.synthesized()).isTrue());
    assertThat(r.artifact.text)
        .startsWith("import Mathlib\n")
        .contains("-- Node: even integer\n" + EVEN_CODE)
        .endsWith(ROOT_CODE + "\n");
    assertThat(compiler.requestIds.get(compiler.requestIds.size() - 1)).endsWith("_final");
    assertThat(r.savedToKnowledge).isEqualTo(1);
    assertThat(k.knowledge().get("even integer")).isPresent();
    assertThat(k.knowledge().get(STATEMENT)).isEmpty();
    assertThat(k.eventStore().readAll()).extracting(e -> e.type).containsExactly(
        RunEvent.STAGE1_DONE, RunEvent.NODE_SYNTHESIZED, RunEvent.NODE_SYNTHESIZED, RunEvent.ARTIFACT,
        RunEvent.ALIGNMENT);

    ObjectNode report = r.report(k.mapper());
    assertThat(report.get("status").asText()).isEqualTo("success");
    assertThat(report.get("nodes")).hasSize(2);
    assertThat(report.at("/alignment/consistencyLevel").asText()).isEqualTo("level_1");
  }

  @Test
  public void testVerifiedConceptIsReusedByTheNextRun(@TempDir Path root) throws Exception {
    FormalizerKernel k = kernel(root);
    ScriptedModel model = mathematician("level_1");
    try (FormalizationPipeline p = new FormalizerComposer(k)
        .search(new FakeSearch()).model(model).compiler(FakeCompiler.lenient()).buildPipeline()) {
      p.formalize(STATEMENT);

      int synthesesBefore = model.count(PromptLibrary.SYNTHESIS);
      FormalizationResult again = p.formalize(STATEMENT);

      assertThat(again.graph.findByDescription("even integer").orElseThrow().resolvedReference().source)
          .isEqualTo(GroundedReference.Source.VERIFIED_KB);
      assertThat(again.artifact.text).contains("-- Verified: even integer\n" + EVEN_CODE);
      assertThat(model.count(PromptLibrary.SYNTHESIS) - synthesesBefore).isEqualTo(1);
      assertThat(again.status()).isEqualTo(FormalizationResult.Status.SUCCESS);
    }

    FormalizerKernel reopened = kernel(root);
    assertThat(reopened.knowledge().get("even integer")).isPresent();
  }

  @Test
  public void testInconsistentRunIsNotRemembered(@TempDir Path root) throws Exception {
    FormalizerKernel k = kernel(root);
    FormalizationResult r;
    try (FormalizationPipeline p = new FormalizerComposer(k)
        .search(new FakeSearch()).model(mathematician("level_3")).compiler(FakeCompiler.lenient()).buildPipeline()) {
      r = p.formalize(STATEMENT);
    }

    assertThat(r.status()).isEqualTo(FormalizationResult.Status.INCONSISTENT);
    assertThat(r.compilationPassed).isTrue();
    assertThat(r.semanticPassed()).isFalse();
    assertThat(k.knowledge().size()).isZero();
  }

  @Test
  public void testFailedLeafStillYieldsAnArtifact(@TempDir Path root) throws Exception {
    FormalizerKernel k = kernel(root);
    FakeCompiler compiler = new FakeCompiler((src, id) -> src.contains("def isEven")
        ? CompilationResult.failure("type mismatch")
        : CompilationResult.success());
    ScriptedModel model = mathematician("level_1");

    FormalizationResult r;
    try (FormalizationPipeline p = new FormalizerComposer(k)
        .search(new FakeSearch()).model(model).compiler(compiler).buildPipeline()) {
      r = p.formalize(STATEMENT);
    }

    assertThat(r.graph.findByDescription("even integer").orElseThrow().status()).isEqualTo(NodeStatus.FAILED);
    assertThat(r.graph.findByDescription("even integer").orElseThrow().attemptCount()).isEqualTo(16);
    assertThat(r.artifact.text).contains("-- [FAILED] not formalized after 16 attempts");
    assertThat(r.status()).isEqualTo(FormalizationResult.Status.FAILED);
    assertThat(r.alignment).isNull();
    assertThat(model.count(PromptLibrary.SEMANTIC_CHECK)).isZero();
    assertThat(compiler.requestIds).noneMatch(id -> id.endsWith("_final"));
  }

  @Test
  public void testGroundedStatementNeedsNoSynthesis(@TempDir Path root) throws Exception {
    FormalizerKernel k = kernel(root);
    FakeSearch search = new FakeSearch().on(STATEMENT, SearchHit.of("Even.add", "sum of evens is even", 0.02));
    ScriptedModel model = mathematician("level_1");

    FormalizationResult r;
    try (FormalizationPipeline p = new FormalizerComposer(k)
        .search(search).model(model).compiler(FakeCompiler.lenient()).buildPipeline()) {
      r = p.formalize(STATEMENT);
    }

    assertThat(r.plan.synthesisOrder).isEmpty();
    assertThat(r.artifact.text).contains("-> Even.add");
    assertThat(r.compilationPassed).isTrue();
    assertThat(r.alignment).isNull();
    assertThat(model.kinds).isEmpty();
    assertThat(r.status()).isEqualTo(FormalizationResult.Status.SUCCESS);
    assertThat(r.outcomes).isEqualTo(List.of());
  }

  @Test
  public void testRootGateRejectsAMisreadStatement(@TempDir Path root) throws Exception {
    FormalizerKernel k = kernel(root);
    k.config().synthesis.rootSemanticGate = true;
    ScriptedModel model = mathematician("level_3");
    FakeCompiler compiler = FakeCompiler.lenient();

    FormalizationResult r;
    try (FormalizationPipeline p = new FormalizerComposer(k)
        .search(new FakeSearch()).model(model).compiler(compiler).buildPipeline()) {
      r = p.formalize(STATEMENT);
    }

    assertThat(r.graph.root().status()).isEqualTo(NodeStatus.FAILED);
    assertThat(r.graph.root().attemptCount()).isEqualTo(1);
    assertThat(r.graph.findByDescription("even integer").orElseThrow().status()).isEqualTo(NodeStatus.SYNTHESIZED);
    assertThat(r.outcomes.get(r.outcomes.size() - 1).reason).isEqualTo(SynthesisOutcome.Reason.SEMANTIC_REJECTED);
    assertThat(r.status()).isEqualTo(FormalizationResult.Status.FAILED);
    assertThat(model.count(PromptLibrary.BACK_TRANSLATION)).isEqualTo(1);
    assertThat(compiler.requestIds).hasSize(1);
  }
}
