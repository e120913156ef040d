package org.calista.formalizer.assemble;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.knowledge.InMemoryVerifiedKnowledgeBase;
import org.calista.formalizer.knowledge.VerifiedEntry;
import org.calista.formalizer.schedule.BuildPlan;
import org.calista.formalizer.schedule.BuildScheduler;
import org.junit.jupiter.api.Test;

public class AssemblerTest {

  private ConceptGraph graph;
  private ConceptNode evens;
  private ConceptNode broken;

  private BuildPlan finishedRun() {
    graph = new ConceptGraph("sum of two even integers is even", 8);
    evens = graph.addChild(graph.root(), "even integer");
    broken = graph.addChild(graph.root(), "parity map");
    ConceptNode lib = graph.addChild(graph.root(), "integer addition");
    lib.ground(GroundedReference.library("Int.add", "addition", 0.1));
    evens.planSynthesis(null);
    broken.planSynthesis(null);
    graph.root().planSynthesis(null);
    BuildPlan plan = new BuildScheduler().schedule(graph);

    evens.tryBeginAttempt(16);
    evens.synthesized("import Mathlib.Algebra.Group.Even\n\ndef isEven (n : ℤ) : Prop := ∃ k, n = 2 * k");
    for (int i = 0; i < 16; i++) broken.tryBeginAttempt(16);
    broken.failed(List.of("unknown identifier 'parity'\n  at line 3"));
    graph.root().tryBeginAttempt(16);
    graph.root().synthesized("theorem even_add (a b : ℤ) : isEven a → isEven b → isEven (a + b) := sorry");
    return plan;
  }

  @Test
  public void testLayout() {
    BuildPlan plan = finishedRun();

    FormalArtifact a = new Assembler(List.of("import Mathlib"), null, true).assemble(graph, plan);

    assertThat(a.text).isEqualTo(String.join("\n",
        "import Mathlib",
        "import Mathlib.Algebra.Group.Even",
        "",
        "-- Grounded: integer addition -> Int.add",
        "",
        "-- Node: even integer",
        "def isEven (n : ℤ) : Prop := ∃ k, n = 2 * k",
        "",
        "-- Node: parity map",
        "-- [FAILED] not formalized after 16 attempts",
        "-- last error: unknown identifier 'parity' at line 3",
        "",
        "-- Node: sum of two even integers is even",
        "theorem even_add (a b : ℤ) : isEven a → isEven b → isEven (a + b) := sorry",
        ""));
    assertThat(a.synthesized).isEqualTo(2);
    assertThat(a.failed).isEqualTo(1);
    assertThat(a.grounded).isEqualTo(1);
    assertThat(a.isComplete()).isFalse();
  }

  @Test
  public void testAssemblyIsIdempotent() {
    BuildPlan plan = finishedRun();
    Assembler assembler = new Assembler(List.of("import Mathlib"), null, false);

    String first = assembler.assemble(graph, plan).text;

    assertThat(assembler.assemble(graph, plan).text).isEqualTo(first);
    assertThat(first).doesNotContain("-- Grounded:");
  }

  @Test
  public void testVerifiedClosureComesFirstOnce() {
    InMemoryVerifiedKnowledgeBase kb = new InMemoryVerifiedKnowledgeBase();
    kb.upsert(VerifiedEntry.of("even integer", "def isEven (n : ℤ) : Prop := ∃ k, n = 2 * k", List.of()));
    kb.upsert(VerifiedEntry.of("odd integer", "def isOdd (n : ℤ) : Prop := ¬ isEven n", List.of("even integer")));

    ConceptGraph g = new ConceptGraph("parity of integers", 8);
    ConceptNode odd = g.addChild(g.root(), "odd integer");
    ConceptNode even = g.addChild(g.root(), "even integer");
    odd.ground(GroundedReference.verified("odd integer", kb.get("odd integer").orElseThrow().code));
    even.ground(GroundedReference.verified("even integer", kb.get("even integer").orElseThrow().code));
    g.root().planSynthesis(null);
    BuildPlan plan = new BuildScheduler().schedule(g);
    g.root().tryBeginAttempt(1);
    g.root().synthesized("theorem parity (n : ℤ) : isEven n ∨ isOdd n := sorry");

    String text = new Assembler(List.of("import Mathlib"), kb, true).assemble(g, plan).text;

    assertThat(text.indexOf("-- Verified: even integer")).isPositive()
        .isLessThan(text.indexOf("-- Verified: odd integer"));
    assertThat(text.indexOf("def isEven")).isEqualTo(text.lastIndexOf("def isEven"));
    assertThat(text.indexOf("-- Verified: odd integer")).isLessThan(text.indexOf("-- Node: parity of integers"));
  }

  @Test
  public void testGroundedRootAssemblesToImportsAndAnnotation() {
    ConceptGraph g = new ConceptGraph("the set of even integers", 4);
    g.root().ground(GroundedReference.library("Even", "", 0.05));
    BuildPlan plan = new BuildScheduler().schedule(g);

    FormalArtifact a = new Assembler(List.of("import Mathlib"), null, true).assemble(g, plan);

    assertThat(a.text).isEqualTo("import Mathlib\n\n-- Grounded: the set of even integers -> Even\n");
    assertThat(a.isComplete()).isTrue();
  }
}
