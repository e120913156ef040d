package org.calista.formalizer.plan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.calista.formalizer.core.FormalizerConfig;
import org.calista.formalizer.core.Retries;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.llm.PromptLibrary;
import org.calista.formalizer.testing.ScriptedModel;
import org.junit.jupiter.api.Test;

public class DecompositionExpanderTest {

  private static DecompositionExpander expander(ScriptedModel model, int maxDepth) {
    FormalizerConfig.Planner cfg = new FormalizerConfig.Planner();
    cfg.maxDepth = maxDepth;
    return new DecompositionExpander(model, new PromptLibrary(), new ObjectMapper(), cfg, Retries.none());
  }

  private static ScriptedModel replying(String json) {
    return new ScriptedModel((kind, user) -> json);
  }

  private static List<String> descriptions(List<ConceptNode> nodes) {
    return nodes.stream().map(ConceptNode::description).collect(Collectors.toList());
  }

  @Test
  public void testTwoSubconceptsBecomePendingChildren() {
    ConceptGraph g = new ConceptGraph("a group with finite order", 16);
    ScriptedModel model = replying("{\"subconcepts\": [\"binary operation with identity and inverses\","
        + " \"finite carrier set\"], \"statement_shape\": \"structure FinGroup\"}");

    Expansion e = expander(model, 4).expand(g, g.root());

    assertThat(e.outcome).isEqualTo(Expansion.Outcome.EXPANDED);
    assertThat(descriptions(e.newChildren))
        .containsExactly("binary operation with identity and inverses", "finite carrier set");
    assertThat(e.newChildren).allSatisfy(c -> assertThat(c.status()).isEqualTo(NodeStatus.PENDING));
    assertThat(g.root().dependencies()).containsExactly(e.newChildren.get(0).id(), e.newChildren.get(1).id());
    assertThat(g.root().status()).isEqualTo(NodeStatus.TO_SYNTHESIZE);
    assertThat(g.root().plannedShape()).isEqualTo("structure FinGroup");
    assertThat(ScriptedModel.conceptOf(model.userMessages.get(0))).isEqualTo("a group with finite order");
  }

  @Test
  public void testExistingConceptIsShared() {
    ConceptGraph g = new ConceptGraph("root", 16);
    ConceptNode a = g.addChild(g.root(), "prime number");
    ConceptNode b = g.addChild(g.root(), "twin primes");
    a.planSynthesis(null);

    Expansion e = expander(replying("[\"Prime number\", \"difference of two\"]"), 4).expand(g, b);

    assertThat(e.outcome).isEqualTo(Expansion.Outcome.EXPANDED);
    assertThat(e.sharedDependencies).containsExactly(a);
    assertThat(descriptions(e.newChildren)).containsExactly("difference of two");
    assertThat(b.dependencies()).contains(a.id());
    assertThat(g.size()).isEqualTo(4);
  }

  @Test
  public void testMaxDepthSkipsTheModel() {
    ConceptGraph g = new ConceptGraph("root", 16);
    ConceptNode a = g.addChild(g.root(), "a");
    ScriptedModel model = replying("[\"x\"]");

    Expansion e = expander(model, 1).expand(g, a);

    assertThat(e.outcome).isEqualTo(Expansion.Outcome.FORCED_DEPTH);
    assertThat(a.status()).isEqualTo(NodeStatus.TO_SYNTHESIZE);
    assertThat(model.kinds).isEmpty();
  }

  @Test
  public void testOverCapacityProposalIsDiscarded() {
    ConceptGraph g = new ConceptGraph("root", 3);
    Expansion e = expander(replying("[\"a\", \"b\", \"c\"]"), 4).expand(g, g.root());

    assertThat(e.outcome).isEqualTo(Expansion.Outcome.FORCED_COUNT);
    assertThat(g.size()).isEqualTo(1);
    assertThat(g.root().status()).isEqualTo(NodeStatus.TO_SYNTHESIZE);
  }

  @Test
  public void testProposalNamingAnAncestorIsRejected() {
    ConceptGraph g = new ConceptGraph("cyclic group", 16);
    ConceptNode gen = g.addChild(g.root(), "generator of a group");

    Expansion e = expander(replying("[\"Cyclic group\", \"group element\"]"), 4).expand(g, gen);

    assertThat(e.outcome).isEqualTo(Expansion.Outcome.REJECTED_CYCLE);
    assertThat(gen.status()).isEqualTo(NodeStatus.TO_SYNTHESIZE);
    assertThat(gen.dependencies()).isEmpty();
    assertThat(g.size()).isEqualTo(2);
  }

  @Test
  public void testProposalNamingItselfIsRejected() {
    ConceptGraph g = new ConceptGraph("prime number", 16);
    Expansion e = expander(replying("[\"prime number\"]"), 4).expand(g, g.root());
    assertThat(e.outcome).isEqualTo(Expansion.Outcome.REJECTED_CYCLE);
  }

  @Test
  public void testEmptyProposalIsIrreducible() {
    ConceptGraph g = new ConceptGraph("natural number", 16);
    Expansion e = expander(replying("{\"subconcepts\": []}"), 4).expand(g, g.root());
    assertThat(e.outcome).isEqualTo(Expansion.Outcome.IRREDUCIBLE);
    assertThat(e.forced()).isFalse();
    assertThat(g.root().status()).isEqualTo(NodeStatus.TO_SYNTHESIZE);
  }

  @Test
  public void testMalformedReplyFallsBackToDirectSynthesis() {
    ConceptGraph g = new ConceptGraph("root", 16);
    Expansion e = expander(replying("Sure! First we need groups."), 4).expand(g, g.root());
    assertThat(e.outcome).isEqualTo(Expansion.Outcome.MALFORMED);
    assertThat(e.forced()).isTrue();
    assertThat(g.root().status()).isEqualTo(NodeStatus.TO_SYNTHESIZE);
  }

  @Test
  public void testUnavailableModelFallsBackToDirectSynthesis() {
    ConceptGraph g = new ConceptGraph("root", 16);
    ScriptedModel model = new ScriptedModel((kind, user) -> {
      throw ScriptedModel.down();
    });
    Expansion e = expander(model, 4).expand(g, g.root());
    assertThat(e.outcome).isEqualTo(Expansion.Outcome.UNAVAILABLE);
    assertThat(g.root().status()).isEqualTo(NodeStatus.TO_SYNTHESIZE);
  }
}
