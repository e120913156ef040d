package org.calista.formalizer.ground;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.calista.formalizer.core.FormalizerConfig;
import org.calista.formalizer.core.Retries;
import org.calista.formalizer.graph.ConceptGraph;
import org.calista.formalizer.graph.ConceptNode;
import org.calista.formalizer.graph.GroundedReference;
import org.calista.formalizer.graph.NodeStatus;
import org.calista.formalizer.knowledge.InMemoryVerifiedKnowledgeBase;
import org.calista.formalizer.knowledge.VerifiedEntry;
import org.calista.formalizer.llm.PromptLibrary;
import org.calista.formalizer.search.SearchHit;
import org.calista.formalizer.testing.FakeSearch;
import org.calista.formalizer.testing.ScriptedModel;
import org.junit.jupiter.api.Test;

public class GroundingResolverTest {

  private static final String EVENS = "the set of even integers";

  private static GroundingResolver resolver(FakeSearch search, InMemoryVerifiedKnowledgeBase kb,
      GroundingReasoner reasoner) {
    return new GroundingResolver(search, kb, reasoner, new FormalizerConfig.Grounding(), Retries.none());
  }

  @Test
  public void testCloseMatchGroundsTheNode() {
    FakeSearch search = new FakeSearch()
        .on(EVENS, SearchHit.of("Even", "n is even", 0.08), SearchHit.of("Odd", "n is odd", 0.6));
    ConceptGraph g = new ConceptGraph(EVENS, 8);

    GroundingDecision d = resolver(search, null, null).resolve(g.root());

    assertThat(d.grounded).isTrue();
    assertThat(g.root().status()).isEqualTo(NodeStatus.GROUNDED);
    assertThat(g.root().resolvedReference().canonicalId).isEqualTo("Even");
    assertThat(g.root().resolvedReference().source).isEqualTo(GroundedReference.Source.LIBRARY);
    assertThat(g.size()).isEqualTo(1);
    assertThat(g.root().dependencies()).isEmpty();
  }

  @Test
  public void testFarMatchLeavesNodePending() {
    FakeSearch search = new FakeSearch().on("a group with finite order", SearchHit.of("Group", "a group", 0.7));
    ConceptGraph g = new ConceptGraph("a group with finite order", 8);

    GroundingDecision d = resolver(search, null, null).resolve(g.root());

    assertThat(d.grounded).isFalse();
    assertThat(d.isRecoverableError()).isFalse();
    assertThat(d.candidates).hasSize(1);
    assertThat(g.root().status()).isEqualTo(NodeStatus.PENDING);
  }

  @Test
  public void testSearchOutageFailsOpen() {
    ConceptGraph g = new ConceptGraph(EVENS, 8);

    GroundingDecision d = resolver(new FakeSearch().down(), null, null).resolve(g.root());

    assertThat(d.grounded).isFalse();
    assertThat(d.isRecoverableError()).isTrue();
    assertThat(d.error).contains("503");
    assertThat(g.root().status()).isEqualTo(NodeStatus.PENDING);
  }

  @Test
  public void testRetriesBeforeFailingOpen() {
    FakeSearch search = new FakeSearch().down();
    GroundingResolver r = new GroundingResolver(search, null, null, new FormalizerConfig.Grounding(),
        new Retries(2, 0));

    r.decide(EVENS);

    assertThat(search.queries).hasSize(3);
  }

  @Test
  public void testVerifiedKnowledgeWinsOverSearch() {
    InMemoryVerifiedKnowledgeBase kb = new InMemoryVerifiedKnowledgeBase();
    kb.upsert(VerifiedEntry.of("The set of even integers", "def evens : Set ℤ := {n | Even n}", List.of()));
    FakeSearch search = new FakeSearch().on(EVENS, SearchHit.of("Even", "n is even", 0.01));
    ConceptGraph g = new ConceptGraph(EVENS, 8);

    GroundingDecision d = resolver(search, kb, null).resolve(g.root());

    assertThat(d.reference.source).isEqualTo(GroundedReference.Source.VERIFIED_KB);
    assertThat(d.reference.code).contains("def evens");
    assertThat(search.queries).isEmpty();
  }

  @Test
  public void testLatexFreeVariantIsQueried() {
    FakeSearch search = new FakeSearch().on("integers n with n mod 2 = 0", SearchHit.of("Even", "even", 0.2));
    GroundingResolver r = resolver(search, null, null);

    assertThat(r.queries("integers $n$ with $n mod 2 = 0$"))
        .containsExactly("integers $n$ with $n mod 2 = 0$", "integers n with n mod 2 = 0");
    assertThat(r.decide("integers $n$ with $n mod 2 = 0$").grounded).isTrue();
  }

  @Test
  public void testReasonerCanRejectCloseMatch() {
    FakeSearch search = new FakeSearch().on(EVENS, SearchHit.of("Even", "n is even", 0.08));
    ScriptedModel model = new ScriptedModel((kind, user) -> "NO_MATCH");
    GroundingReasoner reasoner = new GroundingReasoner(model, new PromptLibrary(), 0.0);

    GroundingDecision d = resolver(search, null, reasoner).decide(EVENS);

    assertThat(d.grounded).isFalse();
    assertThat(model.kinds).containsExactly(PromptLibrary.GROUNDING);
  }

  @Test
  public void testReasonerConfirmsCandidate() {
    FakeSearch search = new FakeSearch()
        .on(EVENS, SearchHit.of("Odd", "odd", 0.05), SearchHit.of("Even", "n is even", 0.08));
    ScriptedModel model = new ScriptedModel((kind, user) -> "Looking at the list...\nFOUND: `Even`");
    GroundingReasoner reasoner = new GroundingReasoner(model, new PromptLibrary(), 0.0);

    GroundingDecision d = resolver(search, null, reasoner).decide(EVENS);

    assertThat(d.grounded).isTrue();
    assertThat(d.reference.canonicalId).isEqualTo("Even");
  }

  @Test
  public void testOnlyPendingNodesAreResolved() {
    ConceptGraph g = new ConceptGraph(EVENS, 8);
    g.root().planSynthesis(null);
    assertThatThrownBy(() -> resolver(new FakeSearch(), null, null).resolve(g.root()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
