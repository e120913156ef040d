package org.calista.formalizer.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

public class ConceptNodeTest {

  private static ConceptNode fresh() {
    return new ConceptGraph("the set of even integers", 4).root();
  }

  @Test
  public void testGroundIsTerminal() {
    ConceptNode n = fresh();
    n.ground(GroundedReference.library("Even", "even numbers", 0.12));

    assertThat(n.status()).isEqualTo(NodeStatus.GROUNDED);
    assertThat(n.resolvedReference().canonicalId).isEqualTo("Even");
    assertThat(n.statusHistory()).containsExactly(NodeStatus.PENDING, NodeStatus.GROUNDED);
    assertThatThrownBy(() -> n.planSynthesis(null)).isInstanceOf(GraphInvariantException.class);
  }

  @Test
  public void testSynthesisLifecycle() {
    ConceptNode n = fresh();
    n.planSynthesis("def evens : Set ℤ");
    assertThat(n.plannedShape()).isEqualTo("def evens : Set ℤ");

    assertThat(n.tryBeginAttempt(3)).isEqualTo(1);
    n.synthesized("def evens : Set ℤ := {n | Even n}");

    assertThat(n.status()).isEqualTo(NodeStatus.SYNTHESIZED);
    assertThat(n.attemptCount()).isEqualTo(1);
    assertThat(n.statusHistory())
        .containsExactly(NodeStatus.PENDING, NodeStatus.TO_SYNTHESIZE, NodeStatus.SYNTHESIZED);
    assertThatThrownBy(() -> n.failed(List.of("x"))).isInstanceOf(GraphInvariantException.class);
  }

  @Test
  public void testAttemptCountIsBounded() {
    ConceptNode n = fresh();
    n.planSynthesis(null);
    assertThat(n.tryBeginAttempt(2)).isEqualTo(1);
    assertThat(n.tryBeginAttempt(2)).isEqualTo(2);
    assertThat(n.tryBeginAttempt(2)).isZero();
    assertThat(n.attemptCount()).isEqualTo(2);

    n.failed(List.of("type mismatch"));
    assertThat(n.lastDiagnostics()).containsExactly("type mismatch");
    assertThatThrownBy(() -> n.tryBeginAttempt(5)).isInstanceOf(GraphInvariantException.class);
  }

  @Test
  public void testCannotSynthesizeWithoutPlanning() {
    ConceptNode n = fresh();
    assertThatThrownBy(() -> n.synthesized("x")).isInstanceOf(GraphInvariantException.class);
    assertThatThrownBy(() -> n.tryBeginAttempt(1)).isInstanceOf(GraphInvariantException.class);
  }

  @Test
  public void testEdgesOnlyWhilePending() {
    ConceptGraph g = new ConceptGraph("root", 4);
    ConceptNode a = g.addChild(g.root(), "a");
    ConceptNode b = g.addChild(g.root(), "b");
    a.planSynthesis(null);
    assertThatThrownBy(() -> g.addDependency(a.id(), b.id())).isInstanceOf(GraphInvariantException.class);
  }

  @Test
  public void testTransitionTable() {
    assertThat(NodeStatus.PENDING.canTransitionTo(NodeStatus.GROUNDED)).isTrue();
    assertThat(NodeStatus.PENDING.canTransitionTo(NodeStatus.SYNTHESIZED)).isFalse();
    assertThat(NodeStatus.GROUNDED.canTransitionTo(NodeStatus.TO_SYNTHESIZE)).isFalse();
    assertThat(NodeStatus.FAILED.canTransitionTo(NodeStatus.SYNTHESIZED)).isFalse();
    assertThat(NodeStatus.TO_SYNTHESIZE.isTerminal()).isFalse();
    assertThat(NodeStatus.TO_SYNTHESIZE.isPlanned()).isTrue();
  }
}
