package org.calista.formalizer.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class ConceptGraphTest {

  private static List<String> ids(List<ConceptNode> nodes) {
    return nodes.stream().map(ConceptNode::id).collect(Collectors.toList());
  }

  @Test
  public void testRootIsPendingAtDepthZero() {
    ConceptGraph g = new ConceptGraph("Every finite group of prime order is cyclic", 8);
    assertThat(g.size()).isEqualTo(1);
    assertThat(g.root().depth()).isZero();
    assertThat(g.root().status()).isEqualTo(NodeStatus.PENDING);
    assertThat(g.remainingCapacity()).isEqualTo(7);
  }

  @Test
  public void testAddChildCreatesEdgeFromParent() {
    ConceptGraph g = new ConceptGraph("a group with finite order", 8);
    ConceptNode a = g.addChild(g.root(), "binary operation with identity and inverses");
    ConceptNode b = g.addChild(g.root(), "finite carrier set");

    assertThat(g.root().dependencies()).containsExactly(a.id(), b.id());
    assertThat(a.depth()).isEqualTo(1);
    assertThat(a.status()).isEqualTo(NodeStatus.PENDING);
    assertThat(g.findByDescription("  Finite   CARRIER set ")).contains(b);
  }

  @Test
  public void testDuplicateDescriptionIsRejected() {
    ConceptGraph g = new ConceptGraph("root", 8);
    g.addChild(g.root(), "finite carrier set");
    assertThatThrownBy(() -> g.addChild(g.root(), "Finite carrier set"))
        .isInstanceOf(GraphInvariantException.class);
  }

  @Test
  public void testNodeCapIsEnforced() {
    ConceptGraph g = new ConceptGraph("root", 2);
    g.addChild(g.root(), "a");
    assertThatThrownBy(() -> g.addChild(g.root(), "b"))
        .isInstanceOf(GraphInvariantException.class)
        .hasMessageContaining("node cap");
    assertThat(g.size()).isEqualTo(2);
  }

  @Test
  public void testCyclicEdgeIsRejected() {
    ConceptGraph g = new ConceptGraph("root", 8);
    ConceptNode a = g.addChild(g.root(), "a");
    ConceptNode b = g.addChild(a, "b");

    assertThat(g.wouldCreateCycle(b.id(), g.root().id())).isTrue();
    assertThat(g.wouldCreateCycle(a.id(), a.id())).isTrue();
    assertThatThrownBy(() -> g.addDependency(b.id(), a.id()))
        .isInstanceOf(GraphInvariantException.class)
        .hasMessageContaining("cycle");
    assertThat(b.dependencies()).isEmpty();
  }

  @Test
  public void testUnknownIdIsRejected() {
    ConceptGraph g = new ConceptGraph("root", 8);
    assertThatThrownBy(() -> g.node("n42")).isInstanceOf(GraphInvariantException.class);
    assertThatThrownBy(() -> g.addDependency(g.root().id(), "n42")).isInstanceOf(GraphInvariantException.class);
    assertThat(g.find("n42")).isEmpty();
  }

  @Test
  public void testTransitiveDependenciesAreDependenciesFirst() {
    ConceptGraph g = new ConceptGraph("root", 8);
    ConceptNode a = g.addChild(g.root(), "a");
    ConceptNode b = g.addChild(g.root(), "b");
    ConceptNode c = g.addChild(a, "c");
    g.addDependency(b.id(), c.id());

    assertThat(ids(g.transitiveDependencies(g.root().id()))).containsExactly(c.id(), a.id(), b.id());
    assertThat(ids(g.transitiveDependencies(b.id()))).containsExactly(c.id());
    assertThat(g.reaches(g.root().id(), c.id())).isTrue();
    assertThat(g.reaches(c.id(), a.id())).isFalse();
  }

  @Test
  public void testReachableFromRootKeepsCreationOrder() {
    ConceptGraph g = new ConceptGraph("root", 8);
    ConceptNode a = g.addChild(g.root(), "a");
    ConceptNode b = g.addChild(a, "b");
    assertThat(ids(g.reachableFromRoot())).containsExactly(g.root().id(), a.id(), b.id());
  }

  @Test
  public void testStatusCountsCoverEveryStatus() {
    ConceptGraph g = new ConceptGraph("root", 8);
    g.addChild(g.root(), "a").ground(GroundedReference.library("Set.Finite", "finite set", 0.1));
    assertThat(g.statusCounts())
        .containsEntry(NodeStatus.PENDING, 1)
        .containsEntry(NodeStatus.GROUNDED, 1)
        .containsEntry(NodeStatus.FAILED, 0);
  }
}
