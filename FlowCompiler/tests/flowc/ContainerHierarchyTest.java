package flowc;

import static com.google.common.truth.Truth.assertThat;
import static flowc.GraphFixtures.child;
import static flowc.GraphFixtures.node;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ContainerHierarchyTest {

  private static ContainerHierarchy build(FlowGraph graph) throws CompilerException {
    return ContainerHierarchy.build(graph, RoleTable.defaults(), "articy_");
  }

  @Test
  public void preOrderLocations() throws CompilerException {
    FlowGraph graph =
        GraphFixtures.graph(
            node("a", "FlowFragment").setDisplayName("Act  One"),
            child("a", "s1", "Dialogue").setDisplayName("Scene One"),
            child("s1", "line", "DialogueFragment"),
            child("a", "s2", "FlowFragment").setDisplayName("Scene: Two?"),
            node("b", "FlowFragment"));

    ContainerHierarchy hierarchy = build(graph);

    assertThat(hierarchy.rootIds()).containsExactly("a", "b").inOrder();
    assertThat(
            hierarchy.containers().stream()
                .map(FlowGraph.Node::id)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly("a", "s1", "s2", "b")
        .inOrder();
    assertThat(hierarchy.locationOf("a").get().filePath()).isEqualTo("act_one/articy_act_one.rpy");
    assertThat(hierarchy.locationOf("s1").get().filePath())
        .isEqualTo("act_one/scene_one/articy_scene_one.rpy");
    assertThat(hierarchy.locationOf("s2").get().directoryPath()).isEqualTo("act_one/scene__two_");
    assertThat(hierarchy.locationOf("b").get().filePath()).isEqualTo("b/articy_b.rpy");
    assertThat(hierarchy.contains("line")).isFalse();
  }

  @Test
  public void exportRootsRestrictTheHierarchy() throws CompilerException {
    FlowGraph graph =
        FlowGraph.builder()
            .addNode(node("a", "FlowFragment").build())
            .addNode(node("b", "FlowFragment").build())
            .addNode(node("hub", "Hub").build())
            .addRoot("hub")
            .addRoot("b")
            .build();

    ContainerHierarchy hierarchy = build(graph);

    assertThat(hierarchy.rootIds()).containsExactly("b");
    assertThat(hierarchy.contains("a")).isFalse();
  }

  @Test
  public void sameLocationTwiceIsFatal() throws CompilerException {
    FlowGraph graph =
        GraphFixtures.graph(
            node("a", "FlowFragment").setDisplayName("Intro"),
            node("b", "Dialogue").setDisplayName("intro"));

    CompilerException ex = assertThrows(CompilerException.class, () -> build(graph));
    assertThat(ex.nodeId()).hasValue("b");
  }

  @Test
  public void containerReachedTwiceIsFatal() throws CompilerException {
    FlowGraph graph =
        FlowGraph.builder()
            .addNode(node("a", "FlowFragment").build())
            .addRoot("a")
            .addRoot("a")
            .build();

    assertThrows(CompilerException.class, () -> build(graph));
  }

  @Test
  public void dotNamesFallBackToId() throws CompilerException {
    FlowGraph graph =
        GraphFixtures.graph(
            node("up", "FlowFragment").setDisplayName(".."),
            child("up", "here", "Dialogue").setDisplayName(" . "));

    ContainerHierarchy hierarchy = build(graph);

    assertThat(hierarchy.locationOf("here").get().filePath())
        .isEqualTo("up/here/articy_here.rpy");
  }
}
