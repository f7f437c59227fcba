package flowc;

import static com.google.common.truth.Truth.assertThat;
import static flowc.GraphFixtures.child;
import static flowc.GraphFixtures.graph;
import static flowc.GraphFixtures.in;
import static flowc.GraphFixtures.node;
import static flowc.GraphFixtures.out;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TargetResolverTest {

  private static TargetResolver resolver(FlowGraph graph) {
    return new TargetResolver(graph, RoleTable.defaults());
  }

  private static FlowGraph.Pin exitTo(String owner, String targetNode, String targetPin) {
    return FlowGraph.Pin.output(
        out(owner), owner, "", ImmutableList.of(FlowGraph.Connection.to(targetNode, targetPin)));
  }

  @Test
  public void singleTarget() throws CompilerException {
    FlowGraph graph = graph(node("a", "DialogueFragment", "b"), node("b", "Hub"));

    TargetResolver.Resolution resolution = resolver(graph).resolveNext(graph.node("a").get());

    assertThat(resolution.kind()).isEqualTo(TargetResolver.Resolution.Kind.SINGLE);
    assertThat(resolution.target().id()).isEqualTo("b");
  }

  @Test
  public void noConnections() throws CompilerException {
    FlowGraph graph = graph(node("a", "DialogueFragment"));

    TargetResolver.Resolution resolution = resolver(graph).resolveNext(graph.node("a").get());

    assertThat(resolution.kind()).isEqualTo(TargetResolver.Resolution.Kind.NONE);
    assertThat(resolution.path()).hasSize(1);
  }

  @Test
  public void noPins() throws CompilerException {
    FlowGraph graph = graph(FlowGraph.Node.builder("a", "Hub"));

    TargetResolver.Resolution resolution = resolver(graph).resolveNext(graph.node("a").get());

    assertThat(resolution.kind()).isEqualTo(TargetResolver.Resolution.Kind.NONE);
    assertThat(resolution.path()).isEmpty();
  }

  @Test
  public void severalConnectionsBranch() throws CompilerException {
    FlowGraph graph =
        graph(node("a", "DialogueFragment", "b", "c"), node("b", "Hub"), node("c", "Hub"));

    TargetResolver.Resolution resolution = resolver(graph).resolveNext(graph.node("a").get());

    assertThat(resolution.kind()).isEqualTo(TargetResolver.Resolution.Kind.BRANCH);
    assertThat(resolution.branchPin().id()).isEqualTo(out("a"));
  }

  @Test
  public void followsNestedContainerExits() throws CompilerException {
    // "a" sits three containers deep; its exit chains through each container's output pin.
    FlowGraph graph =
        graph(
            FlowGraph.Node.builder("outer", "FlowFragment")
                .addInputPin(GraphFixtures.input("outer", ""))
                .addOutputPin(GraphFixtures.output("outer", "x")),
            FlowGraph.Node.builder("middle", "FlowFragment")
                .setParentId("outer")
                .addInputPin(GraphFixtures.input("middle", ""))
                .addOutputPin(exitTo("middle", "outer", out("outer"))),
            FlowGraph.Node.builder("inner", "Dialogue")
                .setParentId("middle")
                .addInputPin(GraphFixtures.input("inner", ""))
                .addOutputPin(exitTo("inner", "middle", out("middle"))),
            FlowGraph.Node.builder("a", "DialogueFragment")
                .setParentId("inner")
                .addInputPin(GraphFixtures.input("a", ""))
                .addOutputPin(exitTo("a", "inner", out("inner"))),
            node("x", "Hub"));

    TargetResolver.Resolution resolution = resolver(graph).resolveNext(graph.node("a").get());

    assertThat(resolution.kind()).isEqualTo(TargetResolver.Resolution.Kind.SINGLE);
    assertThat(resolution.target().id()).isEqualTo("x");
    assertThat(
            resolution.instructionPins().stream()
                .map(FlowGraph.Pin::id)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly(out("a"), out("inner"), out("middle"), out("outer"))
        .inOrder();
  }

  @Test
  public void containerWithContentStartsInside() throws CompilerException {
    FlowGraph graph =
        graph(
            FlowGraph.Node.builder("c", "FlowFragment")
                .addInputPin(
                    FlowGraph.Pin.create(
                        in("c"),
                        "c",
                        FlowGraph.Pin.Direction.INPUT,
                        "",
                        ImmutableList.of(FlowGraph.Connection.to("first", in("first")))))
                .addOutputPin(GraphFixtures.output("c", "after")),
            child("c", "first", "DialogueFragment"),
            node("after", "Hub"));
    TargetResolver resolver = resolver(graph);

    assertThat(resolver.governingPin(graph.node("c").get()).get().id()).isEqualTo(in("c"));
    assertThat(resolver.resolveNext(graph.node("c").get()).target().id()).isEqualTo("first");
  }

  @Test
  public void emptyContainerIsTransparent() throws CompilerException {
    FlowGraph graph = graph(node("c", "Dialogue", "after"), node("after", "Hub"));
    TargetResolver resolver = resolver(graph);

    assertThat(resolver.governingPin(graph.node("c").get()).get().id()).isEqualTo(out("c"));
    assertThat(resolver.resolveNext(graph.node("c").get()).target().id()).isEqualTo("after");
  }

  @Test
  public void cycleIsFatal() throws CompilerException {
    FlowGraph graph =
        graph(
            FlowGraph.Node.builder("p", "FlowFragment").addOutputPin(exitTo("p", "q", out("q"))),
            FlowGraph.Node.builder("q", "FlowFragment").addOutputPin(exitTo("q", "p", out("p"))));

    CompilerException ex =
        assertThrows(
            CompilerException.class, () -> resolver(graph).resolveNext(graph.node("p").get()));
    assertThat(ex.errorMsg()).contains("cyclic graph");
  }

  @Test
  public void unknownTargetPinIsFatal() throws CompilerException {
    FlowGraph graph =
        graph(FlowGraph.Node.builder("a", "Hub").addOutputPin(exitTo("a", "b", "nowhere")));

    CompilerException ex =
        assertThrows(
            CompilerException.class, () -> resolver(graph).resolveNext(graph.node("a").get()));
    assertThat(ex.nodeId()).hasValue("a");
    assertThat(ex.errorMsg()).contains("neither an input nor an output pin");
  }

  @Test
  public void conditionOutcomes() throws CompilerException {
    FlowGraph graph =
        graph(
            FlowGraph.Node.builder("cond", "Condition")
                .addInputPin(GraphFixtures.input("cond", ""))
                .addOutputPin(exitTo("cond", "yes", in("yes")))
                .addOutputPin(
                    FlowGraph.Pin.output(
                        "cond-false",
                        "cond",
                        "",
                        ImmutableList.of(FlowGraph.Connection.to("no", in("no"))))),
            node("yes", "Hub"),
            node("no", "Hub"));
    TargetResolver resolver = resolver(graph);
    FlowGraph.Node cond = graph.node("cond").get();

    assertThat(resolver.resolveOutcome(cond, true).target().id()).isEqualTo("yes");
    assertThat(resolver.resolveOutcome(cond, false).target().id()).isEqualTo("no");
  }

  @Test
  public void conditionNeedsTwoOutputs() throws CompilerException {
    FlowGraph graph = graph(node("cond", "Condition", "yes"), node("yes", "Hub"));

    assertThrows(
        CompilerException.class,
        () -> resolver(graph).resolveOutcome(graph.node("cond").get(), false));
  }
}
