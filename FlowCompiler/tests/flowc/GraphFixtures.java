package flowc;

import com.google.common.collect.ImmutableList;

// Nodes with one input pin "<id>i" and one output pin "<id>o" wired to the input pins of targets.
final class GraphFixtures {
  private GraphFixtures() {}

  static String in(String id) {
    return id + "i";
  }

  static String out(String id) {
    return id + "o";
  }

  static FlowGraph.Pin input(String owner, String condition) {
    return FlowGraph.Pin.input(in(owner), owner, condition);
  }

  static FlowGraph.Pin output(String owner, String... targets) {
    ImmutableList.Builder<FlowGraph.Connection> connections = ImmutableList.builder();
    for (String target : targets) {
      connections.add(FlowGraph.Connection.to(target, in(target)));
    }
    return FlowGraph.Pin.output(out(owner), owner, "", connections.build());
  }

  static FlowGraph.Node.Builder node(String id, String type, String... targets) {
    return FlowGraph.Node.builder(id, type)
        .addInputPin(input(id, ""))
        .addOutputPin(output(id, targets));
  }

  static FlowGraph.Node.Builder child(String parent, String id, String type, String... targets) {
    return node(id, type, targets).setParentId(parent);
  }

  static FlowGraph graph(FlowGraph.Node.Builder... nodes) throws CompilerException {
    FlowGraph.Builder graph = FlowGraph.builder();
    for (FlowGraph.Node.Builder node : nodes) {
      graph.addNode(node.build());
    }
    return graph.build();
  }
}
