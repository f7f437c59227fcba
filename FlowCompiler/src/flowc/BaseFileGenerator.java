package flowc;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

public final class BaseFileGenerator {
  private BaseFileGenerator() {}

  public static ImmutableList<String> generate(
      FlowGraph graph,
      ContainerHierarchy hierarchy,
      CompilerConfig config,
      Labels labels,
      SymbolTable symbols)
      throws CompilerException {
    // The first root container is where the game starts.
    Optional<FlowGraph.Node> first = hierarchy.rootIds().stream().findFirst().flatMap(graph::node);
    String firstLabel = first.map(labels::labelOf).orElse(labels.terminal());

    symbols.issue(config.startLabel());
    symbols.issue(labels.terminal());
    return ScriptOutput.capture(
        out -> {
          RenPyStatements.writeComment("Entry point of the game", out);
          RenPyStatements.writeLabel(config.startLabel(), out);
          out.indented(body -> RenPyStatements.writeJump(firstLabel, body));
          out.blank();
          RenPyStatements.writeLabel(labels.terminal(), out);
          out.indented(RenPyStatements::writeReturn);
        });
  }
}
