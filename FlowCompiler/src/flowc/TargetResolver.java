package flowc;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

// What follows a node: nothing, one node, or a choice between several.
public final class TargetResolver {

  public static final class Resolution {
    public enum Kind {
      NONE,
      SINGLE,
      BRANCH;
    }

    private final Kind kind;
    private final ImmutableList<FlowGraph.Pin> path;
    private final Optional<FlowGraph.Node> target;

    private Resolution(
        Kind kind, ImmutableList<FlowGraph.Pin> path, Optional<FlowGraph.Node> target) {
      this.kind = kind;
      this.path = path;
      this.target = target;
    }

    static Resolution none(ImmutableList<FlowGraph.Pin> path) {
      return new Resolution(Kind.NONE, path, Optional.empty());
    }

    static Resolution single(ImmutableList<FlowGraph.Pin> path, FlowGraph.Node target) {
      return new Resolution(Kind.SINGLE, path, Optional.of(target));
    }

    static Resolution branch(ImmutableList<FlowGraph.Pin> path) {
      Verify.verify(!path.isEmpty());
      return new Resolution(Kind.BRANCH, path, Optional.empty());
    }

    public Kind kind() {
      return kind;
    }

    // Every pin walked, starting with the governing pin.
    public ImmutableList<FlowGraph.Pin> path() {
      return path;
    }

    public FlowGraph.Node target() {
      Verify.verify(kind == Kind.SINGLE, "%s", kind);
      return target.get();
    }

    public FlowGraph.Pin branchPin() {
      Verify.verify(kind == Kind.BRANCH, "%s", kind);
      return path.get(path.size() - 1);
    }

    // Output pins carry instructions; input pins carry conditions and are skipped.
    public ImmutableList<FlowGraph.Pin> instructionPins() {
      return path.stream()
          .filter(p -> p.direction() == FlowGraph.Pin.Direction.OUTPUT)
          .collect(ImmutableList.toImmutableList());
    }
  }

  private final FlowGraph graph;
  private final RoleTable roles;

  public TargetResolver(FlowGraph graph, RoleTable roles) {
    this.graph = graph;
    this.roles = roles;
  }

  // A container with content continues inside itself; an empty one is transparent.
  public Optional<FlowGraph.Pin> governingPin(FlowGraph.Node node) {
    if (roles.isContainer(node)) {
      for (FlowGraph.Pin pin : graph.pinsOf(node, FlowGraph.Pin.Direction.INPUT)) {
        if (pin.isConnected()) return Optional.of(pin);
      }
    }
    ImmutableList<FlowGraph.Pin> outputs = graph.pinsOf(node, FlowGraph.Pin.Direction.OUTPUT);
    return outputs.isEmpty() ? Optional.empty() : Optional.of(outputs.get(0));
  }

  public Resolution resolveNext(FlowGraph.Node node) throws CompilerException {
    Optional<FlowGraph.Pin> pin = governingPin(node);
    return pin.isPresent() ? resolve(pin.get()) : Resolution.none(ImmutableList.of());
  }

  // Condition nodes: output pin 0 is taken when the expression holds, pin 1 otherwise.
  public Resolution resolveOutcome(FlowGraph.Node condition, boolean outcome)
      throws CompilerException {
    ImmutableList<FlowGraph.Pin> outputs =
        graph.pinsOf(condition, FlowGraph.Pin.Direction.OUTPUT);
    if (outputs.size() < 2) {
      throw new CompilerException(
          condition,
          String.format(
              "condition needs a true and a false output pin, found %d", outputs.size()));
    }
    return resolve(outputs.get(outcome ? 0 : 1));
  }

  public Resolution resolve(FlowGraph.Pin start) throws CompilerException {
    Set<String> visited = new HashSet<>();
    ImmutableList.Builder<FlowGraph.Pin> path = ImmutableList.builder();

    FlowGraph.Pin pin = start;
    while (true) {
      if (!visited.add(pin.id())) {
        throw new CompilerException(
            ownerOf(pin),
            String.format(
                "cyclic graph: pin %s is reached again while resolving pin %s",
                pin.id(),
                start.id()));
      }
      path.add(pin);

      if (pin.connections().isEmpty()) return Resolution.none(path.build());
      if (pin.connections().size() > 1) return Resolution.branch(path.build());

      FlowGraph.Connection connection = pin.connections().get(0);
      Optional<FlowGraph.Pin> input = graph.inputPin(connection.targetPinId());
      if (input.isPresent()) {
        return Resolution.single(path.build(), ownerOf(input.get()));
      }

      Optional<FlowGraph.Pin> output = graph.outputPin(connection.targetPinId());
      if (!output.isPresent()) {
        throw new CompilerException(
            ownerOf(pin),
            String.format(
                "target pin %s of pin %s is neither an input nor an output pin",
                connection.targetPinId(),
                pin.id()));
      }
      // A container's exit wired onward: keep following.
      pin = output.get();
    }
  }

  private FlowGraph.Node ownerOf(FlowGraph.Pin pin) throws CompilerException {
    Optional<FlowGraph.Node> owner = graph.node(pin.ownerId());
    if (!owner.isPresent()) {
      throw new CompilerException(
          String.format("pin %s is owned by unknown node %s", pin.id(), pin.ownerId()));
    }
    return owner.get();
  }
}
