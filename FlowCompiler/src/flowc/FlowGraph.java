package flowc;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

/** The node/pin/connection graph of one export. Immutable once built. */
public final class FlowGraph {

  @AutoValue
  public abstract static class Connection {
    public abstract String label();

    public abstract String targetNodeId();

    public abstract String targetPinId();

    public static Connection create(String label, String targetNodeId, String targetPinId) {
      return new AutoValue_FlowGraph_Connection(label, targetNodeId, targetPinId);
    }

    public static Connection to(String targetNodeId, String targetPinId) {
      return create("", targetNodeId, targetPinId);
    }
  }

  @AutoValue
  public abstract static class Pin {
    public enum Direction {
      INPUT,
      OUTPUT;
    }

    public abstract String id();

    public abstract String ownerId();

    public abstract Direction direction();

    // Conditions on input pins, instructions on output pins.
    public abstract String text();

    public abstract ImmutableList<Connection> connections();

    public boolean isConnected() {
      return !connections().isEmpty();
    }

    public static Pin create(
        String id,
        String ownerId,
        Direction direction,
        String text,
        Iterable<Connection> connections) {
      return new AutoValue_FlowGraph_Pin(
          id, ownerId, direction, text, ImmutableList.copyOf(connections));
    }

    public static Pin input(String id, String ownerId, String text) {
      return create(id, ownerId, Direction.INPUT, text, ImmutableList.of());
    }

    public static Pin output(
        String id, String ownerId, String text, Iterable<Connection> connections) {
      return create(id, ownerId, Direction.OUTPUT, text, connections);
    }
  }

  @AutoValue
  public abstract static class Node {
    public abstract String id();

    public abstract String type();

    public abstract String displayName();

    public abstract String text();

    public abstract String menuText();

    public abstract String stageDirections();

    public abstract String expression();

    public abstract Optional<String> speakerId();

    public abstract Optional<String> parentId();

    public abstract Optional<String> jumpTargetId();

    public abstract ImmutableList<Pin> inputPins();

    public abstract ImmutableList<Pin> outputPins();

    public ImmutableList<Pin> pins(Pin.Direction direction) {
      return direction == Pin.Direction.INPUT ? inputPins() : outputPins();
    }

    public abstract Builder toBuilder();

    public static Builder builder(String id, String type) {
      return new AutoValue_FlowGraph_Node.Builder()
          .setId(id)
          .setType(type)
          .setDisplayName("")
          .setText("")
          .setMenuText("")
          .setStageDirections("")
          .setExpression("");
    }

    @AutoValue.Builder
    public abstract static class Builder {
      abstract Builder setId(String id);

      abstract Builder setType(String type);

      public abstract Builder setDisplayName(String displayName);

      public abstract Builder setText(String text);

      public abstract Builder setMenuText(String menuText);

      public abstract Builder setStageDirections(String stageDirections);

      public abstract Builder setExpression(String expression);

      public abstract Builder setSpeakerId(String speakerId);

      public abstract Builder setParentId(String parentId);

      public abstract Builder setJumpTargetId(String jumpTargetId);

      public abstract ImmutableList.Builder<Pin> inputPinsBuilder();

      public abstract ImmutableList.Builder<Pin> outputPinsBuilder();

      public final Builder addInputPin(Pin pin) {
        inputPinsBuilder().add(pin);
        return this;
      }

      public final Builder addOutputPin(Pin pin) {
        outputPinsBuilder().add(pin);
        return this;
      }

      public abstract Node build();
    }
  }

  private final ImmutableMap<String, Node> nodesById;
  private final ImmutableMap<String, Pin> inputPinsById;
  private final ImmutableMap<String, Pin> outputPinsById;
  private final ImmutableListMultimap<String, Node> childrenByParent;
  private final ImmutableList<String> rootIds;

  private FlowGraph(
      ImmutableMap<String, Node> nodesById,
      ImmutableMap<String, Pin> inputPinsById,
      ImmutableMap<String, Pin> outputPinsById,
      ImmutableListMultimap<String, Node> childrenByParent,
      ImmutableList<String> rootIds) {
    this.nodesById = nodesById;
    this.inputPinsById = inputPinsById;
    this.outputPinsById = outputPinsById;
    this.childrenByParent = childrenByParent;
    this.rootIds = rootIds;
  }

  public ImmutableList<Node> nodes() {
    return nodesById.values().asList();
  }

  public Optional<Node> node(String id) {
    return Optional.ofNullable(nodesById.get(id));
  }

  public ImmutableList<Pin> pinsOf(Node node, Pin.Direction direction) {
    return node.pins(direction);
  }

  public ImmutableList<Node> childrenOf(String containerId) {
    return childrenByParent.get(containerId);
  }

  public Optional<Pin> inputPin(String pinId) {
    return Optional.ofNullable(inputPinsById.get(pinId));
  }

  public Optional<Pin> outputPin(String pinId) {
    return Optional.ofNullable(outputPinsById.get(pinId));
  }

  // Top-level containers in authoring order, as declared by the export; may be empty.
  public ImmutableList<String> rootIds() {
    return rootIds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Node> nodesById = new LinkedHashMap<>();
    private final ImmutableList.Builder<String> rootIds = ImmutableList.builder();

    private Builder() {}

    public Builder addNode(Node node) throws CompilerException {
      if (nodesById.putIfAbsent(node.id(), node) != null) {
        throw new CompilerException(node, "duplicate node id");
      }
      return this;
    }

    public Builder addRoot(String containerId) {
      rootIds.add(containerId);
      return this;
    }

    public FlowGraph build() throws CompilerException {
      Map<String, Pin> inputPins = new LinkedHashMap<>();
      Map<String, Pin> outputPins = new LinkedHashMap<>();
      ImmutableListMultimap.Builder<String, Node> children = ImmutableListMultimap.builder();

      for (Node node : nodesById.values()) {
        for (Pin pin : node.inputPins()) {
          checkPin(node, pin, Pin.Direction.INPUT, inputPins, outputPins);
          inputPins.put(pin.id(), pin);
        }
        for (Pin pin : node.outputPins()) {
          checkPin(node, pin, Pin.Direction.OUTPUT, inputPins, outputPins);
          outputPins.put(pin.id(), pin);
        }
        node.parentId().ifPresent(parent -> children.put(parent, node));
      }

      return new FlowGraph(
          ImmutableMap.copyOf(nodesById),
          ImmutableMap.copyOf(inputPins),
          ImmutableMap.copyOf(outputPins),
          children.build(),
          rootIds.build());
    }

    private static void checkPin(
        Node node,
        Pin pin,
        Pin.Direction expected,
        Map<String, Pin> inputPins,
        Map<String, Pin> outputPins)
        throws CompilerException {
      if (pin.direction() != expected) {
        throw new CompilerException(
            node,
            String.format(
                "pin %s listed as %s but declared %s", pin.id(), expected, pin.direction()));
      }
      if (!pin.ownerId().equals(node.id())) {
        throw new CompilerException(
            node, String.format("pin %s is owned by %s", pin.id(), pin.ownerId()));
      }
      if (inputPins.containsKey(pin.id()) || outputPins.containsKey(pin.id())) {
        throw new CompilerException(node, String.format("duplicate pin id %s", pin.id()));
      }
    }
  }
}
