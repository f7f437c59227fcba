package flowc;

import java.util.Optional;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Optional<String> nodeId;
  private final String errorMsg;

  public CompilerException(String errorMsg) {
    this(Optional.empty(), errorMsg, null);
  }

  public CompilerException(String errorMsg, Throwable cause) {
    this(Optional.empty(), errorMsg, cause);
  }

  public CompilerException(FlowGraph.Node node, String errorMsg) {
    this(Optional.of(node.id()), errorMsg, null);
  }

  private CompilerException(Optional<String> nodeId, String errorMsg, Throwable cause) {
    super(nodeId.map(id -> String.format("node %s: %s", id, errorMsg)).orElse(errorMsg), cause);
    this.nodeId = nodeId;
    this.errorMsg = errorMsg;
  }

  public Optional<String> nodeId() {
    return nodeId;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print() {
    System.out.println(
        nodeId
            .map(id -> String.format("ERROR: node %s: %s", id, errorMsg))
            .orElseGet(() -> String.format("ERROR: %s", errorMsg)));
  }
}
