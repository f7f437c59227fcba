package flowc;

// Declarations and jumps both name labels through here.
public final class Labels {
  private final String prefix;
  private final String terminal;
  private final RoleTable roles;

  public Labels(CompilerConfig config) {
    this.prefix = config.labelPrefix();
    this.terminal = config.terminalLabel();
    this.roles = config.roles();
  }

  public String labelOf(FlowGraph.Node node) {
    if (roles.roleOf(node).orElse(null) == Role.ENTRY_POINT && !node.text().trim().isEmpty()) {
      return node.text().trim();
    }
    return Directives.of(node)
        .value(Directives.LABEL)
        .filter(label -> !label.isEmpty())
        .orElse(prefix + node.id());
  }

  // Jumped to whenever a node has nowhere else to go.
  public String terminal() {
    return terminal;
  }
}
