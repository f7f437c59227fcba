package flowc;

import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

// Maps node type tags to roles. New templates are added through configuration.
public final class RoleTable {
  private static final ImmutableMap<String, Role> DEFAULTS =
      ImmutableMap.<String, Role>builder()
          .put("FlowFragment", Role.CONTAINER)
          .put("Dialogue", Role.CONTAINER)
          .put("DialogueFragment", Role.DIALOGUE_LINE)
          .put("Condition", Role.BRANCH_CONDITION)
          .put("Hub", Role.HUB)
          .put("Instruction", Role.INSTRUCTION)
          .put("Jump", Role.JUMP)
          .put("RenPyBox", Role.CODE_BLOCK)
          .put("RenPyBoxMenuChoice", Role.CODE_BLOCK)
          .put("RenPyEntryPoint", Role.ENTRY_POINT)
          .put("Comment", Role.IGNORED)
          .build();

  private final ImmutableMap<String, Role> roles;

  private RoleTable(ImmutableMap<String, Role> roles) {
    this.roles = roles;
  }

  public static RoleTable defaults() {
    return new RoleTable(DEFAULTS);
  }

  // Later entries win over defaults.
  public static RoleTable withOverrides(Map<String, Role> overrides) {
    return new RoleTable(
        ImmutableMap.<String, Role>builder()
            .putAll(DEFAULTS)
            .putAll(overrides)
            .buildKeepingLast());
  }

  public Optional<Role> roleOf(String typeTag) {
    return Optional.ofNullable(roles.get(typeTag));
  }

  public Optional<Role> roleOf(FlowGraph.Node node) {
    return roleOf(node.type());
  }

  public boolean isContainer(FlowGraph.Node node) {
    return roleOf(node).map(r -> r == Role.CONTAINER).orElse(false);
  }
}
