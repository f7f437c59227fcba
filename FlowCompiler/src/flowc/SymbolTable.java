package flowc;

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

// Identifiers issued into the generated script. One instance per compilation run.
public final class SymbolTable {
  private final Set<String> symbols = new LinkedHashSet<>();

  public void issue(String identifier) throws CompilerException {
    if (!tryIssue(identifier)) {
      throw new CompilerException(String.format("definition '%s' already used", identifier));
    }
  }

  public void issue(FlowGraph.Node node, String identifier) throws CompilerException {
    if (!tryIssue(identifier)) {
      throw new CompilerException(node, String.format("definition '%s' already used", identifier));
    }
  }

  // Returns base, or base_N for the smallest N >= 1 that is still free.
  public String allocate(String base) {
    String candidate = base;
    for (int suffix = 1; !tryIssue(candidate); suffix++) {
      candidate = String.format("%s_%d", base, suffix);
    }
    return candidate;
  }

  public boolean contains(String identifier) {
    return symbols.contains(identifier);
  }

  public ImmutableSet<String> symbols() {
    return ImmutableSet.copyOf(symbols);
  }

  private boolean tryIssue(String identifier) {
    Preconditions.checkArgument(!identifier.isEmpty(), "empty identifier");
    return symbols.add(identifier);
  }
}
