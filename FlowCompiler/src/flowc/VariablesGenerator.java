package flowc;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

// One init python in <store>: block per variable namespace.
public final class VariablesGenerator {
  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\\r\\n|\\r|\\n");

  private VariablesGenerator() {}

  public static ImmutableList<String> generate(
      Iterable<VariableNamespace> namespaces, SymbolTable symbols) throws CompilerException {
    ScriptOutput out = new ScriptOutput();
    for (VariableNamespace namespace : namespaces) {
      String store = storeName(namespace.name());
      symbols.issue(store);
      RenPyStatements.writeInitPython(
          store,
          body -> {
            writeDescription(namespace.description(), body);
            body.blank();
            for (VariableNamespace.Variable variable : namespace.variables()) {
              writeDescription(variable.description(), body);
              RenPyStatements.writeAssignment(variable.name(), valueOf(namespace, variable), body);
              body.blank();
            }
          },
          out);
      out.blank();
    }
    return out.lines();
  }

  // Ren'Py store names start lowercase.
  static String storeName(String namespace) throws CompilerException {
    if (namespace.isEmpty()) {
      throw new CompilerException("variable namespace without a name");
    }
    return Character.toLowerCase(namespace.charAt(0)) + namespace.substring(1);
  }

  static String valueOf(VariableNamespace namespace, VariableNamespace.Variable variable)
      throws CompilerException {
    switch (variable.type()) {
      case "Boolean":
        return variable.value().trim().equalsIgnoreCase("true") ? "True" : "False";
      case "Integer":
        try {
          return Integer.toString(Integer.parseInt(variable.value().trim()));
        } catch (NumberFormatException ex) {
          throw new CompilerException(
              String.format(
                  "%s.%s: '%s' is not an integer",
                  namespace.name(),
                  variable.name(),
                  variable.value()),
              ex);
        }
      case "String":
        return TextFormatter.quote(TextFormatter.escape(variable.value()));
      default:
        throw new CompilerException(
            String.format(
                "%s.%s: unexpected variable type '%s'",
                namespace.name(),
                variable.name(),
                variable.type()));
    }
  }

  private static void writeDescription(String description, ScriptOutput out) {
    for (String line : LINE_SPLITTER.split(description)) {
      if (!line.trim().isEmpty()) RenPyStatements.writeComment(line.trim(), out);
    }
  }
}
