package flowc;

import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

// Writers for the Ren'Py statements the compiler emits. Block statements take their body as a
// ScriptOutput.Writer, run one level deeper.
public final class RenPyStatements {
  private static final Joiner SPACE_JOINER = Joiner.on(' ').skipNulls();

  private RenPyStatements() {}

  public static void writeLabel(String label, ScriptOutput out) {
    out.line(String.format("label %s:", label));
  }

  public static void writeJump(String label, ScriptOutput out) {
    out.line("jump " + label);
  }

  public static void writeReturn(ScriptOutput out) {
    out.line("return");
  }

  public static void writeComment(String text, ScriptOutput out) {
    out.line("# " + text);
  }

  public static void writePython(String statement, ScriptOutput out) {
    out.line("$ " + statement);
  }

  // speaker pre "text" post, skipping empty parts.
  public static void writeSay(
      String speaker, String pre, String formattedText, String post, ScriptOutput out) {
    out.line(
        SPACE_JOINER.join(
            Strings.emptyToNull(speaker),
            Strings.emptyToNull(pre),
            TextFormatter.quote(formattedText),
            Strings.emptyToNull(post)));
  }

  public static void writeExtend(String formattedText, ScriptOutput out) {
    out.line("extend " + TextFormatter.quote(formattedText));
  }

  public static void writeIf(String condition, ScriptOutput.Writer body, ScriptOutput out)
      throws CompilerException {
    out.line(String.format("if %s:", condition));
    out.indented(body);
  }

  public static void writeElse(ScriptOutput.Writer body, ScriptOutput out)
      throws CompilerException {
    out.line("else:");
    out.indented(body);
  }

  public static void writeMenu(ScriptOutput.Writer body, ScriptOutput out)
      throws CompilerException {
    out.line("menu:");
    out.indented(body);
  }

  public static void writeMenuOption(
      String formattedText, Optional<String> guard, ScriptOutput.Writer body, ScriptOutput out)
      throws CompilerException {
    String choice = TextFormatter.quote(formattedText);
    out.line(guard.map(g -> String.format("%s if %s:", choice, g)).orElse(choice + ":"));
    out.indented(body);
  }

  public static void writeInitPython(String store, ScriptOutput.Writer body, ScriptOutput out)
      throws CompilerException {
    out.line(String.format("init python in %s:", store));
    out.indented(body);
  }

  public static void writeAssignment(String name, String value, ScriptOutput out) {
    out.line(String.format("%s = %s", name, value));
  }

  public static void writeDefine(String name, String value, ScriptOutput out) {
    out.line(String.format("define %s = %s", name, value));
  }
}
