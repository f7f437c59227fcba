package flowc;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

public final class ScriptOutput {
  public interface Writer {
    void write(ScriptOutput out) throws CompilerException;
  }

  private static final String INDENT = "    ";

  private final List<String> lines = new ArrayList<>();
  private int depth = 0;

  public ScriptOutput line(String text) {
    lines.add(Strings.repeat(INDENT, depth) + text);
    return this;
  }

  public ScriptOutput blank() {
    lines.add("");
    return this;
  }

  public void indented(Writer body) throws CompilerException {
    depth++;
    try {
      body.write(this);
    } finally {
      depth--;
    }
  }

  public ImmutableList<String> lines() {
    return ImmutableList.copyOf(lines);
  }

  public static ImmutableList<String> capture(Writer writer) throws CompilerException {
    ScriptOutput out = new ScriptOutput();
    writer.write(out);
    return out.lines();
  }

  public static String render(Iterable<String> lines) {
    StringBuilder sb = new StringBuilder();
    for (String line : lines) {
      sb.append(line).append('\n');
    }
    return sb.toString();
  }
}
