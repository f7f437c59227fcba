package flowc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

// Compiles a single node into labeled script lines. Every emitting node starts with its label and
// ends with a blank line; most roles finish with the jump logic of their governing pin.
public final class NodeCompiler {
  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\\r\\n|\\r|\\n");
  private static final Joiner PATH_JOINER = Joiner.on('/');
  private static final Pattern BRACES = Pattern.compile("\\{([^{}]+)\\}");
  private static final String PARENT_DIR = "../";

  private final FlowGraph graph;
  private final ContainerHierarchy hierarchy;
  private final CompilerConfig config;
  private final SymbolTable symbols;
  private final Diagnostics diagnostics;
  private final SpeakerLookup speakers;
  private final AssetTree assets;

  private final Labels labels;
  private final TargetResolver resolver;
  private final MenuEmitter menus;

  public NodeCompiler(
      FlowGraph graph,
      ContainerHierarchy hierarchy,
      CompilerConfig config,
      SymbolTable symbols,
      Diagnostics diagnostics,
      SpeakerLookup speakers,
      AssetTree assets) {
    this.graph = graph;
    this.hierarchy = hierarchy;
    this.config = config;
    this.symbols = symbols;
    this.diagnostics = diagnostics;
    this.speakers = speakers;
    this.assets = assets;

    this.labels = new Labels(config);
    this.resolver = new TargetResolver(graph, config.roles());
    this.menus = new MenuEmitter(graph, config, labels, diagnostics);
  }

  public Labels labels() {
    return labels;
  }

  public void compile(FlowGraph.Node node, Location location, ScriptOutput out)
      throws CompilerException {
    Optional<Role> role = config.roles().roleOf(node);
    if (!role.isPresent()) {
      diagnostics.log(
          location,
          String.format("Type \"%s\" of node %s is not supported", node.type(), node.id()));
      return;
    }
    if (role.get() == Role.IGNORED) return;

    Directives directives = Directives.of(node);
    for (String segment : directives.malformed()) {
      diagnostics.log(
          location,
          String.format("%s has malformed stage direction '%s'", labels.labelOf(node), segment));
    }
    logAttentionLines(node, location);

    String label = labels.labelOf(node);
    symbols.issue(node, label);
    RenPyStatements.writeLabel(label, out);
    out.indented(body -> writeBody(role.get(), node, directives, location, body));
    out.blank();
  }

  private void writeBody(
      Role role, FlowGraph.Node node, Directives directives, Location location, ScriptOutput out)
      throws CompilerException {
    switch (role) {
      case DIALOGUE_LINE:
        writeComments(node, false, out);
        writeDialogue(node, node.text(), directives, out);
        writeJumpLogic(node, location, out);
        break;
      case CODE_BLOCK:
        writeComments(node, false, out);
        writeCodeBlock(node, location, out);
        if (repeatMenuText(directives)) {
          writeDialogue(node, node.menuText(), directives, out);
        }
        writeJumpLogic(node, location, out);
        break;
      case BRANCH_CONDITION:
        writeComments(node, true, out);
        writeCondition(node, location, out);
        break;
      case INSTRUCTION:
        writeComments(node, true, out);
        for (String statement : ExpressionTranslator.translateStatements(node.expression())) {
          RenPyStatements.writePython(statement, out);
        }
        writeJumpLogic(node, location, out);
        break;
      case JUMP:
        writeComments(node, true, out);
        writeStaticJump(node, location, out);
        break;
      case ENTRY_POINT:
        RenPyStatements.writeComment(node.type(), out);
        writeJumpLogic(node, location, out);
        break;
      case CONTAINER:
      case HUB:
        writeComments(node, true, out);
        writeJumpLogic(node, location, out);
        break;
      case IGNORED:
        break;
    }
  }

  private void writeComments(FlowGraph.Node node, boolean withText, ScriptOutput out) {
    if (!config.comments()) return;
    RenPyStatements.writeComment(node.type(), out);
    if (!node.displayName().trim().isEmpty()) {
      RenPyStatements.writeComment(node.displayName().trim(), out);
    }
    writeCommentLines(node.stageDirections(), out);
    if (withText) writeCommentLines(node.text(), out);
  }

  private static void writeCommentLines(String text, ScriptOutput out) {
    for (String line : LINE_SPLITTER.split(text)) {
      if (!line.trim().isEmpty()) RenPyStatements.writeComment(line.trim(), out);
    }
  }

  private void writeDialogue(
      FlowGraph.Node node, String text, Directives directives, ScriptOutput out) {
    String speaker =
        directives
            .value(Directives.SPEAKER)
            .map(name -> TextFormatter.quote(TextFormatter.escape(name)))
            .orElseGet(() -> speakers.speakerName(node));
    String pre = directives.value(Directives.PRE).orElse("");
    String post = directives.value(Directives.POST).orElse("");
    boolean textStyles =
        directives.booleanValue(Directives.MARKDOWN, config.markdownTextStyles());
    for (String paragraph : TextFormatter.paragraphs(text, textStyles)) {
      RenPyStatements.writeSay(speaker, pre, paragraph, post, out);
    }
  }

  private boolean repeatMenuText(Directives directives) {
    Optional<Boolean> explicit = directives.booleanValue(Directives.REPEAT_MENU_TEXT);
    if (explicit.isPresent()) return explicit.get();
    if (directives.hasFlag(Directives.DONT_REPEAT_MENU_TEXT)) return false;
    return config.repeatMenuText();
  }

  private void writeCodeBlock(FlowGraph.Node node, Location location, ScriptOutput out) {
    for (String line : LINE_SPLITTER.split(node.text())) {
      if (line.isEmpty()) continue;
      out.line(config.relativeAssetsInBraces() ? resolveAssets(node, line, location) : line);
    }
  }

  // {name.png} -> 'images/<container dirs>/name.png'; each leading ../ drops one directory.
  private String resolveAssets(FlowGraph.Node node, String line, Location location) {
    Matcher m = BRACES.matcher(line);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String placeholder = m.group(1);
      if (!isAsset(placeholder)) {
        m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
        continue;
      }
      List<String> directories = new ArrayList<>(containerDirectories(node, location));
      String name = placeholder;
      while (name.startsWith(PARENT_DIR)) {
        if (!directories.isEmpty()) directories.remove(directories.size() - 1);
        name = name.substring(PARENT_DIR.length());
      }
      String path =
          PATH_JOINER.join(
              ImmutableList.<String>builder()
                  .add(config.assetDirectory())
                  .addAll(directories)
                  .add(name)
                  .build());
      if (!assets.exists(path)) {
        diagnostics.log(
            location,
            String.format("%s references non-existent file %s", labels.labelOf(node), path));
      }
      m.appendReplacement(sb, Matcher.quoteReplacement("'" + path + "'"));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private boolean isAsset(String placeholder) {
    String lower = placeholder.toLowerCase(Locale.ROOT);
    return config.assetExtensions().stream()
        .anyMatch(ext -> lower.endsWith(ext.toLowerCase(Locale.ROOT)));
  }

  private ImmutableList<String> containerDirectories(FlowGraph.Node node, Location location) {
    return node.parentId()
        .flatMap(hierarchy::locationOf)
        .map(Location::directories)
        .orElse(location.directories());
  }

  private void writeCondition(FlowGraph.Node node, Location location, ScriptOutput out)
      throws CompilerException {
    String condition = ExpressionTranslator.translateCondition(node.expression());
    if (condition.isEmpty()) {
      diagnostics.log(
          location,
          String.format("%s has an empty condition, using True", labels.labelOf(node)));
      condition = "True";
    }
    TargetResolver.Resolution whenTrue = resolver.resolveOutcome(node, true);
    TargetResolver.Resolution whenFalse = resolver.resolveOutcome(node, false);
    RenPyStatements.writeIf(
        condition, body -> writeResolution(node, whenTrue, location, body), out);
    RenPyStatements.writeElse(body -> writeResolution(node, whenFalse, location, body), out);
  }

  private void writeStaticJump(FlowGraph.Node node, Location location, ScriptOutput out) {
    Optional<FlowGraph.Node> target = node.jumpTargetId().flatMap(graph::node);
    if (target.isPresent()) {
      RenPyStatements.writeJump(labels.labelOf(target.get()), out);
      return;
    }
    diagnostics.log(
        location,
        String.format(
            "%s jumps to unknown node %s, will jump to %s",
            labels.labelOf(node),
            node.jumpTargetId().orElse("<none>"),
            labels.terminal()));
    RenPyStatements.writeJump(labels.terminal(), out);
  }

  private void writeJumpLogic(FlowGraph.Node node, Location location, ScriptOutput out)
      throws CompilerException {
    writeResolution(node, resolver.resolveNext(node), location, out);
  }

  private void writeResolution(
      FlowGraph.Node node,
      TargetResolver.Resolution resolution,
      Location location,
      ScriptOutput out)
      throws CompilerException {
    switch (resolution.kind()) {
      case NONE:
        writeStatements(resolution, out);
        diagnostics.log(
            location,
            String.format(
                "%s was not assigned any jump target, will jump to %s",
                labels.labelOf(node),
                labels.terminal()));
        RenPyStatements.writeJump(labels.terminal(), out);
        break;
      case SINGLE:
        writeStatements(resolution, out);
        RenPyStatements.writeJump(labels.labelOf(resolution.target()), out);
        break;
      case BRANCH:
        menus.emit(node, resolution, location, out);
        break;
    }
  }

  private static void writeStatements(TargetResolver.Resolution resolution, ScriptOutput out) {
    for (FlowGraph.Pin pin : resolution.instructionPins()) {
      for (String statement : ExpressionTranslator.translateStatements(pin.text())) {
        RenPyStatements.writePython(statement, out);
      }
    }
  }

  private void logAttentionLines(FlowGraph.Node node, Location location) {
    ImmutableList.Builder<String> texts = ImmutableList.builder();
    texts.add(node.text(), node.expression());
    for (FlowGraph.Pin pin : node.inputPins()) texts.add(pin.text());
    for (FlowGraph.Pin pin : node.outputPins()) texts.add(pin.text());
    for (String text : texts.build()) {
      for (String line : LINE_SPLITTER.split(text)) {
        String lower = line.trim().toLowerCase(Locale.ROOT);
        for (String prefix : config.attentionPrefixes()) {
          if (!prefix.isEmpty() && lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
            diagnostics.log(location, String.format("%s: %s", labels.labelOf(node), line.trim()));
            break;
          }
        }
      }
    }
  }
}
