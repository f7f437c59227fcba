package flowc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

// Writes a menu: for a pin that connects to several destinations.
public final class MenuEmitter {
  // Added to a destination's numeric id when it has no explicit priority.
  static final BigInteger DEFAULT_PRIORITY = BigInteger.valueOf(1904);

  private static final Pattern DECIMAL_ID = Pattern.compile("\\d+");
  private static final Pattern HEX_ID = Pattern.compile("0[xX][0-9a-fA-F]+");
  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

  private static final Comparator<Option> OPTION_ORDER =
      Comparator.comparing(
              (Option o) -> o.priority, Comparator.nullsLast(Comparator.<BigInteger>naturalOrder()))
          .thenComparing(o -> o.destination.id());

  private static final class Option {
    private final FlowGraph.Connection connection;
    // Supplies the option's text and priority; also the jump target unless the option ends.
    private final FlowGraph.Node destination;
    private final Optional<FlowGraph.Pin> entryPin;
    // Instructions on container exits passed on the way to the destination.
    private final ImmutableList<String> statements;
    private final boolean ends;
    private final BigInteger priority; // null when the destination id is not numeric

    private Option(
        FlowGraph.Connection connection,
        FlowGraph.Node destination,
        Optional<FlowGraph.Pin> entryPin,
        ImmutableList<String> statements,
        boolean ends) {
      this.connection = connection;
      this.destination = destination;
      this.entryPin = entryPin;
      this.statements = statements;
      this.ends = ends;
      this.priority = priority(destination);
    }
  }

  private final FlowGraph graph;
  private final CompilerConfig config;
  private final Labels labels;
  private final Diagnostics diagnostics;
  private final TargetResolver resolver;

  public MenuEmitter(
      FlowGraph graph, CompilerConfig config, Labels labels, Diagnostics diagnostics) {
    this.graph = graph;
    this.config = config;
    this.labels = labels;
    this.diagnostics = diagnostics;
    this.resolver = new TargetResolver(graph, config.roles());
  }

  public void emit(
      FlowGraph.Node source,
      TargetResolver.Resolution branch,
      Location location,
      ScriptOutput out)
      throws CompilerException {
    ImmutableList<Option> options = options(source, branch.branchPin(), location);
    ImmutableList<String> statements = statements(branch);
    boolean displayTextBox =
        Directives.of(source)
            .booleanValue(Directives.DISPLAY_TEXT_BOX, config.menuDisplayTextBox());

    RenPyStatements.writeMenu(
        menu -> {
          if (displayTextBox) {
            // Keeps the previous line on screen while the choices are shown.
            RenPyStatements.writeExtend("", menu);
            menu.blank();
          }
          for (Option option : options) {
            writeOption(option, statements, menu);
          }
        },
        out);
  }

  private void writeOption(Option option, ImmutableList<String> statements, ScriptOutput out)
      throws CompilerException {
    Optional<String> guard =
        option
            .entryPin
            .map(pin -> ExpressionTranslator.translateCondition(pin.text()))
            .filter(condition -> !condition.isEmpty());
    RenPyStatements.writeMenuOption(
        optionText(option),
        guard,
        body -> {
          for (String statement : statements) {
            RenPyStatements.writePython(statement, body);
          }
          for (String statement : option.statements) {
            RenPyStatements.writePython(statement, body);
          }
          RenPyStatements.writeJump(
              option.ends ? labels.terminal() : labels.labelOf(option.destination), body);
        },
        out);
  }

  private ImmutableList<Option> options(
      FlowGraph.Node source, FlowGraph.Pin pin, Location location) throws CompilerException {
    List<Option> options = new ArrayList<>();
    for (FlowGraph.Connection connection : pin.connections()) {
      Optional<FlowGraph.Node> destination = graph.node(connection.targetNodeId());
      if (!destination.isPresent()) {
        throw new CompilerException(
            source,
            String.format("menu option leads to unknown node %s", connection.targetNodeId()));
      }
      Optional<FlowGraph.Pin> entryPin = graph.inputPin(connection.targetPinId());
      if (entryPin.isPresent()) {
        options.add(
            new Option(connection, destination.get(), entryPin, ImmutableList.of(), false));
        continue;
      }
      Optional<FlowGraph.Pin> exitPin = graph.outputPin(connection.targetPinId());
      if (!exitPin.isPresent()) {
        throw new CompilerException(
            source,
            String.format(
                "target pin %s of pin %s is neither an input nor an output pin",
                connection.targetPinId(),
                pin.id()));
      }
      options.add(exitOption(source, connection, destination.get(), exitPin.get(), location));
    }
    options.sort(OPTION_ORDER);
    return ImmutableList.copyOf(options);
  }

  // The option leaves a container through its exit pin; follow the exit to where it leads.
  private Option exitOption(
      FlowGraph.Node source,
      FlowGraph.Connection connection,
      FlowGraph.Node container,
      FlowGraph.Pin exitPin,
      Location location)
      throws CompilerException {
    TargetResolver.Resolution exit = resolver.resolve(exitPin);
    switch (exit.kind()) {
      case SINGLE:
        return new Option(
            connection, exit.target(), entryPinOf(exit), statements(exit), false);
      case NONE:
        diagnostics.log(
            location,
            String.format(
                "%s has a menu option leaving %s without a jump target, will jump to %s",
                labels.labelOf(source),
                labels.labelOf(container),
                labels.terminal()));
        return new Option(connection, container, Optional.empty(), statements(exit), true);
      default:
        throw new CompilerException(
            source,
            String.format(
                "menu option through pin %s leads to another choice at pin %s",
                exitPin.id(),
                exit.branchPin().id()));
    }
  }

  private Optional<FlowGraph.Pin> entryPinOf(TargetResolver.Resolution single) {
    ImmutableList<FlowGraph.Pin> path = single.path();
    FlowGraph.Pin last = path.get(path.size() - 1);
    return graph.inputPin(last.connections().get(0).targetPinId());
  }

  private static ImmutableList<String> statements(TargetResolver.Resolution branch) {
    ImmutableList.Builder<String> statements = ImmutableList.builder();
    for (FlowGraph.Pin pin : branch.instructionPins()) {
      statements.addAll(ExpressionTranslator.translateStatements(pin.text()));
    }
    return statements.build();
  }

  // Menu text, else the connection label, else the full text of the destination.
  private String optionText(Option option) throws CompilerException {
    FlowGraph.Node destination = option.destination;
    String text = destination.menuText();
    if (text.trim().isEmpty()) text = option.connection.label();
    if (text.trim().isEmpty()) text = destination.text();
    if (text.trim().isEmpty()) {
      throw new CompilerException(
          destination,
          "menu option has no text; set its menu text, its text or the connection label");
    }
    boolean textStyles =
        Directives.of(destination)
            .booleanValue(Directives.MARKDOWN, config.markdownTextStyles());
    return TextFormatter.format(LINE_BREAK.matcher(text.trim()).replaceAll(" "), textStyles);
  }

  static BigInteger priority(FlowGraph.Node destination) {
    Optional<Integer> explicit = Directives.of(destination).priority();
    if (explicit.isPresent()) return BigInteger.valueOf(explicit.get());
    return numericId(destination.id()).map(DEFAULT_PRIORITY::add).orElse(null);
  }

  static Optional<BigInteger> numericId(String id) {
    if (HEX_ID.matcher(id).matches()) return Optional.of(new BigInteger(id.substring(2), 16));
    if (DECIMAL_ID.matcher(id).matches()) return Optional.of(new BigInteger(id));
    return Optional.empty();
  }
}
